package net.javahippie.liftlog.repository;

import net.javahippie.liftlog.model.entity.UserLevel;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface UserLevelRepository extends JpaRepository<UserLevel, UUID> {
}
