package net.javahippie.liftlog.repository;

import net.javahippie.liftlog.model.entity.Achievement;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for badge definitions.
 */
@Repository
public interface AchievementRepository extends JpaRepository<Achievement, String> {

    List<Achievement> findAllByOrderByCodeAsc();
}
