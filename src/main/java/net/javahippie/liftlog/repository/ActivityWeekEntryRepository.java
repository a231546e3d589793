package net.javahippie.liftlog.repository;

import net.javahippie.liftlog.model.entity.ActivityWeekEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface ActivityWeekEntryRepository extends JpaRepository<ActivityWeekEntry, UUID> {

    boolean existsByUserIdAndWorkoutId(UUID userId, UUID workoutId);
}
