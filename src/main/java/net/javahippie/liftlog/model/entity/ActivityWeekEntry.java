package net.javahippie.liftlog.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Marks a workout as already counted into a weekly aggregate, so re-tracking it is a no-op.
 */
@Entity
@Table(name = "user_activity_week_entries",
       uniqueConstraints = @UniqueConstraint(columnNames = {"user_id", "workout_id"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ActivityWeekEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "workout_id", nullable = false)
    private UUID workoutId;

    @Column(name = "week_start", nullable = false)
    private LocalDate weekStart;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
}
