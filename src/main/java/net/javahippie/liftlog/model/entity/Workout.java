package net.javahippie.liftlog.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * Entity representing a recorded training session.
 * Written by the workout recording flow; the gamification engine only reads it.
 */
@Entity
@Table(name = "workouts", indexes = {
    @Index(name = "idx_workouts_user_id", columnList = "user_id"),
    @Index(name = "idx_workouts_started_at", columnList = "started_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Workout {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(length = 255)
    private String name;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    /**
     * Set once the session is finished. Null while the workout is in progress.
     */
    @Column(name = "ended_at")
    private Instant endedAt;

    /**
     * IANA zone the workout was recorded in, e.g. "Europe/Berlin".
     */
    @Column(name = "local_timezone", length = 64)
    private String localTimezone;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    public boolean isFinished() {
        return endedAt != null;
    }
}
