package net.javahippie.liftlog.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * A badge earned by a user. Created once per (user, achievement code); afterwards only the
 * rust state and the maintenance timestamp change.
 */
@Entity
@Table(name = "user_badges",
       uniqueConstraints = @UniqueConstraint(columnNames = {"user_id", "achievement_code"}),
       indexes = @Index(name = "idx_user_badges_user_id", columnList = "user_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserBadge {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "achievement_code", nullable = false, length = 100, updatable = false)
    private String achievementCode;

    @Column(name = "earned_at", nullable = false)
    private Instant earnedAt;

    @Column(name = "is_rusty", nullable = false)
    @Builder.Default
    private boolean rusty = false;

    /**
     * Last time an activity kept this badge shiny. Null falls back to the latest finished workout.
     */
    @Column(name = "last_maintained_at")
    private Instant lastMaintainedAt;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    /**
     * Reset rust and restart the maintenance clock.
     */
    public void polish(Instant now) {
        this.rusty = false;
        this.lastMaintainedAt = now;
    }
}
