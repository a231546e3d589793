package net.javahippie.liftlog.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Run of consecutive qualifying weeks for one streak type, e.g. "3+ workouts per week".
 * When a gap breaks the run, the row is deactivated and a new one starts.
 */
@Entity
@Table(name = "user_streak_logs", indexes = {
    @Index(name = "idx_streak_logs_user_active", columnList = "user_id, streak_type, is_active")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserStreakLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "streak_type", nullable = false, length = 30)
    private String streakType;

    /**
     * Consecutive qualifying weeks.
     */
    @Column(name = "streak_length", nullable = false)
    @Builder.Default
    private Integer streakLength = 1;

    /**
     * Week start (Monday) of the last qualifying week.
     */
    @Column(name = "week_ended", nullable = false)
    private LocalDate weekEnded;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;
}
