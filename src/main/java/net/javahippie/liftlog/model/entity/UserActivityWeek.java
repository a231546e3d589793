package net.javahippie.liftlog.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Weekly workout aggregate for a user.
 * The week is keyed by its Monday in the local timezone of the workouts counted into it.
 */
@Entity
@Table(name = "user_activity_weeks",
       uniqueConstraints = @UniqueConstraint(columnNames = {"user_id", "week_start"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserActivityWeek {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "week_start", nullable = false)
    private LocalDate weekStart;

    @Column(name = "active_days", nullable = false)
    @Builder.Default
    private Integer activeDays = 0;

    @Column(name = "workouts_completed", nullable = false)
    @Builder.Default
    private Integer workoutsCompleted = 0;

    @Column(name = "total_sets", nullable = false)
    @Builder.Default
    private Integer totalSets = 0;

    @Column(name = "total_volume_kg", precision = 12, scale = 2)
    @Builder.Default
    private BigDecimal totalVolumeKg = BigDecimal.ZERO;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;
}
