package net.javahippie.liftlog.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Entity representing one completed resistance-training set.
 * The {@code pr} flag is the only column the gamification engine writes.
 */
@Entity
@Table(name = "workout_sets", indexes = {
    @Index(name = "idx_workout_sets_workout_id", columnList = "workout_id"),
    @Index(name = "idx_workout_sets_exercise_id", columnList = "exercise_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WorkoutSet {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "workout_id", nullable = false)
    private UUID workoutId;

    @Column(name = "exercise_id", nullable = false)
    private UUID exerciseId;

    /**
     * Total weight in kilograms (canonical unit).
     */
    @Column(name = "weight_kg", precision = 7, scale = 2)
    private BigDecimal weightKg;

    @Column
    private Integer reps;

    @Column(name = "is_pr", nullable = false)
    @Builder.Default
    private boolean pr = false;

    @Column(name = "set_order_index", nullable = false)
    @Builder.Default
    private Integer setOrderIndex = 0;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    /**
     * Weight as a plain double, zero when not recorded.
     */
    public double getWeightValue() {
        return weightKg != null ? weightKg.doubleValue() : 0.0;
    }

    /**
     * Reps as a plain int, zero when not recorded.
     */
    public int getRepsValue() {
        return reps != null ? reps : 0;
    }

    /**
     * Volume of this set (weight x reps) in kilograms.
     */
    public BigDecimal getVolumeKg() {
        if (weightKg == null || reps == null) {
            return BigDecimal.ZERO;
        }
        return weightKg.multiply(BigDecimal.valueOf(reps));
    }
}
