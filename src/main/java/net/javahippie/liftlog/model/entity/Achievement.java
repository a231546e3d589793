package net.javahippie.liftlog.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

/**
 * Badge definition. Global reference data, seeded out-of-band and read-only to the engine.
 * The code selects which rule evaluates the badge (see {@code service.badge}).
 */
@Entity
@Table(name = "achievements")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Achievement {

    @Id
    @Column(length = 100)
    private String code;

    @Column(nullable = false, length = 100)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "icon_url")
    private String iconUrl;

    @Column(name = "threshold_value")
    private Integer thresholdValue;

    /**
     * When set, the badge counts sets of exercises in this muscle group.
     */
    @Column(name = "relevant_muscle_group", length = 50)
    private String relevantMuscleGroup;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    /**
     * Threshold or the given fallback when the definition carries none.
     */
    public int thresholdOr(int fallback) {
        return thresholdValue != null ? thresholdValue : fallback;
    }
}
