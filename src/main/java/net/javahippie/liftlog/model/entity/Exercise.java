package net.javahippie.liftlog.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Exercise catalog entry. Only the muscle group matters to the gamification engine.
 */
@Entity
@Table(name = "exercises", indexes = {
    @Index(name = "idx_exercises_muscle_group", columnList = "muscle_group")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Exercise {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Column(name = "muscle_group", length = 50)
    private String muscleGroup;

    @Column(name = "deleted_at")
    private Instant deletedAt;
}
