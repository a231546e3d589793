package net.javahippie.liftlog.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Denormalized level cache, one row per user.
 * Always recomputed from the XP ledger, never incremented.
 */
@Entity
@Table(name = "user_levels")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserLevel {

    @Id
    @Column(name = "user_id")
    private UUID userId;

    @Column(name = "total_xp", nullable = false)
    @Builder.Default
    private Long totalXp = 0L;

    @Column(nullable = false)
    @Builder.Default
    private Integer level = 1;

    @Column(name = "xp_to_next_level", nullable = false)
    @Builder.Default
    private Long xpToNextLevel = 100L;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
