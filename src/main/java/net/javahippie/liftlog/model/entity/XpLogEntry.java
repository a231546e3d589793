package net.javahippie.liftlog.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only XP grant. The (user, source type, source id) triple is the idempotency key:
 * a set or a workout can earn XP at most once.
 */
@Entity
@Table(name = "user_xp_logs",
       uniqueConstraints = @UniqueConstraint(columnNames = {"user_id", "source_type", "source_id"}),
       indexes = {
           @Index(name = "idx_user_xp_logs_user_id", columnList = "user_id"),
           @Index(name = "idx_user_xp_logs_created_at", columnList = "created_at")
       })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class XpLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "source_type", nullable = false, length = 20, updatable = false)
    @Enumerated(EnumType.STRING)
    private SourceType sourceType;

    /**
     * Id of the set or workout that earned the XP.
     */
    @Column(name = "source_id", nullable = false, updatable = false)
    private UUID sourceId;

    @Column(name = "xp_amount", nullable = false, updatable = false)
    private Integer xpAmount;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public enum SourceType {
        SET,
        WORKOUT,
        BONUS
    }
}
