package net.javahippie.liftlog.model.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Entity representing a user notification.
 * The gamification engine only creates these rows; delivery to devices is handled elsewhere.
 */
@Entity
@Table(name = "notifications", indexes = {
    @Index(name = "idx_notifications_recipient", columnList = "recipient_id"),
    @Index(name = "idx_notifications_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Notification {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    /**
     * The user who receives this notification.
     */
    @Column(name = "recipient_id", nullable = false)
    private UUID recipientId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 50)
    private NotificationType type;

    @Column(nullable = false)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String body;

    /**
     * Structured payload for clients, e.g. the achievement code or the list of rusted badges.
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private Map<String, Object> metadata;

    @Column(name = "read_at")
    private Instant readAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    /**
     * Types of notifications that can be sent.
     */
    public enum NotificationType {
        /**
         * A badge was earned.
         */
        ACHIEVEMENT,

        /**
         * A personal record was set.
         */
        PR,

        /**
         * A weekly streak milestone.
         */
        STREAK,

        /**
         * One or more badges became rusty.
         */
        BADGE_RUST,

        /**
         * One or more badges are shiny again.
         */
        BADGE_POLISHED,

        SYSTEM
    }

    public boolean isRead() {
        return readAt != null;
    }

    /**
     * Mark this notification as read.
     */
    public void markAsRead(Instant now) {
        this.readAt = now;
    }
}
