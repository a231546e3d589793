package net.javahippie.liftlog.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import net.javahippie.liftlog.model.entity.Notification;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * DTO for Notification data transfer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationDTO {

    private UUID id;
    private String type;
    private String title;
    private String body;
    private Map<String, Object> metadata;
    private boolean read;
    private Instant createdAt;
    private Instant readAt;

    /**
     * Creates a DTO from a Notification entity.
     *
     * @param notification the notification entity
     * @return notification DTO
     */
    public static NotificationDTO fromEntity(Notification notification) {
        return NotificationDTO.builder()
            .id(notification.getId())
            .type(notification.getType().name())
            .title(notification.getTitle())
            .body(notification.getBody())
            .metadata(notification.getMetadata())
            .read(notification.isRead())
            .createdAt(notification.getCreatedAt())
            .readAt(notification.getReadAt())
            .build();
    }
}
