package net.javahippie.liftlog.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javahippie.liftlog.model.dto.NotificationDTO;
import net.javahippie.liftlog.model.entity.Notification;
import net.javahippie.liftlog.service.NotificationService;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * REST controller for the authenticated user's notifications.
 */
@RestController
@RequestMapping("/api/notifications")
@RequiredArgsConstructor
@Slf4j
public class NotificationController {

    private final NotificationService notificationService;

    /**
     * Get all notifications for the authenticated user.
     *
     * @param userId the authenticated user
     * @param pageable pagination parameters
     * @return page of notifications
     */
    @GetMapping
    public ResponseEntity<Page<NotificationDTO>> getNotifications(
        @AuthenticationPrincipal UUID userId,
        Pageable pageable
    ) {
        Page<Notification> notifications = notificationService.getNotifications(userId, pageable);
        return ResponseEntity.ok(notifications.map(NotificationDTO::fromEntity));
    }

    @GetMapping("/unread/count")
    public ResponseEntity<Map<String, Long>> getUnreadCount(@AuthenticationPrincipal UUID userId) {
        Map<String, Long> response = new HashMap<>();
        response.put("count", notificationService.countUnreadNotifications(userId));
        return ResponseEntity.ok(response);
    }

    /**
     * Mark a notification as read.
     *
     * @param notificationId the notification ID
     * @param userId the authenticated user
     * @return no content, or 404 if the notification is not the user's
     */
    @PutMapping("/{notificationId}/read")
    public ResponseEntity<Void> markAsRead(
        @PathVariable UUID notificationId,
        @AuthenticationPrincipal UUID userId
    ) {
        if (!notificationService.markAsRead(notificationId, userId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    /**
     * Mark all notifications as read.
     *
     * @param userId the authenticated user
     * @return number of notifications marked as read
     */
    @PutMapping("/read-all")
    public ResponseEntity<Map<String, Integer>> markAllAsRead(@AuthenticationPrincipal UUID userId) {
        int count = notificationService.markAllAsRead(userId);
        log.debug("Marked {} notifications as read for user {}", count, userId);
        Map<String, Integer> response = new HashMap<>();
        response.put("count", count);
        return ResponseEntity.ok(response);
    }
}
