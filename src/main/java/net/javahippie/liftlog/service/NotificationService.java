package net.javahippie.liftlog.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javahippie.liftlog.model.entity.Achievement;
import net.javahippie.liftlog.model.entity.Notification;
import net.javahippie.liftlog.repository.NotificationRepository;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Service for managing user notifications.
 * The engine only writes notification rows; delivering them to devices happens elsewhere.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationService {

    private final NotificationRepository notificationRepository;
    private final Clock clock;

    /**
     * Create a notification for a newly earned badge.
     *
     * @param userId the badge owner
     * @param achievement the earned achievement
     * @param earnedAt when the badge was earned
     */
    @Transactional
    public void createAchievementNotification(UUID userId, Achievement achievement, Instant earnedAt) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("achievementCode", achievement.getCode());
        metadata.put("earnedAt", earnedAt.toString());

        Notification notification = Notification.builder()
            .recipientId(userId)
            .type(Notification.NotificationType.ACHIEVEMENT)
            .title("Achievement Unlocked!")
            .body("You earned \"" + achievement.getTitle() + "\"")
            .metadata(metadata)
            .build();

        notificationRepository.save(notification);
        log.debug("Created ACHIEVEMENT notification for user {}: {}", userId, achievement.getCode());
    }

    /**
     * Create one aggregate notification for badges that just became rusty.
     *
     * @param userId the badge owner
     * @param achievementCodes codes of the rusted badges, not empty
     */
    @Transactional
    public void createBadgeRustNotification(UUID userId, List<String> achievementCodes) {
        int count = achievementCodes.size();
        Notification notification = Notification.builder()
            .recipientId(userId)
            .type(Notification.NotificationType.BADGE_RUST)
            .title("Badges Need Attention")
            .body(count + (count > 1 ? " badges have" : " badge has") + " become rusty. Work out to polish them!")
            .metadata(Map.of("badges", List.copyOf(achievementCodes)))
            .build();

        notificationRepository.save(notification);
        log.debug("Created BADGE_RUST notification for user {} covering {} badges", userId, count);
    }

    /**
     * Create one aggregate notification for badges that are shiny again.
     *
     * @param userId the badge owner
     * @param achievementCodes codes of the polished badges, not empty
     */
    @Transactional
    public void createBadgesPolishedNotification(UUID userId, List<String> achievementCodes) {
        int count = achievementCodes.size();
        Notification notification = Notification.builder()
            .recipientId(userId)
            .type(Notification.NotificationType.BADGE_POLISHED)
            .title("Badges Polished!")
            .body(count + (count > 1 ? " badges are" : " badge is") + " shiny again!")
            .metadata(Map.of("badges", List.copyOf(achievementCodes)))
            .build();

        notificationRepository.save(notification);
        log.debug("Created BADGE_POLISHED notification for user {} covering {} badges", userId, count);
    }

    /**
     * Get all notifications for a user.
     *
     * @param userId the user ID
     * @param pageable pagination parameters
     * @return page of notifications
     */
    @Transactional(readOnly = true)
    public Page<Notification> getNotifications(UUID userId, Pageable pageable) {
        return notificationRepository.findByRecipientId(userId, pageable);
    }

    @Transactional(readOnly = true)
    public long countUnreadNotifications(UUID userId) {
        return notificationRepository.countUnreadByRecipientId(userId);
    }

    /**
     * Mark a notification as read.
     *
     * @param notificationId the notification ID
     * @param userId the user ID (for authorization)
     * @return true if marked as read, false if not found or not owned by user
     */
    @Transactional
    public boolean markAsRead(UUID notificationId, UUID userId) {
        return notificationRepository.findById(notificationId)
            .filter(n -> n.getRecipientId().equals(userId))
            .filter(n -> n.getDeletedAt() == null)
            .map(notification -> {
                if (!notification.isRead()) {
                    notification.markAsRead(clock.instant());
                    notificationRepository.save(notification);
                }
                return true;
            })
            .orElse(false);
    }

    /**
     * Mark all notifications as read for a user.
     *
     * @param userId the user ID
     * @return number of notifications marked as read
     */
    @Transactional
    public int markAllAsRead(UUID userId) {
        return notificationRepository.markAllAsReadByRecipientId(userId, clock.instant());
    }
}
