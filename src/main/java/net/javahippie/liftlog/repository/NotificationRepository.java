package net.javahippie.liftlog.repository;

import net.javahippie.liftlog.model.entity.Notification;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.UUID;

/**
 * Repository for Notification entity.
 */
@Repository
public interface NotificationRepository extends JpaRepository<Notification, UUID> {

    /**
     * Find all notifications for a user, newest first.
     *
     * @param recipientId the user ID
     * @param pageable pagination parameters
     * @return page of notifications
     */
    @Query("SELECT n FROM Notification n " +
           "WHERE n.recipientId = :recipientId AND n.deletedAt IS NULL " +
           "ORDER BY n.createdAt DESC")
    Page<Notification> findByRecipientId(@Param("recipientId") UUID recipientId, Pageable pageable);

    /**
     * Count unread notifications for a user.
     *
     * @param recipientId the user ID
     * @return count of unread notifications
     */
    @Query("SELECT COUNT(n) FROM Notification n " +
           "WHERE n.recipientId = :recipientId AND n.readAt IS NULL AND n.deletedAt IS NULL")
    long countUnreadByRecipientId(@Param("recipientId") UUID recipientId);

    /**
     * Mark all notifications as read for a user.
     *
     * @param recipientId the user ID
     * @param readAt the read timestamp
     * @return number of notifications marked as read
     */
    @Modifying
    @Query("UPDATE Notification n SET n.readAt = :readAt " +
           "WHERE n.recipientId = :recipientId AND n.readAt IS NULL AND n.deletedAt IS NULL")
    int markAllAsReadByRecipientId(@Param("recipientId") UUID recipientId, @Param("readAt") Instant readAt);
}
