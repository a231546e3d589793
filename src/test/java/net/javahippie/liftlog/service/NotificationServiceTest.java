package net.javahippie.liftlog.service;

import net.javahippie.liftlog.model.entity.Achievement;
import net.javahippie.liftlog.model.entity.Notification;
import net.javahippie.liftlog.repository.NotificationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NotificationServiceTest {

    private static final Instant NOW = Instant.parse("2025-06-04T10:00:00Z");

    @Mock
    private NotificationRepository notificationRepository;

    private NotificationService notificationService;

    private UUID userId;

    @BeforeEach
    void setUp() {
        notificationService = new NotificationService(notificationRepository, Clock.fixed(NOW, ZoneOffset.UTC));
        userId = UUID.randomUUID();
    }

    @Test
    @DisplayName("Should create an achievement notification with the badge code")
    void testCreateAchievementNotification() {
        // Given
        Achievement achievement = Achievement.builder().code("FIRST_PR").title("New Personal Best").build();

        // When
        notificationService.createAchievementNotification(userId, achievement, NOW);

        // Then
        ArgumentCaptor<Notification> captor = ArgumentCaptor.forClass(Notification.class);
        verify(notificationRepository).save(captor.capture());
        Notification notification = captor.getValue();
        assertEquals(userId, notification.getRecipientId());
        assertEquals(Notification.NotificationType.ACHIEVEMENT, notification.getType());
        assertEquals("You earned \"New Personal Best\"", notification.getBody());
        assertEquals("FIRST_PR", notification.getMetadata().get("achievementCode"));
    }

    @Test
    @DisplayName("Should word the rust notification by badge count")
    void testCreateBadgeRustNotification() {
        // When
        notificationService.createBadgeRustNotification(userId, List.of("WORKOUT_10", "FIRST_PR"));
        notificationService.createBadgeRustNotification(userId, List.of("WORKOUT_10"));

        // Then
        ArgumentCaptor<Notification> captor = ArgumentCaptor.forClass(Notification.class);
        verify(notificationRepository, times(2)).save(captor.capture());
        assertEquals("2 badges have become rusty. Work out to polish them!", captor.getAllValues().get(0).getBody());
        assertEquals("1 badge has become rusty. Work out to polish them!", captor.getAllValues().get(1).getBody());
        assertEquals(List.of("WORKOUT_10", "FIRST_PR"), captor.getAllValues().get(0).getMetadata().get("badges"));
    }

    @Test
    @DisplayName("Should mark only the recipient's notification as read")
    void testMarkAsRead() {
        // Given
        UUID ownId = UUID.randomUUID();
        UUID foreignId = UUID.randomUUID();
        Notification own = Notification.builder().id(ownId).recipientId(userId).build();
        Notification foreign = Notification.builder().id(foreignId).recipientId(UUID.randomUUID()).build();
        when(notificationRepository.findById(ownId)).thenReturn(Optional.of(own));
        when(notificationRepository.findById(foreignId)).thenReturn(Optional.of(foreign));

        // When / Then
        assertTrue(notificationService.markAsRead(ownId, userId));
        assertEquals(NOW, own.getReadAt());
        assertFalse(notificationService.markAsRead(foreignId, userId));
        assertNull(foreign.getReadAt());
        verify(notificationRepository, times(1)).save(any());
    }
}
