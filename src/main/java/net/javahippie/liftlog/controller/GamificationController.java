package net.javahippie.liftlog.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javahippie.liftlog.exception.ForbiddenOperationException;
import net.javahippie.liftlog.model.dto.AwardXpRequest;
import net.javahippie.liftlog.model.dto.BadgeRustResult;
import net.javahippie.liftlog.model.dto.BadgeUnlockResult;
import net.javahippie.liftlog.model.dto.DetectPrsRequest;
import net.javahippie.liftlog.model.dto.DetectPrsResponse;
import net.javahippie.liftlog.model.dto.GamificationSummary;
import net.javahippie.liftlog.model.dto.LevelProgress;
import net.javahippie.liftlog.model.dto.PolishBadgeRequest;
import net.javahippie.liftlog.model.dto.TrackWeeklyActivityRequest;
import net.javahippie.liftlog.model.dto.UserBadgeDTO;
import net.javahippie.liftlog.model.dto.UserRequest;
import net.javahippie.liftlog.model.dto.WeeklyActivityResult;
import net.javahippie.liftlog.model.dto.XpAwardResult;
import net.javahippie.liftlog.service.BadgeRustService;
import net.javahippie.liftlog.service.BadgeService;
import net.javahippie.liftlog.service.LevelService;
import net.javahippie.liftlog.service.PersonalRecordService;
import net.javahippie.liftlog.service.WeeklyActivityService;
import net.javahippie.liftlog.service.WorkoutGamificationPipeline;
import net.javahippie.liftlog.service.XpLedgerService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for the gamification operations.
 * Every operation acts on the authenticated user; a request naming another user is rejected with 403.
 */
@RestController
@RequestMapping("/api/gamification")
@RequiredArgsConstructor
@Slf4j
public class GamificationController {

    private final XpLedgerService xpLedgerService;
    private final LevelService levelService;
    private final PersonalRecordService personalRecordService;
    private final WeeklyActivityService weeklyActivityService;
    private final BadgeService badgeService;
    private final BadgeRustService badgeRustService;
    private final WorkoutGamificationPipeline pipeline;

    /**
     * Award XP for completed sets.
     *
     * @param request the user and the sets
     * @param authenticatedUserId the authenticated user
     * @return XP granted and the new daily total
     */
    @PostMapping("/xp/award")
    public ResponseEntity<XpAwardResult> awardXp(
        @Valid @RequestBody AwardXpRequest request,
        @AuthenticationPrincipal UUID authenticatedUserId
    ) {
        requireSelf(request.getUserId(), authenticatedUserId);
        return ResponseEntity.ok(xpLedgerService.awardXp(request.getUserId(), request.getSetIds()));
    }

    @PostMapping("/level/calculate")
    public ResponseEntity<LevelProgress> calculateLevel(
        @Valid @RequestBody UserRequest request,
        @AuthenticationPrincipal UUID authenticatedUserId
    ) {
        requireSelf(request.getUserId(), authenticatedUserId);
        return ResponseEntity.ok(levelService.recalculateLevel(request.getUserId()));
    }

    /**
     * Detect personal records in one of the authenticated user's workouts.
     *
     * @param request the workout
     * @param authenticatedUserId the authenticated user
     * @return new records, one per exercise at most
     */
    @PostMapping("/prs/detect")
    public ResponseEntity<DetectPrsResponse> detectPersonalRecords(
        @Valid @RequestBody DetectPrsRequest request,
        @AuthenticationPrincipal UUID authenticatedUserId
    ) {
        return ResponseEntity.ok(DetectPrsResponse.of(
            personalRecordService.detectPersonalRecords(authenticatedUserId, request.getWorkoutId())));
    }

    @PostMapping("/weekly-activity/track")
    public ResponseEntity<WeeklyActivityResult> trackWeeklyActivity(
        @Valid @RequestBody TrackWeeklyActivityRequest request,
        @AuthenticationPrincipal UUID authenticatedUserId
    ) {
        requireSelf(request.getUserId(), authenticatedUserId);
        return ResponseEntity.ok(weeklyActivityService.trackWeeklyActivity(
            request.getUserId(), request.getWorkoutId(), request.getTimezone()));
    }

    @PostMapping("/badges/unlock")
    public ResponseEntity<BadgeUnlockResult> unlockBadges(
        @Valid @RequestBody UserRequest request,
        @AuthenticationPrincipal UUID authenticatedUserId
    ) {
        requireSelf(request.getUserId(), authenticatedUserId);
        return ResponseEntity.ok(badgeService.unlockBadges(request.getUserId()));
    }

    @PostMapping("/badges/rust-check")
    public ResponseEntity<BadgeRustResult> checkBadgeRust(
        @Valid @RequestBody UserRequest request,
        @AuthenticationPrincipal UUID authenticatedUserId
    ) {
        requireSelf(request.getUserId(), authenticatedUserId);
        return ResponseEntity.ok(badgeRustService.checkBadgeRust(request.getUserId()));
    }

    @PostMapping("/badges/polish")
    public ResponseEntity<Void> polishBadge(
        @Valid @RequestBody PolishBadgeRequest request,
        @AuthenticationPrincipal UUID authenticatedUserId
    ) {
        requireSelf(request.getUserId(), authenticatedUserId);
        badgeRustService.polishBadge(request.getUserId(), request.getAchievementCode());
        return ResponseEntity.noContent().build();
    }

    /**
     * Run the full gamification sequence for a saved workout.
     *
     * @param workoutId the workout
     * @param authenticatedUserId the authenticated user
     * @return summary of what the workout earned, including failed stages
     */
    @PostMapping("/workouts/{workoutId}/process")
    public ResponseEntity<GamificationSummary> processWorkout(
        @PathVariable UUID workoutId,
        @AuthenticationPrincipal UUID authenticatedUserId
    ) {
        return ResponseEntity.ok(pipeline.process(authenticatedUserId, workoutId));
    }

    @GetMapping("/users/{userId}/level")
    public ResponseEntity<LevelProgress> getLevel(
        @PathVariable UUID userId,
        @AuthenticationPrincipal UUID authenticatedUserId
    ) {
        requireSelf(userId, authenticatedUserId);
        return ResponseEntity.ok(levelService.getLevel(userId));
    }

    @GetMapping("/users/{userId}/badges")
    public ResponseEntity<List<UserBadgeDTO>> getBadges(
        @PathVariable UUID userId,
        @AuthenticationPrincipal UUID authenticatedUserId
    ) {
        requireSelf(userId, authenticatedUserId);
        return ResponseEntity.ok(badgeService.getUserBadges(userId));
    }

    private void requireSelf(UUID requestedUserId, UUID authenticatedUserId) {
        if (!requestedUserId.equals(authenticatedUserId)) {
            log.warn("User {} attempted to act on behalf of user {}", authenticatedUserId, requestedUserId);
            throw new ForbiddenOperationException("Cannot act on behalf of another user");
        }
    }
}
