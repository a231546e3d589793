package net.javahippie.liftlog.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javahippie.liftlog.config.GamificationProperties;
import net.javahippie.liftlog.exception.ForbiddenOperationException;
import net.javahippie.liftlog.exception.InvalidRequestException;
import net.javahippie.liftlog.exception.ResourceNotFoundException;
import net.javahippie.liftlog.model.dto.XpAwardResult;
import net.javahippie.liftlog.model.entity.Workout;
import net.javahippie.liftlog.model.entity.WorkoutSet;
import net.javahippie.liftlog.model.entity.XpLogEntry;
import net.javahippie.liftlog.repository.WorkoutRepository;
import net.javahippie.liftlog.repository.WorkoutSetRepository;
import net.javahippie.liftlog.repository.XpLogRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Append-only XP ledger.
 *
 * <p>Each set and each finished workout earns XP at most once; the ledger's
 * (user, source type, source id) key makes repeated submissions harmless. Grants are
 * bounded by a daily cap and a per-workout cap on set XP. A grant that would cross a cap
 * is cut to the remaining headroom, and processing stops once a cap is reached.</p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class XpLedgerService {

    private final XpLogRepository xpLogRepository;
    private final WorkoutSetRepository workoutSetRepository;
    private final WorkoutRepository workoutRepository;
    private final LevelService levelService;
    private final UserLockService userLockService;
    private final GamificationProperties properties;
    private final Clock clock;

    /**
     * Award XP for completed sets of one workout, plus the workout bonus once it is finished.
     *
     * @param userId the user earning the XP
     * @param setIds ids of sets of a single workout owned by the user
     * @return XP granted by this call and the user's new daily total
     * @throws InvalidRequestException if no set ids are given or the sets span several workouts
     * @throws ResourceNotFoundException if a set or the workout does not exist
     * @throws ForbiddenOperationException if the workout belongs to another user
     */
    @Transactional
    public XpAwardResult awardXp(UUID userId, List<UUID> setIds) {
        if (setIds == null || setIds.isEmpty()) {
            throw new InvalidRequestException("setIds must not be empty");
        }
        List<UUID> requested = new ArrayList<>(new LinkedHashSet<>(setIds));

        Map<UUID, WorkoutSet> sets = workoutSetRepository.findByIdIn(requested).stream()
            .collect(Collectors.toMap(WorkoutSet::getId, Function.identity()));
        List<UUID> missing = requested.stream().filter(id -> !sets.containsKey(id)).toList();
        if (!missing.isEmpty()) {
            throw new ResourceNotFoundException("Workout sets not found: " + missing);
        }

        Set<UUID> workoutIds = sets.values().stream()
            .map(WorkoutSet::getWorkoutId)
            .collect(Collectors.toSet());
        if (workoutIds.size() > 1) {
            throw new InvalidRequestException("All sets must belong to the same workout");
        }
        UUID workoutId = workoutIds.iterator().next();
        Workout workout = workoutRepository.findByIdAndDeletedAtIsNull(workoutId)
            .orElseThrow(() -> new ResourceNotFoundException("Workout not found: " + workoutId));
        if (!workout.getUserId().equals(userId)) {
            throw new ForbiddenOperationException("Workout " + workoutId + " does not belong to user " + userId);
        }

        userLockService.lockUser(userId);

        long todayTotal = xpLogRepository.sumXpByUserIdSince(userId, startOfToday());
        if (todayTotal >= properties.dailyXpCap()) {
            log.debug("Daily XP cap reached for user {} ({} XP), nothing awarded", userId, todayTotal);
            return new XpAwardResult(0, todayTotal);
        }

        long workoutTotal = xpLogRepository.sumXpBySources(
            userId, XpLogEntry.SourceType.SET, workoutSetRepository.findIdsByWorkoutId(workoutId));
        Set<UUID> alreadyAwarded = new HashSet<>(
            xpLogRepository.findAwardedSourceIds(userId, XpLogEntry.SourceType.SET, requested));

        int granted = 0;
        for (UUID setId : requested) {
            if (alreadyAwarded.contains(setId)) {
                continue;
            }
            if (sets.get(setId).getDeletedAt() != null) {
                log.debug("Skipping deleted set {}", setId);
                continue;
            }
            long dailyHeadroom = properties.dailyXpCap() - (todayTotal + granted);
            long workoutHeadroom = properties.workoutXpCap() - (workoutTotal + granted);
            int amount = (int) Math.min(properties.xpPerSet(), Math.min(dailyHeadroom, workoutHeadroom));
            if (amount <= 0) {
                log.debug("XP cap reached for user {} in workout {}, remaining sets unawarded", userId, workoutId);
                break;
            }
            append(userId, XpLogEntry.SourceType.SET, setId, amount);
            granted += amount;
        }

        if (workout.isFinished()
            && !xpLogRepository.existsByUserIdAndSourceTypeAndSourceId(userId, XpLogEntry.SourceType.WORKOUT, workoutId)) {
            long dailyHeadroom = properties.dailyXpCap() - (todayTotal + granted);
            int bonus = (int) Math.min(properties.workoutBonusXp(), dailyHeadroom);
            if (bonus > 0) {
                append(userId, XpLogEntry.SourceType.WORKOUT, workoutId, bonus);
                granted += bonus;
            }
        }

        if (granted > 0) {
            levelService.recalculateLevel(userId);
            log.info("Awarded {} XP to user {} for workout {}", granted, userId, workoutId);
        }

        return new XpAwardResult(granted, todayTotal + granted);
    }

    private void append(UUID userId, XpLogEntry.SourceType sourceType, UUID sourceId, int amount) {
        XpLogEntry entry = XpLogEntry.builder()
            .userId(userId)
            .sourceType(sourceType)
            .sourceId(sourceId)
            .xpAmount(amount)
            .build();
        xpLogRepository.save(entry);
    }

    private Instant startOfToday() {
        ZoneId zone = properties.ledgerZoneId();
        return LocalDate.ofInstant(clock.instant(), zone).atStartOfDay(zone).toInstant();
    }
}
