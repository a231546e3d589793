package net.javahippie.liftlog.service;

import jakarta.persistence.EntityManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Per-user serialization point for the gamification handlers.
 * Takes a PostgreSQL transaction-scoped advisory lock keyed by the user id; the lock is
 * released when the surrounding transaction ends and is re-entrant within it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserLockService {

    private final EntityManager entityManager;

    /**
     * Blocks until no other transaction holds the lock of this user.
     * Must be called inside a transaction.
     *
     * @param userId the user whose gamification state is about to change
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void lockUser(UUID userId) {
        long key = lockKey(userId);
        entityManager.createNativeQuery("SELECT 1 FROM (SELECT pg_advisory_xact_lock(:key)) AS l")
            .setParameter("key", key)
            .getSingleResult();
        log.trace("Acquired gamification lock for user {}", userId);
    }

    static long lockKey(UUID userId) {
        return userId.getMostSignificantBits() ^ userId.getLeastSignificantBits();
    }
}
