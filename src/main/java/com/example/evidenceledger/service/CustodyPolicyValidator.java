package com.example.evidenceledger.service;

import com.example.evidenceledger.config.CustodyPolicyProperties;
import com.example.evidenceledger.models.CustodyEvent;
import com.example.evidenceledger.models.Fingerprint;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Decides whether a proposed custody action is allowed for an evidence item.
 *
 * <p>The runtime state per evidence id (last accepted step and active checkout) is a cache of the
 * custody log and can be rebuilt from it with {@link #rehydrate}. Decisions for one evidence id
 * are serialized by the lock stripe the id hashes to.
 */
@Component
@Slf4j
public class CustodyPolicyValidator {

    private static final double MILLIS_PER_HOUR = 60 * 60 * 1000.0;
    private static final int LOCK_STRIPES = 64;

    private final CustodyPolicyProperties policy;
    private final Clock clock;
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];
    private final ConcurrentMap<Long, CustodyState> states = new ConcurrentHashMap<>();

    public CustodyPolicyValidator(CustodyPolicyProperties policy, Clock clock) {
        this.policy = policy;
        this.clock = clock;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    /**
     * Validates {@code action} by {@code handler} and, when accepted, records it as the current
     * step. The built-in rules do not inspect {@code details}.
     */
    public PolicyDecision validate(long evidenceId, String action, String handler, Map<String, Object> details) {
        ReentrantLock lock = lockFor(evidenceId);
        lock.lock();
        try {
            CustodyState state = states.computeIfAbsent(evidenceId, id -> new CustodyState());
            long now = clock.millis();
            PolicyDecision decision = decide(state, action, handler, now);
            if (decision.accepted()) {
                state.accept(action, handler, now);
            } else {
                log.debug("Rejected {} by {} on evidence {}: {}", action, handler, evidenceId, decision.detail());
            }
            return decision;
        } finally {
            lock.unlock();
        }
    }

    public void releaseCheckout(long evidenceId) {
        ReentrantLock lock = lockFor(evidenceId);
        lock.lock();
        try {
            CustodyState state = states.get(evidenceId);
            if (state != null) {
                state.checkoutHandler = null;
                state.checkoutSince = 0L;
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean isTracking(long evidenceId) {
        return states.containsKey(evidenceId);
    }

    /**
     * Captures the current runtime state of {@code evidenceId} so that a decision can be undone
     * with {@link #restore} if the action it accepted is never committed.
     */
    public Checkpoint checkpoint(long evidenceId) {
        ReentrantLock lock = lockFor(evidenceId);
        lock.lock();
        try {
            CustodyState state = states.get(evidenceId);
            if (state == null) {
                return new Checkpoint(evidenceId, false, null, null, 0L);
            }
            return new Checkpoint(evidenceId, true, state.currentStep, state.checkoutHandler, state.checkoutSince);
        } finally {
            lock.unlock();
        }
    }

    public void restore(Checkpoint checkpoint) {
        ReentrantLock lock = lockFor(checkpoint.evidenceId());
        lock.lock();
        try {
            if (!checkpoint.tracked()) {
                states.remove(checkpoint.evidenceId());
                return;
            }
            CustodyState state = new CustodyState();
            state.currentStep = checkpoint.currentStep();
            state.checkoutHandler = checkpoint.checkoutHandler();
            state.checkoutSince = checkpoint.checkoutSince();
            states.put(checkpoint.evidenceId(), state);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Rebuilds the runtime state for {@code evidenceId} by replaying its accepted custody actions.
     * VIOLATION records and the VERIFIED records written by fingerprint verification (metadata
     * equal to the evidence fingerprint) never passed through the validator and are skipped.
     */
    public void rehydrate(long evidenceId, Fingerprint evidenceFingerprint, List<CustodyEvent> events) {
        ReentrantLock lock = lockFor(evidenceId);
        lock.lock();
        try {
            CustodyState state = new CustodyState();
            for (CustodyEvent event : events) {
                if (ActionRegistry.VIOLATION.equals(event.getAction())) {
                    continue;
                }
                if (ActionRegistry.VERIFIED.equals(event.getAction())
                        && evidenceFingerprint.equals(event.getMetadataHash())) {
                    continue;
                }
                state.accept(event.getAction(), event.getHandler(), event.getTimestamp());
            }
            states.put(evidenceId, state);
            log.info("Rehydrated custody state for evidence {} from {} events (current step {})",
                    evidenceId, events.size(), state.currentStep);
        } finally {
            lock.unlock();
        }
    }

    Optional<String> currentStep(long evidenceId) {
        return Optional.ofNullable(states.get(evidenceId)).map(s -> s.currentStep);
    }

    Optional<String> checkoutHolder(long evidenceId) {
        return Optional.ofNullable(states.get(evidenceId)).map(s -> s.checkoutHandler);
    }

    private PolicyDecision decide(CustodyState state, String action, String handler, long now) {
        if (state.currentStep != null) {
            PolicyDecision order = checkOrder(state.currentStep, action);
            if (!order.accepted()) {
                return order;
            }
        }

        if (policy.isNoParallelAccess()
                && !ActionRegistry.COLLECTED.equals(action)
                && state.checkoutHandler != null
                && !state.checkoutHandler.equals(handler)) {
            return PolicyDecision.reject(EvidenceLedgerException.Code.PARALLEL_ACCESS_VIOLATION,
                    "Evidence currently held by " + state.checkoutHandler);
        }

        if (state.checkoutHandler != null) {
            double hoursHeld = (now - state.checkoutSince) / MILLIS_PER_HOUR;
            if (hoursHeld > policy.getMaxAccessDurationHours()) {
                return PolicyDecision.reject(EvidenceLedgerException.Code.ACCESS_DURATION_EXCEEDED,
                        String.format(Locale.ROOT, "Max duration %sh exceeded (held %.1fh)",
                                formatHours(policy.getMaxAccessDurationHours()), hoursHeld));
            }
        }

        return PolicyDecision.accept();
    }

    private PolicyDecision checkOrder(String currentStep, String action) {
        if (currentStep.equals(action)) {
            return PolicyDecision.accept();
        }
        List<String> order = policy.getRequiredOrder();
        int nextIndex = order.indexOf(action);
        if (nextIndex < 0) {
            // ad-hoc actions sit outside the lifecycle
            return PolicyDecision.accept();
        }
        // An ad-hoc current step has index -1, so every earlier required step counts as skipped.
        int currentIndex = order.indexOf(currentStep);

        if (nextIndex > currentIndex + 1) {
            List<String> invalidSkips = order.subList(currentIndex + 1, nextIndex).stream()
                    .filter(step -> !policy.getAllowedSkips().contains(step))
                    .toList();
            if (!invalidSkips.isEmpty()) {
                return PolicyDecision.reject(EvidenceLedgerException.Code.INVALID_CUSTODY_ORDER,
                        "Cannot skip required steps: " + String.join(", ", invalidSkips));
            }
        }

        if (nextIndex < currentIndex) {
            return PolicyDecision.reject(EvidenceLedgerException.Code.INVALID_CUSTODY_ORDER,
                    "Cannot move backward in custody chain");
        }
        return PolicyDecision.accept();
    }

    private ReentrantLock lockFor(long evidenceId) {
        return locks[Math.floorMod(Long.hashCode(evidenceId), LOCK_STRIPES)];
    }

    private static String formatHours(double hours) {
        if (hours == Math.rint(hours)) {
            return String.valueOf((long) hours);
        }
        return String.valueOf(hours);
    }

    /**
     * Runtime state of one evidence id at a point in time.
     */
    public record Checkpoint(long evidenceId,
                             boolean tracked,
                             String currentStep,
                             String checkoutHandler,
                             long checkoutSince) {
    }

    private static final class CustodyState {
        private String currentStep;
        private String checkoutHandler;
        private long checkoutSince;

        void accept(String action, String handler, long at) {
            currentStep = action;
            if (ActionRegistry.ACCESSED.equals(action) || ActionRegistry.TRANSFERRED.equals(action)) {
                checkoutHandler = handler;
                checkoutSince = at;
            }
        }
    }
}
