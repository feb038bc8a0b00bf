package com.example.ttlreaper.service;

import com.example.ttlreaper.config.SchedulerConfig;
import com.example.ttlreaper.models.Completion;
import com.example.ttlreaper.models.DeletionOutcome;
import com.example.ttlreaper.models.ReaperPolicy;
import com.example.ttlreaper.models.ResourceKey;
import com.example.ttlreaper.models.ResourceLocator;
import com.example.ttlreaper.models.ScheduledDeletion;
import com.example.ttlreaper.models.TargetInstance;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Turns finished, TTL-bearing instances into deletions: immediately when already expired,
 * otherwise through a timer that fires at the expiration instant.
 *
 * <p>Owns the timer registry. Every read-modify-write of the registry happens under one lock,
 * and no cluster call is made while holding it. At most one timer is registered per resource
 * key; registering a new one cancels the old one first. A firing timer deletes only if it is
 * still the registered entry for its key.
 *
 * <p>A key whose delete was denied is remembered for the policy that tried it and is not
 * deleted again until {@link #clearDenied} is called for that policy.
 */
@Service
@Slf4j
public class ExpirationScheduler {

    public enum Decision {
        DELETED,
        ALREADY_GONE,
        DENIED,
        PREVIOUSLY_DENIED,
        DELETE_FAILED,
        SCHEDULED,
        RESCHEDULED,
        NO_TTL,
        INVALID_TTL,
        UNFINISHED,
        NO_COMPLETION_TIME
    }

    private final Clock clock;
    private final TaskScheduler taskScheduler;
    private final CompletionClassifier classifier;
    private final DeletionExecutor deletionExecutor;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<ResourceKey, ScheduledDeletion> pending = new HashMap<>();
    private final Map<String, Set<ResourceKey>> deniedByPolicy = new HashMap<>();

    public ExpirationScheduler(Clock clock,
                               @Qualifier(SchedulerConfig.TIMER_POOL) TaskScheduler taskScheduler,
                               CompletionClassifier classifier,
                               DeletionExecutor deletionExecutor) {
        this.clock = clock;
        this.taskScheduler = taskScheduler;
        this.classifier = classifier;
        this.deletionExecutor = deletionExecutor;
    }

    /**
     * Evaluates one listed instance against a policy and deletes or schedules it.
     * An instance that is no longer eligible loses any timer it had.
     */
    public Decision evaluate(ReaperPolicy policy, ResourceLocator locator, TargetInstance instance,
                             String ttlFieldPath) {
        String policyName = policy.getName();
        ResourceKey key = instance.key(policy.getTargetKind());

        Optional<JsonNode> ttlValue = instance.getDocument().at(ttlFieldPath);
        if (ttlValue.isEmpty()) {
            cancel(key, "no TTL at " + ttlFieldPath);
            return Decision.NO_TTL;
        }

        Completion completion = classifier.classify(instance);
        if (!completion.finished()) {
            cancel(key, "not finished");
            return Decision.UNFINISHED;
        }

        long ttlSeconds;
        try {
            ttlSeconds = coerceTtlSeconds(ttlValue.get(), ttlFieldPath);
        } catch (TtlReaperException ex) {
            log.warn("Skipping {} for policy {}: {}", key, policyName, ex.getMessage());
            cancel(key, "invalid TTL");
            return Decision.INVALID_TTL;
        }

        Optional<Instant> completedAt = completion.completionInstant();
        if (completedAt.isEmpty()) {
            // Creation time as anchor can expire an instance earlier than its real completion.
            completedAt = instance.creationTime();
            if (completedAt.isPresent()) {
                log.debug("No completion timestamp on {} (signal {}), anchoring TTL on creation time {}",
                        key, completion.signal(), completedAt.get());
            }
        }
        if (completedAt.isEmpty()) {
            log.warn("Skipping {} for policy {}: finished but carries no usable timestamp", key, policyName);
            cancel(key, "no completion time");
            return Decision.NO_COMPLETION_TIME;
        }

        Instant expiresAt;
        try {
            expiresAt = completedAt.get().plusSeconds(ttlSeconds);
        } catch (DateTimeException | ArithmeticException ex) {
            log.warn("Skipping {} for policy {}: TTL {} at {} is out of range", key, policyName,
                    ttlSeconds, ttlFieldPath);
            cancel(key, "invalid TTL");
            return Decision.INVALID_TTL;
        }
        return schedule(policyName, locator, key, expiresAt);
    }

    /**
     * Deletes now when {@code expiresAt} has passed, otherwise (re)arms the timer for the key.
     */
    public Decision schedule(String policyName, ResourceLocator locator, ResourceKey key, Instant expiresAt) {
        Instant now = clock.instant();
        lock.lock();
        try {
            ScheduledDeletion previous = pending.remove(key);
            if (previous != null) {
                previous.cancel();
            }
            if (!isExpired(expiresAt, now)) {
                ScheduledDeletion entry = new ScheduledDeletion(key, locator, policyName, expiresAt);
                entry.attach(taskScheduler.schedule(() -> fire(entry), expiresAt));
                pending.put(key, entry);
                if (previous == null) {
                    log.info("event=schedule-created policy={} resource={} expiresAt={}",
                            policyName, key, expiresAt);
                    return Decision.SCHEDULED;
                }
                if (previous.getExpiresAt().equals(expiresAt)) {
                    log.debug("event=schedule-replaced policy={} resource={} expiresAt={} (unchanged)",
                            policyName, key, expiresAt);
                } else {
                    log.info("event=schedule-replaced policy={} resource={} expiresAt={} previous={}",
                            policyName, key, expiresAt, previous.getExpiresAt());
                }
                return Decision.RESCHEDULED;
            }
            if (previous != null) {
                log.info("event=schedule-cancelled policy={} resource={} Superseded by immediate deletion",
                        policyName, key);
            }
            if (isDenied(policyName, key)) {
                log.debug("Not deleting {} for policy {}: an earlier delete was denied", key, policyName);
                return Decision.PREVIOUSLY_DENIED;
            }
        } finally {
            lock.unlock();
        }
        return toDecision(deleteAndRecord(policyName, locator, key));
    }

    public boolean cancel(ResourceKey key, String reason) {
        ScheduledDeletion removed;
        lock.lock();
        try {
            removed = pending.remove(key);
            if (removed != null) {
                removed.cancel();
            }
        } finally {
            lock.unlock();
        }
        if (removed != null) {
            log.info("event=schedule-cancelled policy={} resource={} reason={}",
                    removed.getPolicyName(), key, reason);
        }
        return removed != null;
    }

    /**
     * Cancels every pending timer a policy registered.
     */
    public int cancelForPolicy(String policyName) {
        int cancelled = 0;
        lock.lock();
        try {
            Iterator<ScheduledDeletion> it = pending.values().iterator();
            while (it.hasNext()) {
                ScheduledDeletion entry = it.next();
                if (entry.getPolicyName().equals(policyName)) {
                    entry.cancel();
                    it.remove();
                    cancelled++;
                }
            }
        } finally {
            lock.unlock();
        }
        if (cancelled > 0) {
            log.info("event=schedule-cancelled policy={} count={} reason=policy removed or disabled",
                    policyName, cancelled);
        }
        return cancelled;
    }

    /**
     * Forgets the denied keys of a policy so the next pass tries them again.
     *
     * @return number of keys forgotten
     */
    public int clearDenied(String policyName) {
        Set<ResourceKey> cleared;
        lock.lock();
        try {
            cleared = deniedByPolicy.remove(policyName);
        } finally {
            lock.unlock();
        }
        if (cleared == null || cleared.isEmpty()) {
            return 0;
        }
        log.info("event=denied-cleared policy={} count={} Denied resources will be retried",
                policyName, cleared.size());
        return cleared.size();
    }

    public int deniedCount(String policyName) {
        lock.lock();
        try {
            Set<ResourceKey> keys = deniedByPolicy.get(policyName);
            return keys == null ? 0 : keys.size();
        } finally {
            lock.unlock();
        }
    }

    public Optional<Instant> scheduledExpiration(ResourceKey key) {
        lock.lock();
        try {
            ScheduledDeletion entry = pending.get(key);
            return entry == null ? Optional.empty() : Optional.of(entry.getExpiresAt());
        } finally {
            lock.unlock();
        }
    }

    public int pendingCount() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    void fire(ScheduledDeletion entry) {
        lock.lock();
        try {
            if (pending.get(entry.getKey()) != entry) {
                log.debug("Stale timer for {} ignored", entry);
                return;
            }
            pending.remove(entry.getKey());
            if (isDenied(entry.getPolicyName(), entry.getKey())) {
                log.debug("Timer for {} dropped: an earlier delete was denied", entry);
                return;
            }
        } finally {
            lock.unlock();
        }
        deleteAndRecord(entry.getPolicyName(), entry.getLocator(), entry.getKey());
    }

    private DeletionOutcome deleteAndRecord(String policyName, ResourceLocator locator, ResourceKey key) {
        DeletionOutcome outcome = deletionExecutor.delete(policyName, locator, key);
        if (outcome == DeletionOutcome.DENIED) {
            lock.lock();
            try {
                deniedByPolicy.computeIfAbsent(policyName, p -> new HashSet<>()).add(key);
            } finally {
                lock.unlock();
            }
        }
        return outcome;
    }

    // callers hold the lock
    private boolean isDenied(String policyName, ResourceKey key) {
        Set<ResourceKey> keys = deniedByPolicy.get(policyName);
        return keys != null && keys.contains(key);
    }

    /**
     * An instance may be deleted once {@code now >= expiresAt}.
     */
    static boolean isExpired(Instant expiresAt, Instant now) {
        return !now.isBefore(expiresAt);
    }

    /**
     * Accepts JSON integers, whole-valued JSON floats and numeric strings.
     *
     * @throws TtlReaperException with {@code INVALID_TTL_VALUE} for anything else, or a negative value
     */
    public static long coerceTtlSeconds(JsonNode value, String fieldPath) {
        long seconds;
        if (value.isIntegralNumber()) {
            if (!value.canConvertToLong()) {
                throw TtlReaperException.invalidTtlValue(fieldPath, value);
            }
            seconds = value.longValue();
        } else if (value.isFloatingPointNumber()) {
            double d = value.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d) || d != Math.rint(d) || Math.abs(d) > Long.MAX_VALUE) {
                throw TtlReaperException.invalidTtlValue(fieldPath, value);
            }
            seconds = (long) d;
        } else if (value.isTextual()) {
            try {
                seconds = Long.parseLong(value.asText().trim());
            } catch (NumberFormatException ex) {
                throw TtlReaperException.invalidTtlValue(fieldPath, value);
            }
        } else {
            throw TtlReaperException.invalidTtlValue(fieldPath, value);
        }
        if (seconds < 0) {
            throw TtlReaperException.invalidTtlValue(fieldPath, value);
        }
        return seconds;
    }

    private static Decision toDecision(DeletionOutcome outcome) {
        return switch (outcome) {
            case DELETED -> Decision.DELETED;
            case ALREADY_GONE -> Decision.ALREADY_GONE;
            case DENIED -> Decision.DENIED;
            case TRANSIENT -> Decision.DELETE_FAILED;
        };
    }
}
