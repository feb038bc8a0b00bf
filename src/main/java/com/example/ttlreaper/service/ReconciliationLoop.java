package com.example.ttlreaper.service;

import com.example.ttlreaper.config.ReaperProperties;
import com.example.ttlreaper.config.SchedulerConfig;
import com.example.ttlreaper.models.PolicyChange;
import com.example.ttlreaper.models.PolicyStatus;
import com.example.ttlreaper.models.ReaperPolicy;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Keeps the known policies and drives their reconciliation passes on the worker pool.
 *
 * <p>Passes for one policy never overlap: a trigger that arrives while a pass is running is
 * folded into a single follow-up pass. Passes for different policies run concurrently.
 * Each policy also gets a fixed-delay tick at its check interval.
 */
@Service
@Slf4j
public class ReconciliationLoop {

    public static final String MDC_POLICY = "policy";

    public enum Trigger {
        POLICY_CHANGE,
        WATCH_EVENT,
        PERIODIC,
        RESYNC
    }

    private final PolicyReconciler reconciler;
    private final ExpirationScheduler expirationScheduler;
    private final TaskExecutor workers;
    private final TaskScheduler timers;
    private final ReaperProperties properties;
    private final Clock clock;

    private final ConcurrentMap<String, PolicyRuntime> runtimes = new ConcurrentHashMap<>();

    public ReconciliationLoop(PolicyReconciler reconciler,
                              ExpirationScheduler expirationScheduler,
                              @Qualifier(SchedulerConfig.WORKER_POOL) TaskExecutor workers,
                              @Qualifier(SchedulerConfig.TIMER_POOL) TaskScheduler timers,
                              ReaperProperties properties,
                              Clock clock) {
        this.reconciler = reconciler;
        this.expirationScheduler = expirationScheduler;
        this.workers = workers;
        this.timers = timers;
        this.properties = properties;
        this.clock = clock;
    }

    public void apply(PolicyChange change) {
        switch (change.type()) {
            case CREATED, UPDATED -> upsert(change.policy());
            case DELETED -> remove(change.policyName());
        }
    }

    /**
     * Registers or replaces a policy. When the definition changed, resources whose delete was
     * denied under the old definition become eligible again and a pass is triggered.
     *
     * @return true if the stored definition changed
     */
    public boolean upsert(ReaperPolicy policy) {
        String name = policy.getName();
        if (name == null || name.isBlank()) {
            log.warn("event=policy-invalid Ignoring policy without a name: {}", policy);
            return false;
        }
        PolicyRuntime runtime;
        boolean changed;
        while (true) {
            runtime = runtimes.computeIfAbsent(name, PolicyRuntime::new);
            synchronized (runtime) {
                if (!runtime.removed) {
                    changed = register(runtime, policy);
                    break;
                }
            }
            // lost a race with remove(); the map no longer holds this runtime
        }
        if (changed) {
            expirationScheduler.clearDenied(name);
            log.info("Policy {} registered: kind={} apiVersion={} namespace={} interval={}",
                    name, policy.getTargetKind(), policy.getTargetApiVersion(),
                    policy.clusterWide() ? "*" : policy.getTargetNamespace(), runtime.interval);
            trigger(name, Trigger.POLICY_CHANGE);
        }
        return changed;
    }

    // caller holds the runtime monitor
    private boolean register(PolicyRuntime runtime, ReaperPolicy policy) {
        String name = runtime.name;
        boolean changed = !policy.equals(runtime.policy);
        Duration interval = policy.checkIntervalOrDefault(properties.getDefaultCheckInterval());
        if (runtime.tick == null || !interval.equals(runtime.interval)) {
            if (runtime.tick != null) {
                runtime.tick.cancel(false);
            }
            runtime.interval = interval;
            runtime.tick = timers.scheduleWithFixedDelay(
                    () -> trigger(name, Trigger.PERIODIC), clock.instant().plus(interval), interval);
        }
        runtime.policy = policy;
        return changed;
    }

    /**
     * Forgets a policy: stops its tick and cancels every timer it scheduled.
     */
    public boolean remove(String policyName) {
        PolicyRuntime runtime = runtimes.remove(policyName);
        if (runtime == null) {
            return false;
        }
        synchronized (runtime) {
            runtime.removed = true;
            if (runtime.tick != null) {
                runtime.tick.cancel(false);
                runtime.tick = null;
            }
        }
        expirationScheduler.cancelForPolicy(policyName);
        expirationScheduler.clearDenied(policyName);
        log.info("Policy {} removed", policyName);
        return true;
    }

    /**
     * Brings the registered set in line with a full listing of the policy store.
     */
    public void resync(Collection<ReaperPolicy> policies) {
        Set<String> seen = new HashSet<>();
        for (ReaperPolicy policy : policies) {
            upsert(policy);
            if (policy.getName() != null) {
                seen.add(policy.getName());
            }
        }
        for (String name : new ArrayList<>(runtimes.keySet())) {
            if (!seen.contains(name)) {
                log.info("Policy {} no longer present in the store", name);
                remove(name);
            }
        }
    }

    /**
     * Requests a pass. Returns immediately; the pass runs on the worker pool.
     */
    public void trigger(String policyName, Trigger trigger) {
        PolicyRuntime runtime = runtimes.get(policyName);
        if (runtime == null) {
            return;
        }
        synchronized (runtime) {
            if (runtime.removed) {
                return;
            }
            if (runtime.running) {
                runtime.pending = true;
                log.debug("Policy {} busy, coalescing {} trigger", policyName, trigger);
                return;
            }
            runtime.running = true;
        }
        log.debug("Policy {} triggered by {}", policyName, trigger);
        try {
            workers.execute(() -> drain(runtime));
        } catch (TaskRejectedException ex) {
            synchronized (runtime) {
                runtime.running = false;
            }
            log.warn("Policy {}: worker pool rejected {} trigger, next tick will retry: {}",
                    policyName, trigger, ex.getMessage());
        }
    }

    private void drain(PolicyRuntime runtime) {
        while (true) {
            ReaperPolicy policy;
            synchronized (runtime) {
                if (runtime.removed) {
                    runtime.running = false;
                    return;
                }
                runtime.pending = false;
                policy = runtime.policy;
            }
            MDC.put(MDC_POLICY, runtime.name);
            try {
                runtime.status = reconciler.reconcile(policy, runtime.status);
            } catch (RuntimeException ex) {
                log.error("Policy {}: reconciliation pass failed: {}", runtime.name, ex.getMessage(), ex);
            } finally {
                MDC.remove(MDC_POLICY);
            }
            synchronized (runtime) {
                if (runtime.removed) {
                    // removed mid-pass: drop anything this pass scheduled
                    expirationScheduler.cancelForPolicy(runtime.name);
                }
                if (runtime.removed || !runtime.pending) {
                    runtime.running = false;
                    return;
                }
            }
        }
    }

    /**
     * Enabled policies whose target is exactly this kind and apiVersion.
     */
    public List<ReaperPolicy> policiesTargeting(String kind, String apiVersion) {
        List<ReaperPolicy> matches = new ArrayList<>();
        for (ReaperPolicy policy : policies()) {
            if (policy.enabledOrDefault() && policy.targets(kind, apiVersion)) {
                matches.add(policy);
            }
        }
        return matches;
    }

    public List<ReaperPolicy> policies() {
        List<ReaperPolicy> result = new ArrayList<>();
        for (PolicyRuntime runtime : runtimes.values()) {
            synchronized (runtime) {
                if (runtime.policy != null) {
                    result.add(runtime.policy);
                }
            }
        }
        return result;
    }

    public Optional<PolicyStatus> status(String policyName) {
        PolicyRuntime runtime = runtimes.get(policyName);
        if (runtime == null) {
            return Optional.empty();
        }
        PolicyStatus status = runtime.status;
        return Optional.of(status != null ? status : PolicyStatus.unvalidated(policyName));
    }

    @PreDestroy
    public void shutdown() {
        for (PolicyRuntime runtime : runtimes.values()) {
            synchronized (runtime) {
                if (runtime.tick != null) {
                    runtime.tick.cancel(false);
                    runtime.tick = null;
                }
            }
        }
        log.info("Reconciliation loop stopped with {} policies registered", runtimes.size());
    }

    private static final class PolicyRuntime {
        private final String name;
        private ReaperPolicy policy;
        private Duration interval;
        private ScheduledFuture<?> tick;
        private boolean running;
        private boolean pending;
        private boolean removed;
        private volatile PolicyStatus status;

        private PolicyRuntime(String name) {
            this.name = name;
        }
    }
}
