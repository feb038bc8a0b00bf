package com.example.ttlreaper.service;

import com.example.ttlreaper.access.ClusterResourceAccess;
import com.example.ttlreaper.access.ReaperPolicyAccess;
import com.example.ttlreaper.models.ReaperPolicy;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Background driver: subscribes to the policy store once the application is up, periodically
 * re-lists it as a backstop for missed notifications, and refreshes the watched kinds.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(value = "reaper.enabled", havingValue = "true")
public class ReaperRunner {

    private final Clock clock;
    private final ReaperPolicyAccess policyAccess;
    private final ReconciliationLoop loop;
    private final WatchRegistry watchRegistry;

    private volatile ClusterResourceAccess.WatchHandle policyWatch;

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        log.info("Starting reaper: subscribing to policy store");
        policyWatch = policyAccess.watch(loop::apply);
        resyncPolicies();
        refreshWatches();
    }

    @Scheduled(initialDelayString = "${reaper.policy-resync-millis:60000}",
            fixedDelayString = "${reaper.policy-resync-millis:60000}")
    public void resyncPolicies() {
        long startTime = clock.millis();
        String jobRequestId = "resync-job-" + UUID.randomUUID();
        List<ReaperPolicy> policies;
        try {
            policies = policyAccess.findAll();
        } catch (RuntimeException ex) {
            log.warn("[{}] Failed to list policies, keeping the current set: {}", jobRequestId, ex.getMessage());
            return;
        }
        loop.resync(policies);
        log.info("[{}] Policy resync completed in {}ms: policies={}",
                jobRequestId, clock.millis() - startTime, policies.size());
    }

    @Scheduled(initialDelayString = "${reaper.watch-refresh-millis:30000}",
            fixedDelayString = "${reaper.watch-refresh-millis:30000}")
    public void refreshWatches() {
        int opened = watchRegistry.refresh();
        if (opened > 0) {
            log.info("Opened {} new watches, {} kinds watched in total",
                    opened, watchRegistry.watchedLocators().size());
        }
    }

    @PreDestroy
    public void stop() {
        ClusterResourceAccess.WatchHandle handle = policyWatch;
        if (handle != null) {
            handle.close();
        }
    }
}
