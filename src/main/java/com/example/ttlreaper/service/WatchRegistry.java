package com.example.ttlreaper.service;

import com.example.ttlreaper.access.ClusterResourceAccess;
import com.example.ttlreaper.models.ReaperPolicy;
import com.example.ttlreaper.models.ResourceEvent;
import com.example.ttlreaper.models.ResourceLocator;
import jakarta.annotation.PreDestroy;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * One cluster-wide watch per distinct target locator. Watches accumulate for the lifetime of
 * the process; the set of target kinds is bounded by the policies, not by instances.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WatchRegistry {

    private final ClusterResourceAccess clusterResourceAccess;
    private final ResourceLocatorResolver resolver;
    private final ReconciliationLoop loop;
    private final ExpirationScheduler expirationScheduler;

    private final Map<ResourceLocator, ClusterResourceAccess.WatchHandle> watches = new ConcurrentHashMap<>();

    /**
     * Opens watches for locators referenced by current policies that are not watched yet.
     *
     * @return number of watches opened by this call
     */
    public synchronized int refresh() {
        int opened = 0;
        for (ReaperPolicy policy : loop.policies()) {
            if (!policy.enabledOrDefault()) {
                continue;
            }
            ResourceLocator locator;
            try {
                locator = resolver.resolve(policy.getTargetKind(), policy.getTargetApiVersion());
            } catch (TtlReaperException ex) {
                // reported by the policy's own pass
                continue;
            }
            if (watches.containsKey(locator)) {
                continue;
            }
            try {
                watches.put(locator, clusterResourceAccess.watch(locator, "", this::onEvent));
                opened++;
                log.info("Watching {} for policy {}", locator, policy.getName());
            } catch (RuntimeException ex) {
                log.warn("Could not open watch on {}, will retry on next refresh: {}", locator, ex.getMessage());
            }
        }
        return opened;
    }

    void onEvent(ResourceEvent event) {
        if (event.type() == ResourceEvent.Type.DELETED) {
            expirationScheduler.cancel(event.key(), "deleted from cluster");
            return;
        }
        List<ReaperPolicy> policies = loop.policiesTargeting(event.kind(), event.apiVersion());
        if (policies.isEmpty()) {
            return;
        }
        log.debug("{} {} re-triggers {} policies", event.type(), event.key(), policies.size());
        for (ReaperPolicy policy : policies) {
            loop.trigger(policy.getName(), ReconciliationLoop.Trigger.WATCH_EVENT);
        }
    }

    public Set<ResourceLocator> watchedLocators() {
        return Set.copyOf(watches.keySet());
    }

    @PreDestroy
    public synchronized void closeAll() {
        watches.forEach((locator, handle) -> {
            try {
                handle.close();
            } catch (RuntimeException ex) {
                log.warn("Failed to close watch on {}: {}", locator, ex.getMessage());
            }
        });
        watches.clear();
    }
}
