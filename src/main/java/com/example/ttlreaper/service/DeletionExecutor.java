package com.example.ttlreaper.service;

import com.example.ttlreaper.access.ClusterApiException;
import com.example.ttlreaper.access.ClusterResourceAccess;
import com.example.ttlreaper.models.DeletionOutcome;
import com.example.ttlreaper.models.ResourceKey;
import com.example.ttlreaper.models.ResourceLocator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Issues a single delete and classifies the result. Never retries; a failed attempt is picked up
 * again by the next reconciliation pass.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeletionExecutor {

    private final ClusterResourceAccess clusterResourceAccess;

    public DeletionOutcome delete(String policyName, ResourceLocator locator, ResourceKey key) {
        log.info("event=delete-attempted policy={} resource={} locator={}", policyName, key, locator);
        try {
            clusterResourceAccess.delete(locator, key.namespace(), key.name());
            log.info("event=delete-succeeded policy={} resource={}", policyName, key);
            return DeletionOutcome.DELETED;
        } catch (ClusterApiException ex) {
            if (ex.isNotFound()) {
                log.info("event=delete-skipped-not-found policy={} resource={}", policyName, key);
                return DeletionOutcome.ALREADY_GONE;
            }
            if (ex.isDenied()) {
                log.error("event=delete-denied policy={} resource={} Deletion will not succeed until "
                        + "permissions change: {}", policyName, key, ex.getMessage());
                return DeletionOutcome.DENIED;
            }
            log.warn("event=delete-failed policy={} resource={} Will retry on next reconciliation: {}",
                    policyName, key, ex.getMessage());
            return DeletionOutcome.TRANSIENT;
        } catch (RuntimeException ex) {
            log.warn("event=delete-failed policy={} resource={} Will retry on next reconciliation: {}",
                    policyName, key, ex.getMessage());
            return DeletionOutcome.TRANSIENT;
        }
    }
}
