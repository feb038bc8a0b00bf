package com.example.ttlreaper.models;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * In-memory snapshot of a policy's last reconciliation. Counters describe the last pass only,
 * except {@code totalReaped} which accumulates for the lifetime of the process and
 * {@code deniedResources}, the resources this policy will not try to delete again until it is edited.
 */
@Builder(toBuilder = true)
@Getter
@ToString
public class PolicyStatus {

    private final String policyName;
    private final PolicyState state;
    private final String message;
    private final Instant lastReconciledAt;
    private final int namespacesProcessed;
    private final int namespacesFailed;
    private final int instancesSeen;
    private final int scheduled;
    private final int deleted;
    private final int denied;
    private final int failed;
    private final int skipped;
    private final long totalReaped;
    private final int deniedResources;

    public static PolicyStatus unvalidated(String policyName) {
        return PolicyStatus.builder()
                .policyName(policyName)
                .state(PolicyState.UNVALIDATED)
                .build();
    }
}
