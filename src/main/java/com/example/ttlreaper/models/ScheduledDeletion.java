package com.example.ttlreaper.models;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import lombok.Getter;

/**
 * A pending deferred deletion. Lives only in memory and is identity-compared: a firing timer
 * acts only while it is still the registered entry for its key.
 */
@Getter
public final class ScheduledDeletion {

    private final ResourceKey key;
    private final ResourceLocator locator;
    private final String policyName;
    private final Instant expiresAt;
    private volatile ScheduledFuture<?> future;

    public ScheduledDeletion(ResourceKey key, ResourceLocator locator, String policyName, Instant expiresAt) {
        this.key = key;
        this.locator = locator;
        this.policyName = policyName;
        this.expiresAt = expiresAt;
    }

    public void attach(ScheduledFuture<?> future) {
        this.future = future;
    }

    public void cancel() {
        ScheduledFuture<?> current = future;
        if (current != null) {
            current.cancel(false);
        }
    }

    @Override
    public String toString() {
        return key + "@" + expiresAt;
    }
}
