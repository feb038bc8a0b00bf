package com.example.ttlreaper.models;

import java.util.Objects;

/**
 * One entry of the policy store's notification feed.
 */
public record PolicyChange(Type type, ReaperPolicy policy) {

    public enum Type {
        CREATED,
        UPDATED,
        DELETED
    }

    public PolicyChange {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(policy, "policy");
    }

    public String policyName() {
        return policy.getName();
    }
}
