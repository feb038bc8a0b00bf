package com.example.ttlreaper.models;

public enum DeletionOutcome {
    DELETED,
    /** Not found at delete time; the desired end state already holds. */
    ALREADY_GONE,
    /** Permission error. Retrying will not help until RBAC changes. */
    DENIED,
    /** Anything else; the next reconciliation pass retries. */
    TRANSIENT;

    public boolean isSuccess() {
        return this == DELETED || this == ALREADY_GONE;
    }
}
