package com.example.ttlreaper.models;

public enum PolicyState {
    UNVALIDATED,
    ACTIVE,
    /** Configuration error; stays here until the policy is edited. */
    FAILED
}
