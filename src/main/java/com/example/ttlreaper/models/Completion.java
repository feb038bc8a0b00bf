package com.example.ttlreaper.models;

import java.time.Instant;
import java.util.Optional;

/**
 * Outcome of completion classification. {@code completedAt} is only set when the payload
 * carried a usable timestamp.
 */
public record Completion(boolean finished, Signal signal, Instant completedAt) {

    public enum Signal {
        PHASE,
        CONDITION,
        COMPLETION_TIME,
        NONE
    }

    private static final Completion UNFINISHED = new Completion(false, Signal.NONE, null);

    public static Completion unfinished() {
        return UNFINISHED;
    }

    public static Completion finished(Signal signal, Instant completedAt) {
        return new Completion(true, signal, completedAt);
    }

    public Optional<Instant> completionInstant() {
        return Optional.ofNullable(completedAt);
    }
}
