package com.example.ttlreaper.models;

import java.util.Objects;

/**
 * Change notification for a watched instance.
 */
public record ResourceEvent(Type type, TargetInstance object) {

    public enum Type {
        ADDED,
        MODIFIED,
        DELETED
    }

    public ResourceEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(object, "object");
    }

    public String kind() {
        return object.getKind();
    }

    public String apiVersion() {
        return object.getApiVersion();
    }

    public ResourceKey key() {
        return object.key(object.getKind());
    }
}
