package com.example.ttlreaper.models;

import java.util.Objects;

/**
 * Identity of a target instance for timer deduplication. Cluster-scoped instances use an
 * empty namespace.
 */
public record ResourceKey(String namespace, String kind, String name) {

    public ResourceKey {
        namespace = namespace == null ? "" : namespace;
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
    }

    @Override
    public String toString() {
        return namespace + "/" + kind + "/" + name;
    }
}
