package com.example.ttlreaper.models;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.Optional;
import lombok.Getter;

/**
 * A live instance of a watched kind, as returned by the cluster API. Not owned by the reaper.
 */
@Getter
public final class TargetInstance {

    private final ResourceDocument document;
    private final String apiVersion;
    private final String kind;
    private final String namespace;
    private final String name;
    private final Instant creationTimestamp;

    private TargetInstance(ResourceDocument document) {
        this.document = document;
        this.apiVersion = document.text("apiVersion").orElse("");
        this.kind = document.text("kind").orElse("");
        this.namespace = document.text("metadata", "namespace").orElse("");
        this.name = document.text("metadata", "name").orElse("");
        this.creationTimestamp = document.timestamp("metadata", "creationTimestamp").orElse(null);
    }

    public static TargetInstance of(JsonNode object) {
        return new TargetInstance(ResourceDocument.of(object));
    }

    public Optional<Instant> creationTime() {
        return Optional.ofNullable(creationTimestamp);
    }

    /**
     * Key used for timer deduplication. Falls back to the given kind when the payload omits it,
     * which list responses are allowed to do.
     */
    public ResourceKey key(String fallbackKind) {
        return new ResourceKey(namespace, kind.isEmpty() ? fallbackKind : kind, name);
    }
}
