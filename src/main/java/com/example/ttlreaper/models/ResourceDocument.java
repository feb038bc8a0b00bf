package com.example.ttlreaper.models;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view over a loosely typed resource payload. Every accessor fails closed: a missing
 * segment, a null, or a value of the wrong shape comes back empty instead of throwing.
 */
public final class ResourceDocument {

    private final JsonNode root;

    private ResourceDocument(JsonNode root) {
        this.root = root == null ? MissingNode.getInstance() : root;
    }

    public static ResourceDocument of(JsonNode root) {
        return new ResourceDocument(root);
    }

    public JsonNode root() {
        return root;
    }

    /**
     * Resolves a dotted path such as {@code spec.ttlSecondsAfterFinished}.
     */
    public Optional<JsonNode> at(String dottedPath) {
        if (dottedPath == null || dottedPath.isBlank()) {
            return Optional.empty();
        }
        return at(dottedPath.split("\\."));
    }

    public Optional<JsonNode> at(String... segments) {
        JsonNode current = root;
        for (String segment : segments) {
            if (segment.isEmpty() || !current.isObject()) {
                return Optional.empty();
            }
            current = current.get(segment);
            if (current == null || current.isNull()) {
                return Optional.empty();
            }
        }
        return current.isMissingNode() ? Optional.empty() : Optional.of(current);
    }

    public Optional<String> text(String... segments) {
        return at(segments).filter(JsonNode::isTextual).map(JsonNode::asText);
    }

    /**
     * RFC 3339 timestamp at the given path; empty when absent or unparsable.
     */
    public Optional<Instant> timestamp(String... segments) {
        return text(segments).flatMap(ResourceDocument::parseTimestamp);
    }

    /**
     * Object elements of the sequence at the given path. Non-object elements are dropped.
     */
    public List<ResourceDocument> objects(String... segments) {
        Optional<JsonNode> node = at(segments).filter(JsonNode::isArray);
        if (node.isEmpty()) {
            return List.of();
        }
        List<ResourceDocument> result = new ArrayList<>();
        for (JsonNode element : node.get()) {
            if (element.isObject()) {
                result.add(new ResourceDocument(element));
            }
        }
        return result;
    }

    public static Optional<Instant> parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(OffsetDateTime.parse(value).toInstant());
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    @Override
    public String toString() {
        return root.toString();
    }
}
