package com.example.ttlreaper.models;

import java.util.Objects;

/**
 * Group, version and plural resource name used to address a kind through the generic API.
 * An empty group is the core API.
 */
public record ResourceLocator(String group, String version, String resource) {

    public ResourceLocator {
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(resource, "resource");
    }

    public String apiVersion() {
        return group.isEmpty() ? version : group + "/" + version;
    }

    @Override
    public String toString() {
        return group.isEmpty() ? resource + "." + version : resource + "." + version + "." + group;
    }
}
