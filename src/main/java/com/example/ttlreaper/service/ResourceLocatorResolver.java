package com.example.ttlreaper.service;

import com.example.ttlreaper.config.ReaperProperties;
import com.example.ttlreaper.models.ResourceLocator;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Maps a kind and apiVersion to the locator used by the generic API.
 *
 * <p>Plurals come from a suffix rule ({@code y -> ies}, {@code s/x/z -> es}, otherwise
 * {@code s}). Irregular kinds ({@code Gateway}, {@code Endpoints}) need an entry in
 * {@code reaper.plural-overrides}, keyed by {@code Kind.group} or plain {@code Kind}.
 */
@Component
public class ResourceLocatorResolver {

    private final Map<String, String> pluralOverrides;

    public ResourceLocatorResolver(ReaperProperties properties) {
        this.pluralOverrides = Map.copyOf(properties.getPluralOverrides());
    }

    public ResourceLocator resolve(String kind, String apiVersion) {
        if (kind == null || kind.isBlank()) {
            throw TtlReaperException.missingRequiredField("targetKind");
        }
        if (apiVersion == null || apiVersion.isBlank()) {
            throw TtlReaperException.missingRequiredField("targetAPIVersion");
        }

        String group;
        String version;
        int slash = apiVersion.indexOf('/');
        if (slash < 0) {
            group = "";
            version = apiVersion;
        } else {
            group = apiVersion.substring(0, slash);
            version = apiVersion.substring(slash + 1);
            if (group.isEmpty() || version.isEmpty() || version.indexOf('/') >= 0) {
                throw TtlReaperException.invalidApiVersion(apiVersion);
            }
        }
        if (containsWhitespace(apiVersion)) {
            throw TtlReaperException.invalidApiVersion(apiVersion);
        }

        return new ResourceLocator(group, version, pluralFor(kind, group));
    }

    private String pluralFor(String kind, String group) {
        String override = pluralOverrides.get(kind + "." + group);
        if (override == null) {
            override = pluralOverrides.get(kind);
        }
        return override != null ? override : pluralize(kind);
    }

    static String pluralize(String kind) {
        String lower = kind.toLowerCase(Locale.ROOT);
        if (lower.endsWith("y")) {
            return lower.substring(0, lower.length() - 1) + "ies";
        }
        if (lower.endsWith("s") || lower.endsWith("x") || lower.endsWith("z")) {
            return lower + "es";
        }
        return lower + "s";
    }

    private static boolean containsWhitespace(String value) {
        return value.chars().anyMatch(Character::isWhitespace);
    }
}
