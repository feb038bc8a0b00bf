package com.example.ttlreaper.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Cluster-scoped cleanup policy: which kind to watch, where, and where its TTL lives.
 * The policy store owns these objects; the reaper only reads them.
 */
@JsonInclude(Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@NoArgsConstructor                     // required by Jackson
@AllArgsConstructor(access = AccessLevel.PRIVATE) // used by Lombok @Builder
@Builder(toBuilder = true)
@Getter @Setter
@EqualsAndHashCode
@ToString
public class ReaperPolicy {

    public static final String DEFAULT_TTL_FIELD_PATH = "spec.ttlSecondsAfterFinished";
    public static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofSeconds(300);

    @NotBlank
    private String name;

    @NotBlank
    private String targetKind;

    @NotBlank
    @JsonProperty("targetAPIVersion")
    private String targetApiVersion;

    // empty means every namespace
    private String targetNamespace;

    @Valid
    private LabelSelector labelSelector;

    private String ttlFieldPath;

    @Min(1)
    private Integer checkInterval;

    private Boolean enabled;

    public boolean clusterWide() {
        return targetNamespace == null || targetNamespace.isBlank();
    }

    public boolean enabledOrDefault() {
        return enabled == null || enabled;
    }

    public String ttlFieldPathOrDefault(String fallback) {
        return ttlFieldPath == null || ttlFieldPath.isBlank() ? fallback : ttlFieldPath;
    }

    public Duration checkIntervalOrDefault(Duration fallback) {
        return checkInterval == null ? fallback : Duration.ofSeconds(checkInterval);
    }

    /**
     * Whether instances of the given kind and apiVersion fall under this policy.
     */
    public boolean targets(String kind, String apiVersion) {
        return targetKind != null && targetKind.equals(kind)
                && targetApiVersion != null && targetApiVersion.equals(apiVersion);
    }
}
