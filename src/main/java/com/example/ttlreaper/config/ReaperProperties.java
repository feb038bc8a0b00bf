package com.example.ttlreaper.config;

import com.example.ttlreaper.models.ReaperPolicy;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Process-wide reaper settings under {@code reaper.*}. The check interval and TTL path apply to
 * policies that leave them unset; the pool sizes and resync periods are fixed at startup.
 * Nothing reconciles unless {@code enabled} is true.
 */
@Component
@ConfigurationProperties(prefix = "reaper")
@Data
public class ReaperProperties {

    private boolean enabled = false;
    private Duration defaultCheckInterval = ReaperPolicy.DEFAULT_CHECK_INTERVAL;
    private String defaultTtlFieldPath = ReaperPolicy.DEFAULT_TTL_FIELD_PATH;
    private long watchRefreshMillis = 30000;  // how often the watched-kind set is recomputed
    private long policyResyncMillis = 60000;  // full re-list of the policy store
    private int workerThreads = 4;
    private int schedulerThreads = 2;
    private Duration watchReconnectBackoff = Duration.ofSeconds(5);

    // Kind (or Kind.group) -> plural resource name, for kinds the suffix rule gets wrong
    private Map<String, String> pluralOverrides = new LinkedHashMap<>();

    private PolicyResource policyResource = new PolicyResource();

    @Data
    public static class PolicyResource {
        private String group = "clusterops.io";
        private String version = "v1alpha1";
        private String plural = "ttlreapers";
    }
}
