package com.example.ttlreaper.access;

import com.example.ttlreaper.config.ReaperProperties;
import com.example.ttlreaper.models.PolicyChange;
import com.example.ttlreaper.models.ReaperPolicy;
import com.example.ttlreaper.models.ResourceEvent;
import com.example.ttlreaper.models.ResourceLocator;
import com.example.ttlreaper.models.TargetInstance;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads policies stored as cluster-scoped custom resources. The object name becomes the policy
 * name and the {@code spec} block is bound onto {@link ReaperPolicy}.
 */
@Component
@Slf4j
public class KubernetesReaperPolicyAccess implements ReaperPolicyAccess {

    private final ClusterResourceAccess clusterResourceAccess;
    private final ObjectMapper objectMapper;
    private final ResourceLocator policyLocator;

    public KubernetesReaperPolicyAccess(ClusterResourceAccess clusterResourceAccess,
                                        ObjectMapper objectMapper,
                                        ReaperProperties properties) {
        this.clusterResourceAccess = clusterResourceAccess;
        this.objectMapper = objectMapper;
        ReaperProperties.PolicyResource resource = properties.getPolicyResource();
        this.policyLocator = new ResourceLocator(resource.getGroup(), resource.getVersion(), resource.getPlural());
    }

    @Override
    public List<ReaperPolicy> findAll() {
        List<ReaperPolicy> policies = new ArrayList<>();
        for (TargetInstance object : clusterResourceAccess.list(policyLocator, "", null)) {
            toPolicy(object).ifPresent(policies::add);
        }
        return policies;
    }

    @Override
    public Optional<ReaperPolicy> findByName(String name) {
        return findAll().stream()
                .filter(policy -> policy.getName().equals(name))
                .findFirst();
    }

    @Override
    public ClusterResourceAccess.WatchHandle watch(Consumer<PolicyChange> listener) {
        return clusterResourceAccess.watch(policyLocator, "", event ->
                toPolicy(event.object()).ifPresent(policy ->
                        listener.accept(new PolicyChange(changeType(event.type()), policy))));
    }

    Optional<ReaperPolicy> toPolicy(TargetInstance object) {
        if (object.getName().isEmpty()) {
            return Optional.empty();
        }
        JsonNode spec = object.getDocument().at("spec").orElse(objectMapper.createObjectNode());
        try {
            ReaperPolicy policy = objectMapper.treeToValue(spec, ReaperPolicy.class);
            policy.setName(object.getName());
            return Optional.of(policy);
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            log.warn("event=policy-invalid policy={} Could not read policy spec: {}",
                    object.getName(), ex.getMessage());
            return Optional.empty();
        }
    }

    private static PolicyChange.Type changeType(ResourceEvent.Type type) {
        return switch (type) {
            case ADDED -> PolicyChange.Type.CREATED;
            case MODIFIED -> PolicyChange.Type.UPDATED;
            case DELETED -> PolicyChange.Type.DELETED;
        };
    }
}
