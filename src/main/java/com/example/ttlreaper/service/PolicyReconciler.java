package com.example.ttlreaper.service;

import com.example.ttlreaper.config.ReaperProperties;
import com.example.ttlreaper.models.PolicyState;
import com.example.ttlreaper.models.PolicyStatus;
import com.example.ttlreaper.models.ReaperPolicy;
import com.example.ttlreaper.models.ResourceLocator;
import com.example.ttlreaper.models.TargetInstance;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs one reconciliation pass for a policy: validate, resolve the locator, list every
 * namespace in scope, and hand each instance to the {@link ExpirationScheduler}.
 *
 * A listing failure only costs the namespace it happened in; a bad instance only costs itself.
 * Configuration errors fail the whole policy until it is edited.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PolicyReconciler {

    private final Validator validator;
    private final ResourceLocatorResolver resolver;
    private final TargetLister lister;
    private final ExpirationScheduler scheduler;
    private final ReaperProperties properties;
    private final Clock clock;

    public PolicyStatus reconcile(ReaperPolicy policy, PolicyStatus previous) {
        String policyName = policy.getName();
        PolicyStatus prior = previous != null ? previous : PolicyStatus.unvalidated(policyName);
        long startTime = clock.millis();
        Instant now = clock.instant();

        if (!policy.enabledOrDefault()) {
            scheduler.cancelForPolicy(policyName);
            log.debug("Policy {} is disabled, skipping pass", policyName);
            return prior.toBuilder().message("disabled").lastReconciledAt(now).build();
        }

        ResourceLocator locator;
        String selector;
        List<String> namespaces;
        try {
            validate(policy);
            locator = resolver.resolve(policy.getTargetKind(), policy.getTargetApiVersion());
            selector = TargetLister.selectorString(policy.getLabelSelector());
            namespaces = lister.namespacesFor(policy);
        } catch (TtlReaperException ex) {
            if (!ex.isConfigError()) {
                log.warn("Policy {}: could not enumerate namespaces, will retry on next trigger: {}",
                        policyName, ex.getMessage());
                return prior.toBuilder().message(ex.getMessage()).lastReconciledAt(now).build();
            }
            log.error("event=policy-invalid policy={} code={} {}", policyName, ex.getCode(), ex.getMessage());
            scheduler.cancelForPolicy(policyName);
            return prior.toBuilder()
                    .state(PolicyState.FAILED)
                    .message(ex.getMessage())
                    .lastReconciledAt(now)
                    .build();
        }

        String ttlFieldPath = policy.ttlFieldPathOrDefault(properties.getDefaultTtlFieldPath());
        PassCounters counters = new PassCounters();

        for (String namespace : namespaces) {
            List<TargetInstance> instances;
            try {
                instances = lister.list(locator, namespace, selector);
            } catch (TtlReaperException ex) {
                counters.namespacesFailed++;
                log.warn("Policy {}: listing {} in namespace {} failed, continuing with the rest: {}",
                        policyName, locator, namespace, ex.getMessage());
                continue;
            }
            counters.namespacesProcessed++;
            for (TargetInstance instance : instances) {
                counters.instancesSeen++;
                try {
                    counters.record(scheduler.evaluate(policy, locator, instance, ttlFieldPath));
                } catch (RuntimeException ex) {
                    counters.failed++;
                    log.error("Policy {}: failed to evaluate {}/{}: {}",
                            policyName, namespace, instance.getName(), ex.getMessage(), ex);
                }
            }
        }

        int deniedResources = scheduler.deniedCount(policyName);
        long duration = clock.millis() - startTime;
        log.info("event=reconcile-completed policy={} durationMs={} namespaces={} namespacesFailed={} "
                        + "seen={} scheduled={} deleted={} denied={} failed={} skipped={} deniedResources={}",
                policyName, duration, counters.namespacesProcessed, counters.namespacesFailed,
                counters.instancesSeen, counters.scheduled, counters.deleted, counters.denied,
                counters.failed, counters.skipped, deniedResources);

        return PolicyStatus.builder()
                .policyName(policyName)
                .state(PolicyState.ACTIVE)
                .message(passMessage(counters.namespacesFailed, deniedResources))
                .lastReconciledAt(now)
                .namespacesProcessed(counters.namespacesProcessed)
                .namespacesFailed(counters.namespacesFailed)
                .instancesSeen(counters.instancesSeen)
                .scheduled(counters.scheduled)
                .deleted(counters.deleted)
                .denied(counters.denied)
                .failed(counters.failed)
                .skipped(counters.skipped)
                .totalReaped(prior.getTotalReaped() + counters.deleted)
                .deniedResources(deniedResources)
                .build();
    }

    private static String passMessage(int namespacesFailed, int deniedResources) {
        List<String> parts = new ArrayList<>();
        if (namespacesFailed > 0) {
            parts.add(namespacesFailed + " namespace(s) could not be listed");
        }
        if (deniedResources > 0) {
            parts.add(deniedResources + " resource(s) could not be deleted: permission denied, "
                    + "edit the policy to retry");
        }
        return parts.isEmpty() ? null : String.join("; ", parts);
    }

    private void validate(ReaperPolicy policy) {
        Set<ConstraintViolation<ReaperPolicy>> violations = validator.validate(policy);
        if (!violations.isEmpty()) {
            String detail = violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            throw TtlReaperException.missingRequiredField(detail);
        }
    }

    private static final class PassCounters {
        private int namespacesProcessed;
        private int namespacesFailed;
        private int instancesSeen;
        private int scheduled;
        private int deleted;
        private int denied;
        private int failed;
        private int skipped;

        void record(ExpirationScheduler.Decision decision) {
            switch (decision) {
                case SCHEDULED, RESCHEDULED -> scheduled++;
                case DELETED, ALREADY_GONE -> deleted++;
                case DENIED, PREVIOUSLY_DENIED -> denied++;
                case DELETE_FAILED -> failed++;
                default -> skipped++;
            }
        }
    }
}
