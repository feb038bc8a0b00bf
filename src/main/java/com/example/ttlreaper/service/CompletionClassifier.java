package com.example.ttlreaper.service;

import com.example.ttlreaper.models.Completion;
import com.example.ttlreaper.models.ResourceDocument;
import com.example.ttlreaper.models.TargetInstance;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Decides from a status payload whether an instance has finished.
 *
 * <p>Finished signals are checked in order: a terminal {@code status.phase}, a
 * {@code Succeeded}/{@code Completed} condition with status {@code True}, then a parseable
 * {@code status.completionTime}. Independently of which signal matched, the completion instant
 * is {@code status.completionTime} if present, else the matching condition's
 * {@code lastTransitionTime}. Falling back to the creation time is left to the caller.
 */
@Component
public class CompletionClassifier {

    static final Set<String> TERMINAL_PHASES = Set.of("Succeeded", "Failed", "Completed");
    static final Set<String> COMPLETION_CONDITIONS = Set.of("Succeeded", "Completed");

    public Completion classify(TargetInstance instance) {
        return classify(instance.getDocument());
    }

    public Completion classify(ResourceDocument resource) {
        Optional<Instant> completionTime = resource.timestamp("status", "completionTime");
        Optional<ResourceDocument> condition = completionCondition(resource);
        Instant completedAt = completionTime
                .or(() -> condition.flatMap(c -> c.timestamp("lastTransitionTime")))
                .orElse(null);

        if (resource.text("status", "phase").filter(TERMINAL_PHASES::contains).isPresent()) {
            return Completion.finished(Completion.Signal.PHASE, completedAt);
        }
        if (condition.isPresent()) {
            return Completion.finished(Completion.Signal.CONDITION, completedAt);
        }
        if (completionTime.isPresent()) {
            return Completion.finished(Completion.Signal.COMPLETION_TIME, completedAt);
        }
        return Completion.unfinished();
    }

    private static Optional<ResourceDocument> completionCondition(ResourceDocument resource) {
        for (ResourceDocument condition : resource.objects("status", "conditions")) {
            boolean completionType = condition.text("type").filter(COMPLETION_CONDITIONS::contains).isPresent();
            boolean isTrue = condition.text("status").filter("True"::equals).isPresent();
            if (completionType && isTrue) {
                return Optional.of(condition);
            }
        }
        return Optional.empty();
    }
}
