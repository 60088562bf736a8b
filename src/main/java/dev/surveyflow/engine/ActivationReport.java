package dev.surveyflow.engine;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Everything found wrong with a survey's flow, gathered in one pass.
 */
public record ActivationReport(
    int surveyId,
    boolean hasCycle,
    List<Integer> cyclePath,
    Set<Integer> endpoints,
    List<String> errors
) {
    public ActivationReport {
        cyclePath = List.copyOf(cyclePath);
        endpoints = Collections.unmodifiableSet(new LinkedHashSet<>(endpoints));
        errors = List.copyOf(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    /** All errors joined into one line, or null when valid. */
    public String errorMessage() {
        return errors.isEmpty() ? null : String.join("; ", errors);
    }
}
