package dev.surveyflow.engine;

import java.util.List;

/**
 * Outcome of a cycle search. {@code cyclePath} is empty and {@code errorMessage} null when no cycle exists.
 */
public record CycleDetectionResult(boolean hasCycle, List<Integer> cyclePath, String errorMessage) {

    public CycleDetectionResult {
        cyclePath = List.copyOf(cyclePath);
    }

    public static CycleDetectionResult none() {
        return new CycleDetectionResult(false, List.of(), null);
    }
}
