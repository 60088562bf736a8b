package dev.surveyflow.error;

import java.util.List;

/**
 * Activation was refused because the explicit jumps of a survey form a loop.
 */
public class CycleDetectedException extends SurveyFlowException {

    private final List<Integer> cyclePath;

    public CycleDetectedException(String message, List<Integer> cyclePath) {
        super(message);
        this.cyclePath = List.copyOf(cyclePath);
    }

    /** Question ids from the first repeated question back to itself, inclusive. */
    public List<Integer> cyclePath() {
        return cyclePath;
    }
}
