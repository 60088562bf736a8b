package dev.surveyflow.model;

/**
 * Tunables for validation messages and the activation barrier.
 */
public record FlowSettings(
    int questionLabelLength,
    boolean lockActiveSurveys
) {
    public static final int DEFAULT_QUESTION_LABEL_LENGTH = 30;
    public static final boolean DEFAULT_LOCK_ACTIVE_SURVEYS = true;

    public static FlowSettings defaults() {
        return new FlowSettings(DEFAULT_QUESTION_LABEL_LENGTH, DEFAULT_LOCK_ACTIVE_SURVEYS);
    }

    public FlowSettings withQuestionLabelLength(int questionLabelLength) {
        return new FlowSettings(questionLabelLength, lockActiveSurveys);
    }
}
