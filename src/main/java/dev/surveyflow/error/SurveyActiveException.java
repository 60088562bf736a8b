package dev.surveyflow.error;

/**
 * The flow of an active survey is frozen; it must be deactivated before editing.
 */
public class SurveyActiveException extends SurveyFlowException {

    private final int surveyId;

    public SurveyActiveException(int surveyId) {
        super("Survey %d is active; deactivate it before editing its flow".formatted(surveyId));
        this.surveyId = surveyId;
    }

    public int surveyId() {
        return surveyId;
    }
}
