package dev.surveyflow.error;

/**
 * Activation was refused because no question can reach the end of the survey.
 */
public class NoEndpointException extends SurveyFlowException {

    private final int surveyId;

    public NoEndpointException(int surveyId, String message) {
        super(message);
        this.surveyId = surveyId;
    }

    public int surveyId() {
        return surveyId;
    }
}
