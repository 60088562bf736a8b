package dev.surveyflow.error;

/**
 * The answer submitted for a question cannot be used to pick the next step.
 */
public class InvalidAnswerFormatException extends SurveyFlowException {

    private final int questionId;

    public InvalidAnswerFormatException(int questionId, String message) {
        super("Invalid answer for question %d: %s".formatted(questionId, message));
        this.questionId = questionId;
    }

    public int questionId() {
        return questionId;
    }
}
