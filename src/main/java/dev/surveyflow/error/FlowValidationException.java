package dev.surveyflow.error;

/**
 * An authoring-time violation: a non-positive question reference, a self-reference,
 * or a branching rule that cannot be created as given.
 */
public class FlowValidationException extends SurveyFlowException {

    public FlowValidationException(String message) {
        super(message);
    }
}
