package dev.surveyflow.error;

/**
 * Base type for every failure raised by the flow engine.
 */
public abstract class SurveyFlowException extends RuntimeException {

    protected SurveyFlowException(String message) {
        super(message);
    }
}
