package dev.surveyflow.model;

import dev.surveyflow.error.FlowValidationException;

/**
 * Where the flow goes after a question or a selected option.
 * Exactly one of three forms: unset, go-to-question, or end-survey.
 */
public sealed interface NextStep {

    /** Defer to the next question by order index. */
    record Unset() implements NextStep {}

    /** Jump to another question of the same survey. */
    record GoToQuestion(int questionId) implements NextStep {
        public GoToQuestion {
            if (questionId <= 0) {
                throw new FlowValidationException(
                    "Next question id must be greater than 0, got " + questionId);
            }
        }
    }

    /** Terminate the response. */
    record EndSurvey() implements NextStep {}

    static NextStep unset() {
        return new Unset();
    }

    static NextStep end() {
        return new EndSurvey();
    }

    static NextStep toQuestion(int questionId) {
        return new GoToQuestion(questionId);
    }

    /**
     * Reject a jump back to the owning question.
     *
     * @param ownerQuestionId id of the question this step hangs off
     * @return this step, for chaining
     */
    default NextStep requireNotSelf(int ownerQuestionId) {
        if (this instanceof GoToQuestion go && go.questionId() == ownerQuestionId) {
            throw new FlowValidationException(
                "Question %d cannot point to itself".formatted(ownerQuestionId));
        }
        return this;
    }
}
