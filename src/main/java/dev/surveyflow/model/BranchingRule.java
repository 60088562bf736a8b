package dev.surveyflow.model;

import dev.surveyflow.error.FlowValidationException;

import java.util.Objects;

/**
 * Redirects the flow from one question to another when the answer matches a condition.
 */
public record BranchingRule(
    int id,
    int sourceQuestionId,
    int targetQuestionId,
    Condition condition
) {
    public BranchingRule {
        if (sourceQuestionId <= 0 || targetQuestionId <= 0) {
            throw new FlowValidationException("Branching rule %d: question ids must be greater than 0"
                .formatted(id));
        }
        if (sourceQuestionId == targetQuestionId) {
            throw new FlowValidationException("Branching rule %d: question %d cannot branch to itself"
                .formatted(id, sourceQuestionId));
        }
        Objects.requireNonNull(condition, "condition");
    }
}
