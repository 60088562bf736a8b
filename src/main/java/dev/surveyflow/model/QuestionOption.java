package dev.surveyflow.model;

import java.util.Objects;

/**
 * A selectable answer of a choice or rating question.
 * Its next step overrides the question's default when the option is selected.
 */
public record QuestionOption(
    int id,
    int questionId,
    int orderIndex,
    String text,
    NextStep next
) {
    public QuestionOption {
        Objects.requireNonNull(next, "next");
        next.requireNotSelf(questionId);
    }

    public QuestionOption(int id, int questionId, int orderIndex, String text) {
        this(id, questionId, orderIndex, text, NextStep.unset());
    }

    public QuestionOption withNext(NextStep next) {
        return new QuestionOption(id, questionId, orderIndex, text, next);
    }
}
