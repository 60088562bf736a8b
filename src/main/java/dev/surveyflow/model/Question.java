package dev.surveyflow.model;

import dev.surveyflow.error.FlowValidationException;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A question of a survey together with its outgoing flow.
 * Options are kept sorted by order index.
 */
public record Question(
    int id,
    int surveyId,
    int orderIndex,
    String text,
    QuestionType type,
    boolean required,
    NextStep defaultNext,
    List<QuestionOption> options
) {
    public Question {
        if (id <= 0) {
            throw new FlowValidationException("Question id must be greater than 0, got " + id);
        }
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(defaultNext, "defaultNext");
        defaultNext.requireNotSelf(id);
        options = options == null ? List.of() : options;
        for (QuestionOption option : options) {
            if (option.questionId() != id) {
                throw new FlowValidationException("Option %d belongs to question %d, not %d"
                    .formatted(option.id(), option.questionId(), id));
            }
        }
        options = options.stream()
            .sorted(Comparator.comparingInt(QuestionOption::orderIndex))
            .toList();
    }

    public Question withDefaultNext(NextStep next) {
        return new Question(id, surveyId, orderIndex, text, type, required, next, options);
    }

    /**
     * Replace one option, keeping the others.
     */
    public Question withOption(QuestionOption replacement) {
        List<QuestionOption> updated = options.stream()
            .map(o -> o.id() == replacement.id() ? replacement : o)
            .toList();
        return new Question(id, surveyId, orderIndex, text, type, required, defaultNext, updated);
    }

    public Optional<QuestionOption> option(int optionId) {
        return options.stream().filter(o -> o.id() == optionId).findFirst();
    }
}
