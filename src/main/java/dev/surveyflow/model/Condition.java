package dev.surveyflow.model;

import java.util.List;
import java.util.Optional;

/**
 * The test a branching rule applies to an answer.
 * The operator is kept as written so that unknown names can be reported instead of rejected.
 */
public record Condition(String operator, List<String> values) {

    public Condition {
        values = values == null ? List.of() : List.copyOf(values);
    }

    public Condition(ConditionOperator operator, String... values) {
        this(operator.displayName(), List.of(values));
    }

    public Optional<ConditionOperator> knownOperator() {
        return ConditionOperator.parse(operator);
    }
}
