package dev.surveyflow.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Comparison operators a branching condition may use.
 */
public enum ConditionOperator {
    EQUALS("Equals"),
    CONTAINS("Contains"),
    IN("In"),
    GREATER_THAN("GreaterThan"),
    LESS_THAN("LessThan"),
    GREATER_THAN_OR_EQUAL("GreaterThanOrEqual"),
    LESS_THAN_OR_EQUAL("LessThanOrEqual");

    private final String displayName;

    ConditionOperator(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public boolean isNumeric() {
        return this == GREATER_THAN || this == LESS_THAN
            || this == GREATER_THAN_OR_EQUAL || this == LESS_THAN_OR_EQUAL;
    }

    /**
     * Look up an operator by display name ({@code GreaterThan}) or constant name
     * ({@code GREATER_THAN}), ignoring case.
     */
    public static Optional<ConditionOperator> parse(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().replace("_", "").toLowerCase(Locale.ROOT);
        for (ConditionOperator op : values()) {
            if (op.displayName.toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
