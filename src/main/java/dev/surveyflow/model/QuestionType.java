package dev.surveyflow.model;

import java.util.Locale;

/**
 * Kinds of questions a survey can ask.
 */
public enum QuestionType {
    TEXT,
    SINGLE_CHOICE,
    MULTIPLE_CHOICE,
    RATING,
    NUMBER,
    DATE,
    LOCATION;

    /** Whether the selected option's next step drives the flow. */
    public boolean supportsBranching() {
        return this == SINGLE_CHOICE || this == RATING;
    }

    /**
     * Parse a type name such as {@code singleChoice}, {@code single_choice} or {@code SINGLE_CHOICE}.
     */
    public static QuestionType parse(String name) {
        String normalized = name.replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
        for (QuestionType type : values()) {
            if (type.name().replace("_", "").toLowerCase(Locale.ROOT).equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown question type: " + name);
    }
}
