package dev.surveyflow.error;

/**
 * A survey, question or option referenced by id does not exist.
 */
public class FlowElementNotFoundException extends SurveyFlowException {

    public enum Kind { SURVEY, QUESTION, OPTION }

    private final Kind kind;
    private final int id;

    public FlowElementNotFoundException(Kind kind, int id) {
        super("%s %d not found".formatted(label(kind), id));
        this.kind = kind;
        this.id = id;
    }

    public FlowElementNotFoundException(Kind kind, int id, String detail) {
        super("%s %d not found: %s".formatted(label(kind), id, detail));
        this.kind = kind;
        this.id = id;
    }

    public Kind kind() { return kind; }
    public int id() { return id; }

    private static String label(Kind kind) {
        return switch (kind) {
            case SURVEY -> "Survey";
            case QUESTION -> "Question";
            case OPTION -> "Option";
        };
    }
}
