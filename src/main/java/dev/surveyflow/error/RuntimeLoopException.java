package dev.surveyflow.error;

import java.util.List;

/**
 * A response was routed back to a question it already answered.
 */
public class RuntimeLoopException extends SurveyFlowException {

    private final int repeatedQuestionId;
    private final List<Integer> visited;

    public RuntimeLoopException(int repeatedQuestionId, List<Integer> visited) {
        super("Response would revisit question %d (visited: %s)".formatted(repeatedQuestionId, visited));
        this.repeatedQuestionId = repeatedQuestionId;
        this.visited = List.copyOf(visited);
    }

    public int repeatedQuestionId() { return repeatedQuestionId; }
    public List<Integer> visited() { return visited; }
}
