package dev.surveyflow.model;

import java.util.List;

/**
 * Progress of one respondent through a survey.
 * Visited question ids are kept in the order they were answered.
 */
public sealed interface ResponseState {

    int surveyId();

    List<Integer> visited();

    /** Waiting for an answer to {@code currentQuestionId}. */
    record InProgress(int surveyId, int currentQuestionId, List<Integer> visited) implements ResponseState {
        public InProgress {
            visited = List.copyOf(visited);
        }
    }

    /** No further answers are accepted. */
    record Complete(int surveyId, List<Integer> visited) implements ResponseState {
        public Complete {
            visited = List.copyOf(visited);
        }
    }
}
