package dev.surveyflow.engine;

import dev.surveyflow.error.FlowElementNotFoundException;
import dev.surveyflow.error.FlowElementNotFoundException.Kind;
import dev.surveyflow.error.RuntimeLoopException;
import dev.surveyflow.model.Question;
import dev.surveyflow.model.ResponseState;
import dev.surveyflow.store.QuestionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Moves a response from question to question.
 * States are immutable; each answer produces a new one.
 */
public final class ResponseTracker {

    private static final Logger log = LoggerFactory.getLogger(ResponseTracker.class);

    private final QuestionRepository questions;
    private final FlowResolver resolver;

    public ResponseTracker(QuestionRepository questions, FlowResolver resolver) {
        this.questions = questions;
        this.resolver = resolver;
    }

    /**
     * Start a response at the survey's first question (lowest order index).
     */
    public ResponseState.InProgress start(int surveyId) {
        List<Question> ordered = questions.getQuestionsForSurvey(surveyId);
        if (ordered.isEmpty()) {
            throw new FlowElementNotFoundException(Kind.SURVEY, surveyId, "survey has no questions");
        }
        int first = ordered.get(0).id();
        log.debug("Response started for survey {} at question {}", surveyId, first);
        return new ResponseState.InProgress(surveyId, first, List.of());
    }

    public ResponseState advance(ResponseState state, String answerValue) {
        return advance(state, answerValue, null);
    }

    /**
     * Record an answer to the current question and move on.
     *
     * @param selectedOptionId nullable — the chosen option
     * @throws IllegalStateException if the response is already complete
     * @throws RuntimeLoopException  if the flow leads back to an answered question
     */
    public ResponseState advance(ResponseState state, String answerValue, Integer selectedOptionId) {
        if (!(state instanceof ResponseState.InProgress current)) {
            throw new IllegalStateException("Response for survey %d is already complete".formatted(state.surveyId()));
        }

        OptionalInt next = resolver.resolveNextStep(current.currentQuestionId(), answerValue, selectedOptionId);

        var visited = new ArrayList<>(current.visited());
        visited.add(current.currentQuestionId());

        if (next.isEmpty()) {
            log.info("Response for survey {} complete after {} question(s)", current.surveyId(), visited.size());
            return new ResponseState.Complete(current.surveyId(), visited);
        }

        int nextId = next.getAsInt();
        if (visited.contains(nextId)) {
            log.warn("Response for survey {} would revisit question {}; visited {}",
                current.surveyId(), nextId, visited);
            throw new RuntimeLoopException(nextId, visited);
        }
        return new ResponseState.InProgress(current.surveyId(), nextId, visited);
    }
}
