package dev.surveyflow.engine;

import dev.surveyflow.model.*;
import dev.surveyflow.store.InMemoryFlowStore;

import java.util.List;

/**
 * Small builders for surveys used across engine tests. Everything lives in survey 1.
 */
final class FlowFixtures {

    static final int SURVEY_ID = 1;

    private FlowFixtures() {}

    static Question text(int id, int order, NextStep next) {
        return new Question(id, SURVEY_ID, order, "Question " + id, QuestionType.TEXT, true, next, List.of());
    }

    static Question choice(int id, int order, QuestionOption... options) {
        return new Question(id, SURVEY_ID, order, "Question " + id, QuestionType.SINGLE_CHOICE, true,
            NextStep.unset(), List.of(options));
    }

    static QuestionOption option(int id, int questionId, int order, NextStep next) {
        return new QuestionOption(id, questionId, order, "Option " + id, next);
    }

    static InMemoryFlowStore store(Question... questions) {
        var store = new InMemoryFlowStore();
        store.saveSurvey(new Survey(SURVEY_ID, "Test survey", false));
        for (Question question : questions) {
            store.saveQuestion(question);
        }
        return store;
    }

    static FlowGraph graph(Question... questions) {
        return FlowGraph.snapshot(SURVEY_ID, store(questions), new InMemoryFlowStore());
    }

    /**
     * Q1 (text) -> Q2 (single choice: A ends, B goes to Q3) ; Q3 (text) ends.
     */
    static InMemoryFlowStore twoPathSurvey() {
        return store(
            text(1, 0, NextStep.toQuestion(2)),
            choice(2, 1,
                option(21, 2, 0, NextStep.end()),
                option(22, 2, 1, NextStep.toQuestion(3))),
            text(3, 2, NextStep.end()));
    }
}
