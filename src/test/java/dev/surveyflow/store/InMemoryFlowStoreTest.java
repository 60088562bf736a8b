package dev.surveyflow.store;

import dev.surveyflow.error.FlowElementNotFoundException;
import dev.surveyflow.error.FlowValidationException;
import dev.surveyflow.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryFlowStoreTest {

    private static Question question(int id, int surveyId, int order) {
        return new Question(id, surveyId, order, "Q" + id, QuestionType.TEXT, true, NextStep.unset(), List.of());
    }

    @Test
    void returnsSurveyQuestionsByOrderIndex() {
        var store = new InMemoryFlowStore();
        store.saveQuestion(question(3, 1, 2));
        store.saveQuestion(question(1, 1, 0));
        store.saveQuestion(question(2, 1, 1));
        store.saveQuestion(question(4, 2, 0));

        assertThat(store.getQuestionsForSurvey(1)).extracting(Question::id).containsExactly(1, 2, 3);
        assertThat(store.getQuestionsForSurvey(2)).extracting(Question::id).containsExactly(4);
        assertThat(store.getQuestionsForSurvey(3)).isEmpty();
    }

    @Test
    void orderIndexIsUniquePerSurvey() {
        var store = new InMemoryFlowStore();
        store.saveQuestion(question(1, 1, 0));

        assertThatThrownBy(() -> store.saveQuestion(question(2, 1, 0)))
            .isInstanceOf(FlowValidationException.class)
            .hasMessageContaining("Order index 0 already used by question 1");

        store.saveQuestion(question(1, 1, 0).withDefaultNext(NextStep.end()));
        store.saveQuestion(question(5, 2, 0));
        assertThat(store.findQuestion(1)).get().extracting(Question::defaultNext).isEqualTo(NextStep.end());
    }

    @Test
    void findsOptionsAcrossQuestions() {
        var store = new InMemoryFlowStore();
        store.saveQuestion(new Question(1, 1, 0, "Pick", QuestionType.SINGLE_CHOICE, true, NextStep.unset(),
            List.of(new QuestionOption(11, 1, 0, "a"), new QuestionOption(12, 1, 1, "b"))));

        assertThat(store.findOption(12)).get().extracting(QuestionOption::questionId).isEqualTo(1);
        assertThat(store.getOptionsForQuestion(1)).extracting(QuestionOption::id).containsExactly(11, 12);
        assertThatThrownBy(() -> store.getOptionsForQuestion(2))
            .isInstanceOf(FlowElementNotFoundException.class);
    }

    @Test
    void rulesKeepInsertionOrderAndReplaceById() {
        var store = new InMemoryFlowStore();
        store.saveQuestion(question(1, 1, 0));
        store.saveQuestion(question(2, 1, 1));
        store.saveBranchingRule(new BranchingRule(5, 1, 2, new Condition(ConditionOperator.EQUALS, "b")));
        store.saveBranchingRule(new BranchingRule(3, 1, 2, new Condition(ConditionOperator.EQUALS, "a")));
        store.saveBranchingRule(new BranchingRule(5, 1, 2, new Condition(ConditionOperator.EQUALS, "c")));

        assertThat(store.getBranchingRulesBySource(1)).extracting(BranchingRule::id).containsExactly(5, 3);
        assertThat(store.getBranchingRulesBySource(1).get(0).condition().values()).containsExactly("c");
        assertThat(store.getBranchingRulesBySurvey(1)).hasSize(2);
        assertThat(store.getBranchingRulesBySurvey(2)).isEmpty();
    }
}
