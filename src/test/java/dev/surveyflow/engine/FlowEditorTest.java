package dev.surveyflow.engine;

import dev.surveyflow.error.FlowElementNotFoundException;
import dev.surveyflow.error.FlowValidationException;
import dev.surveyflow.error.SurveyActiveException;
import dev.surveyflow.model.*;
import dev.surveyflow.store.InMemoryFlowStore;
import org.junit.jupiter.api.Test;

import java.util.List;

import static dev.surveyflow.engine.FlowFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlowEditorTest {

    private static FlowEditor editorFor(InMemoryFlowStore store, FlowSettings settings) {
        return new FlowEditor(store, store, store, settings);
    }

    @Test
    void setsDefaultNext() {
        InMemoryFlowStore store = twoPathSurvey();

        Question updated = editorFor(store, FlowSettings.defaults()).setDefaultNext(1, NextStep.toQuestion(3));

        assertThat(updated.defaultNext()).isEqualTo(NextStep.toQuestion(3));
        assertThat(store.findQuestion(1)).get().extracting(Question::defaultNext).isEqualTo(NextStep.toQuestion(3));
    }

    @Test
    void targetNeedNotExistWhileAuthoring() {
        InMemoryFlowStore store = twoPathSurvey();

        editorFor(store, FlowSettings.defaults()).setDefaultNext(3, NextStep.toQuestion(77));

        assertThat(store.findQuestion(3)).get().extracting(Question::defaultNext).isEqualTo(NextStep.toQuestion(77));
    }

    @Test
    void selfReferenceLeavesQuestionUnchanged() {
        InMemoryFlowStore store = twoPathSurvey();
        FlowEditor editor = editorFor(store, FlowSettings.defaults());

        assertThatThrownBy(() -> editor.setDefaultNext(1, NextStep.toQuestion(1)))
            .isInstanceOf(FlowValidationException.class);
        assertThat(store.findQuestion(1)).get().extracting(Question::defaultNext).isEqualTo(NextStep.toQuestion(2));
    }

    @Test
    void setsOptionNextAndRejectsOwnQuestion() {
        InMemoryFlowStore store = twoPathSurvey();
        FlowEditor editor = editorFor(store, FlowSettings.defaults());

        editor.setOptionNext(22, NextStep.end());
        assertThat(store.findOption(22)).get().extracting(QuestionOption::next).isEqualTo(NextStep.end());
        assertThat(store.findOption(21)).get().extracting(QuestionOption::next).isEqualTo(NextStep.end());

        assertThatThrownBy(() -> editor.setOptionNext(21, NextStep.toQuestion(2)))
            .isInstanceOf(FlowValidationException.class);
        assertThatThrownBy(() -> editor.setOptionNext(404, NextStep.end()))
            .isInstanceOf(FlowElementNotFoundException.class);
    }

    @Test
    void activeSurveyIsFrozen() {
        InMemoryFlowStore store = twoPathSurvey();
        store.saveSurvey(new Survey(SURVEY_ID, "Live", true));
        FlowEditor editor = editorFor(store, FlowSettings.defaults());

        assertThatThrownBy(() -> editor.setDefaultNext(1, NextStep.end()))
            .isInstanceOf(SurveyActiveException.class);
        assertThatThrownBy(() -> editor.setOptionNext(22, NextStep.end()))
            .isInstanceOf(SurveyActiveException.class);
        assertThatThrownBy(() -> editor.saveBranchingRule(
            new BranchingRule(1, 1, 3, new Condition(ConditionOperator.EQUALS, "x"))))
            .isInstanceOf(SurveyActiveException.class);
        assertThat(store.findQuestion(1)).get().extracting(Question::defaultNext).isEqualTo(NextStep.toQuestion(2));
    }

    @Test
    void questionOfUnknownSurveyCannotBeEdited() {
        var store = new InMemoryFlowStore();
        store.saveQuestion(text(1, 0, NextStep.unset()));
        FlowEditor editor = editorFor(store, FlowSettings.defaults());

        assertThatThrownBy(() -> editor.setDefaultNext(1, NextStep.end()))
            .isInstanceOf(FlowElementNotFoundException.class)
            .hasMessageContaining("Survey 1 not found");
        assertThat(store.findQuestion(1)).get().extracting(Question::defaultNext).isEqualTo(NextStep.unset());
    }

    @Test
    void lockCanBeSwitchedOff() {
        InMemoryFlowStore store = twoPathSurvey();
        store.saveSurvey(new Survey(SURVEY_ID, "Live", true));

        editorFor(store, new FlowSettings(30, false)).setDefaultNext(1, NextStep.end());

        assertThat(store.findQuestion(1)).get().extracting(Question::defaultNext).isEqualTo(NextStep.end());
    }

    @Test
    void savesBranchingRulesInOrder() {
        InMemoryFlowStore store = twoPathSurvey();
        FlowEditor editor = editorFor(store, FlowSettings.defaults());

        editor.saveBranchingRule(new BranchingRule(1, 1, 3, new Condition(ConditionOperator.EQUALS, "a")));
        editor.saveBranchingRule(new BranchingRule(2, 1, 2, new Condition(ConditionOperator.EQUALS, "b")));

        assertThat(store.getBranchingRulesBySource(1)).extracting(BranchingRule::id).containsExactly(1, 2);
    }

    @Test
    void rejectsRulesThatCannotWork() {
        InMemoryFlowStore store = twoPathSurvey();
        store.saveSurvey(new Survey(2, "Other", false));
        store.saveQuestion(new Question(50, 2, 0, "Elsewhere", QuestionType.TEXT, true, NextStep.end(), List.of()));
        FlowEditor editor = editorFor(store, FlowSettings.defaults());

        assertThatThrownBy(() -> editor.saveBranchingRule(
            new BranchingRule(1, 1, 50, new Condition(ConditionOperator.EQUALS, "x"))))
            .isInstanceOf(FlowValidationException.class)
            .hasMessageContaining("is in survey 2");
        assertThatThrownBy(() -> editor.saveBranchingRule(
            new BranchingRule(2, 1, 3, new Condition("Equals", List.of()))))
            .isInstanceOf(FlowValidationException.class)
            .hasMessageContaining("no condition values");
        assertThatThrownBy(() -> editor.saveBranchingRule(
            new BranchingRule(3, 99, 3, new Condition(ConditionOperator.EQUALS, "x"))))
            .isInstanceOf(FlowElementNotFoundException.class);
        assertThat(store.getBranchingRulesBySource(1)).isEmpty();
    }
}
