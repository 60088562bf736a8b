package dev.surveyflow.engine;

import dev.surveyflow.model.BranchingRule;
import dev.surveyflow.model.NextStep;
import dev.surveyflow.model.Question;
import dev.surveyflow.model.QuestionOption;
import dev.surveyflow.store.BranchingRuleRepository;
import dev.surveyflow.store.QuestionRepository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only snapshot of one survey's flow: questions in order index order plus its branching rules.
 */
public record FlowGraph(int surveyId, List<Question> questions, List<BranchingRule> branchingRules) {

    public FlowGraph {
        questions = List.copyOf(questions);
        branchingRules = List.copyOf(branchingRules);
    }

    /**
     * Take a snapshot of a survey from the repositories.
     */
    public static FlowGraph snapshot(int surveyId, QuestionRepository questions, BranchingRuleRepository rules) {
        return new FlowGraph(surveyId,
            questions.getQuestionsForSurvey(surveyId),
            rules.getBranchingRulesBySurvey(surveyId));
    }

    public Map<Integer, Question> questionsById() {
        var byId = new LinkedHashMap<Integer, Question>();
        for (Question question : questions) {
            byId.put(question.id(), question);
        }
        return byId;
    }

    /**
     * Explicit jump targets of a question: the default first, then each option in order.
     * Unset and end-survey steps contribute nothing.
     */
    public static List<Integer> explicitTargets(Question question) {
        Set<Integer> targets = new LinkedHashSet<>();
        addTarget(targets, question.defaultNext());
        for (QuestionOption option : question.options()) {
            addTarget(targets, option.next());
        }
        return new ArrayList<>(targets);
    }

    /**
     * Jump targets a response can actually follow: the default, plus option steps
     * only for question types whose options route.
     */
    public static List<Integer> routingTargets(Question question) {
        if (question.type().supportsBranching()) {
            return explicitTargets(question);
        }
        Set<Integer> targets = new LinkedHashSet<>();
        addTarget(targets, question.defaultNext());
        return new ArrayList<>(targets);
    }

    /**
     * Whether the question ends the survey directly, through its default or,
     * for question types whose options route, through one of its options.
     */
    public static boolean endsSurveyDirectly(Question question) {
        if (question.defaultNext() instanceof NextStep.EndSurvey) {
            return true;
        }
        return question.type().supportsBranching()
            && question.options().stream().anyMatch(o -> o.next() instanceof NextStep.EndSurvey);
    }

    private static void addTarget(Set<Integer> targets, NextStep step) {
        if (step instanceof NextStep.GoToQuestion go) {
            targets.add(go.questionId());
        }
    }
}
