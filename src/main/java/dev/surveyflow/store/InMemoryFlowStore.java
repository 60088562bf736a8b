package dev.surveyflow.store;

import dev.surveyflow.error.FlowElementNotFoundException;
import dev.surveyflow.error.FlowValidationException;
import dev.surveyflow.model.BranchingRule;
import dev.surveyflow.model.Question;
import dev.surveyflow.model.QuestionOption;
import dev.surveyflow.model.Survey;
import dev.surveyflow.model.SurveyDefinition;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Map-backed store used by the command line and by tests.
 * Not thread-safe; callers serialize access.
 */
public final class InMemoryFlowStore implements QuestionRepository, BranchingRuleRepository, SurveyRepository {

    private final Map<Integer, Survey> surveys = new LinkedHashMap<>();
    private final Map<Integer, Question> questions = new LinkedHashMap<>();
    private final List<BranchingRule> rules = new ArrayList<>();

    /**
     * Create a store holding a single loaded survey.
     */
    public static InMemoryFlowStore of(SurveyDefinition definition) {
        var store = new InMemoryFlowStore();
        store.saveSurvey(definition.survey());
        definition.questions().forEach(store::saveQuestion);
        definition.branchingRules().forEach(store::saveBranchingRule);
        return store;
    }

    // Surveys

    @Override
    public Optional<Survey> findSurvey(int surveyId) {
        return Optional.ofNullable(surveys.get(surveyId));
    }

    @Override
    public void saveSurvey(Survey survey) {
        surveys.put(survey.id(), survey);
    }

    // Questions

    @Override
    public Optional<Question> findQuestion(int questionId) {
        return Optional.ofNullable(questions.get(questionId));
    }

    @Override
    public Optional<QuestionOption> findOption(int optionId) {
        return questions.values().stream()
            .flatMap(q -> q.options().stream())
            .filter(o -> o.id() == optionId)
            .findFirst();
    }

    @Override
    public List<QuestionOption> getOptionsForQuestion(int questionId) {
        Question question = questions.get(questionId);
        if (question == null) {
            throw new FlowElementNotFoundException(FlowElementNotFoundException.Kind.QUESTION, questionId);
        }
        return question.options();
    }

    @Override
    public List<Question> getQuestionsForSurvey(int surveyId) {
        return questions.values().stream()
            .filter(q -> q.surveyId() == surveyId)
            .sorted(Comparator.comparingInt(Question::orderIndex))
            .toList();
    }

    @Override
    public void saveQuestion(Question question) {
        for (Question other : questions.values()) {
            if (other.id() != question.id()
                && other.surveyId() == question.surveyId()
                && other.orderIndex() == question.orderIndex()) {
                throw new FlowValidationException("Order index %d already used by question %d in survey %d"
                    .formatted(question.orderIndex(), other.id(), question.surveyId()));
            }
        }
        questions.put(question.id(), question);
    }

    // Branching rules

    @Override
    public List<BranchingRule> getBranchingRulesBySource(int questionId) {
        return rules.stream()
            .filter(r -> r.sourceQuestionId() == questionId)
            .toList();
    }

    @Override
    public List<BranchingRule> getBranchingRulesBySurvey(int surveyId) {
        return rules.stream()
            .filter(r -> {
                Question source = questions.get(r.sourceQuestionId());
                return source != null && source.surveyId() == surveyId;
            })
            .toList();
    }

    @Override
    public void saveBranchingRule(BranchingRule rule) {
        for (int i = 0; i < rules.size(); i++) {
            if (rules.get(i).id() == rule.id()) {
                rules.set(i, rule);
                return;
            }
        }
        rules.add(rule);
    }
}
