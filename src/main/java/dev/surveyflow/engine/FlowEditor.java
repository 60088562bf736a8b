package dev.surveyflow.engine;

import dev.surveyflow.error.FlowElementNotFoundException;
import dev.surveyflow.error.FlowElementNotFoundException.Kind;
import dev.surveyflow.error.FlowValidationException;
import dev.surveyflow.error.SurveyActiveException;
import dev.surveyflow.model.BranchingRule;
import dev.surveyflow.model.FlowSettings;
import dev.surveyflow.model.NextStep;
import dev.surveyflow.model.Question;
import dev.surveyflow.model.QuestionOption;
import dev.surveyflow.model.Survey;
import dev.surveyflow.store.BranchingRuleRepository;
import dev.surveyflow.store.QuestionRepository;
import dev.surveyflow.store.SurveyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Authoring commands for a survey's flow. Each command validates first and
 * stores nothing when validation fails.
 * Jump targets need not exist yet; activation checks them.
 */
public final class FlowEditor {

    private static final Logger log = LoggerFactory.getLogger(FlowEditor.class);

    private final SurveyRepository surveys;
    private final QuestionRepository questions;
    private final BranchingRuleRepository rules;
    private final FlowSettings settings;

    public FlowEditor(SurveyRepository surveys, QuestionRepository questions,
                      BranchingRuleRepository rules, FlowSettings settings) {
        this.surveys = surveys;
        this.questions = questions;
        this.rules = rules;
        this.settings = settings;
    }

    /**
     * Point a question's default flow somewhere else.
     *
     * @throws FlowValidationException if the step points back to the question
     */
    public Question setDefaultNext(int questionId, NextStep next) {
        Question question = requireQuestion(questionId);
        requireEditable(question.surveyId());

        Question updated = question.withDefaultNext(next);
        questions.saveQuestion(updated);
        log.debug("Question {} default next set to {}", questionId, next);
        return updated;
    }

    /**
     * Point an option's flow somewhere else.
     *
     * @throws FlowValidationException if the step points back to the owning question
     */
    public QuestionOption setOptionNext(int optionId, NextStep next) {
        QuestionOption option = questions.findOption(optionId)
            .orElseThrow(() -> new FlowElementNotFoundException(Kind.OPTION, optionId));
        Question question = requireQuestion(option.questionId());
        requireEditable(question.surveyId());

        QuestionOption updated = option.withNext(next);
        questions.saveQuestion(question.withOption(updated));
        log.debug("Option {} of question {} next set to {}", optionId, question.id(), next);
        return updated;
    }

    /**
     * Add or replace a branching rule. The source must exist; a target that
     * already exists must belong to the same survey.
     */
    public BranchingRule saveBranchingRule(BranchingRule rule) {
        Question source = requireQuestion(rule.sourceQuestionId());
        requireEditable(source.surveyId());

        if (rule.condition().values().isEmpty()) {
            throw new FlowValidationException("Branching rule %d has no condition values".formatted(rule.id()));
        }
        Optional<Question> target = questions.findQuestion(rule.targetQuestionId());
        if (target.isPresent() && target.get().surveyId() != source.surveyId()) {
            throw new FlowValidationException("Branching rule %d: question %d is in survey %d, not %d"
                .formatted(rule.id(), rule.targetQuestionId(), target.get().surveyId(), source.surveyId()));
        }

        rules.saveBranchingRule(rule);
        log.debug("Branching rule {} saved: {} -> {} when {} {}", rule.id(), rule.sourceQuestionId(),
            rule.targetQuestionId(), rule.condition().operator(), rule.condition().values());
        return rule;
    }

    private Question requireQuestion(int questionId) {
        return questions.findQuestion(questionId)
            .orElseThrow(() -> new FlowElementNotFoundException(Kind.QUESTION, questionId));
    }

    private void requireEditable(int surveyId) {
        Survey survey = surveys.findSurvey(surveyId)
            .orElseThrow(() -> new FlowElementNotFoundException(Kind.SURVEY, surveyId));
        if (settings.lockActiveSurveys() && survey.active()) {
            throw new SurveyActiveException(surveyId);
        }
    }
}
