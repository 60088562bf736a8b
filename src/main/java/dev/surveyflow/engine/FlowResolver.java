package dev.surveyflow.engine;

import dev.surveyflow.error.FlowElementNotFoundException;
import dev.surveyflow.error.FlowElementNotFoundException.Kind;
import dev.surveyflow.error.InvalidAnswerFormatException;
import dev.surveyflow.model.NextStep;
import dev.surveyflow.model.Question;
import dev.surveyflow.model.QuestionOption;
import dev.surveyflow.model.QuestionType;
import dev.surveyflow.store.QuestionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalInt;

/**
 * Decides which question follows an answered one.
 *
 * <p>Precedence, first applicable wins:
 * <ol>
 *   <li>a branching rule of the question matching the answer</li>
 *   <li>the selected option's next step (single choice and rating questions)</li>
 *   <li>the question's default next step</li>
 *   <li>the next question by order index, or the end of the survey after the last one</li>
 * </ol>
 */
public final class FlowResolver {

    private static final Logger log = LoggerFactory.getLogger(FlowResolver.class);

    private final QuestionRepository questions;
    private final BranchingRuleEvaluator evaluator;

    public FlowResolver(QuestionRepository questions, BranchingRuleEvaluator evaluator) {
        this.questions = questions;
        this.evaluator = evaluator;
    }

    public OptionalInt resolveNextStep(int currentQuestionId, String answerValue) {
        return resolveNextStep(currentQuestionId, answerValue, null);
    }

    /**
     * Resolve the next question.
     *
     * @param currentQuestionId the question just answered
     * @param answerValue       the answer text, may be blank when only an option was selected
     * @param selectedOptionId  nullable — the chosen option
     * @return the next question id, or empty when the survey is complete
     * @throws FlowElementNotFoundException  if the question, the option or a jump target is missing
     * @throws InvalidAnswerFormatException  if the answer cannot belong to this question
     */
    public OptionalInt resolveNextStep(int currentQuestionId, String answerValue, Integer selectedOptionId) {
        Question question = questions.findQuestion(currentQuestionId)
            .orElseThrow(() -> new FlowElementNotFoundException(Kind.QUESTION, currentQuestionId));
        QuestionOption option = selectedOption(question, selectedOptionId);
        checkAnswer(question, answerValue, option);

        OptionalInt ruleTarget = evaluator.evaluateBranchingRule(question.id(), answerValue);
        if (ruleTarget.isPresent()) {
            int target = requireTarget(question, ruleTarget.getAsInt());
            log.debug("Question {}: branching rule -> {}", question.id(), target);
            return OptionalInt.of(target);
        }

        if (option != null && question.type().supportsBranching()
            && !(option.next() instanceof NextStep.Unset)) {
            log.debug("Question {}: option {} -> {}", question.id(), option.id(), option.next());
            return follow(question, option.next());
        }

        if (!(question.defaultNext() instanceof NextStep.Unset)) {
            log.debug("Question {}: default -> {}", question.id(), question.defaultNext());
            return follow(question, question.defaultNext());
        }

        return sequentialAfter(question);
    }

    private QuestionOption selectedOption(Question question, Integer selectedOptionId) {
        if (selectedOptionId == null) {
            return null;
        }
        return question.option(selectedOptionId).orElseThrow(() -> {
            if (questions.findOption(selectedOptionId).isPresent()) {
                return new InvalidAnswerFormatException(question.id(),
                    "option %d belongs to another question".formatted(selectedOptionId));
            }
            return new FlowElementNotFoundException(Kind.OPTION, selectedOptionId);
        });
    }

    private static void checkAnswer(Question question, String answerValue, QuestionOption option) {
        if (option != null || !question.required()) {
            return;
        }
        if (question.type() == QuestionType.SINGLE_CHOICE && !question.options().isEmpty()) {
            throw new InvalidAnswerFormatException(question.id(), "an option must be selected");
        }
        if (answerValue == null || answerValue.isBlank()) {
            throw new InvalidAnswerFormatException(question.id(), "answer is required");
        }
    }

    private OptionalInt follow(Question from, NextStep step) {
        if (step instanceof NextStep.GoToQuestion go) {
            return OptionalInt.of(requireTarget(from, go.questionId()));
        }
        return OptionalInt.empty();
    }

    private int requireTarget(Question from, int targetId) {
        Question target = questions.findQuestion(targetId)
            .filter(q -> q.surveyId() == from.surveyId())
            .orElseThrow(() -> new FlowElementNotFoundException(Kind.QUESTION, targetId,
                "referenced from question " + from.id()));
        return target.id();
    }

    private OptionalInt sequentialAfter(Question question) {
        for (Question candidate : questions.getQuestionsForSurvey(question.surveyId())) {
            if (candidate.orderIndex() > question.orderIndex()) {
                log.debug("Question {}: sequential -> {}", question.id(), candidate.id());
                return OptionalInt.of(candidate.id());
            }
        }
        log.debug("Question {} is the last question", question.id());
        return OptionalInt.empty();
    }
}
