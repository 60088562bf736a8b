package dev.surveyflow.store;

import dev.surveyflow.model.Question;
import dev.surveyflow.model.QuestionOption;

import java.util.List;
import java.util.Optional;

/**
 * Lookup and storage of questions and their options.
 */
public interface QuestionRepository {

    /** Find a question by id. */
    Optional<Question> findQuestion(int questionId);

    /** Find an option by id, regardless of which question owns it. */
    Optional<QuestionOption> findOption(int optionId);

    /**
     * Options of a question in order index order.
     *
     * @throws dev.surveyflow.error.FlowElementNotFoundException if the question does not exist
     */
    List<QuestionOption> getOptionsForQuestion(int questionId);

    /** Questions of a survey in order index order; empty if the survey has none. */
    List<Question> getQuestionsForSurvey(int surveyId);

    /** Insert or replace a question, including its options. */
    void saveQuestion(Question question);
}
