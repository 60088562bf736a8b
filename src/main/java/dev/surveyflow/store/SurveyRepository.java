package dev.surveyflow.store;

import dev.surveyflow.model.Survey;

import java.util.Optional;

/**
 * Lookup and storage of survey headers.
 */
public interface SurveyRepository {

    Optional<Survey> findSurvey(int surveyId);

    void saveSurvey(Survey survey);
}
