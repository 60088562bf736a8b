package dev.surveyflow.engine;

import dev.surveyflow.error.CycleDetectedException;
import dev.surveyflow.error.FlowElementNotFoundException;
import dev.surveyflow.error.FlowElementNotFoundException.Kind;
import dev.surveyflow.error.FlowValidationException;
import dev.surveyflow.error.NoEndpointException;
import dev.surveyflow.model.FlowSettings;
import dev.surveyflow.model.Survey;
import dev.surveyflow.store.BranchingRuleRepository;
import dev.surveyflow.store.QuestionRepository;
import dev.surveyflow.store.SurveyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Puts surveys live and takes them offline. A survey goes live only when its flow passes validation.
 */
public final class SurveyActivator {

    private static final Logger log = LoggerFactory.getLogger(SurveyActivator.class);

    private final SurveyRepository surveys;
    private final QuestionRepository questions;
    private final BranchingRuleRepository rules;
    private final FlowSettings settings;

    public SurveyActivator(SurveyRepository surveys, QuestionRepository questions,
                           BranchingRuleRepository rules, FlowSettings settings) {
        this.surveys = surveys;
        this.questions = questions;
        this.rules = rules;
        this.settings = settings;
    }

    public ActivationReport validateForActivation(int surveyId) {
        return FlowValidator.validate(snapshot(surveyId), settings);
    }

    public CycleDetectionResult detectCycle(int surveyId) {
        return FlowValidator.detectCycle(snapshot(surveyId), settings);
    }

    public Set<Integer> findEndpoints(int surveyId) {
        return FlowValidator.findEndpoints(snapshot(surveyId));
    }

    /**
     * Validate and activate.
     *
     * @throws CycleDetectedException  if explicit jumps form a loop
     * @throws NoEndpointException     if no question reaches the end of the survey
     * @throws FlowValidationException for any other problem in the report
     */
    public Survey activate(int surveyId) {
        Survey survey = requireSurvey(surveyId);
        if (survey.active()) {
            return survey;
        }

        ActivationReport report = validateForActivation(surveyId);
        if (report.hasCycle()) {
            throw new CycleDetectedException(report.errorMessage(), report.cyclePath());
        }
        if (report.endpoints().isEmpty()) {
            throw new NoEndpointException(surveyId, report.errorMessage());
        }
        if (!report.isValid()) {
            throw new FlowValidationException(report.errorMessage());
        }

        Survey activated = survey.withActive(true);
        surveys.saveSurvey(activated);
        log.info("Survey {} activated", surveyId);
        return activated;
    }

    public Survey deactivate(int surveyId) {
        Survey survey = requireSurvey(surveyId);
        if (!survey.active()) {
            return survey;
        }
        Survey deactivated = survey.withActive(false);
        surveys.saveSurvey(deactivated);
        log.info("Survey {} deactivated", surveyId);
        return deactivated;
    }

    private FlowGraph snapshot(int surveyId) {
        requireSurvey(surveyId);
        return FlowGraph.snapshot(surveyId, questions, rules);
    }

    private Survey requireSurvey(int surveyId) {
        return surveys.findSurvey(surveyId)
            .orElseThrow(() -> new FlowElementNotFoundException(Kind.SURVEY, surveyId));
    }
}
