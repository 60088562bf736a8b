package dev.surveyflow.model;

import java.util.List;

/**
 * A whole survey as authored: header, questions, branching rules and settings.
 */
public record SurveyDefinition(
    Survey survey,
    List<Question> questions,
    List<BranchingRule> branchingRules,
    FlowSettings settings
) {}
