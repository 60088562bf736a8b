package dev.surveyflow.store;

import dev.surveyflow.model.BranchingRule;

import java.util.List;

/**
 * Lookup and storage of branching rules.
 * Both lookups return rules in insertion order; evaluation depends on it.
 */
public interface BranchingRuleRepository {

    List<BranchingRule> getBranchingRulesBySource(int questionId);

    List<BranchingRule> getBranchingRulesBySurvey(int surveyId);

    void saveBranchingRule(BranchingRule rule);
}
