package dev.surveyflow.engine;

import dev.surveyflow.model.BranchingRule;
import dev.surveyflow.model.Condition;
import dev.surveyflow.model.ConditionOperator;
import dev.surveyflow.store.BranchingRuleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Matches answers against branching rule conditions.
 */
public final class BranchingRuleEvaluator {

    private static final Logger log = LoggerFactory.getLogger(BranchingRuleEvaluator.class);

    private final BranchingRuleRepository rules;

    public BranchingRuleEvaluator(BranchingRuleRepository rules) {
        this.rules = rules;
    }

    /**
     * Evaluate one condition against an answer.
     * Text comparisons ignore case; numeric operators compare integers and
     * yield false when either side does not parse.
     *
     * @param condition   the condition to test
     * @param answerValue the raw answer, may be null
     * @return true if the answer satisfies the condition
     */
    public static boolean matches(Condition condition, String answerValue) {
        if (answerValue == null || answerValue.isBlank()) {
            return false;
        }
        Optional<ConditionOperator> operator = condition.knownOperator();
        List<String> values = condition.values();
        if (operator.isEmpty() || values.isEmpty()) {
            return false;
        }

        String answer = answerValue.trim();
        String first = values.get(0) == null ? "" : values.get(0).trim();

        switch (operator.get()) {
            case EQUALS:
                return answer.equalsIgnoreCase(first);
            case CONTAINS:
                return !first.isEmpty()
                    && answer.toLowerCase(Locale.ROOT).contains(first.toLowerCase(Locale.ROOT));
            case IN:
                return values.stream()
                    .filter(v -> v != null)
                    .anyMatch(v -> v.trim().equalsIgnoreCase(answer));
            default:
                return compareNumbers(operator.get(), answer, first);
        }
    }

    /**
     * Find the first rule of a question whose condition matches the answer.
     * Rules are tried in the order the repository returns them; the first match wins.
     *
     * @return the matching rule's target question, or empty if none matches
     */
    public OptionalInt evaluateBranchingRule(int sourceQuestionId, String answerValue) {
        for (BranchingRule rule : rules.getBranchingRulesBySource(sourceQuestionId)) {
            if (rule.condition().knownOperator().isEmpty()) {
                log.warn("Branching rule {} on question {} uses unknown operator '{}', skipping",
                    rule.id(), sourceQuestionId, rule.condition().operator());
                continue;
            }
            if (matches(rule.condition(), answerValue)) {
                log.debug("Branching rule {} matched on question {}: -> question {}",
                    rule.id(), sourceQuestionId, rule.targetQuestionId());
                return OptionalInt.of(rule.targetQuestionId());
            }
        }
        return OptionalInt.empty();
    }

    private static boolean compareNumbers(ConditionOperator operator, String answer, String expected) {
        int left;
        int right;
        try {
            left = Integer.parseInt(answer);
            right = Integer.parseInt(expected);
        } catch (NumberFormatException e) {
            return false;
        }
        return switch (operator) {
            case GREATER_THAN -> left > right;
            case LESS_THAN -> left < right;
            case GREATER_THAN_OR_EQUAL -> left >= right;
            case LESS_THAN_OR_EQUAL -> left <= right;
            default -> false;
        };
    }
}
