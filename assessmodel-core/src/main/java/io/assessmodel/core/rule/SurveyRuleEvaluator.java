package io.assessmodel.core.rule;

import io.assessmodel.core.node.NavigationIdentifier;
import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/// Evaluates survey rules against a recorded answer.
///
/// Pure and side-effect free, so it can be used to preview where an answer would lead
/// before the participant commits to it.
///
/// ### Comparison
/// | Answer / matching answer | Supported operators |
/// |---|---|
/// | number / number | all, compared as {@link BigDecimal} |
/// | string / string | all, compared lexicographically |
/// | boolean / boolean | `eq`, `ne` |
/// | list / list | `eq`, `ne`, element-wise equality |
/// | null | `always`, `de` |
///
/// Any other pairing is not comparable and never matches.
public final class SurveyRuleEvaluator {

    private SurveyRuleEvaluator() {}

    /// Returns the target of the first rule matching the answer.
    ///
    /// @param rules rules in evaluation order, may be null
    /// @param answer JSON-shaped answer value, may be null
    /// @return jump target of the first matching rule, or null if none match
    public static NavigationIdentifier evaluate(List<SurveyRule> rules, Object answer) {
        if (rules == null) {
            return null;
        }
        return rules.stream()
                .filter(rule -> matches(rule, answer))
                .findFirst()
                .map(SurveyRule::skipToIdentifier)
                .orElse(null);
    }

    /// Returns whether a single rule matches the answer.
    ///
    /// @param rule the rule, not null
    /// @param answer JSON-shaped answer value, may be null
    /// @return true if the rule matches
    public static boolean matches(SurveyRule rule, Object answer) {
        RuleOperator operator = rule.effectiveOperator();
        if (operator == RuleOperator.ALWAYS) {
            return true;
        }
        if (operator == RuleOperator.SKIP) {
            return answer == null;
        }
        Object expected = rule.matchingAnswer();
        if (answer == null || expected == null) {
            return false;
        }

        if (answer instanceof Number actual && expected instanceof Number target) {
            return compareNumbers(actual, target, operator);
        }
        if (answer instanceof String actual && expected instanceof String target) {
            return test(actual.compareTo(target), operator);
        }
        if (answer instanceof Boolean && expected instanceof Boolean) {
            return testEquality(answer.equals(expected), operator);
        }
        if (answer instanceof List<?> actual && expected instanceof List<?> target) {
            return testEquality(listsEqual(actual, target), operator);
        }
        return false;
    }

    private static boolean compareNumbers(Number actual, Number target, RuleOperator operator) {
        try {
            return test(toDecimal(actual).compareTo(toDecimal(target)), operator);
        } catch (NumberFormatException e) {
            // NaN or infinite values
            return false;
        }
    }

    private static BigDecimal toDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        return new BigDecimal(number.toString());
    }

    private static boolean listsEqual(List<?> actual, List<?> target) {
        if (actual.size() != target.size()) {
            return false;
        }
        for (int i = 0; i < actual.size(); i++) {
            Object a = actual.get(i);
            Object b = target.get(i);
            if (a instanceof Number na && b instanceof Number nb) {
                if (!compareNumbers(na, nb, RuleOperator.EQUAL)) {
                    return false;
                }
            } else if (!Objects.equals(a, b)) {
                return false;
            }
        }
        return true;
    }

    private static boolean test(int comparison, RuleOperator operator) {
        return switch (operator) {
            case EQUAL -> comparison == 0;
            case NOT_EQUAL -> comparison != 0;
            case LESS_THAN -> comparison < 0;
            case LESS_THAN_EQUAL -> comparison <= 0;
            case GREATER_THAN -> comparison > 0;
            case GREATER_THAN_EQUAL -> comparison >= 0;
            case ALWAYS -> true;
            case SKIP -> false;
        };
    }

    private static boolean testEquality(boolean equal, RuleOperator operator) {
        return switch (operator) {
            case EQUAL -> equal;
            case NOT_EQUAL -> !equal;
            default -> false;
        };
    }
}
