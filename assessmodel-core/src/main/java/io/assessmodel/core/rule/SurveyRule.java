package io.assessmodel.core.rule;

import io.assessmodel.core.node.NavigationIdentifier;
import java.util.Objects;

/// Conditional jump attached to a question.
///
/// When the operator is omitted it resolves to {@link RuleOperator#ALWAYS} for a rule
/// without a matching answer and to {@link RuleOperator#EQUAL} otherwise. The raw operator
/// is kept so the rule serializes back to the shape it was read from.
///
/// @param skipToIdentifier jump target when the rule matches, not null
/// @param matchingAnswer JSON-shaped value compared against the answer, may be null
/// @param ruleOperator declared operator, may be null
/// @see SurveyRuleEvaluator for matching semantics
public record SurveyRule(
        NavigationIdentifier skipToIdentifier, Object matchingAnswer, RuleOperator ruleOperator) {

    public SurveyRule {
        Objects.requireNonNull(skipToIdentifier, "skipToIdentifier required");
    }

    /// Rule that jumps when the answer equals the given value.
    public static SurveyRule equalTo(Object matchingAnswer, String skipToIdentifier) {
        return new SurveyRule(
                NavigationIdentifier.parse(skipToIdentifier), matchingAnswer, RuleOperator.EQUAL);
    }

    /// Rule that jumps unconditionally.
    public static SurveyRule always(String skipToIdentifier) {
        return new SurveyRule(NavigationIdentifier.parse(skipToIdentifier), null, null);
    }

    public static SurveyRule of(
            RuleOperator ruleOperator, Object matchingAnswer, String skipToIdentifier) {
        return new SurveyRule(
                NavigationIdentifier.parse(skipToIdentifier), matchingAnswer, ruleOperator);
    }

    /// Returns the operator used for matching.
    ///
    /// @return declared operator, or the default implied by `matchingAnswer`, never null
    public RuleOperator effectiveOperator() {
        if (ruleOperator != null) {
            return ruleOperator;
        }
        return matchingAnswer == null ? RuleOperator.ALWAYS : RuleOperator.EQUAL;
    }
}
