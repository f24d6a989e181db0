package io.assessmodel.core.rule;

/// Comparison applied between a recorded answer and a rule's matching answer.
///
/// The serialized name is the value of the `ruleOperator` field in survey rule JSON.
public enum RuleOperator {
    EQUAL("eq"),
    NOT_EQUAL("ne"),
    LESS_THAN("lt"),
    LESS_THAN_EQUAL("le"),
    GREATER_THAN("gt"),
    GREATER_THAN_EQUAL("ge"),
    /// Matches any answer, including no answer.
    ALWAYS("always"),
    /// Matches a question that was skipped (no answer recorded).
    SKIP("de");

    private final String jsonName;

    RuleOperator(String jsonName) {
        this.jsonName = jsonName;
    }

    public String getJsonName() {
        return jsonName;
    }

    /// Returns whether this operator orders its operands rather than testing equality.
    public boolean isOrdering() {
        return this == LESS_THAN
                || this == LESS_THAN_EQUAL
                || this == GREATER_THAN
                || this == GREATER_THAN_EQUAL;
    }

    public static RuleOperator fromJsonName(String jsonName) {
        for (RuleOperator operator : values()) {
            if (operator.jsonName.equals(jsonName)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown rule operator: " + jsonName);
    }
}
