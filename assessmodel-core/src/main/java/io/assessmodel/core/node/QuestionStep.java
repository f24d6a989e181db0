package io.assessmodel.core.node;

import io.assessmodel.core.result.AnswerResult;
import io.assessmodel.core.result.Result;
import io.assessmodel.core.rule.SurveyRule;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// A step that asks the participant a question.
///
/// Simple questions declare their {@link AnswerType} directly. Choice questions declare a
/// base kind and an ordered list of {@link Choice}s; a single-choice question answers with
/// the base kind, a multiple-choice question with an array of it.
///
/// Survey rules are evaluated in list order against the recorded answer when the participant
/// moves forward. The first match wins; {@link #getNextNode()} is the fallback when none
/// match.
///
/// @see io.assessmodel.core.rule.SurveyRuleEvaluator
public final class QuestionStep extends Node {

    private final List<SurveyRule> surveyRules;
    private final AnswerType simpleAnswerType;
    private final AnswerType.Kind baseType;
    private final boolean singleChoice;
    private final List<Choice> choices;
    private final boolean optional;
    private final String uiHint;

    private QuestionStep(NodeType nodeType, Builder builder) {
        super(nodeType, builder);
        this.surveyRules = List.copyOf(builder.surveyRules);
        this.optional = builder.optional;
        this.uiHint = builder.uiHint;
        if (nodeType == NodeType.CHOICE_QUESTION) {
            if (builder.choices.isEmpty()) {
                throw new IllegalStateException("Choice question '" + id + "' requires choices");
            }
            this.simpleAnswerType = null;
            this.baseType = builder.baseType != null ? builder.baseType : AnswerType.Kind.STRING;
            this.singleChoice = builder.singleChoice;
            this.choices = List.copyOf(builder.choices);
        } else {
            if (!builder.choices.isEmpty()) {
                throw new IllegalStateException("Simple question '" + id + "' cannot have choices");
            }
            this.simpleAnswerType =
                    builder.answerType != null
                            ? builder.answerType
                            : AnswerType.of(AnswerType.Kind.STRING);
            this.baseType = null;
            this.singleChoice = true;
            this.choices = List.of();
        }
    }

    public static Builder simple() {
        return new Builder(NodeType.SIMPLE_QUESTION);
    }

    public static Builder choice() {
        return new Builder(NodeType.CHOICE_QUESTION);
    }

    /// @return survey rules in evaluation order, never null
    public List<SurveyRule> getSurveyRules() {
        return surveyRules;
    }

    /// Returns the shape of the answer recorded for this question.
    ///
    /// @return declared type for simple questions, the base kind or an array of it for
    ///     choice questions, never null
    public AnswerType getAnswerType() {
        if (getNodeType() == NodeType.SIMPLE_QUESTION) {
            return simpleAnswerType;
        }
        return singleChoice ? AnswerType.of(baseType) : AnswerType.arrayOf(baseType);
    }

    /// @return element kind of a choice question, null for simple questions
    public AnswerType.Kind getBaseType() {
        return baseType;
    }

    public boolean isSingleChoice() {
        return singleChoice;
    }

    /// @return options of a choice question, empty for simple questions
    public List<Choice> getChoices() {
        return choices;
    }

    public boolean isOptional() {
        return optional;
    }

    public String getUiHint() {
        return uiHint;
    }

    @Override
    public Result instantiateResult(Instant startDate) {
        return new AnswerResult(id, startDate, getAnswerType(), getTitle());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QuestionStep other)) return false;
        return baseEquals(other)
                && surveyRules.equals(other.surveyRules)
                && Objects.equals(simpleAnswerType, other.simpleAnswerType)
                && baseType == other.baseType
                && singleChoice == other.singleChoice
                && choices.equals(other.choices)
                && optional == other.optional
                && Objects.equals(uiHint, other.uiHint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseHashCode(), surveyRules, choices);
    }

    public static final class Builder extends Node.Builder<Builder> {
        private final NodeType nodeType;
        private final List<SurveyRule> surveyRules = new ArrayList<>();
        private AnswerType answerType;
        private AnswerType.Kind baseType;
        private boolean singleChoice = true;
        private final List<Choice> choices = new ArrayList<>();
        private boolean optional = true;
        private String uiHint;

        private Builder(NodeType nodeType) {
            this.nodeType = nodeType;
        }

        @Override
        protected Builder self() {
            return this;
        }

        public Builder surveyRule(SurveyRule rule) {
            this.surveyRules.add(Objects.requireNonNull(rule, "rule must not be null"));
            return this;
        }

        public Builder surveyRules(List<SurveyRule> surveyRules) {
            this.surveyRules.clear();
            if (surveyRules != null) {
                this.surveyRules.addAll(surveyRules);
            }
            return this;
        }

        /// Sets the answer type of a simple question. Defaults to string.
        public Builder answerType(AnswerType answerType) {
            this.answerType = answerType;
            return this;
        }

        /// Sets the element kind of a choice question. Defaults to string.
        public Builder baseType(AnswerType.Kind baseType) {
            this.baseType = baseType;
            return this;
        }

        public Builder singleChoice(boolean singleChoice) {
            this.singleChoice = singleChoice;
            return this;
        }

        public Builder choice(Choice choice) {
            this.choices.add(Objects.requireNonNull(choice, "choice must not be null"));
            return this;
        }

        public Builder choices(List<Choice> choices) {
            this.choices.clear();
            if (choices != null) {
                this.choices.addAll(choices);
            }
            return this;
        }

        public Builder optional(boolean optional) {
            this.optional = optional;
            return this;
        }

        public Builder uiHint(String uiHint) {
            this.uiHint = uiHint;
            return this;
        }

        public QuestionStep build() {
            return new QuestionStep(nodeType, this);
        }
    }
}
