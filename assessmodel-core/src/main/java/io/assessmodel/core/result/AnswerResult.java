package io.assessmodel.core.result;

import io.assessmodel.core.node.AnswerType;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Result of a question.
///
/// The answer is held as a JSON-shaped value: null while unanswered, a `String`, `Number`
/// or `Boolean` scalar, or a `List` of scalars for multiple-choice questions.
public final class AnswerResult extends Result {

    private AnswerType answerType;
    private Object jsonValue;
    private String questionText;

    public AnswerResult(String identifier, Instant startDate) {
        super(identifier, startDate);
    }

    public AnswerResult(
            String identifier, Instant startDate, AnswerType answerType, String questionText) {
        super(identifier, startDate);
        this.answerType = answerType;
        this.questionText = questionText;
    }

    @Override
    public ResultType getResultType() {
        return ResultType.ANSWER;
    }

    /// @return the answer shape, may be null
    public AnswerType getAnswerType() {
        return answerType;
    }

    public void setAnswerType(AnswerType answerType) {
        this.answerType = answerType;
    }

    /// @return the recorded answer, or null if not answered
    public Object getJsonValue() {
        return jsonValue;
    }

    /// Records the participant's answer.
    ///
    /// @param jsonValue null, a scalar or a list of scalars
    /// @throws IllegalArgumentException if the value is not JSON-shaped
    public void setJsonValue(Object jsonValue) {
        if (jsonValue != null
                && !(jsonValue instanceof String
                        || jsonValue instanceof Number
                        || jsonValue instanceof Boolean
                        || jsonValue instanceof List<?>)) {
            throw new IllegalArgumentException(
                    "Unsupported answer value type: " + jsonValue.getClass().getName());
        }
        this.jsonValue = jsonValue instanceof List<?> list ? new ArrayList<>(list) : jsonValue;
    }

    public String getQuestionText() {
        return questionText;
    }

    public void setQuestionText(String questionText) {
        this.questionText = questionText;
    }

    @Override
    public AnswerResult deepCopy() {
        AnswerResult copy =
                new AnswerResult(getIdentifier(), getStartDate(), answerType, questionText);
        copy.setEndDate(getEndDate());
        copy.setJsonValue(jsonValue);
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnswerResult other)) return false;
        return baseEquals(other)
                && Objects.equals(answerType, other.answerType)
                && Objects.equals(jsonValue, other.jsonValue)
                && Objects.equals(questionText, other.questionText);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), jsonValue);
    }
}
