package io.assessmodel.core.result;

import java.time.Instant;

/// Result of a step that collects no answer.
public final class BasicResult extends Result {

    public BasicResult(String identifier, Instant startDate) {
        super(identifier, startDate);
    }

    @Override
    public ResultType getResultType() {
        return ResultType.BASE;
    }

    @Override
    public BasicResult deepCopy() {
        BasicResult copy = new BasicResult(getIdentifier(), getStartDate());
        copy.setEndDate(getEndDate());
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BasicResult other)) return false;
        return baseEquals(other);
    }

    @Override
    public int hashCode() {
        return super.hashCode();
    }
}
