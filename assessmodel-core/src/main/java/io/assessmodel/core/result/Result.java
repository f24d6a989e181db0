package io.assessmodel.core.result;

import java.time.Instant;
import java.util.Objects;

/// Mutable record of what happened on one node during a run.
///
/// A result is created when its node is first shown and its end date is stamped when
/// navigation leaves the node. Results are owned by the branch that created them and are
/// not thread-safe.
///
/// @see BranchNodeResult for the per-level history
public abstract sealed class Result permits AnswerResult, BasicResult, BranchNodeResult {

    private final String identifier;
    private Instant startDate;
    private Instant endDate;

    protected Result(String identifier, Instant startDate) {
        this.identifier = Objects.requireNonNull(identifier, "identifier required");
        this.startDate = Objects.requireNonNull(startDate, "startDate required");
    }

    /// @return identifier of the node this result belongs to, never null
    public String getIdentifier() {
        return identifier;
    }

    public Instant getStartDate() {
        return startDate;
    }

    public void setStartDate(Instant startDate) {
        this.startDate = Objects.requireNonNull(startDate, "startDate required");
    }

    /// @return when navigation left the node, or null while it is shown
    public Instant getEndDate() {
        return endDate;
    }

    public void setEndDate(Instant endDate) {
        this.endDate = endDate;
    }

    public abstract ResultType getResultType();

    /// Returns an independent copy of this result, including nested results.
    ///
    /// @return a new result equal to this one, never null
    public abstract Result deepCopy();

    protected boolean baseEquals(Result other) {
        return identifier.equals(other.identifier)
                && startDate.equals(other.startDate)
                && Objects.equals(endDate, other.endDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identifier, startDate);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()
                + "{identifier='"
                + identifier
                + "', startDate="
                + startDate
                + ", endDate="
                + endDate
                + "}";
    }
}
