package io.assessmodel.core.result;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Result scope for one navigation level: an assessment or a nested section.
///
/// Keeps two views of the traversal:
/// - `pathHistory` holds one result per node identifier in first-shown order. Recording an
///   identifier again replaces the earlier entry in place.
/// - `path` is an append-only log of {@link PathMarker}s with one entry per traversal step,
///   revisits included. It drives loop-safe backward navigation and restoring a run.
///
/// `inputResults` holds auxiliary results that are not part of the visible sequence.
///
/// ### Contracts
/// - **Invariant**: identifiers in `pathHistory` are unique
/// - **Invariant**: no two consecutive markers in `path` are equal
///
/// @implNote Not thread-safe. Getters return snapshots.
public sealed class BranchNodeResult extends Result permits AssessmentResult {

    private final List<Result> pathHistory = new ArrayList<>();
    private final List<PathMarker> path = new ArrayList<>();
    private final Map<String, Result> inputResults = new LinkedHashMap<>();

    public BranchNodeResult(String identifier, Instant startDate) {
        super(identifier, startDate);
    }

    @Override
    public ResultType getResultType() {
        return ResultType.SECTION;
    }

    /// Records a traversal step to the given result.
    ///
    /// Replaces any earlier entry with the same identifier in `pathHistory` (or appends) and
    /// appends a path marker unless it repeats the last one.
    ///
    /// @param result the child result, not null
    /// @param direction direction of the step, not null
    public void appendStepHistory(Result result, Direction direction) {
        updateStepHistory(result);
        appendPathMarker(new PathMarker(result.getIdentifier(), direction));
    }

    /// Replaces or appends a child result without recording a traversal step.
    ///
    /// @param result the child result, not null
    public void updateStepHistory(Result result) {
        Objects.requireNonNull(result, "result must not be null");
        for (int i = 0; i < pathHistory.size(); i++) {
            if (pathHistory.get(i).getIdentifier().equals(result.getIdentifier())) {
                pathHistory.set(i, result);
                return;
            }
        }
        pathHistory.add(result);
    }

    /// Appends a marker unless it equals the last marker.
    ///
    /// @param marker the marker, not null
    public void appendPathMarker(PathMarker marker) {
        Objects.requireNonNull(marker, "marker must not be null");
        if (path.isEmpty() || !path.get(path.size() - 1).equals(marker)) {
            path.add(marker);
        }
    }

    /// Replaces the path log wholesale. Used when rehydrating a persisted result.
    ///
    /// @param markers markers in traversal order, not null
    public void setPath(List<PathMarker> markers) {
        path.clear();
        path.addAll(markers);
    }

    /// Adds or replaces an auxiliary result, keyed by identifier.
    ///
    /// @param result the auxiliary result, not null
    public void appendInputResult(Result result) {
        Objects.requireNonNull(result, "result must not be null");
        inputResults.put(result.getIdentifier(), result);
    }

    /// Finds a child result in `pathHistory`.
    ///
    /// @param identifier node identifier, not null
    /// @return the recorded result, or null if the node has not been shown
    public Result findResult(String identifier) {
        for (Result result : pathHistory) {
            if (result.getIdentifier().equals(identifier)) {
                return result;
            }
        }
        return null;
    }

    /// Returns the answer recorded for a question in this branch.
    ///
    /// @param identifier question identifier, not null
    /// @return the JSON-shaped answer, or null if unanswered or not a question
    public Object findAnswer(String identifier) {
        return findResult(identifier) instanceof AnswerResult answer ? answer.getJsonValue() : null;
    }

    /// @return child results in first-shown order, never null
    public List<Result> getPathHistory() {
        return List.copyOf(pathHistory);
    }

    /// @return traversal log, never null
    public List<PathMarker> getPath() {
        return List.copyOf(path);
    }

    /// @return the last traversal marker, or null if the log is empty
    public PathMarker lastPathMarker() {
        return path.isEmpty() ? null : path.get(path.size() - 1);
    }

    /// @return auxiliary results in insertion order, never null
    public List<Result> getInputResults() {
        return List.copyOf(inputResults.values());
    }

    @Override
    public BranchNodeResult deepCopy() {
        BranchNodeResult copy = new BranchNodeResult(getIdentifier(), getStartDate());
        copyInto(copy);
        return copy;
    }

    protected void copyInto(BranchNodeResult copy) {
        copy.setEndDate(getEndDate());
        pathHistory.forEach(result -> copy.pathHistory.add(result.deepCopy()));
        copy.path.addAll(path);
        inputResults.values().forEach(result -> copy.appendInputResult(result.deepCopy()));
    }

    protected boolean branchEquals(BranchNodeResult other) {
        return baseEquals(other)
                && pathHistory.equals(other.pathHistory)
                && path.equals(other.path)
                && inputResults.equals(other.inputResults);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || o.getClass() != BranchNodeResult.class) return false;
        return branchEquals((BranchNodeResult) o);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), pathHistory.size(), path.size());
    }
}
