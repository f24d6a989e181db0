package io.assessmodel.core.execution;

import io.assessmodel.core.node.Node;
import io.assessmodel.core.result.Result;
import java.util.Objects;

/// The step currently shown and the result it writes into.
///
/// The result is mutable; the host records the participant's answer on it directly.
///
/// @param step the leaf node shown, not null
/// @param result result for this showing of the step, not null
/// @param parentIdentifier identifier of the branch that owns the result, not null
public record StepState(Node step, Result result, String parentIdentifier) {

    public StepState {
        Objects.requireNonNull(step, "step required");
        Objects.requireNonNull(result, "result required");
        Objects.requireNonNull(parentIdentifier, "parentIdentifier required");
    }
}
