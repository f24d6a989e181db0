package io.assessmodel.core.result;

import java.util.Objects;

/// One entry of the append-only traversal log kept by a {@link BranchNodeResult}.
///
/// @param identifier identifier of the node shown or left, not null
/// @param direction direction of the traversal step, not null
public record PathMarker(String identifier, Direction direction) {

    public PathMarker {
        Objects.requireNonNull(identifier, "identifier required");
        Objects.requireNonNull(direction, "direction required");
    }
}
