package io.assessmodel.core.navigation;

import io.assessmodel.core.node.Node;
import io.assessmodel.core.result.Direction;
import java.util.Objects;

/// Answer of a navigator: the node to show next and the direction of travel.
///
/// @param node node to show, or null when the branch is exhausted or exited
/// @param direction direction of travel, not null
public record NavigationPoint(Node node, Direction direction) {

    public NavigationPoint {
        Objects.requireNonNull(direction, "direction required");
    }
}
