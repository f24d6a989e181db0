package io.assessmodel.core.execution;

import io.assessmodel.core.navigation.NodeNavigator;
import io.assessmodel.core.node.BranchNode;
import io.assessmodel.core.result.BranchNodeResult;
import java.util.Objects;

/// One frame of the controller's traversal stack.
///
/// @param node the branch being navigated, not null
/// @param navigator navigator over the branch's children, not null
/// @param result result scope of the branch, not null
public record BranchState(BranchNode node, NodeNavigator navigator, BranchNodeResult result) {

    public BranchState {
        Objects.requireNonNull(node, "node required");
        Objects.requireNonNull(navigator, "navigator required");
        Objects.requireNonNull(result, "result required");
    }

    public String identifier() {
        return node.getId();
    }
}
