package io.assessmodel.core.node;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/// A node that contains an ordered list of child nodes and is navigated as its own level.
///
/// Button overrides declared on a branch apply to the branch itself and to every node it
/// contains, at any depth.
public abstract sealed class BranchNode extends Node permits Assessment, Section {

    private final List<Node> children;
    private final Set<String> descendantIds;

    protected BranchNode(NodeType nodeType, Builder<?> builder) {
        super(nodeType, builder);
        this.children = List.copyOf(builder.children);
        Set<String> ids = new HashSet<>();
        collectIds(children, ids);
        this.descendantIds = Set.copyOf(ids);
    }

    private static void collectIds(List<Node> nodes, Set<String> ids) {
        for (Node node : nodes) {
            ids.add(node.getId());
            if (node instanceof BranchNode branch) {
                collectIds(branch.children, ids);
            }
        }
    }

    /// @return child nodes in navigation order, never null
    public List<Node> getChildren() {
        return children;
    }

    @Override
    protected boolean owns(String nodeIdentifier) {
        return super.owns(nodeIdentifier) || descendantIds.contains(nodeIdentifier);
    }

    @Override
    protected boolean baseEquals(Node other) {
        return super.baseEquals(other) && children.equals(((BranchNode) other).children);
    }

    @Override
    protected int baseHashCode() {
        return Objects.hash(super.baseHashCode(), children);
    }

    public abstract static class Builder<B extends Builder<B>> extends Node.Builder<B> {
        private final List<Node> children = new ArrayList<>();

        public B child(Node child) {
            this.children.add(Objects.requireNonNull(child, "child must not be null"));
            return self();
        }

        public B children(List<? extends Node> children) {
            this.children.clear();
            if (children != null) {
                children.forEach(this::child);
            }
            return self();
        }
    }
}
