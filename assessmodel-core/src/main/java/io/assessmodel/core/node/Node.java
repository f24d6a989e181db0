package io.assessmodel.core.node;

import io.assessmodel.core.result.Result;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Base class for all assessment node types.
///
/// Nodes are the building blocks of an assessment. Each node has an identifier that is
/// unique within its containing list, a {@link NodeType} discriminant, and optional
/// presentation overrides for the navigation buttons. Navigation code switches on the
/// node type explicitly; the hierarchy is closed.
///
/// ### Node Types
/// - {@link ContentStep} - instruction, overview, completion and countdown steps
/// - {@link QuestionStep} - simple and choice questions carrying survey rules
/// - {@link BranchNode} - {@link Section} and {@link Assessment}, which contain child nodes
///
/// @implNote Immutable after construction. The same node instance is shared by every run
/// of the assessment.
///
/// @see io.assessmodel.core.navigation.NodeNavigator for traversal
public abstract sealed class Node permits BranchNode, ContentStep, QuestionStep {

    protected final String id;
    private final NodeType nodeType;
    private final String comment;
    private final String title;
    private final String subtitle;
    private final String detail;
    private final NavigationIdentifier nextNode;
    private final Set<ButtonType> hiddenButtons;
    private final Map<ButtonType, ButtonActionInfo> buttonMap;

    protected Node(NodeType nodeType, Builder<?> builder) {
        this.id = Objects.requireNonNull(builder.id, "Node ID required");
        this.nodeType = Objects.requireNonNull(nodeType, "Node type required");
        this.comment = builder.comment;
        this.title = builder.title;
        this.subtitle = builder.subtitle;
        this.detail = builder.detail;
        this.nextNode = builder.nextNode;
        this.hiddenButtons =
                builder.hiddenButtons.isEmpty()
                        ? Set.of()
                        : Collections.unmodifiableSet(EnumSet.copyOf(builder.hiddenButtons));
        this.buttonMap =
                builder.buttonMap.isEmpty()
                        ? Map.of()
                        : Collections.unmodifiableMap(new EnumMap<>(builder.buttonMap));
    }

    /// Returns the node identifier.
    ///
    /// @return identifier, unique within the containing list, never null
    public String getId() {
        return id;
    }

    /// Returns the node type used for navigation dispatch and serialization.
    ///
    /// @return the node type, never null
    public NodeType getNodeType() {
        return nodeType;
    }

    public String getComment() {
        return comment;
    }

    public String getTitle() {
        return title;
    }

    public String getSubtitle() {
        return subtitle;
    }

    public String getDetail() {
        return detail;
    }

    /// Returns the direct jump target for this node.
    ///
    /// For questions the survey rules are consulted first; this pointer is only used when
    /// no rule matches.
    ///
    /// @return jump target, or null to advance sequentially
    public NavigationIdentifier getNextNode() {
        return nextNode;
    }

    /// @return unmodifiable set of buttons hidden by this node, never null
    public Set<ButtonType> getHiddenButtons() {
        return hiddenButtons;
    }

    /// @return unmodifiable map of button label overrides, never null
    public Map<ButtonType, ButtonActionInfo> getButtonMap() {
        return buttonMap;
    }

    /// Returns whether this node hides a button on the node with the given identifier.
    ///
    /// A step only has an opinion about itself. A branch also answers for every node it
    /// contains.
    ///
    /// @param buttonType the button being resolved, not null
    /// @param nodeIdentifier identifier of the node the button is shown on, not null
    /// @return true or false if this node owns the target, null otherwise
    public Boolean shouldHideButton(ButtonType buttonType, String nodeIdentifier) {
        return owns(nodeIdentifier) ? hiddenButtons.contains(buttonType) : null;
    }

    /// Returns this node's label override for a button on the node with the given identifier.
    ///
    /// @param buttonType the button being resolved, not null
    /// @param nodeIdentifier identifier of the node the button is shown on, not null
    /// @return label override, or null if none applies
    public ButtonActionInfo button(ButtonType buttonType, String nodeIdentifier) {
        return owns(nodeIdentifier) ? buttonMap.get(buttonType) : null;
    }

    /// Returns whether button overrides on this node apply to the given node.
    protected boolean owns(String nodeIdentifier) {
        return id.equals(nodeIdentifier);
    }

    /// Creates the empty result recorded when this node is first shown.
    ///
    /// @param startDate when the node is shown, not null
    /// @return a new mutable result with this node's identifier, never null
    public abstract Result instantiateResult(Instant startDate);

    protected boolean baseEquals(Node other) {
        return id.equals(other.id)
                && nodeType == other.nodeType
                && Objects.equals(comment, other.comment)
                && Objects.equals(title, other.title)
                && Objects.equals(subtitle, other.subtitle)
                && Objects.equals(detail, other.detail)
                && Objects.equals(nextNode, other.nextNode)
                && hiddenButtons.equals(other.hiddenButtons)
                && buttonMap.equals(other.buttonMap);
    }

    protected int baseHashCode() {
        return Objects.hash(id, nodeType, title, nextNode);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id='" + id + "', type=" + nodeType + "}";
    }

    /// Shared builder state for all node types.
    ///
    /// Required fields: `id`
    ///
    /// @param <B> concrete builder type returned for chaining
    public abstract static class Builder<B extends Builder<B>> {
        private String id;
        private String comment;
        private String title;
        private String subtitle;
        private String detail;
        private NavigationIdentifier nextNode;
        private final Set<ButtonType> hiddenButtons = EnumSet.noneOf(ButtonType.class);
        private final Map<ButtonType, ButtonActionInfo> buttonMap = new EnumMap<>(ButtonType.class);

        protected Builder() {}

        protected abstract B self();

        /// Sets the node identifier (required).
        ///
        /// @param id identifier unique within the containing list, not null
        /// @return this builder for chaining
        public B id(String id) {
            this.id = id;
            return self();
        }

        public B comment(String comment) {
            this.comment = comment;
            return self();
        }

        public B title(String title) {
            this.title = title;
            return self();
        }

        public B subtitle(String subtitle) {
            this.subtitle = subtitle;
            return self();
        }

        public B detail(String detail) {
            this.detail = detail;
            return self();
        }

        /// Sets the direct jump target.
        ///
        /// @param nextNode jump target, may be null
        /// @return this builder for chaining
        public B nextNode(NavigationIdentifier nextNode) {
            this.nextNode = nextNode;
            return self();
        }

        /// Sets the direct jump target from its serialized form.
        ///
        /// @param nextNode node identifier or reserved key, may be null
        /// @return this builder for chaining
        public B nextNode(String nextNode) {
            this.nextNode = nextNode != null ? NavigationIdentifier.parse(nextNode) : null;
            return self();
        }

        public B hideButton(ButtonType buttonType) {
            this.hiddenButtons.add(buttonType);
            return self();
        }

        public B hiddenButtons(Set<ButtonType> hiddenButtons) {
            this.hiddenButtons.clear();
            if (hiddenButtons != null) {
                this.hiddenButtons.addAll(hiddenButtons);
            }
            return self();
        }

        public B button(ButtonType buttonType, ButtonActionInfo info) {
            this.buttonMap.put(buttonType, info);
            return self();
        }

        public B buttonMap(Map<ButtonType, ButtonActionInfo> buttonMap) {
            this.buttonMap.clear();
            if (buttonMap != null) {
                this.buttonMap.putAll(buttonMap);
            }
            return self();
        }
    }
}
