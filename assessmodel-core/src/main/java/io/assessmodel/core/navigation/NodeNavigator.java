package io.assessmodel.core.navigation;

import io.assessmodel.core.exception.DuplicateIdentifierException;
import io.assessmodel.core.exception.NodeNotFoundException;
import io.assessmodel.core.node.BranchNode;
import io.assessmodel.core.node.ButtonType;
import io.assessmodel.core.node.NavigationIdentifier;
import io.assessmodel.core.node.Node;
import io.assessmodel.core.node.NodeType;
import io.assessmodel.core.node.QuestionStep;
import io.assessmodel.core.result.BranchNodeResult;
import io.assessmodel.core.result.Direction;
import io.assessmodel.core.result.PathMarker;
import io.assessmodel.core.result.Result;
import io.assessmodel.core.rule.SurveyRuleEvaluator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/// Computes the next and previous node within one navigation level.
///
/// A navigator is built once per node list (the children of an assessment or section) and
/// holds no per-run state. Every query takes the branch's {@link BranchNodeResult}, which
/// carries the recorded answers and the traversal log.
///
/// ### Forward resolution
/// 1. Question steps evaluate their survey rules against the recorded answer. The first
///    matching rule wins.
/// 2. Otherwise the node's direct `nextNode` pointer is used.
/// 3. Otherwise the next node in list order, or none at the end of the list.
///
/// Jumps are always reported as {@link Direction#FORWARD}, even to an earlier node. An `exit`
/// jump is reported as {@link Direction#EXIT} with no node.
///
/// ### Backward resolution
/// Uses the `path` log so that loops do not oscillate. See
/// {@link #previousNode(Node, BranchNodeResult)}.
///
/// ### Peeking
/// {@link #hasNodeAfter(Node, BranchNodeResult)} does not evaluate question rules, so button
/// state does not depend on an answer that has not been committed. It can under-report
/// when a late rule shortens the path.
///
/// @implNote Thread-safe. Instances are immutable.
public class NodeNavigator {

    private static final Logger logger = Logger.getLogger(NodeNavigator.class.getName());

    private final String identifier;
    private final List<Node> nodes;
    private final Map<String, Integer> indexById;

    /// Creates a navigator over the children of a branch.
    ///
    /// @param branch the branch node, not null
    /// @throws DuplicateIdentifierException if two children share an identifier
    public NodeNavigator(BranchNode branch) throws DuplicateIdentifierException {
        this(branch.getId(), branch.getChildren());
    }

    /// Creates a navigator over a node list.
    ///
    /// @param identifier identifier of the owning branch, used in error messages, not null
    /// @param nodes nodes in navigation order, not null
    /// @throws DuplicateIdentifierException if two nodes share an identifier
    public NodeNavigator(String identifier, List<Node> nodes) throws DuplicateIdentifierException {
        this.identifier = identifier;
        this.nodes = List.copyOf(nodes);
        this.indexById = new HashMap<>();
        Set<String> duplicates = new TreeSet<>();
        for (int i = 0; i < this.nodes.size(); i++) {
            String id = this.nodes.get(i).getId();
            if (indexById.putIfAbsent(id, i) != null) {
                duplicates.add(id);
            }
        }
        if (!duplicates.isEmpty()) {
            throw new DuplicateIdentifierException(identifier, duplicates);
        }
    }

    public String getIdentifier() {
        return identifier;
    }

    /// @return nodes in navigation order, never null
    public List<Node> getNodes() {
        return nodes;
    }

    /// Looks up a node by identifier.
    ///
    /// @param identifier node identifier, may be null
    /// @return the node, or null if not in this list
    public Node node(String identifier) {
        Integer idx = identifier != null ? indexById.get(identifier) : null;
        return idx != null ? nodes.get(idx) : null;
    }

    /// @return first node in the list, or null if the list is empty
    public Node firstNode() {
        return nodes.isEmpty() ? null : nodes.get(0);
    }

    /// Returns the node to show after the current one.
    ///
    /// When `currentNode` is null or not in this list, resumes at the node named by the last
    /// path marker, or starts at the first node.
    ///
    /// @param currentNode node being left, may be null
    /// @param branchResult result of this branch, not null
    /// @return the next navigation point, never null
    /// @throws NodeNotFoundException if a rule or pointer names a node not in this list
    public NavigationPoint nodeAfter(Node currentNode, BranchNodeResult branchResult)
            throws NodeNotFoundException {
        Integer idx = nodeIndex(currentNode);
        if (idx == null) {
            NavigationPoint restored = restoreNode(branchResult);
            return restored != null
                    ? restored
                    : new NavigationPoint(firstNode(), Direction.FORWARD);
        }

        NavigationIdentifier navId = nextNodeIdentifier(currentNode, branchResult, false);
        if (navId instanceof NavigationIdentifier.Reserved reserved) {
            return reserved.key() == NavigationIdentifier.ReservedKey.EXIT
                    ? new NavigationPoint(null, Direction.EXIT)
                    : new NavigationPoint(firstNode(), Direction.FORWARD);
        }
        if (navId instanceof NavigationIdentifier.NodeTarget target) {
            Node node = node(target.identifier());
            if (node == null) {
                throw new NodeNotFoundException(identifier, target.identifier());
            }
            logger.fine(() -> "Jump from '" + currentNode.getId() + "' to '" + node.getId() + "'");
            return new NavigationPoint(node, Direction.FORWARD);
        }
        if (idx + 1 >= nodes.size()) {
            return new NavigationPoint(null, Direction.FORWARD);
        }
        return new NavigationPoint(nodes.get(idx + 1), Direction.FORWARD);
    }

    /// Returns the node to show when going back from the current one.
    ///
    /// @param currentNode node being left, may be null
    /// @param branchResult result of this branch, not null
    /// @return navigation point with {@link Direction#BACKWARD}, never null
    public NavigationPoint nodeBefore(Node currentNode, BranchNodeResult branchResult) {
        return new NavigationPoint(previousNode(currentNode, branchResult), Direction.BACKWARD);
    }

    /// Returns whether a node follows the current one, without evaluating question rules.
    ///
    /// Never mutates the branch result.
    ///
    /// @param currentNode the current node, not null
    /// @param branchResult result of this branch, not null
    /// @return true if a following node exists in this list
    public boolean hasNodeAfter(Node currentNode, BranchNodeResult branchResult) {
        NavigationIdentifier navId = nextNodeIdentifier(currentNode, branchResult, true);
        if (navId instanceof NavigationIdentifier.Reserved) {
            return false;
        }
        if (navId instanceof NavigationIdentifier.NodeTarget target) {
            return indexById.containsKey(target.identifier());
        }
        Integer idx = nodeIndex(currentNode);
        return idx != null && idx + 1 < nodes.size();
    }

    /// Returns whether the back button is available on the current node.
    public boolean allowBackNavigation(Node currentNode, BranchNodeResult branchResult) {
        return !Boolean.TRUE.equals(
                        currentNode.shouldHideButton(ButtonType.GO_BACKWARD, currentNode.getId()))
                && previousNode(currentNode, branchResult) != null;
    }

    /// Returns whether the run may be paused on the current node.
    public boolean canPauseAssessment(Node currentNode, BranchNodeResult branchResult) {
        Integer idx = nodeIndex(currentNode);
        return idx != null && idx > 0 && !isCompleted(currentNode, branchResult);
    }

    /// Returns the position of the current node.
    ///
    /// @return progress marked as estimated, or null if the node is not in this list
    public Progress progress(Node currentNode, BranchNodeResult branchResult) {
        Integer idx = nodeIndex(currentNode);
        return idx != null ? new Progress(idx, nodes.size(), true) : null;
    }

    /// Returns whether the current node is a completion step the participant cannot leave
    /// backward.
    public boolean isCompleted(Node currentNode, BranchNodeResult branchResult) {
        return !allowBackNavigation(currentNode, branchResult)
                && currentNode.getNodeType() == NodeType.COMPLETION;
    }

    /// Returns the node shown before the current one.
    ///
    /// - A null current node resolves to the last entry of `pathHistory`.
    /// - A result without path markers falls back to list order.
    /// - Otherwise the marker preceding the last forward visit of the current node names the
    ///   previous node. If that node sits after the current node in list order the path
    ///   looped, and the marker preceding the first forward visit is used instead.
    ///
    /// @param currentNode the current node, may be null
    /// @param branchResult result of this branch, not null
    /// @return the previous node, or null if there is none
    public Node previousNode(Node currentNode, BranchNodeResult branchResult) {
        Integer currentIdx = nodeIndex(currentNode);
        if (currentIdx == null) {
            List<Result> history = branchResult.getPathHistory();
            return history.isEmpty() ? null : node(history.get(history.size() - 1).getIdentifier());
        }

        List<PathMarker> path = branchResult.getPath();
        if (path.isEmpty()) {
            return currentIdx > 0 ? nodes.get(currentIdx - 1) : null;
        }

        Integer previousIdx = findIndexBefore(currentNode, path, true);
        if (previousIdx == null) {
            return null;
        }
        if (previousIdx < currentIdx) {
            return nodes.get(previousIdx);
        }

        Integer originalIdx = findIndexBefore(currentNode, path, false);
        return originalIdx != null ? nodes.get(originalIdx) : null;
    }

    private Integer findIndexBefore(Node currentNode, List<PathMarker> path, boolean findLast) {
        int index = -1;
        for (int i = 0; i < path.size(); i++) {
            PathMarker marker = path.get(i);
            if (marker.identifier().equals(currentNode.getId())
                    && marker.direction() == Direction.FORWARD) {
                index = i;
                if (!findLast) {
                    break;
                }
            }
        }
        if (index <= 0) {
            return null;
        }
        return indexById.get(path.get(index - 1).identifier());
    }

    private NavigationIdentifier nextNodeIdentifier(
            Node currentNode, BranchNodeResult branchResult, boolean isPeeking) {
        return switch (currentNode.getNodeType()) {
            case SIMPLE_QUESTION, CHOICE_QUESTION -> {
                if (isPeeking) {
                    yield null;
                }
                QuestionStep question = (QuestionStep) currentNode;
                NavigationIdentifier matched =
                        SurveyRuleEvaluator.evaluate(
                                question.getSurveyRules(),
                                branchResult.findAnswer(question.getId()));
                yield matched != null ? matched : question.getNextNode();
            }
            default -> currentNode.getNextNode();
        };
    }

    private NavigationPoint restoreNode(BranchNodeResult branchResult) {
        PathMarker marker = branchResult.lastPathMarker();
        Node node = marker != null ? node(marker.identifier()) : null;
        return node != null ? new NavigationPoint(node, Direction.FORWARD) : null;
    }

    private Integer nodeIndex(Node node) {
        return node != null ? indexById.get(node.getId()) : null;
    }
}
