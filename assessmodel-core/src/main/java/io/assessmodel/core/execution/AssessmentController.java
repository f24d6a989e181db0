package io.assessmodel.core.execution;

import io.assessmodel.core.exception.DuplicateIdentifierException;
import io.assessmodel.core.exception.NavigationException;
import io.assessmodel.core.exception.NodeNotFoundException;
import io.assessmodel.core.navigation.NavigationPoint;
import io.assessmodel.core.navigation.NodeNavigator;
import io.assessmodel.core.node.Assessment;
import io.assessmodel.core.node.BranchNode;
import io.assessmodel.core.node.ButtonActionInfo;
import io.assessmodel.core.node.ButtonType;
import io.assessmodel.core.node.ContentStep;
import io.assessmodel.core.node.NavigationIdentifier;
import io.assessmodel.core.node.Node;
import io.assessmodel.core.node.NodeType;
import io.assessmodel.core.result.AssessmentResult;
import io.assessmodel.core.result.BranchNodeResult;
import io.assessmodel.core.result.Direction;
import io.assessmodel.core.result.PathMarker;
import io.assessmodel.core.result.Result;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Drives one run of an assessment.
///
/// Keeps a traversal stack of {@link BranchState} frames, one per navigation level. The top
/// frame navigates the assessment's children; entering a section pushes a frame and
/// exhausting it pops back to the parent, which continues from the section node. Frames nest
/// to any depth.
///
/// ### Forward step
/// 1. Stamp the end date on the current step's result and record it in its branch.
/// 2. Ask the current frame's navigator for the node after it, skipping steps flagged
///    full-instructions-only unless the run shows full instructions.
/// 3. A step becomes current. A section is entered. No node pops the frame, or finishes the
///    run at the top frame.
///
/// Backward steps mirror this with {@link NodeNavigator#nodeBefore}. Going back past the
/// first step of the assessment is a no-op.
///
/// ### Failure
/// A {@link DuplicateIdentifierException} building a navigator, or a
/// {@link NodeNotFoundException} resolving a jump, moves the run to
/// {@link AssessmentStatus#ERROR}. The cause is retained on the state. There are no retries.
///
/// @implNote Not thread-safe. Each call runs to completion before the next is accepted.
///
/// @see NodeNavigator for per-level resolution
/// @see NavigationListener for run events
public class AssessmentController {

    private static final Logger logger = Logger.getLogger(AssessmentController.class.getName());

    private final AssessmentConfig config;
    private final NavigationListener listener;
    private final AssessmentState state;
    private final Deque<BranchState> frames = new ArrayDeque<>();

    /// Creates a controller for a new run with default configuration.
    ///
    /// @param assessment the assessment definition, not null
    public AssessmentController(Assessment assessment) {
        this(assessment, new AssessmentConfig(), null, NavigationListener.NOOP);
    }

    /// Creates a controller.
    ///
    /// @param assessment the assessment definition, not null
    /// @param config run options, not null
    /// @param restoredResult persisted result to resume, or null for a new run
    /// @param listener event listener, not null. Use {@link NavigationListener#NOOP} if none.
    public AssessmentController(
            Assessment assessment,
            AssessmentConfig config,
            AssessmentResult restoredResult,
            NavigationListener listener) {
        Objects.requireNonNull(assessment, "assessment must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
        AssessmentResult result =
                restoredResult != null
                        ? restoredResult
                        : (AssessmentResult) assessment.instantiateResult(now());
        this.state = new AssessmentState(assessment, result);
        this.state.setShowFullInstructions(config.isShowFullInstructions());
    }

    /// @return the observable run state, never null
    public AssessmentState getState() {
        return state;
    }

    /// Returns the innermost traversal frame.
    ///
    /// @return the current frame, or null before {@link #initialize()}
    public BranchState getCurrentBranchState() {
        return frames.peek();
    }

    /// Starts the run and shows the first step.
    ///
    /// A restored result resumes at the node named by its last path marker.
    public void initialize() {
        if (state.getStatus() != AssessmentStatus.NOT_STARTED) {
            logger.warning("Assessment already initialized: " + state.getAssessment().getId());
            return;
        }
        Assessment assessment = state.getAssessment();
        try {
            frames.push(
                    new BranchState(
                            assessment, new NodeNavigator(assessment), state.getAssessmentResult()));
        } catch (DuplicateIdentifierException e) {
            fail(e);
            return;
        }
        logger.info(
                "Starting assessment '"
                        + assessment.getId()
                        + "' run "
                        + state.getAssessmentResult().getRunUUID());
        setStatus(AssessmentStatus.RUNNING);
        goForward();
    }

    /// Leaves the current step forward.
    public void goForward() {
        if (!acceptsNavigation(Direction.FORWARD)) {
            return;
        }
        StepState current = state.getCurrentStep();
        if (current != null) {
            current.result().setEndDate(now());
            currentBranch().result().updateStepHistory(current.result());
            NodeType type = current.step().getNodeType();
            if (type != NodeType.INSTRUCTION && type != NodeType.OVERVIEW) {
                state.setHasPartialResults(true);
            }
        }
        try {
            goForward(current != null ? current.step() : null);
        } catch (NavigationException e) {
            fail(e);
        }
    }

    /// Leaves the current step backward.
    ///
    /// Does nothing when no earlier step is reachable.
    public void goBack() {
        if (!acceptsNavigation(Direction.BACKWARD)) {
            return;
        }
        StepState current = state.getCurrentStep();
        if (current != null) {
            currentBranch().result().updateStepHistory(current.result());
            if (!canGoBack(current.step())) {
                logger.fine(() -> "No earlier step before '" + current.step().getId() + "'");
                return;
            }
        }
        try {
            goBack(current != null ? current.step() : null);
        } catch (NavigationException e) {
            fail(e);
        }
    }

    /// Pauses the run if the current step allows it.
    ///
    /// @return true if the run is now paused
    public boolean pause() {
        if (state.getStatus() != AssessmentStatus.RUNNING || !state.canPause()) {
            return false;
        }
        setStatus(AssessmentStatus.PAUSED);
        return true;
    }

    /// Resumes a paused run.
    public void resume() {
        if (state.getStatus() == AssessmentStatus.PAUSED) {
            setStatus(AssessmentStatus.RUNNING);
        }
    }

    /// Jumps back to the assessment's review step and shows full instructions from there on.
    ///
    /// The review target is {@link io.assessmodel.core.node.InterruptionHandling#reviewIdentifier()}:
    /// `beginning` is the first node of the assessment, a node identifier is looked up in the
    /// current branch. Does nothing when there is no target or it is not a step.
    public void reviewInstructions() {
        AssessmentStatus status = state.getStatus();
        if (!status.acceptsNavigation() && status != AssessmentStatus.PAUSED) {
            return;
        }
        NavigationIdentifier reviewId = state.getInterruptionHandling().reviewIdentifier();
        Node node = null;
        if (reviewId instanceof NavigationIdentifier.Reserved reserved) {
            if (reserved.key() == NavigationIdentifier.ReservedKey.BEGINNING) {
                node = frames.getLast().navigator().firstNode();
                if (node != null && !(node instanceof BranchNode)) {
                    while (frames.size() > 1) {
                        popFrame(Direction.BACKWARD);
                    }
                }
            }
        } else if (reviewId instanceof NavigationIdentifier.NodeTarget target) {
            node = currentBranch().navigator().node(target.identifier());
        }
        if (node == null || node instanceof BranchNode) {
            logger.fine("No review step for assessment: " + state.getAssessment().getId());
            return;
        }
        state.setShowFullInstructions(true);
        setStatus(AssessmentStatus.RUNNING);
        moveTo(new NavigationPoint(node, Direction.BACKWARD), stepState(node));
    }

    /// Marks the run as declined by the participant.
    public void skipAssessment() {
        setStatus(AssessmentStatus.DECLINED);
    }

    /// Marks the run to be continued later from its saved result.
    public void exitAssessment() {
        setStatus(AssessmentStatus.CONTINUE_LATER);
    }

    /// Returns whether a button is hidden on a step.
    ///
    /// The assessment is consulted first, then each enclosing section, then the step.
    ///
    /// @param buttonType the button, not null
    /// @param step the step the button is shown on, not null
    /// @return true if any owner hides the button
    public boolean isButtonHidden(ButtonType buttonType, Node step) {
        Assessment assessment = state.getAssessment();
        if (Boolean.TRUE.equals(assessment.shouldHideButton(buttonType, step.getId()))) {
            return true;
        }
        Iterator<BranchState> outerFirst = frames.descendingIterator();
        while (outerFirst.hasNext()) {
            BranchNode branch = outerFirst.next().node();
            if (branch != assessment
                    && Boolean.TRUE.equals(branch.shouldHideButton(buttonType, step.getId()))) {
                return true;
            }
        }
        return Boolean.TRUE.equals(step.shouldHideButton(buttonType, step.getId()));
    }

    /// Returns the label override for a button on a step.
    ///
    /// The step is consulted first, then each enclosing section, then the assessment.
    ///
    /// @param buttonType the button, not null
    /// @param step the step the button is shown on, not null
    /// @return the override, or null to use the default label
    public ButtonActionInfo buttonInfo(ButtonType buttonType, Node step) {
        ButtonActionInfo info = step.button(buttonType, step.getId());
        for (BranchState frame : frames) {
            if (info != null) {
                return info;
            }
            info = frame.node().button(buttonType, step.getId());
        }
        return info != null ? info : state.getAssessment().button(buttonType, step.getId());
    }

    private void goForward(Node previousNode) throws NavigationException {
        BranchState branch = currentBranch();
        NavigationPoint next = nodeAfter(branch, previousNode);
        Node node = next.node();
        if (node == null) {
            if (next.direction() == Direction.EXIT && previousNode != null) {
                branch.result().appendPathMarker(new PathMarker(previousNode.getId(), Direction.EXIT));
            }
            moveToNextSection();
            return;
        }
        if (node instanceof BranchNode branchNode) {
            moveInto(branchState(branchNode), Direction.FORWARD);
            return;
        }

        StepState stepState = stepState(node);
        if (frames.size() == 1 && branch.navigator().isCompleted(node, branch.result())) {
            state.getAssessmentResult().setEndDate(now());
            setStatus(AssessmentStatus.READY_TO_SAVE);
        } else {
            setStatus(AssessmentStatus.RUNNING);
        }
        moveTo(next, stepState);
    }

    private NavigationPoint nodeAfter(BranchState branch, Node previousNode)
            throws NodeNotFoundException {
        NavigationPoint next = branch.navigator().nodeAfter(previousNode, branch.result());
        while (!state.isShowFullInstructions()
                && next.node() instanceof ContentStep step
                && step.isFullInstructionsOnly()) {
            logger.fine(() -> "Skipping full-instructions step '" + step.getId() + "'");
            next = branch.navigator().nodeAfter(step, branch.result());
        }
        return next;
    }

    private void moveToNextSection() throws NavigationException {
        BranchState branch = currentBranch();
        branch.result().setEndDate(now());
        if (frames.size() == 1) {
            markAsFinished();
            return;
        }
        popFrame(Direction.FORWARD);
        goForward(branch.node());
    }

    private void markAsFinished() {
        state.setCurrentStep(null);
        setStatus(AssessmentStatus.FINISHED);
        logger.info("Finished assessment '" + state.getAssessment().getId() + "'");
    }

    private void goBack(Node previousNode) throws NavigationException {
        BranchState branch = currentBranch();
        NavigationPoint previous = branch.navigator().nodeBefore(previousNode, branch.result());
        Node node = previous.node();
        if (node == null) {
            moveToPreviousSection();
            return;
        }
        if (node instanceof BranchNode branchNode) {
            moveInto(branchState(branchNode), Direction.BACKWARD);
            return;
        }
        setStatus(AssessmentStatus.RUNNING);
        moveTo(previous, stepState(node));
    }

    private void moveToPreviousSection() throws NavigationException {
        if (frames.size() == 1) {
            return;
        }
        BranchState branch = popFrame(Direction.BACKWARD);
        goBack(branch.node());
    }

    private void moveInto(BranchState branch, Direction direction) throws NavigationException {
        currentBranch().result().appendStepHistory(branch.result(), direction);
        frames.push(branch);
        listener.onBranchEntered(branch.node(), direction);
        if (direction == Direction.BACKWARD) {
            goBack(null);
        } else {
            goForward(null);
        }
    }

    private BranchState popFrame(Direction direction) {
        BranchState branch = frames.pop();
        if (branch.result().getEndDate() == null) {
            branch.result().setEndDate(now());
        }
        currentBranch().result().updateStepHistory(branch.result());
        listener.onBranchExited(branch.node(), direction);
        return branch;
    }

    private void moveTo(NavigationPoint point, StepState stepState) {
        StepState leaving = state.getCurrentStep();
        if (leaving != null && leaving.result().getEndDate() == null) {
            leaving.result().setEndDate(now());
        }

        BranchState branch = currentBranch();
        Direction direction =
                point.direction() == Direction.BACKWARD ? Direction.BACKWARD : Direction.FORWARD;
        branch.result().appendStepHistory(stepState.result(), direction);

        Node step = stepState.step();
        state.setCurrentStep(stepState);
        state.setCurrentDirection(direction);
        state.setCanPause(canPauseAssessment(step));
        state.setBackEnabled(canGoBack(step));
        state.setProgress(branch.navigator().progress(step, branch.result()));
        listener.onStepShown(stepState, direction);
    }

    private BranchState branchState(BranchNode node) throws DuplicateIdentifierException {
        NodeNavigator navigator = new NodeNavigator(node);
        return new BranchState(node, navigator, (BranchNodeResult) resultFor(node));
    }

    private StepState stepState(Node node) {
        return new StepState(node, resultFor(node), currentBranch().identifier());
    }

    /// Copies the result recorded on an earlier visit, or creates a fresh one.
    private Result resultFor(Node node) {
        Instant now = now();
        Result fresh = node.instantiateResult(now);
        Result existing = currentBranch().result().findResult(node.getId());
        if (existing == null || existing.getResultType() != fresh.getResultType()) {
            return fresh;
        }
        Result copy = existing.deepCopy();
        copy.setStartDate(now);
        copy.setEndDate(null);
        return copy;
    }

    private boolean canGoBack(Node step) {
        if (isButtonHidden(ButtonType.GO_BACKWARD, step)) {
            return false;
        }
        Node node = step;
        Iterator<BranchState> innerFirst = frames.iterator();
        while (innerFirst.hasNext()) {
            BranchState frame = innerFirst.next();
            if (frame.navigator().allowBackNavigation(node, frame.result())) {
                return true;
            }
            if (!isFirstNode(frame, node)) {
                return false;
            }
            node = frame.node();
        }
        return false;
    }

    private boolean canPauseAssessment(Node step) {
        if (!state.getInterruptionHandling().canPause() || isButtonHidden(ButtonType.PAUSE, step)) {
            return false;
        }
        Node node = step;
        Iterator<BranchState> innerFirst = frames.iterator();
        while (innerFirst.hasNext()) {
            BranchState frame = innerFirst.next();
            if (frame.navigator().canPauseAssessment(node, frame.result())) {
                return true;
            }
            if (!isFirstNode(frame, node)) {
                return false;
            }
            node = frame.node();
        }
        return false;
    }

    private static boolean isFirstNode(BranchState frame, Node node) {
        Node first = frame.navigator().firstNode();
        return first != null && first.getId().equals(node.getId());
    }

    private boolean acceptsNavigation(Direction direction) {
        if (frames.isEmpty() || !state.getStatus().acceptsNavigation()) {
            logger.fine(
                    () ->
                            "Ignoring "
                                    + direction.getJsonName()
                                    + " navigation in status "
                                    + state.getStatus());
            return false;
        }
        return true;
    }

    private BranchState currentBranch() {
        return frames.getFirst();
    }

    private void fail(NavigationException error) {
        logger.log(
                Level.SEVERE,
                "Navigation failed for assessment '" + state.getAssessment().getId() + "'",
                error);
        state.setNavigationError(error);
        setStatus(AssessmentStatus.ERROR);
        listener.onNavigationError(error);
    }

    private void setStatus(AssessmentStatus status) {
        AssessmentStatus previous = state.getStatus();
        if (previous == status) {
            return;
        }
        state.setStatus(status);
        listener.onStatusChanged(previous, status);
    }

    private Instant now() {
        return Instant.now(config.getClock());
    }
}
