package io.assessmodel.core.execution;

import io.assessmodel.core.exception.NavigationException;
import io.assessmodel.core.node.BranchNode;
import io.assessmodel.core.result.Direction;

/// Listener for assessment run events.
///
/// All methods have default no-op implementations, allowing listeners to override only the
/// events they care about. Callbacks run synchronously on the thread calling the controller.
///
/// ### Callback order for one forward call into a section
/// ```
/// onBranchEntered(section, FORWARD)
/// onStepShown(firstChild, FORWARD)
/// ```
///
/// @see AssessmentController
public interface NavigationListener {

    /// Called after a step becomes the current step.
    ///
    /// @param stepState the step now shown, not null
    /// @param direction direction of travel, not null
    default void onStepShown(StepState stepState, Direction direction) {}

    /// Called after a branch frame is pushed.
    ///
    /// @param branch the branch entered, not null
    /// @param direction direction of travel, not null
    default void onBranchEntered(BranchNode branch, Direction direction) {}

    /// Called after a branch frame is popped.
    ///
    /// @param branch the branch left, not null
    /// @param direction direction of travel, not null
    default void onBranchExited(BranchNode branch, Direction direction) {}

    /// Called when the run status changes.
    ///
    /// @param previous status before the change, not null
    /// @param current status after the change, not null
    default void onStatusChanged(AssessmentStatus previous, AssessmentStatus current) {}

    /// Called when navigation fails and the run moves to {@link AssessmentStatus#ERROR}.
    ///
    /// @param error the cause, not null
    default void onNavigationError(NavigationException error) {}

    /// No-op listener instance that ignores all events.
    NavigationListener NOOP = new NavigationListener() {};
}
