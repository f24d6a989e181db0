package io.assessmodel.core.execution;

import io.assessmodel.core.node.BranchNode;
import io.assessmodel.core.result.Direction;
import java.util.logging.Logger;

/// Reports run events through `java.util.logging`.
///
/// Steps and branch changes are logged at `FINE`, status changes at `INFO`. Navigation
/// errors are logged by the controller itself.
public class LoggingNavigationListener implements NavigationListener {

    private static final Logger logger =
            Logger.getLogger(LoggingNavigationListener.class.getName());

    @Override
    public void onStepShown(StepState stepState, Direction direction) {
        logger.fine(
                () ->
                        "Showing step '"
                                + stepState.step().getId()
                                + "' in '"
                                + stepState.parentIdentifier()
                                + "' ("
                                + direction.getJsonName()
                                + ")");
    }

    @Override
    public void onBranchEntered(BranchNode branch, Direction direction) {
        logger.fine(() -> "Entered branch '" + branch.getId() + "' (" + direction.getJsonName() + ")");
    }

    @Override
    public void onBranchExited(BranchNode branch, Direction direction) {
        logger.fine(() -> "Left branch '" + branch.getId() + "' (" + direction.getJsonName() + ")");
    }

    @Override
    public void onStatusChanged(AssessmentStatus previous, AssessmentStatus current) {
        logger.info("Assessment status: " + previous + " -> " + current);
    }
}
