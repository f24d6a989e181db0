package io.assessmodel.core.execution;

import io.assessmodel.core.exception.NavigationException;
import io.assessmodel.core.navigation.Progress;
import io.assessmodel.core.node.Assessment;
import io.assessmodel.core.node.InterruptionHandling;
import io.assessmodel.core.result.AssessmentResult;
import io.assessmodel.core.result.Direction;
import java.util.Objects;

/// Observable state of one assessment run.
///
/// Holds the run's result tree, its status and the step currently shown, plus the view
/// state derived on every move: direction of travel, back-button enablement, pause
/// eligibility and progress within the current branch.
///
/// @implNote Not thread-safe. Mutated only by {@link AssessmentController}.
public class AssessmentState {

    private final Assessment assessment;
    private final AssessmentResult assessmentResult;
    private AssessmentStatus status = AssessmentStatus.NOT_STARTED;
    private StepState currentStep;
    private boolean showFullInstructions;
    private boolean hasPartialResults;
    private NavigationException navigationError;
    private Direction currentDirection = Direction.FORWARD;
    private boolean backEnabled;
    private boolean canPause;
    private Progress progress;

    AssessmentState(Assessment assessment, AssessmentResult assessmentResult) {
        this.assessment = Objects.requireNonNull(assessment, "assessment must not be null");
        this.assessmentResult =
                Objects.requireNonNull(assessmentResult, "assessmentResult must not be null");
    }

    public Assessment getAssessment() {
        return assessment;
    }

    /// @return the run's top-level result, never null
    public AssessmentResult getAssessmentResult() {
        return assessmentResult;
    }

    public InterruptionHandling getInterruptionHandling() {
        return assessment.getInterruptionHandling();
    }

    public AssessmentStatus getStatus() {
        return status;
    }

    void setStatus(AssessmentStatus status) {
        this.status = status;
    }

    /// @return the step shown, or null before start and after finishing
    public StepState getCurrentStep() {
        return currentStep;
    }

    void setCurrentStep(StepState currentStep) {
        this.currentStep = currentStep;
    }

    public boolean isShowFullInstructions() {
        return showFullInstructions;
    }

    void setShowFullInstructions(boolean showFullInstructions) {
        this.showFullInstructions = showFullInstructions;
    }

    /// Returns whether the participant has left any step other than an instruction or
    /// overview step.
    public boolean hasPartialResults() {
        return hasPartialResults;
    }

    void setHasPartialResults(boolean hasPartialResults) {
        this.hasPartialResults = hasPartialResults;
    }

    /// @return the error that halted the run, or null
    public NavigationException getNavigationError() {
        return navigationError;
    }

    void setNavigationError(NavigationException navigationError) {
        this.navigationError = navigationError;
    }

    /// @return direction of the last move, {@link Direction#BACKWARD} or
    ///     {@link Direction#FORWARD}
    public Direction getCurrentDirection() {
        return currentDirection;
    }

    void setCurrentDirection(Direction currentDirection) {
        this.currentDirection = currentDirection;
    }

    public boolean isBackEnabled() {
        return backEnabled;
    }

    void setBackEnabled(boolean backEnabled) {
        this.backEnabled = backEnabled;
    }

    public boolean canPause() {
        return canPause;
    }

    void setCanPause(boolean canPause) {
        this.canPause = canPause;
    }

    /// @return progress within the current branch, or null if unknown
    public Progress getProgress() {
        return progress;
    }

    void setProgress(Progress progress) {
        this.progress = progress;
    }
}
