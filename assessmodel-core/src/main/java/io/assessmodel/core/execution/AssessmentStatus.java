package io.assessmodel.core.execution;

/// Lifecycle status of one assessment run.
public enum AssessmentStatus {
    NOT_STARTED,
    RUNNING,
    PAUSED,
    /// The participant declined to take the assessment.
    DECLINED,
    /// The participant left and may continue later from the saved result.
    CONTINUE_LATER,
    /// A final completion step is shown and the result can be saved.
    READY_TO_SAVE,
    FINISHED,
    /// Navigation failed. The cause is retained on the state.
    ERROR;

    /// Returns whether forward and backward navigation is accepted in this status.
    public boolean acceptsNavigation() {
        return this == RUNNING || this == READY_TO_SAVE;
    }
}
