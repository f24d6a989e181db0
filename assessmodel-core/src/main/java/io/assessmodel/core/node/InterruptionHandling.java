package io.assessmodel.core.node;

/// Assessment-level rules for pausing, skipping and reviewing.
///
/// @param canPause whether the pause action is offered at all
/// @param canSaveForLater whether an interrupted run may be continued later
/// @param canSkip whether the participant may decline the assessment
/// @param canResume whether a paused run may be resumed
/// @param reviewIdentifier step shown by "review instructions", may be null
public record InterruptionHandling(
        boolean canPause,
        boolean canSaveForLater,
        boolean canSkip,
        boolean canResume,
        NavigationIdentifier reviewIdentifier) {

    /// Everything allowed, no review target.
    public static InterruptionHandling defaults() {
        return new InterruptionHandling(true, true, true, true, null);
    }
}
