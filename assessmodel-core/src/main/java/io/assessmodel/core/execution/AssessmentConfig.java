package io.assessmodel.core.execution;

import java.time.Clock;
import java.util.Objects;

/// Options for one assessment run.
///
/// ### Default Values
/// - `showFullInstructions`: `false` (steps flagged full-instructions-only are skipped)
/// - `clock`: `Clock.systemUTC()`
///
/// @implNote **Not thread-safe**. Configure before passing to {@link AssessmentController}.
public class AssessmentConfig {
    private boolean showFullInstructions = false;
    private Clock clock = Clock.systemUTC();

    /// Creates a configuration with default values.
    public AssessmentConfig() {}

    /// Returns whether steps flagged full-instructions-only are shown.
    ///
    /// @return `true` to show them, `false` to skip them
    public boolean isShowFullInstructions() {
        return showFullInstructions;
    }

    public void setShowFullInstructions(boolean showFullInstructions) {
        this.showFullInstructions = showFullInstructions;
    }

    /// Returns the clock every result timestamp is read from.
    ///
    /// @return the clock, never null
    public Clock getClock() {
        return clock;
    }

    public void setClock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link AssessmentConfig}.
    public static class Builder {
        private final AssessmentConfig config = new AssessmentConfig();

        public Builder showFullInstructions(boolean showFullInstructions) {
            config.showFullInstructions = showFullInstructions;
            return this;
        }

        /// Sets the timestamp source.
        ///
        /// @param clock the clock, not null
        /// @return this builder for chaining, never null
        public Builder clock(Clock clock) {
            config.setClock(clock);
            return this;
        }

        public AssessmentConfig build() {
            return config;
        }
    }
}
