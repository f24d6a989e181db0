package io.assessmodel.core.node;

import io.assessmodel.core.result.BasicResult;
import io.assessmodel.core.result.Result;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// A step that shows content without collecting an answer.
///
/// Covers instruction, overview, completion and countdown steps. Instruction and countdown
/// steps may be flagged `fullInstructionsOnly`, in which case the controller skips them unless
/// the run has opted into full instructions.
///
/// ### Contracts
/// - **Countdown**: `duration` is required and positive
/// - **Full instructions**: only instruction and countdown steps may set the flag
///
/// @see io.assessmodel.core.execution.AssessmentConfig#isShowFullInstructions()
public final class ContentStep extends Node {

    /// Keys of {@link #getSpokenInstructions()}.
    public static final String SPOKEN_START = "start";

    public static final String SPOKEN_END = "end";

    private static final Set<NodeType> CONTENT_TYPES =
            EnumSet.of(
                    NodeType.INSTRUCTION,
                    NodeType.OVERVIEW,
                    NodeType.COMPLETION,
                    NodeType.COUNTDOWN);

    private final boolean fullInstructionsOnly;
    private final Map<String, String> spokenInstructions;
    private final Integer duration;

    private ContentStep(NodeType nodeType, Builder builder) {
        super(nodeType, builder);
        if (builder.fullInstructionsOnly
                && nodeType != NodeType.INSTRUCTION
                && nodeType != NodeType.COUNTDOWN) {
            throw new IllegalStateException(
                    "fullInstructionsOnly is not supported by " + nodeType.getJsonName() + " steps");
        }
        if (nodeType == NodeType.COUNTDOWN) {
            Objects.requireNonNull(builder.duration, "Countdown duration required");
            if (builder.duration <= 0) {
                throw new IllegalStateException("Countdown duration must be positive");
            }
        }
        this.fullInstructionsOnly = builder.fullInstructionsOnly;
        this.spokenInstructions = Map.copyOf(builder.spokenInstructions);
        this.duration = builder.duration;
    }

    /// Creates a builder for a content step of the given kind.
    ///
    /// @param nodeType one of instruction, overview, completion or countdown, not null
    /// @return new builder, never null
    /// @throws IllegalArgumentException if the type is not a content type
    public static Builder builder(NodeType nodeType) {
        if (!CONTENT_TYPES.contains(nodeType)) {
            throw new IllegalArgumentException("Not a content step type: " + nodeType);
        }
        return new Builder(nodeType);
    }

    public static ContentStep instruction(String id) {
        return builder(NodeType.INSTRUCTION).id(id).build();
    }

    public static ContentStep overview(String id) {
        return builder(NodeType.OVERVIEW).id(id).build();
    }

    public static ContentStep completion(String id) {
        return builder(NodeType.COMPLETION).id(id).build();
    }

    public boolean isFullInstructionsOnly() {
        return fullInstructionsOnly;
    }

    /// @return spoken text keyed by {@link #SPOKEN_START} / {@link #SPOKEN_END}, never null
    public Map<String, String> getSpokenInstructions() {
        return spokenInstructions;
    }

    /// @return countdown length in seconds, null for non-countdown steps
    public Integer getDuration() {
        return duration;
    }

    @Override
    public Result instantiateResult(Instant startDate) {
        return new BasicResult(id, startDate);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ContentStep other)) return false;
        return baseEquals(other)
                && fullInstructionsOnly == other.fullInstructionsOnly
                && spokenInstructions.equals(other.spokenInstructions)
                && Objects.equals(duration, other.duration);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseHashCode(), fullInstructionsOnly, duration);
    }

    public static final class Builder extends Node.Builder<Builder> {
        private final NodeType nodeType;
        private boolean fullInstructionsOnly;
        private final Map<String, String> spokenInstructions = new LinkedHashMap<>();
        private Integer duration;

        private Builder(NodeType nodeType) {
            this.nodeType = nodeType;
        }

        @Override
        protected Builder self() {
            return this;
        }

        public Builder fullInstructionsOnly(boolean fullInstructionsOnly) {
            this.fullInstructionsOnly = fullInstructionsOnly;
            return this;
        }

        public Builder spokenInstruction(String key, String text) {
            this.spokenInstructions.put(key, text);
            return this;
        }

        public Builder spokenInstructions(Map<String, String> spokenInstructions) {
            this.spokenInstructions.clear();
            if (spokenInstructions != null) {
                this.spokenInstructions.putAll(spokenInstructions);
            }
            return this;
        }

        public Builder duration(Integer duration) {
            this.duration = duration;
            return this;
        }

        public ContentStep build() {
            return new ContentStep(nodeType, this);
        }
    }
}
