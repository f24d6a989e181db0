package io.assessmodel.core.node;

import io.assessmodel.core.result.AssessmentResult;
import io.assessmodel.core.result.Result;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/// The root node of an assessment definition.
///
/// Carries the metadata copied into every {@link AssessmentResult} and the
/// {@link InterruptionHandling} rules consulted by the controller.
///
/// ### Usage
/// {@snippet :
/// Assessment assessment = Assessment.builder()
///     .id("survey")
///     .versionString("1.0.0")
///     .child(ContentStep.overview("overview"))
///     .child(ContentStep.completion("completion"))
///     .build();
/// }
public final class Assessment extends BranchNode {

    private final String versionString;
    private final Integer estimatedMinutes;
    private final String copyright;
    private final String schemaIdentifier;
    private final InterruptionHandling interruptionHandling;

    private Assessment(Builder builder) {
        super(NodeType.ASSESSMENT, builder);
        this.versionString = builder.versionString;
        this.estimatedMinutes = builder.estimatedMinutes;
        this.copyright = builder.copyright;
        this.schemaIdentifier = builder.schemaIdentifier;
        this.interruptionHandling =
                builder.interruptionHandling != null
                        ? builder.interruptionHandling
                        : InterruptionHandling.defaults();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getVersionString() {
        return versionString;
    }

    public Integer getEstimatedMinutes() {
        return estimatedMinutes;
    }

    public String getCopyright() {
        return copyright;
    }

    public String getSchemaIdentifier() {
        return schemaIdentifier;
    }

    /// @return interruption rules, never null
    public InterruptionHandling getInterruptionHandling() {
        return interruptionHandling;
    }

    /// Creates the top-level result for a new run with a fresh run UUID.
    @Override
    public Result instantiateResult(Instant startDate) {
        return new AssessmentResult(
                id,
                startDate,
                UUID.randomUUID().toString(),
                id,
                schemaIdentifier,
                versionString);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Assessment other)) return false;
        return baseEquals(other)
                && Objects.equals(versionString, other.versionString)
                && Objects.equals(estimatedMinutes, other.estimatedMinutes)
                && Objects.equals(copyright, other.copyright)
                && Objects.equals(schemaIdentifier, other.schemaIdentifier)
                && interruptionHandling.equals(other.interruptionHandling);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseHashCode(), versionString, schemaIdentifier);
    }

    public static final class Builder extends BranchNode.Builder<Builder> {
        private String versionString;
        private Integer estimatedMinutes;
        private String copyright;
        private String schemaIdentifier;
        private InterruptionHandling interruptionHandling;

        private Builder() {}

        @Override
        protected Builder self() {
            return this;
        }

        public Builder versionString(String versionString) {
            this.versionString = versionString;
            return this;
        }

        public Builder estimatedMinutes(Integer estimatedMinutes) {
            this.estimatedMinutes = estimatedMinutes;
            return this;
        }

        public Builder copyright(String copyright) {
            this.copyright = copyright;
            return this;
        }

        public Builder schemaIdentifier(String schemaIdentifier) {
            this.schemaIdentifier = schemaIdentifier;
            return this;
        }

        public Builder interruptionHandling(InterruptionHandling interruptionHandling) {
            this.interruptionHandling = interruptionHandling;
            return this;
        }

        public Assessment build() {
            return new Assessment(this);
        }
    }
}
