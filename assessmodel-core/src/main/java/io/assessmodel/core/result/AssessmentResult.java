package io.assessmodel.core.result;

import java.time.Instant;
import java.util.Objects;

/// Top-level result of one assessment run.
///
/// Created once per run, or rehydrated wholesale from persisted JSON by the caller.
public final class AssessmentResult extends BranchNodeResult {

    private final String runUUID;
    private final String assessmentIdentifier;
    private final String schemaIdentifier;
    private final String versionString;

    /// @param identifier identifier of the assessment node, not null
    /// @param startDate when the run started, not null
    /// @param runUUID identifier of this run, not null
    /// @param assessmentIdentifier assessment identifier, may be null
    /// @param schemaIdentifier schema identifier, may be null
    /// @param versionString assessment version, may be null
    public AssessmentResult(
            String identifier,
            Instant startDate,
            String runUUID,
            String assessmentIdentifier,
            String schemaIdentifier,
            String versionString) {
        super(identifier, startDate);
        this.runUUID = Objects.requireNonNull(runUUID, "runUUID required");
        this.assessmentIdentifier = assessmentIdentifier;
        this.schemaIdentifier = schemaIdentifier;
        this.versionString = versionString;
    }

    @Override
    public ResultType getResultType() {
        return ResultType.ASSESSMENT;
    }

    public String getRunUUID() {
        return runUUID;
    }

    public String getAssessmentIdentifier() {
        return assessmentIdentifier;
    }

    public String getSchemaIdentifier() {
        return schemaIdentifier;
    }

    public String getVersionString() {
        return versionString;
    }

    @Override
    public AssessmentResult deepCopy() {
        AssessmentResult copy =
                new AssessmentResult(
                        getIdentifier(),
                        getStartDate(),
                        runUUID,
                        assessmentIdentifier,
                        schemaIdentifier,
                        versionString);
        copyInto(copy);
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AssessmentResult other)) return false;
        return branchEquals(other)
                && runUUID.equals(other.runUUID)
                && Objects.equals(assessmentIdentifier, other.assessmentIdentifier)
                && Objects.equals(schemaIdentifier, other.schemaIdentifier)
                && Objects.equals(versionString, other.versionString);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), runUUID);
    }
}
