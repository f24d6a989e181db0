package io.assessmodel.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.assessmodel.core.result.AnswerResult;
import io.assessmodel.core.result.AssessmentResult;
import io.assessmodel.core.result.BranchNodeResult;
import io.assessmodel.core.result.PathMarker;
import io.assessmodel.core.result.Result;
import java.io.IOException;
import java.io.Serial;

/// Serializes `Result` subtypes to JSON with a `"type"` discriminator field.
///
/// Dates are written through the registered `java.time` support as ISO-8601 strings.
///
/// ```
/// Type        Additional fields
/// ------------+--------------------------------------------------------------
/// base        │ (none)
/// answer      │ answerType, value, questionText
/// section     │ stepHistory, asyncResults, path
/// assessment  │ stepHistory, asyncResults, path, taskRunUUID,
///             │ assessmentIdentifier, schemaIdentifier, versionString
/// ```
///
/// @implNote Package-private. Registered by {@link AssessmentJacksonModule}.
/// @see ResultDeserializer for the inverse operation
class ResultSerializer extends StdSerializer<Result> {

    @Serial private static final long serialVersionUID = -7810227367035312530L;

    ResultSerializer() {
        super(Result.class);
    }

    @Override
    public void serialize(Result result, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("identifier", result.getIdentifier());
        gen.writeStringField("type", result.getResultType().getJsonName());
        provider.defaultSerializeField("startDate", result.getStartDate(), gen);
        if (result.getEndDate() != null) {
            provider.defaultSerializeField("endDate", result.getEndDate(), gen);
        }

        if (result instanceof AnswerResult answer) {
            if (answer.getAnswerType() != null) {
                provider.defaultSerializeField("answerType", answer.getAnswerType(), gen);
            }
            if (answer.getJsonValue() != null) {
                JsonValues.writeValue(gen, provider, "value", answer.getJsonValue());
            }
            JsonValues.writeIfNotNull(gen, "questionText", answer.getQuestionText());
        } else if (result instanceof BranchNodeResult branch) {
            writeBranch(branch, gen, provider);
        }

        gen.writeEndObject();
    }

    private void writeBranch(BranchNodeResult branch, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        provider.defaultSerializeField("stepHistory", branch.getPathHistory(), gen);
        if (!branch.getInputResults().isEmpty()) {
            provider.defaultSerializeField("asyncResults", branch.getInputResults(), gen);
        }
        gen.writeArrayFieldStart("path");
        for (PathMarker marker : branch.getPath()) {
            gen.writeStartObject();
            gen.writeStringField("identifier", marker.identifier());
            gen.writeStringField("direction", marker.direction().getJsonName());
            gen.writeEndObject();
        }
        gen.writeEndArray();

        if (branch instanceof AssessmentResult assessment) {
            gen.writeStringField("taskRunUUID", assessment.getRunUUID());
            JsonValues.writeIfNotNull(gen, "assessmentIdentifier", assessment.getAssessmentIdentifier());
            JsonValues.writeIfNotNull(gen, "schemaIdentifier", assessment.getSchemaIdentifier());
            JsonValues.writeIfNotNull(gen, "versionString", assessment.getVersionString());
        }
    }
}
