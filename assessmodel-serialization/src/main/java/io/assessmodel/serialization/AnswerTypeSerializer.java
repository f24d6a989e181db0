package io.assessmodel.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.assessmodel.core.node.AnswerType;
import java.io.IOException;
import java.io.Serial;

/// Writes an `AnswerType` as `{type, baseType?, codingFormat?, unit?}`.
///
/// @implNote Package-private. Registered by {@link AssessmentJacksonModule}.
class AnswerTypeSerializer extends StdSerializer<AnswerType> {

    @Serial private static final long serialVersionUID = 3120949785101624468L;

    AnswerTypeSerializer() {
        super(AnswerType.class);
    }

    @Override
    public void serialize(AnswerType answerType, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("type", answerType.kind().getJsonName());
        if (answerType.baseType() != null) {
            gen.writeStringField("baseType", answerType.baseType().getJsonName());
        }
        JsonValues.writeIfNotNull(gen, "codingFormat", answerType.codingFormat());
        JsonValues.writeIfNotNull(gen, "unit", answerType.unit());
        gen.writeEndObject();
    }
}
