package io.assessmodel.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.assessmodel.core.node.AnswerType;
import java.io.IOException;
import java.io.Serial;

/// Reads an `AnswerType`. A bare string is accepted as shorthand for `{"type": ...}`.
///
/// @implNote Package-private. Registered by {@link AssessmentJacksonModule}.
class AnswerTypeDeserializer extends StdDeserializer<AnswerType> {

    @Serial private static final long serialVersionUID = -1693308201755950275L;

    AnswerTypeDeserializer() {
        super(AnswerType.class);
    }

    @Override
    public AnswerType deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        try {
            if (root.isTextual()) {
                return AnswerType.of(AnswerType.Kind.fromJsonName(root.asText()));
            }
            String baseType = JsonValues.textOrNull(root, "baseType");
            return new AnswerType(
                    AnswerType.Kind.fromJsonName(JsonValues.requiredText(p, root, "type")),
                    baseType != null ? AnswerType.Kind.fromJsonName(baseType) : null,
                    JsonValues.textOrNull(root, "codingFormat"),
                    JsonValues.textOrNull(root, "unit"));
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(p, e.getMessage(), e);
        }
    }
}
