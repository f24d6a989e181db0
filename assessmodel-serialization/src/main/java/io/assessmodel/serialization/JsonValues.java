package io.assessmodel.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/// Shared helpers for reading and writing answer-shaped values and optional fields.
///
/// Answers are scalars or lists of scalars. Integral JSON numbers decode to `Integer` or
/// `Long`, fractional ones to `Double`.
final class JsonValues {

    private JsonValues() {}

    static Object readValue(JsonParser p, JsonNode node) throws JsonMappingException {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isArray()) {
            List<Object> values = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                values.add(readValue(p, element));
            }
            return values;
        }
        throw JsonMappingException.from(p, "Unsupported value shape: " + node.getNodeType());
    }

    static void writeValue(
            JsonGenerator gen, SerializerProvider provider, String field, Object value)
            throws IOException {
        provider.defaultSerializeField(field, value, gen);
    }

    static String textOrNull(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node != null && !node.isNull() ? node.asText() : null;
    }

    static Integer intOrNull(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node != null && !node.isNull() ? node.asInt() : null;
    }

    static boolean booleanOr(JsonNode root, String field, boolean defaultValue) {
        JsonNode node = root.get(field);
        return node != null && !node.isNull() ? node.asBoolean() : defaultValue;
    }

    static String requiredText(JsonParser p, JsonNode root, String field)
            throws JsonMappingException {
        String value = textOrNull(root, field);
        if (value == null) {
            throw JsonMappingException.from(p, "Missing required field '" + field + "'");
        }
        return value;
    }

    static void writeIfNotNull(JsonGenerator gen, String field, String value) throws IOException {
        if (value != null) {
            gen.writeStringField(field, value);
        }
    }
}
