package io.assessmodel.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.assessmodel.core.node.Assessment;
import io.assessmodel.core.node.Node;
import io.assessmodel.core.result.Result;
import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Logger;

/// Utility class for encoding and decoding assessment definitions and results as JSON.
///
/// Provides a pre-configured `ObjectMapper` with the assessment type handlers and
/// `java.time` support for result timestamps.
///
/// ### Usage
/// {@snippet :
/// // Load a definition
/// Assessment assessment = AssessmentSerializer.readAssessment(in);
///
/// // Persist a run and restore it later
/// String json = AssessmentSerializer.toJson(controller.getState().getAssessmentResult());
/// AssessmentResult saved = (AssessmentResult) AssessmentSerializer.resultFromJson(json);
/// }
///
/// ### Contracts
/// - Encoding then decoding yields a value equal to the original.
/// - Every failure surfaces as `IllegalArgumentException` carrying the Jackson cause.
///
/// @implNote Thread-safe. The internal ObjectMapper is created once and only read from.
/// Callers that need their own configuration use `createMapper()`.
///
/// @see AssessmentJacksonModule for the registered type handlers
public final class AssessmentSerializer {

    private static final Logger logger = Logger.getLogger(AssessmentSerializer.class.getName());

    private static final ObjectMapper MAPPER = createMapper();

    private AssessmentSerializer() {}

    /// Encodes a node tree.
    ///
    /// @param node the node to encode, not null
    /// @return JSON tree, never null
    public static JsonNode encodeNode(Node node) {
        return MAPPER.valueToTree(node);
    }

    /// Decodes a node tree.
    ///
    /// @param json JSON tree, not null
    /// @return decoded node, never null
    /// @throws IllegalArgumentException if the JSON is not a valid node
    public static Node decodeNode(JsonNode json) {
        try {
            return MAPPER.treeToValue(json, Node.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to decode node: " + e.getMessage(), e);
        }
    }

    /// Encodes a result tree.
    ///
    /// @param result the result to encode, not null
    /// @return JSON tree, never null
    public static JsonNode encodeResult(Result result) {
        return MAPPER.valueToTree(result);
    }

    /// Decodes a result tree.
    ///
    /// @param json JSON tree, not null
    /// @return decoded result, never null
    /// @throws IllegalArgumentException if the JSON is not a valid result
    public static Result decodeResult(JsonNode json) {
        try {
            return MAPPER.treeToValue(json, Result.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to decode result: " + e.getMessage(), e);
        }
    }

    /// Serializes a node or result to pretty-printed JSON.
    ///
    /// @param value a `Node` or `Result`, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize: " + e.getMessage(), e);
        }
    }

    /// Deserializes a node from JSON.
    ///
    /// @param json JSON string, not null
    /// @return deserialized node, never null
    /// @throws IllegalArgumentException if deserialization fails
    public static Node nodeFromJson(String json) {
        try {
            return MAPPER.readValue(json, Node.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize node: " + e.getMessage(), e);
        }
    }

    /// Deserializes a result from JSON.
    ///
    /// @param json JSON string, not null
    /// @return deserialized result, never null
    /// @throws IllegalArgumentException if deserialization fails
    public static Result resultFromJson(String json) {
        try {
            return MAPPER.readValue(json, Result.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize result: " + e.getMessage(), e);
        }
    }

    /// Reads an assessment definition from a stream. The stream is not closed.
    ///
    /// @param in JSON input, not null
    /// @return the assessment, never null
    /// @throws IllegalArgumentException if the input is not a valid assessment
    public static Assessment readAssessment(InputStream in) {
        Node node;
        try {
            node = MAPPER.readValue(in, Node.class);
        } catch (IOException e) {
            throw new IllegalArgumentException(
                    "Failed to read assessment: " + e.getMessage(), e);
        }
        if (!(node instanceof Assessment assessment)) {
            throw new IllegalArgumentException(
                    "Expected an assessment but found "
                            + (node != null ? node.getNodeType().getJsonName() : "null"));
        }
        logger.fine(
                () ->
                        "Read assessment '"
                                + assessment.getId()
                                + "' with "
                                + assessment.getChildren().size()
                                + " steps");
        return assessment;
    }

    /// Creates an ObjectMapper configured for assessment serialization.
    ///
    /// Registers:
    /// - `AssessmentJacksonModule` for the node, result and rule types
    /// - `JavaTimeModule` for `Instant` timestamps
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps written as ISO-8601 strings (not numeric)
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new AssessmentJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
