package io.assessmodel.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.assessmodel.core.node.AnswerType;
import io.assessmodel.core.node.Assessment;
import io.assessmodel.core.node.BranchNode;
import io.assessmodel.core.node.ButtonActionInfo;
import io.assessmodel.core.node.ButtonType;
import io.assessmodel.core.node.Choice;
import io.assessmodel.core.node.ContentStep;
import io.assessmodel.core.node.InterruptionHandling;
import io.assessmodel.core.node.NavigationIdentifier;
import io.assessmodel.core.node.Node;
import io.assessmodel.core.node.NodeType;
import io.assessmodel.core.node.QuestionStep;
import io.assessmodel.core.node.Section;
import io.assessmodel.core.rule.SurveyRule;
import java.io.IOException;
import java.io.Serial;
import java.util.Iterator;
import java.util.Map;

/// Deserializes JSON to the appropriate `Node` subtype using the `"type"` discriminator field.
///
/// Nested value types (`Choice`, `InterruptionHandling`, button overrides) are extracted
/// manually from the `JsonNode` tree. Survey rules, answer types and child steps delegate to
/// their registered deserializers.
///
/// Validation failures raised by the node builders (missing choices, a countdown without a
/// duration) are reported as `JsonMappingException`.
///
/// @implNote Package-private. Registered by {@link AssessmentJacksonModule}.
/// @see NodeSerializer for the inverse operation
class NodeDeserializer extends StdDeserializer<Node> {

    @Serial private static final long serialVersionUID = -5036934931466342519L;

    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};

    NodeDeserializer() {
        super(Node.class);
    }

    /// Reads `"identifier"` and `"type"` and dispatches to the matching subtype builder.
    ///
    /// @param p the JSON parser positioned at the start of the node object, not null
    /// @param ctxt the deserialization context, not null
    /// @return the constructed `Node`, never null
    /// @throws IOException if a required field is absent, the `"type"` value is unrecognized
    /// or the node is invalid
    @Override
    public Node deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        String id = JsonValues.requiredText(p, root, "identifier");
        String type = JsonValues.requiredText(p, root, "type");
        try {
            NodeType nodeType = NodeType.fromJsonName(type);
            return switch (nodeType) {
                case INSTRUCTION, OVERVIEW, COMPLETION, COUNTDOWN ->
                        deserializeContent(mapper, root, id, nodeType);
                case SIMPLE_QUESTION -> deserializeQuestion(mapper, p, root, id, false);
                case CHOICE_QUESTION -> deserializeQuestion(mapper, p, root, id, true);
                case SECTION ->
                        children(mapper, root, common(Section.builder().id(id), root)).build();
                case ASSESSMENT -> deserializeAssessment(mapper, root, id);
            };
        } catch (IllegalArgumentException | IllegalStateException | NullPointerException e) {
            throw JsonMappingException.from(p, "Invalid node '" + id + "': " + e.getMessage(), e);
        }
    }

    private ContentStep deserializeContent(
            ObjectMapper mapper, JsonNode root, String id, NodeType nodeType) throws IOException {
        ContentStep.Builder b =
                common(ContentStep.builder(nodeType).id(id), root)
                        .fullInstructionsOnly(
                                JsonValues.booleanOr(root, "fullInstructionsOnly", false))
                        .duration(JsonValues.intOrNull(root, "duration"));
        if (root.hasNonNull("spokenInstructions")) {
            b.spokenInstructions(mapper.convertValue(root.get("spokenInstructions"), STRING_MAP));
        }
        return b.build();
    }

    private QuestionStep deserializeQuestion(
            ObjectMapper mapper, JsonParser p, JsonNode root, String id, boolean choice)
            throws IOException {
        QuestionStep.Builder b =
                common(choice ? QuestionStep.choice() : QuestionStep.simple(), root)
                        .id(id)
                        .optional(JsonValues.booleanOr(root, "optional", true))
                        .uiHint(JsonValues.textOrNull(root, "uiHint"));
        JsonNode rules = root.get("surveyRules");
        if (rules != null) {
            for (JsonNode rule : rules) {
                b.surveyRule(mapper.treeToValue(rule, SurveyRule.class));
            }
        }
        if (!choice) {
            if (root.hasNonNull("answerType")) {
                b.answerType(mapper.treeToValue(root.get("answerType"), AnswerType.class));
            }
            return b.build();
        }

        String baseType = JsonValues.textOrNull(root, "baseType");
        if (baseType != null) {
            b.baseType(AnswerType.Kind.fromJsonName(baseType));
        }
        b.singleChoice(JsonValues.booleanOr(root, "singleChoice", true));
        JsonNode choices = root.get("choices");
        if (choices != null) {
            for (JsonNode c : choices) {
                String selector = JsonValues.textOrNull(c, "selectorType");
                b.choice(
                        new Choice(
                                JsonValues.readValue(p, c.get("value")),
                                JsonValues.textOrNull(c, "text"),
                                selector != null ? Choice.SelectorType.fromJsonName(selector) : null));
            }
        }
        return b.build();
    }

    private Assessment deserializeAssessment(ObjectMapper mapper, JsonNode root, String id)
            throws IOException {
        Assessment.Builder b =
                children(mapper, root, common(Assessment.builder().id(id), root))
                        .versionString(JsonValues.textOrNull(root, "versionString"))
                        .estimatedMinutes(JsonValues.intOrNull(root, "estimatedMinutes"))
                        .copyright(JsonValues.textOrNull(root, "copyright"))
                        .schemaIdentifier(JsonValues.textOrNull(root, "schemaIdentifier"));

        JsonNode ih = root.get("interruptionHandling");
        if (ih != null && !ih.isNull()) {
            String review = JsonValues.textOrNull(ih, "reviewIdentifier");
            b.interruptionHandling(
                    new InterruptionHandling(
                            JsonValues.booleanOr(ih, "canPause", true),
                            JsonValues.booleanOr(ih, "canSaveForLater", true),
                            JsonValues.booleanOr(ih, "canSkip", true),
                            JsonValues.booleanOr(ih, "canResume", true),
                            review != null ? NavigationIdentifier.parse(review) : null));
        }
        return b.build();
    }

    private <B extends BranchNode.Builder<B>> B children(
            ObjectMapper mapper, JsonNode root, B builder) throws IOException {
        JsonNode steps = root.get("steps");
        if (steps != null) {
            for (JsonNode step : steps) {
                builder.child(mapper.treeToValue(step, Node.class));
            }
        }
        return builder;
    }

    private <B extends Node.Builder<B>> B common(B builder, JsonNode root) {
        builder.comment(JsonValues.textOrNull(root, "comment"))
                .title(JsonValues.textOrNull(root, "title"))
                .subtitle(JsonValues.textOrNull(root, "subtitle"))
                .detail(JsonValues.textOrNull(root, "detail"))
                .nextNode(JsonValues.textOrNull(root, "nextStepIdentifier"));

        JsonNode hidden = root.get("shouldHideActions");
        if (hidden != null) {
            for (JsonNode button : hidden) {
                builder.hideButton(ButtonType.fromJsonName(button.asText()));
            }
        }
        JsonNode actions = root.get("actions");
        if (actions != null) {
            Iterator<Map.Entry<String, JsonNode>> fields = actions.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                builder.button(
                        ButtonType.fromJsonName(field.getKey()),
                        new ButtonActionInfo(JsonValues.textOrNull(field.getValue(), "buttonTitle")));
            }
        }
        return builder;
    }
}
