package io.assessmodel.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.assessmodel.core.node.Assessment;
import io.assessmodel.core.node.BranchNode;
import io.assessmodel.core.node.ButtonActionInfo;
import io.assessmodel.core.node.ButtonType;
import io.assessmodel.core.node.Choice;
import io.assessmodel.core.node.ContentStep;
import io.assessmodel.core.node.InterruptionHandling;
import io.assessmodel.core.node.Node;
import io.assessmodel.core.node.QuestionStep;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Serializes all `Node` subtypes to JSON with a `"type"` discriminator field.
///
/// Every serialized object begins with `"identifier"` and `"type"`, followed by the shared
/// presentation fields and then subtype-specific fields. Optional fields are omitted when
/// null or empty.
///
/// ```
/// Type                       Additional fields
/// ---------------------------+------------------------------------------------------
/// instruction, overview,     │ fullInstructionsOnly, spokenInstructions, duration
/// completion, countdown      │
/// simpleQuestion             │ optional, uiHint, surveyRules, answerType
/// choiceQuestion             │ optional, uiHint, surveyRules, baseType, singleChoice,
///                            │ choices
/// section                    │ steps
/// assessment                 │ steps, versionString, estimatedMinutes, copyright,
///                            │ schemaIdentifier, interruptionHandling
/// ```
///
/// @implNote Package-private. Registered by {@link AssessmentJacksonModule}.
/// @see NodeDeserializer for the inverse operation
class NodeSerializer extends StdSerializer<Node> {

    @Serial private static final long serialVersionUID = 8437360146306921180L;

    NodeSerializer() {
        super(Node.class);
    }

    @Override
    public void serialize(Node node, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("identifier", node.getId());
        gen.writeStringField("type", node.getNodeType().getJsonName());
        writeCommon(node, gen);

        if (node instanceof ContentStep step) {
            writeContentStep(step, gen, provider);
        } else if (node instanceof QuestionStep question) {
            writeQuestion(question, gen, provider);
        } else if (node instanceof BranchNode branch) {
            provider.defaultSerializeField("steps", branch.getChildren(), gen);
            if (branch instanceof Assessment assessment) {
                writeAssessment(assessment, gen);
            }
        } else {
            throw new IOException("Unknown node type: " + node.getClass().getSimpleName());
        }

        gen.writeEndObject();
    }

    private void writeCommon(Node node, JsonGenerator gen) throws IOException {
        JsonValues.writeIfNotNull(gen, "comment", node.getComment());
        JsonValues.writeIfNotNull(gen, "title", node.getTitle());
        JsonValues.writeIfNotNull(gen, "subtitle", node.getSubtitle());
        JsonValues.writeIfNotNull(gen, "detail", node.getDetail());
        if (node.getNextNode() != null) {
            gen.writeStringField("nextStepIdentifier", node.getNextNode().stringValue());
        }
        if (!node.getHiddenButtons().isEmpty()) {
            gen.writeArrayFieldStart("shouldHideActions");
            for (ButtonType buttonType : node.getHiddenButtons()) {
                gen.writeString(buttonType.getJsonName());
            }
            gen.writeEndArray();
        }
        if (!node.getButtonMap().isEmpty()) {
            gen.writeObjectFieldStart("actions");
            for (Map.Entry<ButtonType, ButtonActionInfo> entry : node.getButtonMap().entrySet()) {
                gen.writeObjectFieldStart(entry.getKey().getJsonName());
                JsonValues.writeIfNotNull(gen, "buttonTitle", entry.getValue().buttonTitle());
                gen.writeEndObject();
            }
            gen.writeEndObject();
        }
    }

    private void writeContentStep(ContentStep step, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        if (step.isFullInstructionsOnly()) {
            gen.writeBooleanField("fullInstructionsOnly", true);
        }
        if (!step.getSpokenInstructions().isEmpty()) {
            provider.defaultSerializeField("spokenInstructions", step.getSpokenInstructions(), gen);
        }
        if (step.getDuration() != null) {
            gen.writeNumberField("duration", step.getDuration());
        }
    }

    private void writeQuestion(QuestionStep question, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeBooleanField("optional", question.isOptional());
        JsonValues.writeIfNotNull(gen, "uiHint", question.getUiHint());
        if (!question.getSurveyRules().isEmpty()) {
            provider.defaultSerializeField("surveyRules", question.getSurveyRules(), gen);
        }
        if (question.getBaseType() == null) {
            provider.defaultSerializeField("answerType", question.getAnswerType(), gen);
            return;
        }
        gen.writeStringField("baseType", question.getBaseType().getJsonName());
        gen.writeBooleanField("singleChoice", question.isSingleChoice());
        gen.writeArrayFieldStart("choices");
        for (Choice choice : question.getChoices()) {
            gen.writeStartObject();
            JsonValues.writeValue(gen, provider, "value", choice.value());
            gen.writeStringField("text", choice.text());
            if (choice.selectorType() != Choice.SelectorType.DEFAULT) {
                gen.writeStringField("selectorType", choice.selectorType().getJsonName());
            }
            gen.writeEndObject();
        }
        gen.writeEndArray();
    }

    private void writeAssessment(Assessment assessment, JsonGenerator gen) throws IOException {
        JsonValues.writeIfNotNull(gen, "versionString", assessment.getVersionString());
        if (assessment.getEstimatedMinutes() != null) {
            gen.writeNumberField("estimatedMinutes", assessment.getEstimatedMinutes());
        }
        JsonValues.writeIfNotNull(gen, "copyright", assessment.getCopyright());
        JsonValues.writeIfNotNull(gen, "schemaIdentifier", assessment.getSchemaIdentifier());

        InterruptionHandling handling = assessment.getInterruptionHandling();
        gen.writeObjectFieldStart("interruptionHandling");
        gen.writeBooleanField("canPause", handling.canPause());
        gen.writeBooleanField("canSaveForLater", handling.canSaveForLater());
        gen.writeBooleanField("canSkip", handling.canSkip());
        gen.writeBooleanField("canResume", handling.canResume());
        if (handling.reviewIdentifier() != null) {
            gen.writeStringField("reviewIdentifier", handling.reviewIdentifier().stringValue());
        }
        gen.writeEndObject();
    }
}
