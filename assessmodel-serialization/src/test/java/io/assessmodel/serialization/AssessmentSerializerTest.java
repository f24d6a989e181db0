package io.assessmodel.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.assessmodel.core.execution.AssessmentConfig;
import io.assessmodel.core.execution.AssessmentController;
import io.assessmodel.core.execution.AssessmentStatus;
import io.assessmodel.core.execution.NavigationListener;
import io.assessmodel.core.node.AnswerType;
import io.assessmodel.core.node.Assessment;
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
import io.assessmodel.core.result.AnswerResult;
import io.assessmodel.core.result.AssessmentResult;
import io.assessmodel.core.result.BasicResult;
import io.assessmodel.core.result.BranchNodeResult;
import io.assessmodel.core.result.Direction;
import io.assessmodel.core.result.PathMarker;
import io.assessmodel.core.result.Result;
import io.assessmodel.core.rule.RuleOperator;
import io.assessmodel.core.rule.SurveyRule;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class AssessmentSerializerTest {

    private static final Instant START = Instant.parse("2024-01-01T10:00:00Z");
    private static final Instant END = Instant.parse("2024-01-01T10:00:42.5Z");

    @Test
    void readAssessment_surveyA() throws IOException {
        Assessment assessment = loadSurveyA();

        assertThat(assessment.getId()).isEqualTo("surveyA");
        assertThat(assessment.getVersionString()).isEqualTo("1.0.0");
        assertThat(assessment.getEstimatedMinutes()).isEqualTo(3);
        assertThat(assessment.getChildren()).hasSize(11);
        assertThat(assessment.getHiddenButtons()).containsExactly(ButtonType.PAUSE);
        assertThat(assessment.getButtonMap())
                .containsEntry(ButtonType.SKIP, new ButtonActionInfo("Skip me"));
        assertThat(assessment.getInterruptionHandling().reviewIdentifier())
                .isEqualTo(NavigationIdentifier.parse("beginning"));

        QuestionStep choiceQ1 = (QuestionStep) assessment.getChildren().get(1);
        assertThat(choiceQ1.getNodeType()).isEqualTo(NodeType.CHOICE_QUESTION);
        assertThat(choiceQ1.getAnswerType()).isEqualTo(AnswerType.of(AnswerType.Kind.INTEGER));
        assertThat(choiceQ1.getChoices()).hasSize(4);
        assertThat(choiceQ1.getSurveyRules().get(0).ruleOperator()).isEqualTo(RuleOperator.SKIP);
        SurveyRule first = choiceQ1.getSurveyRules().get(1);
        assertThat(first.matchingAnswer()).isEqualTo(1);
        assertThat(first.ruleOperator()).isNull();
        assertThat(first.effectiveOperator()).isEqualTo(RuleOperator.EQUAL);

        QuestionStep colors = (QuestionStep) assessment.getChildren().get(7);
        assertThat(colors.getAnswerType()).isEqualTo(AnswerType.arrayOf(AnswerType.Kind.STRING));
        assertThat(colors.getChoices().get(2).selectorType()).isEqualTo(Choice.SelectorType.ALL);
        assertThat(colors.getChoices().get(2).value()).isNull();

        ContentStep pizza = (ContentStep) assessment.getChildren().get(9);
        assertThat(pizza.getSpokenInstructions())
                .containsEntry(ContentStep.SPOKEN_START, "Enjoy your pizza.");
    }

    @Test
    void readAssessment_decodedDefinitionNavigates() throws IOException {
        AssessmentController controller = new AssessmentController(loadSurveyA());
        controller.initialize();

        controller.goForward();
        controller.goForward();

        assertThat(controller.getState().getCurrentStep().step().getId()).isEqualTo("followupQ");
        assertThat(controller.getState().getStatus()).isEqualTo(AssessmentStatus.RUNNING);
    }

    @Test
    void readAssessment_rejectsNonAssessmentRoot() {
        String json = "{\"identifier\": \"s\", \"type\": \"section\", \"steps\": []}";

        assertThatThrownBy(
                        () ->
                                AssessmentSerializer.readAssessment(
                                        new ByteArrayInputStream(
                                                json.getBytes(StandardCharsets.UTF_8))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("section");
    }

    @Test
    void roundTrip_surveyA() throws IOException {
        Assessment original = loadSurveyA();

        Node restored = AssessmentSerializer.nodeFromJson(AssessmentSerializer.toJson(original));

        assertThat(restored).isEqualTo(original);
    }

    @Test
    void roundTrip_sectionWithContentSteps() {
        Section original =
                Section.builder()
                        .id("timed")
                        .title("Timed block")
                        .comment("author note")
                        .hideButton(ButtonType.GO_BACKWARD)
                        .child(
                                ContentStep.builder(NodeType.COUNTDOWN)
                                        .id("countdown")
                                        .duration(5)
                                        .fullInstructionsOnly(true)
                                        .build())
                        .child(
                                ContentStep.builder(NodeType.INSTRUCTION)
                                        .id("done")
                                        .subtitle("Nearly there")
                                        .nextNode("exit")
                                        .button(ButtonType.GO_FORWARD, new ButtonActionInfo("Finish"))
                                        .build())
                        .build();

        JsonNode json = AssessmentSerializer.encodeNode(original);
        Node restored = AssessmentSerializer.decodeNode(json);

        assertThat(restored).isEqualTo(original);
        assertThat(json.get("type").asText()).isEqualTo("section");
        assertThat(json.get("shouldHideActions").get(0).asText()).isEqualTo("goBackward");
        assertThat(json.get("steps").get(1).get("nextStepIdentifier").asText()).isEqualTo("exit");
        assertThat(json.get("steps").get(1).get("actions").get("goForward").get("buttonTitle").asText())
                .isEqualTo("Finish");
    }

    @Test
    void roundTrip_assessmentProperties() {
        Assessment original =
                Assessment.builder()
                        .id("meta")
                        .copyright("(c) 2024")
                        .schemaIdentifier("schema-1")
                        .interruptionHandling(new InterruptionHandling(false, true, false, true, null))
                        .child(
                                QuestionStep.simple()
                                        .id("weight")
                                        .answerType(
                                                new AnswerType(
                                                        AnswerType.Kind.MEASUREMENT, null, "%.1f", "kg"))
                                        .optional(false)
                                        .surveyRule(SurveyRule.of(RuleOperator.GREATER_THAN, 150.5, "exit"))
                                        .build())
                        .build();

        Node restored = AssessmentSerializer.decodeNode(AssessmentSerializer.encodeNode(original));

        assertThat(restored).isEqualTo(original);
        Assessment assessment = (Assessment) restored;
        assertThat(assessment.getInterruptionHandling().canPause()).isFalse();
        assertThat(assessment.getInterruptionHandling().reviewIdentifier()).isNull();
    }

    @Test
    void surveyRule_omittedFieldsStayOmitted() throws IOException {
        ObjectMapper mapper = AssessmentSerializer.createMapper();

        SurveyRule rule = mapper.readValue("{\"skipToIdentifier\": \"exit\"}", SurveyRule.class);
        JsonNode written = mapper.valueToTree(rule);

        assertThat(rule).isEqualTo(new SurveyRule(NavigationIdentifier.exit(), null, null));
        assertThat(rule.effectiveOperator()).isEqualTo(RuleOperator.ALWAYS);
        assertThat(written.has("matchingAnswer")).isFalse();
        assertThat(written.has("ruleOperator")).isFalse();
    }

    @Test
    void surveyRule_listAnswer() throws IOException {
        ObjectMapper mapper = AssessmentSerializer.createMapper();
        SurveyRule original = SurveyRule.equalTo(List.of("blue", "red"), "colors");

        SurveyRule restored =
                mapper.readValue(mapper.writeValueAsString(original), SurveyRule.class);

        assertThat(restored).isEqualTo(original);
    }

    @Test
    void roundTrip_assessmentResult() {
        AssessmentResult original =
                new AssessmentResult("surveyA", START, "run-1", "surveyA", null, "1.0.0");
        original.setEndDate(END);
        BasicResult overview = new BasicResult("overview", START);
        overview.setEndDate(END);
        original.appendStepHistory(overview, Direction.FORWARD);
        AnswerResult colors =
                new AnswerResult(
                        "multipleChoice",
                        START,
                        AnswerType.arrayOf(AnswerType.Kind.STRING),
                        "What are your favorite colors?");
        colors.setJsonValue(List.of("blue", "red"));
        original.appendStepHistory(colors, Direction.FORWARD);
        BranchNodeResult section = new BranchNodeResult("B", START);
        AnswerResult decimal = new AnswerResult("decimal", START, AnswerType.of(AnswerType.Kind.NUMBER), null);
        decimal.setJsonValue(2.5);
        section.appendStepHistory(decimal, Direction.FORWARD);
        section.appendPathMarker(new PathMarker("decimal", Direction.EXIT));
        section.appendInputResult(new BasicResult("sensor", START));
        original.appendStepHistory(section, Direction.FORWARD);
        original.appendStepHistory(colors, Direction.BACKWARD);

        String json = AssessmentSerializer.toJson(original);
        Result restored = AssessmentSerializer.resultFromJson(json);

        assertThat(restored).isInstanceOf(AssessmentResult.class).isEqualTo(original);
        AssessmentResult result = (AssessmentResult) restored;
        assertThat(result.getRunUUID()).isEqualTo("run-1");
        assertThat(result.lastPathMarker()).isEqualTo(new PathMarker("multipleChoice", Direction.BACKWARD));
        assertThat(((BranchNodeResult) result.findResult("B")).getInputResults()).hasSize(1);
        assertThat(json).contains("\"startDate\" : \"2024-01-01T10:00:00Z\"");
        assertThat(json).contains("\"taskRunUUID\" : \"run-1\"");
    }

    @Test
    void roundTrip_persistedRunResumes() throws IOException {
        Assessment assessment = loadSurveyA();
        AssessmentController first = new AssessmentController(assessment);
        first.initialize();
        first.goForward();
        ((AnswerResult) first.getState().getCurrentStep().result()).setJsonValue(3);
        first.goForward();

        JsonNode saved = AssessmentSerializer.encodeResult(first.getState().getAssessmentResult());
        AssessmentResult restored = (AssessmentResult) AssessmentSerializer.decodeResult(saved);
        AssessmentController second =
                new AssessmentController(
                        assessment,
                        new AssessmentConfig(),
                        restored,
                        NavigationListener.NOOP);
        second.initialize();

        assertThat(second.getState().getCurrentStep().step().getId()).isEqualTo("simpleQ3");
        assertThat(restored.findAnswer("choiceQ1")).isEqualTo(3);
    }

    @Test
    void decode_invalidNodes() {
        assertThatThrownBy(() -> AssessmentSerializer.nodeFromJson("{\"type\": \"instruction\"}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("identifier");
        assertThatThrownBy(
                        () ->
                                AssessmentSerializer.nodeFromJson(
                                        "{\"identifier\": \"x\", \"type\": \"video\"}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("video");
        assertThatThrownBy(
                        () ->
                                AssessmentSerializer.nodeFromJson(
                                        "{\"identifier\": \"q\", \"type\": \"choiceQuestion\"}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("requires choices");
    }

    @Test
    void decode_resultWithoutStartDate() {
        assertThatThrownBy(
                        () ->
                                AssessmentSerializer.resultFromJson(
                                        "{\"identifier\": \"r\", \"type\": \"base\"}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("startDate");
    }

    private static Assessment loadSurveyA() throws IOException {
        try (InputStream in = AssessmentSerializerTest.class.getResourceAsStream("/surveyA.json")) {
            return AssessmentSerializer.readAssessment(in);
        }
    }
}
