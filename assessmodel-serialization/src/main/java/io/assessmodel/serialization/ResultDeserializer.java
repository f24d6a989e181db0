package io.assessmodel.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.assessmodel.core.node.AnswerType;
import io.assessmodel.core.result.AnswerResult;
import io.assessmodel.core.result.AssessmentResult;
import io.assessmodel.core.result.BasicResult;
import io.assessmodel.core.result.BranchNodeResult;
import io.assessmodel.core.result.Direction;
import io.assessmodel.core.result.PathMarker;
import io.assessmodel.core.result.Result;
import io.assessmodel.core.result.ResultType;
import java.io.IOException;
import java.io.Serial;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/// Deserializes JSON to the appropriate `Result` subtype using the `"type"` discriminator field.
///
/// Branch results are rebuilt child by child; the persisted `path` replaces the log wholesale
/// so that a restored run resumes where it left off.
///
/// @implNote Package-private. Registered by {@link AssessmentJacksonModule}.
/// @see ResultSerializer for the inverse operation
class ResultDeserializer extends StdDeserializer<Result> {

    @Serial private static final long serialVersionUID = 2299165316546335802L;

    ResultDeserializer() {
        super(Result.class);
    }

    @Override
    public Result deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        String id = JsonValues.requiredText(p, root, "identifier");
        String type = JsonValues.requiredText(p, root, "type");
        if (!root.hasNonNull("startDate")) {
            throw JsonMappingException.from(p, "Result '" + id + "' has no startDate");
        }
        Instant startDate = mapper.treeToValue(root.get("startDate"), Instant.class);
        try {
            Result result =
                    switch (ResultType.fromJsonName(type)) {
                        case BASE -> new BasicResult(id, startDate);
                        case ANSWER -> deserializeAnswer(mapper, p, root, id, startDate);
                        case SECTION ->
                                fillBranch(mapper, root, new BranchNodeResult(id, startDate));
                        case ASSESSMENT ->
                                fillBranch(
                                        mapper,
                                        root,
                                        new AssessmentResult(
                                                id,
                                                startDate,
                                                JsonValues.textOrNull(root, "taskRunUUID"),
                                                JsonValues.textOrNull(root, "assessmentIdentifier"),
                                                JsonValues.textOrNull(root, "schemaIdentifier"),
                                                JsonValues.textOrNull(root, "versionString")));
                    };
            if (root.hasNonNull("endDate")) {
                result.setEndDate(mapper.treeToValue(root.get("endDate"), Instant.class));
            }
            return result;
        } catch (IllegalArgumentException | NullPointerException e) {
            throw JsonMappingException.from(p, "Invalid result '" + id + "': " + e.getMessage(), e);
        }
    }

    private AnswerResult deserializeAnswer(
            ObjectMapper mapper, JsonParser p, JsonNode root, String id, Instant startDate)
            throws IOException {
        AnswerType answerType =
                root.hasNonNull("answerType")
                        ? mapper.treeToValue(root.get("answerType"), AnswerType.class)
                        : null;
        AnswerResult answer =
                new AnswerResult(id, startDate, answerType, JsonValues.textOrNull(root, "questionText"));
        answer.setJsonValue(JsonValues.readValue(p, root.get("value")));
        return answer;
    }

    private <R extends BranchNodeResult> R fillBranch(ObjectMapper mapper, JsonNode root, R branch)
            throws IOException {
        JsonNode history = root.get("stepHistory");
        if (history != null) {
            for (JsonNode child : history) {
                branch.updateStepHistory(mapper.treeToValue(child, Result.class));
            }
        }
        JsonNode async = root.get("asyncResults");
        if (async != null) {
            for (JsonNode child : async) {
                branch.appendInputResult(mapper.treeToValue(child, Result.class));
            }
        }
        List<PathMarker> markers = new ArrayList<>();
        JsonNode path = root.get("path");
        if (path != null) {
            for (JsonNode marker : path) {
                markers.add(
                        new PathMarker(
                                JsonValues.textOrNull(marker, "identifier"),
                                Direction.fromJsonName(JsonValues.textOrNull(marker, "direction"))));
            }
        }
        branch.setPath(markers);
        return branch;
    }
}
