package io.assessmodel.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.assessmodel.core.node.NavigationIdentifier;
import io.assessmodel.core.rule.RuleOperator;
import io.assessmodel.core.rule.SurveyRule;
import java.io.IOException;
import java.io.Serial;

/// Reads a `SurveyRule`. `matchingAnswer` and `ruleOperator` are optional.
///
/// @implNote Package-private. Registered by {@link AssessmentJacksonModule}.
/// @see SurveyRuleSerializer for the inverse operation
class SurveyRuleDeserializer extends StdDeserializer<SurveyRule> {

    @Serial private static final long serialVersionUID = -3405781169377226745L;

    SurveyRuleDeserializer() {
        super(SurveyRule.class);
    }

    @Override
    public SurveyRule deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        String target = JsonValues.requiredText(p, root, "skipToIdentifier");
        String operator = JsonValues.textOrNull(root, "ruleOperator");
        try {
            return new SurveyRule(
                    NavigationIdentifier.parse(target),
                    JsonValues.readValue(p, root.get("matchingAnswer")),
                    operator != null ? RuleOperator.fromJsonName(operator) : null);
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(p, e.getMessage(), e);
        }
    }
}
