package io.assessmodel.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.assessmodel.core.rule.SurveyRule;
import java.io.IOException;
import java.io.Serial;

/// Writes a `SurveyRule` as `{skipToIdentifier, matchingAnswer?, ruleOperator?}`.
///
/// The declared operator is written as-is; an omitted operator stays omitted so the rule
/// keeps its implied default when read back.
///
/// @implNote Package-private. Registered by {@link AssessmentJacksonModule}.
/// @see SurveyRuleDeserializer for the inverse operation
class SurveyRuleSerializer extends StdSerializer<SurveyRule> {

    @Serial private static final long serialVersionUID = 6958446000383216104L;

    SurveyRuleSerializer() {
        super(SurveyRule.class);
    }

    @Override
    public void serialize(SurveyRule rule, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("skipToIdentifier", rule.skipToIdentifier().stringValue());
        if (rule.matchingAnswer() != null) {
            JsonValues.writeValue(gen, provider, "matchingAnswer", rule.matchingAnswer());
        }
        if (rule.ruleOperator() != null) {
            gen.writeStringField("ruleOperator", rule.ruleOperator().getJsonName());
        }
        gen.writeEndObject();
    }
}
