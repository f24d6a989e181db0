package io.assessmodel.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.assessmodel.core.node.AnswerType;
import io.assessmodel.core.node.Node;
import io.assessmodel.core.result.Result;
import io.assessmodel.core.rule.SurveyRule;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all assessment serialization configuration in one
/// place.
///
/// Custom serializer/deserializer pairs, one per polymorphic or value type. The `"type"`
/// discriminator drives subtype selection at runtime:
/// - `Node` - `NodeSerializer` / `NodeDeserializer`
/// - `Result` - `ResultSerializer` / `ResultDeserializer`
/// - `SurveyRule` - `SurveyRuleSerializer` / `SurveyRuleDeserializer`
/// - `AnswerType` - `AnswerTypeSerializer` / `AnswerTypeDeserializer`
///
/// Serializers match subclasses, so a concrete `Section` or `AssessmentResult` is written by
/// the base type's serializer. Deserialization targets the base type; callers cast.
///
/// @implNote All registrations are explicit. No classpath scanning, no reflection on the
/// domain types.
/// @see AssessmentSerializer for the convenience factory API
public class AssessmentJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 4521389902716245318L;

    public AssessmentJacksonModule() {
        super("AssessmentJacksonModule");

        addSerializer(Node.class, new NodeSerializer());
        addDeserializer(Node.class, new NodeDeserializer());

        addSerializer(Result.class, new ResultSerializer());
        addDeserializer(Result.class, new ResultDeserializer());

        addSerializer(SurveyRule.class, new SurveyRuleSerializer());
        addDeserializer(SurveyRule.class, new SurveyRuleDeserializer());

        addSerializer(AnswerType.class, new AnswerTypeSerializer());
        addDeserializer(AnswerType.class, new AnswerTypeDeserializer());
    }
}
