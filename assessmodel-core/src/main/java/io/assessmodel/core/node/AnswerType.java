package io.assessmodel.core.node;

import java.util.Objects;

/// Describes the JSON shape of an answer.
///
/// @param kind the answer kind, not null
/// @param baseType element kind for arrays, null otherwise
/// @param codingFormat date format for date-time answers, may be null
/// @param unit unit for measurements, may be null
public record AnswerType(Kind kind, Kind baseType, String codingFormat, String unit) {

    public AnswerType {
        Objects.requireNonNull(kind, "Answer kind required");
        if (kind == Kind.ARRAY && baseType == null) {
            baseType = Kind.STRING;
        }
    }

    public static AnswerType of(Kind kind) {
        return new AnswerType(kind, null, null, null);
    }

    public static AnswerType arrayOf(Kind baseType) {
        return new AnswerType(Kind.ARRAY, baseType, null, null);
    }

    public enum Kind {
        STRING("string"),
        INTEGER("integer"),
        NUMBER("number"),
        BOOLEAN("boolean"),
        ARRAY("array"),
        OBJECT("object"),
        DATE_TIME("date-time"),
        TIME("time"),
        MEASUREMENT("measurement");

        private final String jsonName;

        Kind(String jsonName) {
            this.jsonName = jsonName;
        }

        public String getJsonName() {
            return jsonName;
        }

        public static Kind fromJsonName(String jsonName) {
            for (Kind kind : values()) {
                if (kind.jsonName.equals(jsonName)) {
                    return kind;
                }
            }
            throw new IllegalArgumentException("Unknown answer type: " + jsonName);
        }
    }
}
