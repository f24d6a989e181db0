package io.assessmodel.core.result;

/// Discriminant for result kinds. The serialized name is the `type` field of result JSON.
public enum ResultType {
    BASE("base"),
    ANSWER("answer"),
    SECTION("section"),
    ASSESSMENT("assessment");

    private final String jsonName;

    ResultType(String jsonName) {
        this.jsonName = jsonName;
    }

    public String getJsonName() {
        return jsonName;
    }

    public static ResultType fromJsonName(String jsonName) {
        for (ResultType type : values()) {
            if (type.jsonName.equals(jsonName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown result type: " + jsonName);
    }
}
