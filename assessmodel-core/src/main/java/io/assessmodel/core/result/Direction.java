package io.assessmodel.core.result;

/// Direction of one traversal step.
public enum Direction {
    FORWARD("forward"),
    BACKWARD("backward"),
    /// The branch was left early through an `exit` jump.
    EXIT("exit");

    private final String jsonName;

    Direction(String jsonName) {
        this.jsonName = jsonName;
    }

    public String getJsonName() {
        return jsonName;
    }

    public static Direction fromJsonName(String jsonName) {
        for (Direction direction : values()) {
            if (direction.jsonName.equals(jsonName)) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unknown direction: " + jsonName);
    }
}
