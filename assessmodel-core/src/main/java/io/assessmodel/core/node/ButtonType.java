package io.assessmodel.core.node;

/// Navigation buttons whose visibility and label a node may override.
public enum ButtonType {
    GO_FORWARD("goForward"),
    GO_BACKWARD("goBackward"),
    SKIP("skip"),
    PAUSE("pause"),
    CANCEL("cancel");

    private final String jsonName;

    ButtonType(String jsonName) {
        this.jsonName = jsonName;
    }

    public String getJsonName() {
        return jsonName;
    }

    public static ButtonType fromJsonName(String jsonName) {
        for (ButtonType type : values()) {
            if (type.jsonName.equals(jsonName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown button type: " + jsonName);
    }
}
