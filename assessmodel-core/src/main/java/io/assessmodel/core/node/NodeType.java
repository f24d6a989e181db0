package io.assessmodel.core.node;

/// Discriminant for the closed set of node kinds.
///
/// The serialized name is the value of the `type` field in node JSON.
public enum NodeType {
    ASSESSMENT("assessment"),
    SECTION("section"),
    INSTRUCTION("instruction"),
    OVERVIEW("overview"),
    COMPLETION("completion"),
    COUNTDOWN("countdown"),
    SIMPLE_QUESTION("simpleQuestion"),
    CHOICE_QUESTION("choiceQuestion");

    private final String jsonName;

    NodeType(String jsonName) {
        this.jsonName = jsonName;
    }

    public String getJsonName() {
        return jsonName;
    }

    /// Returns whether nodes of this kind contain child nodes.
    public boolean isBranch() {
        return this == ASSESSMENT || this == SECTION;
    }

    /// Returns whether nodes of this kind carry survey rules.
    public boolean isQuestion() {
        return this == SIMPLE_QUESTION || this == CHOICE_QUESTION;
    }

    /// Looks up a node type by its serialized name.
    ///
    /// @param jsonName the `type` value, not null
    /// @return the matching node type, never null
    /// @throws IllegalArgumentException if no node type has this name
    public static NodeType fromJsonName(String jsonName) {
        for (NodeType type : values()) {
            if (type.jsonName.equals(jsonName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown node type: " + jsonName);
    }
}
