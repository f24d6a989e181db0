package io.assessmodel.core.node;

import java.util.Objects;

/// One selectable option of a choice question.
///
/// @param value JSON-shaped answer value recorded when selected, may be null
/// @param text display text, not null
/// @param selectorType how selecting this option interacts with the others, not null
public record Choice(Object value, String text, SelectorType selectorType) {

    public Choice {
        Objects.requireNonNull(text, "Choice text required");
        selectorType = selectorType != null ? selectorType : SelectorType.DEFAULT;
    }

    public Choice(Object value, String text) {
        this(value, text, SelectorType.DEFAULT);
    }

    public enum SelectorType {
        DEFAULT("default"),
        /// Selecting this option deselects every other option.
        EXCLUSIVE("exclusive"),
        /// Selecting this option selects every non-exclusive option.
        ALL("all");

        private final String jsonName;

        SelectorType(String jsonName) {
            this.jsonName = jsonName;
        }

        public String getJsonName() {
            return jsonName;
        }

        public static SelectorType fromJsonName(String jsonName) {
            for (SelectorType type : values()) {
                if (type.jsonName.equals(jsonName)) {
                    return type;
                }
            }
            throw new IllegalArgumentException("Unknown selector type: " + jsonName);
        }
    }
}
