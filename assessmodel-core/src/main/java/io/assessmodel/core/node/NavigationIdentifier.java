package io.assessmodel.core.node;

import java.util.Objects;

/// Target of a direct jump: either a concrete node identifier or a reserved key.
///
/// ### Permitted Implementations
/// - {@link NodeTarget} - jump to the node with this identifier in the same list
/// - {@link Reserved} - `exit` the current branch, or go to the `beginning`
///
/// Reserved keys take precedence when parsing, so no node can be named `exit` or
/// `beginning` and still be reached by a jump.
public sealed interface NavigationIdentifier {

    /// Returns the serialized form of this target.
    ///
    /// @return node identifier or reserved key name, never null
    String stringValue();

    /// Parses a serialized jump target.
    ///
    /// @param value node identifier or reserved key name, not null
    /// @return parsed target, never null
    static NavigationIdentifier parse(String value) {
        Objects.requireNonNull(value, "Navigation identifier required");
        for (ReservedKey key : ReservedKey.values()) {
            if (key.getJsonName().equals(value)) {
                return new Reserved(key);
            }
        }
        return new NodeTarget(value);
    }

    static NavigationIdentifier node(String identifier) {
        return new NodeTarget(identifier);
    }

    static NavigationIdentifier exit() {
        return new Reserved(ReservedKey.EXIT);
    }

    /// Jump to a node in the same list.
    ///
    /// @param identifier target node identifier, not null
    record NodeTarget(String identifier) implements NavigationIdentifier {
        public NodeTarget {
            Objects.requireNonNull(identifier, "Target identifier required");
        }

        @Override
        public String stringValue() {
            return identifier;
        }
    }

    /// Jump to a reserved location.
    ///
    /// @param key reserved key, not null
    record Reserved(ReservedKey key) implements NavigationIdentifier {
        public Reserved {
            Objects.requireNonNull(key, "Reserved key required");
        }

        @Override
        public String stringValue() {
            return key.getJsonName();
        }
    }

    enum ReservedKey {
        /// Leave the current branch immediately.
        EXIT("exit"),
        /// The first node of the assessment. Only used when reviewing instructions.
        BEGINNING("beginning");

        private final String jsonName;

        ReservedKey(String jsonName) {
            this.jsonName = jsonName;
        }

        public String getJsonName() {
            return jsonName;
        }
    }
}
