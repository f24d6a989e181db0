package io.assessmodel.core.exception;

import java.io.Serial;

/// Thrown when a survey rule or `nextNode` pointer names an identifier that is not part
/// of the node list being navigated.
public class NodeNotFoundException extends NavigationException {
    @Serial private static final long serialVersionUID = 7105236617340991224L;

    private final String identifier;

    public NodeNotFoundException(String branchIdentifier, String identifier) {
        super("Node '" + identifier + "' not found in '" + branchIdentifier + "'");
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
