package io.assessmodel.core.exception;

import java.io.Serial;

/// Base type for failures raised while building or walking a node graph.
///
/// @see DuplicateIdentifierException for configuration errors
/// @see NodeNotFoundException for runtime resolution errors
public class NavigationException extends Exception {
    @Serial private static final long serialVersionUID = 3620911957472460315L;

    public NavigationException(String message) {
        super(message);
    }
}
