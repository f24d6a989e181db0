package io.assessmodel.core.exception;

import java.io.Serial;
import java.util.Set;

/// Thrown when a node list contains two nodes with the same identifier.
///
/// This is a configuration error: the assessment definition itself is invalid and the
/// navigator for it can never be built.
public class DuplicateIdentifierException extends NavigationException {
    @Serial private static final long serialVersionUID = -1864205720393152846L;

    private final String branchIdentifier;
    private final Set<String> duplicates;

    public DuplicateIdentifierException(String branchIdentifier, Set<String> duplicates) {
        super("Node identifiers in '" + branchIdentifier + "' are not unique: " + duplicates);
        this.branchIdentifier = branchIdentifier;
        this.duplicates = Set.copyOf(duplicates);
    }

    public String getBranchIdentifier() {
        return branchIdentifier;
    }

    public Set<String> getDuplicates() {
        return duplicates;
    }
}
