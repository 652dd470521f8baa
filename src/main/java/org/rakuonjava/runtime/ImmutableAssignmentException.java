package org.rakuonjava.runtime;

import java.io.Serial;

/**
 * Thrown when a value is assigned through something that is not a mutable Container,
 * such as a bare element of a List.
 */
public class ImmutableAssignmentException extends RakuRuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    public ImmutableAssignmentException(Object value) {
        super("Cannot modify an immutable " + ScalarUtils.typeName(value) + " (" + ScalarUtils.display(value) + ")");
    }
}
