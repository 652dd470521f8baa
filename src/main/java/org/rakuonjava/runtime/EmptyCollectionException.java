package org.rakuonjava.runtime;

import java.io.Serial;

/**
 * Thrown by pop and shift on an Array without elements.
 */
public class EmptyCollectionException extends RakuRuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    public EmptyCollectionException(String operation) {
        super("Cannot " + operation + " from an empty Array");
    }
}
