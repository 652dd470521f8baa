package org.rakuonjava.runtime;

import java.io.Serial;

/**
 * Thrown when a value that is not Positional is bound to an array-style target.
 */
public class NotPositionalException extends RakuRuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    public NotPositionalException(Object value) {
        super("Type check failed in binding; expected Positional but got " + ScalarUtils.typeName(value));
    }
}
