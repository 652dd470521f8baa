package org.rakuonjava.runtime;

import java.io.Serial;

/**
 * RakuRuntimeException is the base class of every contract violation reported by the
 * list runtime. Each error kind has its own subclass so callers can catch exactly the
 * condition they are prepared to handle.
 */
public class RakuRuntimeException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    public RakuRuntimeException(String message) {
        super(message);
    }

    public RakuRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }
}
