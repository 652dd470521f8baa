package org.rakuonjava.runtime;

import java.io.Serial;

/**
 * Thrown when a one-shot sequence is iterated a second time.
 */
public class AlreadyConsumedException extends RakuRuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    private final SeqState state;

    public AlreadyConsumedException(SeqState state) {
        super("The iterator of this Seq is already in use/consumed by another Seq (state " + state
                + "); call cache on it before the first use, or assign it into an Array");
        this.state = state;
    }

    public SeqState getState() {
        return state;
    }
}
