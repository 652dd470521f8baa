package org.rakuonjava.runtime;

import java.io.Serial;

/**
 * Reports the failure of a parallel materialization. The first failing work unit is the
 * cause; failures of other units that had already finished are attached as suppressed
 * exceptions.
 */
public class WorkUnitFailureException extends RakuRuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    private final int batchIndex;

    public WorkUnitFailureException(int batchIndex, Throwable cause) {
        super("A work unit failed (batch " + batchIndex + "): " + cause, cause);
        this.batchIndex = batchIndex;
    }

    public WorkUnitFailureException(String message, Throwable cause) {
        super(message, cause);
        this.batchIndex = -1;
    }

    /**
     * @return the index of the first failing batch, or -1 when the failure is not tied to a batch
     */
    public int getBatchIndex() {
        return batchIndex;
    }
}
