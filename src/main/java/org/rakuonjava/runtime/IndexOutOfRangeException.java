package org.rakuonjava.runtime;

import java.io.Serial;

public class IndexOutOfRangeException extends RakuRuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    private final long index;

    public IndexOutOfRangeException(long index, int size) {
        super(size == 0
                ? "Index out of range. Is: " + index + ", should be in nothing (the collection is empty)"
                : "Index out of range. Is: " + index + ", should be in 0.." + (size - 1));
        this.index = index;
    }

    public IndexOutOfRangeException(String message, long index) {
        super(message);
        this.index = index;
    }

    public long getIndex() {
        return index;
    }
}
