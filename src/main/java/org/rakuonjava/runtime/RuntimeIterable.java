package org.rakuonjava.runtime;

import java.util.Iterator;

/**
 * Capability of values that produce their elements through a {@link RuntimeIterator}.
 * A value with this capability is flattened and counted element-wise unless it is held
 * in a Container.
 */
public interface RuntimeIterable extends Iterable<Object> {

    /**
     * @return a fresh pull iterator over the elements as stored (Containers are not unwrapped)
     */
    RuntimeIterator runtimeIterator();

    boolean isLazy();

    @Override
    default Iterator<Object> iterator() {
        return runtimeIterator().asJavaIterator();
    }
}
