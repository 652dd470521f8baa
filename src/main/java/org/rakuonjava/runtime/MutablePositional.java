package org.rakuonjava.runtime;

/**
 * Structural mutation on top of {@link Positional}. Every element is held in its own Container.
 */
public interface MutablePositional extends Positional {

    RuntimeScalar set(int index, Object value);

    int push(Arguments values);

    int unshift(Arguments values);

    Object pop();

    Object shift();

    RuntimeList splice(int start, int count, Arguments replacement);

    MutablePositional assign(Object source);

    void clear();
}
