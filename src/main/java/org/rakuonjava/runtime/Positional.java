package org.rakuonjava.runtime;

/**
 * Read-only indexed access. Implemented by List, Slip, Array and Range; a Seq is not Positional.
 */
public interface Positional extends RuntimeIterable {

    /**
     * @param index 0-based position
     * @return the element value with any Container removed
     * @throws IndexOutOfRangeException when there is no element at {@code index}
     */
    Object get(int index);

    /**
     * Returns the Container holding the element. A bare element is returned inside a
     * read-only Container, so assigning through it fails.
     *
     * @param index 0-based position
     * @return the element's Container
     * @throws IndexOutOfRangeException when there is no element at {@code index}
     */
    RuntimeScalar container(int index);

    /**
     * @return the element count
     * @throws InfiniteLengthException when the value is lazy
     */
    int elems();

    default boolean isEmpty() {
        return elems() == 0;
    }
}
