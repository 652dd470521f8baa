package org.rakuonjava.runtime;

/**
 * The RuntimeScalar class is the Container of the runtime: a single assignable slot.
 *
 * <p>A Container is the only place where a value can change. Lists never change their
 * elements; Arrays change elements by assigning into the Container of each slot. Several
 * Lists and Arrays may hold the same Container, in which case an assignment through one of
 * them is visible through all of them.
 *
 * <p>Putting a value in a Container is always an explicit call ({@link #box(Object)} or
 * {@link #readOnly(Object)}); a Container-held value counts as a single argument everywhere.
 */
public class RuntimeScalar {

    public static final int PLAIN_SCALAR = 0;
    public static final int READONLY_SCALAR = 1;

    // PLAIN_SCALAR or READONLY_SCALAR
    public final int type;
    // Current value; null is the undefined value
    Object value;

    // Empty mutable Container
    public RuntimeScalar() {
        this(PLAIN_SCALAR, null);
    }

    public RuntimeScalar(Object value) {
        this(PLAIN_SCALAR, value);
    }

    protected RuntimeScalar(int type, Object value) {
        this.type = type;
        this.value = decont(value);
    }

    /**
     * Puts a value in a fresh mutable Container. If the value is itself a Container, its
     * current value is copied.
     *
     * @param value the value to box
     * @return a new mutable Container
     */
    public static RuntimeScalar box(Object value) {
        return new RuntimeScalar(PLAIN_SCALAR, value);
    }

    /**
     * Puts a value in a fresh Container that rejects assignment.
     *
     * @param value the value to hold
     * @return a new read-only Container
     */
    public static RuntimeScalar readOnly(Object value) {
        return new RuntimeScalar(READONLY_SCALAR, value);
    }

    /**
     * Removes one level of Container.
     *
     * @param value any value
     * @return the value held by the Container, or {@code value} itself
     */
    public static Object decont(Object value) {
        if (value instanceof RuntimeScalar scalar) {
            return scalar.get();
        }
        return value;
    }

    public Object get() {
        return value;
    }

    /**
     * Assigns a new value. Containers are never nested: assigning a Container copies its value.
     *
     * @param newValue the value to store
     * @return this Container
     * @throws ImmutableAssignmentException if this Container is read-only
     */
    public RuntimeScalar set(Object newValue) {
        return switch (type) {
            case PLAIN_SCALAR -> {
                this.value = decont(newValue);
                yield this;
            }
            case READONLY_SCALAR -> throw new ImmutableAssignmentException(value);
            default -> throw new IllegalStateException("Unknown scalar type: " + type);
        };
    }

    public boolean isReadOnly() {
        return type == READONLY_SCALAR;
    }

    public boolean isDefined() {
        return get() != null;
    }

    @Override
    public String toString() {
        return ScalarUtils.display(get());
    }
}
