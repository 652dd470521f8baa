package org.rakuonjava.runtime;

/**
 * RuntimeArrayProxyEntry stands for a slot past the end of a RuntimeArray. The slot is
 * created (vivified) only when a value is assigned through the proxy; the Array then grows
 * and any gap is filled with empty Containers.
 */
public class RuntimeArrayProxyEntry extends RuntimeScalar {

    // Reference to the parent RuntimeArray
    private final RuntimeArray parent;
    // Index associated with this proxy in the parent array
    private final int key;
    // The slot Container once vivified
    private RuntimeScalar lvalue;

    /**
     * Constructs a RuntimeArrayProxyEntry for a given index in the specified parent array.
     *
     * @param parent the parent RuntimeArray
     * @param key    the index in the array for which this proxy is created
     */
    public RuntimeArrayProxyEntry(RuntimeArray parent, int key) {
        super(PLAIN_SCALAR, null);
        this.parent = parent;
        this.key = key;
    }

    /**
     * Reading before assignment yields the undefined value, unless the slot was created
     * through another path in the meantime.
     */
    @Override
    public Object get() {
        if (lvalue == null && parent.exists(key)) {
            lvalue = parent.container(key);
        }
        return lvalue == null ? null : lvalue.get();
    }

    @Override
    public RuntimeScalar set(Object newValue) {
        if (lvalue == null) {
            lvalue = parent.set(key, newValue);
            return lvalue;
        }
        return lvalue.set(newValue);
    }
}
