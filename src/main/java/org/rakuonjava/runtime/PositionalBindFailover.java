package org.rakuonjava.runtime;

/**
 * Capability of non-Positional producers that a parameter binder may turn into a List
 * when binding to an array-style parameter.
 */
public interface PositionalBindFailover {

    /**
     * @return the memoized List of all produced values; repeated calls return the same List
     */
    RuntimeList cache();
}
