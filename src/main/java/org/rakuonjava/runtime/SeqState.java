package org.rakuonjava.runtime;

/**
 * Lifecycle of a one-shot sequence. CONSUMED and CACHED are terminal for iteration;
 * CACHED still answers repeated cache calls with the stored List.
 */
public enum SeqState {
    FRESH,
    CONSUMING,
    CACHED,
    CONSUMED
}
