package org.rakuonjava.runtime;

import java.util.Objects;

/**
 * Helpers shared by the value classes: type names for messages, display strings and
 * value equality on decontainerized values.
 */
public final class ScalarUtils {

    private ScalarUtils() {
    }

    /**
     * Returns the name used for a value in error messages.
     */
    public static String typeName(Object value) {
        if (value == null) {
            return "Any";
        }
        if (value instanceof RuntimeScalar) {
            return "Scalar";
        }
        if (value instanceof RuntimeList list) {
            return list.isSlip() ? "Slip" : "List";
        }
        if (value instanceof RuntimeArray) {
            return "Array";
        }
        if (value instanceof RuntimeHyperSeq hyperSeq) {
            return hyperSeq.type == RuntimeHyperSeq.RACE ? "RaceSeq" : "HyperSeq";
        }
        if (value instanceof RuntimeSeq) {
            return "Seq";
        }
        if (value instanceof RuntimeRange) {
            return "Range";
        }
        if (value instanceof Integer || value instanceof Long) {
            return "Int";
        }
        if (value instanceof Double || value instanceof Float) {
            return "Num";
        }
        if (value instanceof String) {
            return "Str";
        }
        if (value instanceof Boolean) {
            return "Bool";
        }
        return value.getClass().getSimpleName();
    }

    /**
     * Returns the display form of a value; Containers show the value they hold.
     */
    public static String display(Object value) {
        Object v = RuntimeScalar.decont(value);
        if (v == null) {
            return "(Any)";
        }
        if (v instanceof String s) {
            return s;
        }
        return v.toString();
    }

    /**
     * Compares two values after removing Containers. Nested runtime collections are
     * compared element by element.
     */
    public static boolean valueEquals(Object a, Object b) {
        Object left = RuntimeScalar.decont(a);
        Object right = RuntimeScalar.decont(b);
        if (left instanceof Positional l && right instanceof Positional r
                && !(left instanceof RuntimeRange) && !(right instanceof RuntimeRange)) {
            int size = l.elems();
            if (size != r.elems()) {
                return false;
            }
            for (int i = 0; i < size; i++) {
                if (!valueEquals(l.get(i), r.get(i))) {
                    return false;
                }
            }
            return true;
        }
        if (left instanceof Number ln && right instanceof Number rn
                && !(left instanceof Double) && !(right instanceof Double)) {
            return ln.longValue() == rn.longValue();
        }
        return Objects.equals(left, right);
    }
}
