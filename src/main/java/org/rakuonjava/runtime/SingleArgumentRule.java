package org.rakuonjava.runtime;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides how many arguments a slot that takes "the list" really receives.
 *
 * <ol>
 *   <li>One operand held in a Container is one argument, whatever it holds.</li>
 *   <li>One bare iterable operand (List, Array, Range, Seq) gives one argument per element.</li>
 *   <li>Comma-built operands give one argument per operand; Slip operands are exploded
 *       into their elements first.</li>
 * </ol>
 * A single operand that is neither a Container nor iterable is one argument.
 */
public final class SingleArgumentRule {

    private SingleArgumentRule() {
    }

    /**
     * Returns an iterator over the effective arguments. Nothing is pulled from lazy
     * operands until the iterator is pulled.
     *
     * @param args the slot shape
     * @return the effective arguments, Containers preserved
     */
    public static RuntimeIterator iterate(Arguments args) {
        if (!args.isCommaBuilt()) {
            Object operand = args.operands().get(0);
            if (operand instanceof RuntimeScalar) {
                return RuntimeIterator.single(operand);
            }
            if (operand instanceof RuntimeIterable iterable) {
                return iterable.runtimeIterator();
            }
            return RuntimeIterator.single(operand);
        }
        return new CommaIterator(args.operands());
    }

    /**
     * Resolves the effective arguments eagerly.
     *
     * @throws InfiniteLengthException when the effective arguments come from a lazy producer
     */
    public static List<Object> resolve(Arguments args) {
        RuntimeIterator iterator = iterate(args);
        if (iterator.isLazy()) {
            throw new InfiniteLengthException("eager");
        }
        List<Object> result = new ArrayList<>();
        iterator.pushAll(result);
        return result;
    }

    /**
     * Counts the effective arguments without consuming Seq operands when the count is
     * known up front.
     */
    public static int count(Arguments args) {
        if (!args.isCommaBuilt()) {
            Object operand = args.operands().get(0);
            if (operand instanceof RuntimeScalar) {
                return 1;
            }
            if (operand instanceof Positional positional) {
                return positional.elems();
            }
            if (operand instanceof RuntimeIterable) {
                return resolve(args).size();
            }
            return 1;
        }
        int count = 0;
        for (Object operand : args.operands()) {
            if (operand instanceof RuntimeList list && list.isSlip()) {
                count += list.elems();
            } else {
                count++;
            }
        }
        return count;
    }

    /**
     * Yields each comma operand as one value, exploding Slips in place.
     */
    private static final class CommaIterator implements RuntimeIterator {
        private final List<Object> operands;
        private final boolean lazy;
        private int index = 0;
        private RuntimeIterator slip;

        CommaIterator(List<Object> operands) {
            this.operands = operands;
            boolean anyLazy = false;
            for (Object operand : operands) {
                if (operand instanceof RuntimeList list && list.isSlip() && list.isLazy()) {
                    anyLazy = true;
                    break;
                }
            }
            this.lazy = anyLazy;
        }

        @Override
        public Object pullOne() {
            while (true) {
                if (slip != null) {
                    Object value = slip.pullOne();
                    if (value != IterationEnd.END) {
                        return value;
                    }
                    slip = null;
                }
                if (index >= operands.size()) {
                    return IterationEnd.END;
                }
                Object operand = operands.get(index++);
                if (operand instanceof RuntimeList list && list.isSlip()) {
                    slip = list.runtimeIterator();
                } else {
                    return operand;
                }
            }
        }

        @Override
        public boolean isLazy() {
            return lazy;
        }
    }
}
