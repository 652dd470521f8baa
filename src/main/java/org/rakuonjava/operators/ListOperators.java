package org.rakuonjava.operators;

import org.rakuonjava.runtime.*;

import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Entry points used by the language layers on top of the runtime: construction, coercion,
 * binding and the list-processing operations.
 *
 * <p>Every list-processing operation returns a fresh {@link RuntimeSeq} and pulls nothing
 * from its source until that Seq is pulled. Functions receive element values with
 * Containers removed; a function result that is a Slip is spliced into the output.
 */
public class ListOperators {

    /**
     * The comma operator: builds an immutable List from a slot shape.
     *
     * @param operands the operands as written at the call site
     * @return the new List
     */
    public static RuntimeList makeList(Arguments operands) {
        return RuntimeList.fromIterator(SingleArgumentRule.iterate(operands));
    }

    /**
     * Same as {@link #makeList(Arguments)} with {@link Arguments#of(Object...)}.
     */
    public static RuntimeList makeList(Object... operands) {
        return makeList(Arguments.of(operands));
    }

    /**
     * The Array composer: allocates an empty Array and assigns the operands into it.
     *
     * @param operands the operands as written at the call site
     * @return the new Array
     */
    public static RuntimeArray makeArray(Arguments operands) {
        return new RuntimeArray().assign(operands);
    }

    public static RuntimeArray makeArray(Object... operands) {
        return makeArray(Arguments.of(operands));
    }

    /**
     * Explicit boxing: the value counts as one argument wherever it goes.
     */
    public static RuntimeScalar item(Object value) {
        return RuntimeScalar.box(value);
    }

    /**
     * Wraps a value in a Slip so that construction splices its elements.
     *
     * @param value a List, Array, Range or Seq (consumed); a Container is looked into;
     *              anything else becomes a one-element Slip
     * @return the Slip
     */
    public static RuntimeList toSlip(Object value) {
        Object v = RuntimeScalar.decont(value);
        if (v instanceof RuntimeList list) {
            return list.slip();
        }
        if (v instanceof RuntimeArray array) {
            return array.list().slip();
        }
        if (v instanceof RuntimeIterable iterable) {
            return RuntimeList.fromIterator(iterable.runtimeIterator()).slip();
        }
        return RuntimeList.of(v).slip();
    }

    public static RuntimeSeq toSequence(RuntimeIterator iterator) {
        return new RuntimeSeq(iterator);
    }

    /**
     * Marks a producer as lazy: constructions and Array assignment keep it pending instead
     * of draining it.
     */
    public static RuntimeSeq lazy(Object source) {
        RuntimeIterator iterator = SingleArgumentRule.iterate(Arguments.single(source));
        return new RuntimeSeq(new RuntimeIterator() {
            @Override
            public Object pullOne() {
                return iterator.pullOne();
            }

            @Override
            public boolean isLazy() {
                return true;
            }
        });
    }

    public static RuntimeSeq flatten(Object value) {
        return Flattener.flatten(value);
    }

    /**
     * Binds a value to an array-style parameter.
     *
     * @param value         the argument; a Container is looked into
     * @param allowFailover whether a Seq may be bound through its cache
     * @return the Positional to bind
     * @throws NotPositionalException if the value is not Positional and no failover applies
     */
    public static Positional bindToArrayParam(Object value, boolean allowFailover) {
        Object v = RuntimeScalar.decont(value);
        if (v instanceof Positional positional) {
            return positional;
        }
        if (allowFailover && v instanceof PositionalBindFailover failover) {
            return failover.cache();
        }
        throw new NotPositionalException(v);
    }

    /**
     * Binds a value to an array variable. A Seq is never cached here.
     */
    public static Positional bindToArrayVariable(Object value) {
        return bindToArrayParam(value, false);
    }

    /**
     * Transforms each element of the source.
     *
     * @param source iterated with the single argument rule
     * @param fn     the transformation
     * @return a lazy-if-the-source-is sequence of results
     */
    public static RuntimeSeq map(Object source, Function<Object, Object> fn) {
        RuntimeIterator input = SingleArgumentRule.iterate(Arguments.single(source));
        return new RuntimeSeq(new RuntimeIterator() {
            private RuntimeIterator pending;
            private boolean done;

            @Override
            public Object pullOne() {
                while (true) {
                    if (pending != null) {
                        Object value = pending.pullOne();
                        if (value != IterationEnd.END) {
                            return value;
                        }
                        pending = null;
                    }
                    if (done) {
                        return IterationEnd.END;
                    }
                    Object element = input.pullOne();
                    if (element == IterationEnd.END) {
                        done = true;
                        return IterationEnd.END;
                    }
                    Object mapped = fn.apply(RuntimeScalar.decont(element));
                    if (mapped instanceof RuntimeList list && list.isSlip()) {
                        pending = list.runtimeIterator();
                    } else {
                        return mapped;
                    }
                }
            }

            @Override
            public boolean isLazy() {
                return input.isLazy();
            }
        });
    }

    /**
     * Keeps the elements for which the predicate holds. Kept elements are yielded as stored,
     * so Containers of the source stay shared.
     */
    public static RuntimeSeq grep(Object source, Predicate<Object> predicate) {
        RuntimeIterator input = SingleArgumentRule.iterate(Arguments.single(source));
        return new RuntimeSeq(new RuntimeIterator() {
            private boolean done;

            @Override
            public Object pullOne() {
                while (!done) {
                    Object element = input.pullOne();
                    if (element == IterationEnd.END) {
                        done = true;
                        break;
                    }
                    if (predicate.test(RuntimeScalar.decont(element))) {
                        return element;
                    }
                }
                return IterationEnd.END;
            }

            @Override
            public boolean isLazy() {
                return input.isLazy();
            }
        });
    }

    /**
     * Pairs up elements of two sources into two-element Lists, stopping at the shorter one.
     */
    public static RuntimeSeq zip(Object left, Object right) {
        RuntimeIterator a = SingleArgumentRule.iterate(Arguments.single(left));
        RuntimeIterator b = SingleArgumentRule.iterate(Arguments.single(right));
        return new RuntimeSeq(new RuntimeIterator() {
            private boolean done;

            @Override
            public Object pullOne() {
                if (done) {
                    return IterationEnd.END;
                }
                Object x = a.pullOne();
                Object y = x == IterationEnd.END ? IterationEnd.END : b.pullOne();
                if (y == IterationEnd.END) {
                    done = true;
                    return IterationEnd.END;
                }
                return RuntimeList.of(x, y);
            }

            @Override
            public boolean isLazy() {
                return a.isLazy() && b.isLazy();
            }
        });
    }

    /**
     * Takes at most {@code count} elements; the result is never lazy.
     */
    public static RuntimeSeq head(Object source, int count) {
        RuntimeIterator input = SingleArgumentRule.iterate(Arguments.single(source));
        return new RuntimeSeq(new RuntimeIterator() {
            private int taken = 0;

            @Override
            public Object pullOne() {
                if (taken >= count) {
                    return IterationEnd.END;
                }
                Object element = input.pullOne();
                if (element == IterationEnd.END) {
                    taken = count;
                    return IterationEnd.END;
                }
                taken++;
                return element;
            }
        });
    }

    /**
     * An infinite lazy sequence: {@code seed}, {@code next(seed)}, {@code next(next(seed))}, ...
     */
    public static RuntimeSeq sequence(Object seed, UnaryOperator<Object> next) {
        return new RuntimeSeq(new RuntimeIterator() {
            private Object current = seed;
            private boolean started;

            @Override
            public Object pullOne() {
                if (started) {
                    current = next.apply(current);
                }
                started = true;
                return current;
            }

            @Override
            public boolean isLazy() {
                return true;
            }
        });
    }

    /**
     * Forces a value: a Seq is cached, a List fully reified.
     *
     * @throws InfiniteLengthException for lazy values
     */
    public static Object eager(Object value) {
        Object v = RuntimeScalar.decont(value);
        if (v instanceof RuntimeSeq seq) {
            return seq.eager();
        }
        if (v instanceof RuntimeList list) {
            return list.eager();
        }
        if (v instanceof RuntimeIterable iterable && iterable.isLazy()) {
            throw new InfiniteLengthException("eager");
        }
        return v;
    }
}
