package org.rakuonjava.runtime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The shape of a syntactic slot that conceptually takes "the list": either one operand
 * written on its own, or operands joined by the comma operator.
 *
 * <p>A single operand with a trailing comma is comma-built ({@code comma(x)}), which is
 * different from the operand on its own ({@code single(x)}). Parentheses used only for
 * grouping have no representation here: they never change the shape.
 */
public final class Arguments {

    private static final Arguments NONE = new Arguments(Collections.emptyList(), true);

    private final List<Object> operands;
    private final boolean commaBuilt;

    private Arguments(List<Object> operands, boolean commaBuilt) {
        this.operands = operands;
        this.commaBuilt = commaBuilt;
    }

    /**
     * One operand, not built by a comma at this call site.
     */
    public static Arguments single(Object operand) {
        List<Object> list = new ArrayList<>(1);
        list.add(operand);
        return new Arguments(Collections.unmodifiableList(list), false);
    }

    /**
     * Operands joined by the comma operator. {@code comma(x)} is {@code x} with a trailing comma.
     */
    public static Arguments comma(Object... operands) {
        if (operands.length == 0) {
            return NONE;
        }
        return new Arguments(Collections.unmodifiableList(new ArrayList<>(Arrays.asList(operands))), true);
    }

    /**
     * Builds the shape the way source text reads: one operand on its own is {@link #single},
     * anything else is {@link #comma}.
     */
    public static Arguments of(Object... operands) {
        if (operands.length == 1) {
            return single(operands[0]);
        }
        return comma(operands);
    }

    public static Arguments none() {
        return NONE;
    }

    public List<Object> operands() {
        return operands;
    }

    public boolean isCommaBuilt() {
        return commaBuilt;
    }

    public int size() {
        return operands.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < operands.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(ScalarUtils.display(operands.get(i)));
        }
        if (commaBuilt && operands.size() == 1) {
            sb.append(',');
        }
        return sb.toString();
    }
}
