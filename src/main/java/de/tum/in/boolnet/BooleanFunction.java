/*
 * This file is part of BoolNet.
 * Copyright (c) 2026 The BoolNet Authors.
 *
 * BoolNet is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * BoolNet is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with BoolNet. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.boolnet;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

import java.util.BitSet;

/**
 * The update function of one variable of a network.
 *
 * <p>Equality is semantic: two functions are equal if they update the same variable of networks of
 * the same size and agree on all {@code 2^n} states, regardless of how their expressions are
 * written.</p>
 */
public final class BooleanFunction {
    private final int variable;
    private final int variableCount;
    private final Expression expression;
    private final String formula;
    private final BitSet minterms;

    private BooleanFunction(int variable, int variableCount, Expression expression, String formula, BitSet minterms) {
        this.variable = variable;
        this.variableCount = variableCount;
        this.expression = expression;
        this.formula = formula;
        this.minterms = minterms;
    }

    /**
     * Creates the update function of the given variable.
     *
     * @throws IllegalArgumentException if the expression references a variable outside of
     *     {@code x1, ..., x<variableCount>}.
     */
    public static BooleanFunction of(int variable, int variableCount, Expression expression) {
        checkElementIndex(variable, variableCount);
        BitSet variables = expression.variables();
        if (variables.length() > variableCount) {
            throw new IllegalArgumentException(String.format(
                    "Expression %s references undefined variable %s",
                    expression,
                    StateSpace.variableName(variables.length() - 1)));
        }
        BitSet minterms = new BitSet(1 << variableCount);
        for (State state : StateSpace.of(variableCount)) {
            if (expression.evaluate(state)) {
                minterms.set(state.index());
            }
        }
        return new BooleanFunction(variable, variableCount, expression, expression.toString(), minterms);
    }

    public static BooleanFunction of(int variable, SumOfProducts sum) {
        checkElementIndex(variable, sum.variableCount());
        return new BooleanFunction(variable, sum.variableCount(), sum.toExpression(), sum.toString(), sum.minterms());
    }

    public int variable() {
        return variable;
    }

    public int variableCount() {
        return variableCount;
    }

    public Expression expression() {
        return expression;
    }

    public boolean evaluate(State state) {
        checkArgument(state.variableCount() == variableCount, "State %s has wrong size", state);
        return minterms.get(state.index());
    }

    /** The indices of all states on which the function is {@code true}. */
    public BitSet minterms() {
        return BitSets.copyOf(minterms);
    }

    /** The variables the function actually depends on. */
    public BitSet support() {
        BitSet support = new BitSet(variableCount);
        int size = 1 << variableCount;
        for (int variable = 0; variable < variableCount; variable++) {
            int bit = State.mask(variableCount, variable);
            for (int index = 0; index < size; index++) {
                if ((index & bit) == 0 && minterms.get(index) != minterms.get(index | bit)) {
                    support.set(variable);
                    break;
                }
            }
        }
        return support;
    }

    /** Whether both functions agree on all states, irrespective of the variable they update. */
    public boolean isEquivalent(BooleanFunction other) {
        return variableCount == other.variableCount && minterms.equals(other.minterms);
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof BooleanFunction)) {
            return false;
        }
        BooleanFunction that = (BooleanFunction) object;
        return variable == that.variable && isEquivalent(that);
    }

    @Override
    public int hashCode() {
        return (31 * variable + variableCount) * 31 + minterms.hashCode();
    }

    /** The expression in the literal syntax. */
    @Override
    public String toString() {
        return formula;
    }
}
