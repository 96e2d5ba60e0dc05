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

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A Boolean network given by one update function per variable. Under asynchronous semantics a
 * state {@code s} may move to {@code s} with variable {@code i} flipped whenever
 * {@code f_i(s) != s_i}.
 */
public final class BooleanNetwork {
    private final ImmutableList<BooleanFunction> functions;

    private BooleanNetwork(ImmutableList<BooleanFunction> functions) {
        this.functions = functions;
    }

    /**
     * Creates a network from the update functions of {@code x1, ..., xn}, in that order.
     *
     * @throws IllegalArgumentException if the functions are not given for exactly the variables of a
     *     network of their size, in order.
     */
    public static BooleanNetwork of(List<BooleanFunction> functions) {
        checkArgument(!functions.isEmpty(), "A network needs at least one variable");
        int variableCount = functions.size();
        for (int i = 0; i < variableCount; i++) {
            BooleanFunction function = functions.get(i);
            checkArgument(
                    function.variable() == i && function.variableCount() == variableCount,
                    "Function %s at position %s does not update variable %s of %s",
                    function,
                    i,
                    StateSpace.variableName(i),
                    variableCount);
        }
        return new BooleanNetwork(ImmutableList.copyOf(functions));
    }

    public int variableCount() {
        return functions.size();
    }

    public ImmutableList<BooleanFunction> functions() {
        return functions;
    }

    public BooleanFunction function(int variable) {
        return functions.get(variable);
    }

    public boolean nextValue(State state, int variable) {
        return functions.get(variable).evaluate(state);
    }

    /**
     * Simulates all single-variable updates of all states. States where no update changes anything
     * are registered without successors.
     */
    public TransitionSet transitions() {
        int variableCount = variableCount();
        TransitionSet.Builder builder = TransitionSet.builder(variableCount);
        for (State state : StateSpace.of(variableCount)) {
            builder.addState(state);
            for (int variable = 0; variable < variableCount; variable++) {
                if (nextValue(state, variable) != state.get(variable)) {
                    builder.add(state, state.flip(variable));
                }
            }
        }
        return builder.build();
    }

    @Override
    public boolean equals(Object object) {
        return this == object
                || (object instanceof BooleanNetwork && ((BooleanNetwork) object).functions.equals(functions));
    }

    @Override
    public int hashCode() {
        return functions.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (BooleanFunction function : functions) {
            builder.append(StateSpace.variableName(function.variable()))
                    .append(" = ")
                    .append(function)
                    .append(System.lineSeparator());
        }
        return builder.toString();
    }
}
