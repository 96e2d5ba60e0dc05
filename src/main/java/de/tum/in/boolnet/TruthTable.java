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

import com.google.common.collect.ImmutableSortedMap;
import java.util.Arrays;

/**
 * For every state and every variable, the state which results when that variable updates. The
 * result either equals the state or differs from it exactly at the updated variable.
 */
public final class TruthTable {
    private static final int UNSET = -1;

    private final int variableCount;
    // Row-major: next[state * variableCount + variable] is the index of the resulting state.
    private final int[] next;

    private TruthTable(int variableCount, int[] next) {
        this.variableCount = variableCount;
        this.next = next;
    }

    public static Builder builder(int variableCount) {
        return new Builder(variableCount);
    }

    public int variableCount() {
        return variableCount;
    }

    public StateSpace stateSpace() {
        return StateSpace.of(variableCount);
    }

    public State next(State state, int variable) {
        checkArgument(state.variableCount() == variableCount, "State %s has wrong size", state);
        checkElementIndex(variable, variableCount);
        return State.of(variableCount, next[state.index() * variableCount + variable]);
    }

    /** The value of the variable after it updated in the given state. */
    public boolean nextValue(State state, int variable) {
        return next(state, variable).get(variable);
    }

    /** The results of all variables for the given state, keyed by variable index. */
    public ImmutableSortedMap<Integer, State> row(State state) {
        ImmutableSortedMap.Builder<Integer, State> row = ImmutableSortedMap.naturalOrder();
        for (int variable = 0; variable < variableCount; variable++) {
            row.put(variable, next(state, variable));
        }
        return row.build();
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof TruthTable)) {
            return false;
        }
        TruthTable that = (TruthTable) object;
        return variableCount == that.variableCount && Arrays.equals(next, that.next);
    }

    @Override
    public int hashCode() {
        return 31 * variableCount + Arrays.hashCode(next);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (State state : stateSpace()) {
            builder.append(state).append(" -> ").append(row(state).values()).append(System.lineSeparator());
        }
        return builder.toString();
    }

    public static final class Builder {
        private final int variableCount;
        private final int[] next;

        private Builder(int variableCount) {
            checkArgument(
                    0 < variableCount && variableCount <= State.MAX_VARIABLES,
                    "Variable count %s out of range",
                    variableCount);
            this.variableCount = variableCount;
            this.next = new int[(1 << variableCount) * variableCount];
            Arrays.fill(next, UNSET);
        }

        /**
         * Records the result of updating the variable in the given state.
         *
         * @throws IllegalArgumentException if the result differs from the state at any other variable.
         */
        public Builder put(State state, int variable, State result) {
            checkArgument(state.variableCount() == variableCount, "State %s has wrong size", state);
            checkArgument(result.variableCount() == variableCount, "State %s has wrong size", result);
            checkElementIndex(variable, variableCount);
            int difference = state.index() ^ result.index();
            checkArgument(
                    (difference & ~State.mask(variableCount, variable)) == 0,
                    "Updating %s in %s cannot lead to %s",
                    StateSpace.variableName(variable),
                    state,
                    result);
            next[state.index() * variableCount + variable] = result.index();
            return this;
        }

        /**
         * Creates the table.
         *
         * @throws IllegalStateException if some state has no result for some variable.
         */
        public TruthTable build() {
            for (int i = 0; i < next.length; i++) {
                if (next[i] == UNSET) {
                    throw new IllegalStateException(String.format(
                            "No result for %s in state %s",
                            StateSpace.variableName(i % variableCount),
                            State.of(variableCount, i / variableCount)));
                }
            }
            return new TruthTable(variableCount, next.clone());
        }
    }
}
