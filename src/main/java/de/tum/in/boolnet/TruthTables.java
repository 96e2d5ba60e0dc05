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

import java.util.logging.Level;
import java.util.logging.Logger;

/** Builds truth tables from transition sets and from networks. */
public final class TruthTables {
    private static final Logger logger = Logger.getLogger(TruthTables.class.getName());

    private TruthTables() {}

    /** Equivalent to {@code fromTransitions(transitions, MissingTransitionPolicy.FLIP)}. */
    public static TruthTable fromTransitions(TransitionSet transitions) {
        return fromTransitions(transitions, MissingTransitionPolicy.FLIP);
    }

    /**
     * Records for each state and variable the recorded transition flipping that variable, or the
     * state chosen by the policy if there is none.
     */
    public static TruthTable fromTransitions(TransitionSet transitions, MissingTransitionPolicy policy) {
        int variableCount = transitions.variableCount();
        TruthTable.Builder builder = TruthTable.builder(variableCount);
        int missing = 0;
        for (State state : transitions.stateSpace()) {
            for (int variable = 0; variable < variableCount; variable++) {
                State flipped = state.flip(variable);
                if (transitions.contains(state, flipped)) {
                    builder.put(state, variable, flipped);
                } else {
                    builder.put(state, variable, policy.resolve(state, variable));
                    missing += 1;
                }
            }
        }
        logger.log(Level.FINE, "Resolved {0} missing transitions with policy {1}", new Object[] {missing, policy});
        return builder.build();
    }

    /**
     * Evaluates every update function in every state. The result is the flipped state if the
     * function disagrees with the current value and the state itself otherwise.
     */
    public static TruthTable fromNetwork(BooleanNetwork network) {
        int variableCount = network.variableCount();
        TruthTable.Builder builder = TruthTable.builder(variableCount);
        for (State state : StateSpace.of(variableCount)) {
            for (int variable = 0; variable < variableCount; variable++) {
                boolean value = network.nextValue(state, variable);
                builder.put(state, variable, state.with(variable, value));
            }
        }
        return builder.build();
    }
}
