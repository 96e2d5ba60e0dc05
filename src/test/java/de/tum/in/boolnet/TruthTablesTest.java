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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

public class TruthTablesTest {
    private static TransitionSet example() {
        return TransitionSet.builder(2)
                .add(State.parse("00"), State.parse("01"))
                .add(State.parse("00"), State.parse("10"))
                .add(State.parse("01"), State.parse("11"))
                .add(State.parse("10"), State.parse("00"))
                .add(State.parse("11"), State.parse("01"))
                .build();
    }

    @Test
    public void testRecordedTransitions() {
        TruthTable table = TruthTables.fromTransitions(example());
        assertThat(table.next(State.parse("00"), 0), is(State.parse("10")));
        assertThat(table.next(State.parse("00"), 1), is(State.parse("01")));
        assertThat(table.next(State.parse("01"), 0), is(State.parse("11")));
    }

    @Test
    public void testMissingTransitionIsFlippedByDefault() {
        TruthTable table = TruthTables.fromTransitions(example());
        // Neither "01" nor "10" has a transition flipping x2
        assertThat(table.next(State.parse("01"), 1), is(State.parse("00")));
        assertThat(table.next(State.parse("10"), 1), is(State.parse("11")));
        assertThat(table.nextValue(State.parse("10"), 1), is(true));
    }

    @Test
    public void testMissingTransitionAsSelfLoop() {
        TruthTable table = TruthTables.fromTransitions(example(), MissingTransitionPolicy.SELF_LOOP);
        assertThat(table.next(State.parse("00"), 0), is(State.parse("10")));
        assertThat(table.next(State.parse("01"), 1), is(State.parse("01")));
        assertThat(table.next(State.parse("10"), 1), is(State.parse("10")));
        assertThat(table.nextValue(State.parse("10"), 1), is(false));
    }

    @Test
    public void testResultsDifferAtMostInUpdatedVariable() {
        for (MissingTransitionPolicy policy : MissingTransitionPolicy.values()) {
            TruthTable table = TruthTables.fromTransitions(example(), policy);
            for (State state : table.stateSpace()) {
                table.row(state).forEach((variable, result) -> {
                    int difference = state.distance(result);
                    assertThat(difference <= 1, is(true));
                    assertThat(difference == 0 || state.differingVariable(result) == variable, is(true));
                });
            }
        }
    }

    @Test
    public void testFromNetwork() throws InvalidFormatException {
        // x1' = x2, x2' = ~x1
        BooleanNetwork network = BooleanNetwork.of(List.of(
                BooleanFunction.of(0, 2, ExpressionParser.parse("x2", 2)),
                BooleanFunction.of(1, 2, ExpressionParser.parse("~x1", 2))));
        TruthTable table = TruthTables.fromNetwork(network);
        assertThat(table.next(State.parse("00"), 0), is(State.parse("00")));
        assertThat(table.next(State.parse("00"), 1), is(State.parse("01")));
        assertThat(table.next(State.parse("01"), 0), is(State.parse("11")));
        assertThat(table.next(State.parse("11"), 1), is(State.parse("10")));
        assertThat(table.next(State.parse("10"), 0), is(State.parse("00")));
    }

    @Test
    public void testPoliciesOnSimulatedTransitions() {
        BooleanNetwork network = RandomNetworks.network(7, 4, 4);
        TransitionSet transitions = network.transitions();
        assertThat(TruthTables.fromTransitions(transitions, MissingTransitionPolicy.SELF_LOOP),
                is(TruthTables.fromNetwork(network)));

        TruthTable flipped = TruthTables.fromTransitions(transitions, MissingTransitionPolicy.FLIP);
        for (State state : flipped.stateSpace()) {
            for (int variable = 0; variable < 4; variable++) {
                assertThat(flipped.next(state, variable), is(state.flip(variable)));
            }
        }
    }

    @Test
    public void testBuilderRejectsMalformedRows() {
        TruthTable.Builder builder = TruthTable.builder(2);
        assertThrows(IllegalArgumentException.class,
                () -> builder.put(State.parse("00"), 0, State.parse("01")));
        assertThrows(IllegalArgumentException.class,
                () -> builder.put(State.parse("00"), 0, State.parse("11")));
        builder.put(State.parse("00"), 0, State.parse("10"));
        assertThrows(IllegalStateException.class, builder::build);
    }
}
