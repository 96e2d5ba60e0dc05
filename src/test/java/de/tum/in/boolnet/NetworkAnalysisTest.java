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
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;

import java.util.BitSet;
import java.util.List;
import org.junit.jupiter.api.Test;

public class NetworkAnalysisTest {
    private static TransitionSet transitions(int variableCount, String... edges) {
        TransitionSet.Builder builder = TransitionSet.builder(variableCount);
        for (State state : StateSpace.of(variableCount)) {
            builder.addState(state);
        }
        for (String edge : edges) {
            String[] states = edge.split("->");
            builder.add(State.parse(states[0].trim()), State.parse(states[1].trim()));
        }
        return builder.build();
    }

    @Test
    public void testTwoCycleAttractor() {
        // 00 -> 01, 00 -> 10, 10 -> 00, 01 <-> 11
        TransitionSet transitions = transitions(2, "00 -> 01", "00 -> 10", "01 -> 11", "10 -> 00", "11 -> 01");
        NetworkAnalysis analysis = transitions.analyse();
        assertThat(analysis.transitionCount(), is(5));
        assertThat(analysis.parentless(), is(empty()));
        assertThat(analysis.attractors().size(), is(1));
        assertThat(analysis.attractors().get(0), contains(State.parse("01"), State.parse("11")));
        assertThat(analysis.attractorSizes(), contains(2));
        assertThat(analysis.transientStates(), contains(State.parse("00"), State.parse("10")));
        assertThat(analysis.transientComponents().size(), is(1));
        assertThat(analysis.everyStateReachesAttractor(), is(true));
    }

    @Test
    public void testFixedPointsAndParentless() {
        TransitionSet transitions = transitions(3, "000 -> 001", "000 -> 100", "001 -> 011", "100 -> 110");
        NetworkAnalysis analysis = transitions.analyse();
        assertThat(analysis.parentless(), containsInAnyOrder(
                State.parse("000"), State.parse("010"), State.parse("101"), State.parse("111")));
        assertThat(analysis.fixedPoints().size(), is(5));
        assertThat(analysis.attractorSizes(), contains(1, 1, 1, 1, 1));
        assertThat(analysis.everyStateReachesAttractor(), is(true));
    }

    @Test
    public void testCondensation() {
        TransitionSet transitions = transitions(2, "00 -> 01", "01 -> 00", "01 -> 11", "11 -> 10", "10 -> 11");
        NetworkAnalysis analysis = transitions.analyse();
        assertThat(analysis.components().size(), is(2));
        assertThat(analysis.componentSuccessors(0), contains(1));
        assertThat(analysis.isAttractor(0), is(false));
        assertThat(analysis.isAttractor(1), is(true));
        assertThat(analysis.everyStateReachesAttractor(), is(true));
    }

    @Test
    public void testStateGraph() {
        StateGraph graph = transitions(2, "00 -> 01", "01 -> 11", "11 -> 01").graph();
        assertThat(graph.size(), is(4));
        assertThat(graph.inDegrees()[0], is(0));
        assertThat(graph.inDegrees()[1], is(2));
        assertThat(graph.isClosed(new int[] {1, 3}), is(true));
        assertThat(graph.isClosed(new int[] {0, 1}), is(false));

        BitSet start = new BitSet();
        start.set(0);
        assertThat(graph.reachableFrom(start).cardinality(), is(3));
        BitSet target = new BitSet();
        target.set(3);
        BitSet reaching = graph.canReach(target);
        assertThat(reaching.get(0) && reaching.get(1) && reaching.get(3), is(true));
        assertThat(reaching.get(2), is(false));

        List<int[]> components = graph.stronglyConnectedComponents();
        assertThat(components.size(), is(3));
    }
}
