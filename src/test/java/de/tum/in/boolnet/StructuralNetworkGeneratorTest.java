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
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

public class StructuralNetworkGeneratorTest {
    static Stream<Arguments> configurations() {
        return Stream.of(
                Arguments.of(7, 8, List.of(64, 1, 1)),
                Arguments.of(7, 8, List.of(4, 4, 4)),
                Arguments.of(4, 2, List.of(4, 2)),
                Arguments.of(4, 3, List.of(2, 2, 1)),
                Arguments.of(5, 0, List.of(8)),
                Arguments.of(6, 5, List.of(6, 1, 10)),
                Arguments.of(3, 0, List.of(8)));
    }

    private static StructuralNetworkConfiguration configuration(
            int variableCount, int parentlessCount, List<Integer> attractorSizes, long seed) {
        return ImmutableStructuralNetworkConfiguration.builder()
                .variableCount(variableCount)
                .parentlessCount(parentlessCount)
                .attractorSizes(attractorSizes)
                .seed(seed)
                .build();
    }

    @Test
    public void testDefaultExample() throws StructuralInfeasibleException {
        StructuralNetwork network = new StructuralNetworkGenerator(configuration(7, 8, List.of(64, 1, 1), 42)).generate();
        TransitionSet transitions = network.transitions();
        assertThat(transitions.states().size(), is(128));

        int[] inDegrees = transitions.graph().inDegrees();
        int sources = 0;
        for (int degree : inDegrees) {
            if (degree == 0) {
                sources += 1;
            }
        }
        assertThat(sources, is(8));

        NetworkAnalysis analysis = transitions.analyse();
        assertThat(analysis.attractors().size(), is(3));
        assertThat(analysis.attractorSizes(), contains(64, 1, 1));
        assertThat(analysis.everyStateReachesAttractor(), is(true));
    }

    @ParameterizedTest(name = "{0} variables, {1} parentless, attractors {2}")
    @MethodSource("configurations")
    public void testRequestedStructure(int variableCount, int parentlessCount, List<Integer> sizes)
            throws StructuralInfeasibleException {
        StructuralNetwork network =
                new StructuralNetworkGenerator(configuration(variableCount, parentlessCount, sizes, 1)).generate();
        NetworkAnalysis analysis = network.analyse();

        assertThat(analysis.parentless().size(), is(parentlessCount));
        assertThat(analysis.parentless(), is(network.parentless()));
        List<Integer> expected = new ArrayList<>(sizes);
        expected.sort(Comparator.reverseOrder());
        assertThat(analysis.attractorSizes(), is(expected));
        assertThat(analysis.everyStateReachesAttractor(), is(true));
        assertThat(analysis.transientStates(), is(network.transientStates()));

        for (Transition transition : network.transitions().transitions()) {
            assertThat(transition.source().distance(transition.target()), is(1));
            assertThat(network.parentless().contains(transition.target()), is(false));
        }

        // Attractors are closed cycles of single flips.
        for (List<State> cycle : network.attractors()) {
            for (int i = 0; i < cycle.size(); i++) {
                State state = cycle.get(i);
                if (cycle.size() == 1) {
                    assertThat(network.transitions().successors(state).isEmpty(), is(true));
                } else {
                    assertThat(network.transitions().successors(state),
                            contains(cycle.get((i + 1) % cycle.size())));
                }
            }
        }

        // The transient region is a single strongly connected component.
        int transientComponents = 0;
        for (Set<State> component : analysis.transientComponents()) {
            if (!network.parentless().containsAll(component)) {
                transientComponents += 1;
                assertThat(component.size(), is(network.transientStates().size()));
            }
        }
        assertThat(transientComponents, is(network.transientStates().isEmpty() ? 0 : 1));
    }

    @Test
    public void testReproducible() throws StructuralInfeasibleException {
        StructuralNetworkConfiguration configuration = configuration(6, 4, List.of(4, 2, 1), 7);
        TransitionSet first = new StructuralNetworkGenerator(configuration).generate().transitions();
        TransitionSet second = new StructuralNetworkGenerator(configuration).generate().transitions();
        assertThat(first, is(second));
    }

    @Test
    public void testInfeasibleParameters() {
        StructuralInfeasibleException odd = assertThrows(StructuralInfeasibleException.class,
                () -> new StructuralNetworkGenerator(configuration(4, 2, List.of(3), 0)).generate());
        assertThat(odd.parameter(), is("attractorSizes"));

        StructuralInfeasibleException tooLarge = assertThrows(StructuralInfeasibleException.class,
                () -> new StructuralNetworkGenerator(configuration(3, 0, List.of(16), 0)).generate());
        assertThat(tooLarge.parameter(), is("attractorSizes"));

        StructuralInfeasibleException tooManyAttractorStates = assertThrows(StructuralInfeasibleException.class,
                () -> new StructuralNetworkGenerator(configuration(3, 0, List.of(8, 2), 0)).generate());
        assertThat(tooManyAttractorStates.parameter(), is("attractorSizes"));

        StructuralInfeasibleException parentless = assertThrows(StructuralInfeasibleException.class,
                () -> new StructuralNetworkGenerator(configuration(7, 125, List.of(4), 0)).generate());
        assertThat(parentless.parameter(), is("parentlessCount"));

        StructuralInfeasibleException noAttractor = assertThrows(StructuralInfeasibleException.class,
                () -> new StructuralNetworkGenerator(configuration(4, 2, List.of(), 0)).generate());
        assertThat(noAttractor.parameter(), is("attractorSizes"));

        StructuralInfeasibleException noTransient = assertThrows(StructuralInfeasibleException.class,
                () -> new StructuralNetworkGenerator(configuration(2, 1, List.of(2, 1), 0)).generate());
        assertThat(noTransient.parameter(), is("parentlessCount"));
    }

    @Test
    public void testExhaustedAttempts() {
        StructuralNetworkConfiguration configuration = ImmutableStructuralNetworkConfiguration.builder()
                .variableCount(3)
                .parentlessCount(6)
                .addAttractorSizes(1)
                .maxAttempts(4)
                .build();
        StructuralInfeasibleException exception = assertThrows(StructuralInfeasibleException.class,
                () -> new StructuralNetworkGenerator(configuration).generate());
        assertThat(exception.parameter(), is("parentlessCount"));
    }

    @Test
    public void testVerificationNamesViolatedParameter() {
        StructuralNetworkConfiguration configuration = configuration(2, 1, List.of(1), 0);
        State s00 = State.parse("00");
        State s01 = State.parse("01");
        State s10 = State.parse("10");
        State s11 = State.parse("11");

        TransitionSet requested = TransitionSet.builder(2)
                .add(s00, s01)
                .add(s01, s11)
                .add(s11, s01)
                .add(s11, s10)
                .build();
        assertThat(StructuralNetworkGenerator.violatedParameter(configuration, requested.analyse()), is(nullValue()));

        TransitionSet twoFixedPoints = TransitionSet.builder(2)
                .add(s00, s01)
                .add(s01, s11)
                .addState(s10)
                .build();
        assertThat(StructuralNetworkGenerator.violatedParameter(configuration, twoFixedPoints.analyse()),
                is("attractorSizes"));

        TransitionSet noParentless = TransitionSet.builder(2)
                .add(s00, s01)
                .add(s01, s00)
                .add(s01, s11)
                .add(s11, s01)
                .add(s11, s10)
                .build();
        assertThat(StructuralNetworkGenerator.violatedParameter(configuration, noParentless.analyse()),
                is("parentlessCount"));
    }

    @Test
    public void testInvalidConfiguration() {
        assertThrows(IllegalStateException.class, () -> configuration(0, 1, List.of(1), 0));
        assertThrows(IllegalStateException.class, () -> configuration(4, -1, List.of(1), 0));
        assertThrows(IllegalStateException.class, () -> configuration(4, 1, List.of(0), 0));
    }

    @Test
    public void testGrayCycles() {
        for (int dimension = 1; dimension <= 6; dimension++) {
            for (int length = 2; length <= 1 << dimension; length += 2) {
                if (StructuralNetworkGenerator.dimension(length) != dimension) {
                    continue;
                }
                int[] cycle = StructuralNetworkGenerator.grayCycle(length, dimension);
                BitSet seen = new BitSet();
                for (int i = 0; i < length; i++) {
                    assertThat(Integer.bitCount(cycle[i] ^ cycle[(i + 1) % length]), is(1));
                    assertThat(cycle[i] < 1 << dimension, is(true));
                    seen.set(cycle[i]);
                }
                assertThat(seen.cardinality(), is(length));
            }
        }
        assertThat(StructuralNetworkGenerator.dimension(1), is(0));
        assertThat(StructuralNetworkGenerator.dimension(64), is(6));
        assertThat(StructuralNetworkGenerator.dimension(6), is(3));
    }
}
