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

import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;

/**
 * Structural summary of the state graph of a network: parentless states, strongly connected
 * components, their condensation, attractors (terminal components) and the transient remainder.
 */
public final class NetworkAnalysis {
    private final int variableCount;
    private final int transitionCount;
    private final ImmutableSortedSet<State> parentless;
    private final ImmutableList<ImmutableSortedSet<State>> components;
    private final ImmutableList<ImmutableSortedSet<Integer>> componentSuccessors;
    private final ImmutableList<Integer> attractorIndices;
    private final boolean everyStateReachesAttractor;

    private NetworkAnalysis(
            int variableCount,
            int transitionCount,
            ImmutableSortedSet<State> parentless,
            ImmutableList<ImmutableSortedSet<State>> components,
            ImmutableList<ImmutableSortedSet<Integer>> componentSuccessors,
            ImmutableList<Integer> attractorIndices,
            boolean everyStateReachesAttractor) {
        this.variableCount = variableCount;
        this.transitionCount = transitionCount;
        this.parentless = parentless;
        this.components = components;
        this.componentSuccessors = componentSuccessors;
        this.attractorIndices = attractorIndices;
        this.everyStateReachesAttractor = everyStateReachesAttractor;
    }

    public static NetworkAnalysis of(TransitionSet transitions) {
        int variableCount = transitions.variableCount();
        StateGraph graph = transitions.graph();

        int[] inDegrees = graph.inDegrees();
        ImmutableSortedSet.Builder<State> parentless = ImmutableSortedSet.naturalOrder();
        for (int state = 0; state < inDegrees.length; state++) {
            if (inDegrees[state] == 0) {
                parentless.add(State.of(variableCount, state));
            }
        }

        List<int[]> rawComponents = new ArrayList<>(graph.stronglyConnectedComponents());
        rawComponents.sort(Comparator.comparingInt(component -> component[0]));
        int[] componentOf = new int[graph.size()];
        for (int i = 0; i < rawComponents.size(); i++) {
            for (int state : rawComponents.get(i)) {
                componentOf[state] = i;
            }
        }

        ImmutableList.Builder<ImmutableSortedSet<State>> components = ImmutableList.builder();
        ImmutableList.Builder<ImmutableSortedSet<Integer>> componentSuccessors = ImmutableList.builder();
        ImmutableList.Builder<Integer> attractors = ImmutableList.builder();
        BitSet attractorStates = new BitSet(graph.size());
        for (int i = 0; i < rawComponents.size(); i++) {
            int[] component = rawComponents.get(i);
            ImmutableSortedSet.Builder<State> states = ImmutableSortedSet.naturalOrder();
            TreeSet<Integer> successors = new TreeSet<>();
            for (int state : component) {
                states.add(State.of(variableCount, state));
                for (int successor : graph.successors(state)) {
                    if (componentOf[successor] != i) {
                        successors.add(componentOf[successor]);
                    }
                }
            }
            components.add(states.build());
            componentSuccessors.add(ImmutableSortedSet.copyOf(successors));
            if (successors.isEmpty()) {
                attractors.add(i);
                for (int state : component) {
                    attractorStates.set(state);
                }
            }
        }

        boolean everyStateReachesAttractor = graph.canReach(attractorStates).cardinality() == graph.size();
        return new NetworkAnalysis(
                variableCount,
                transitions.transitionCount(),
                parentless.build(),
                components.build(),
                componentSuccessors.build(),
                attractors.build(),
                everyStateReachesAttractor);
    }

    public int variableCount() {
        return variableCount;
    }

    public int stateCount() {
        return 1 << variableCount;
    }

    public int transitionCount() {
        return transitionCount;
    }

    /** States without incoming transition. */
    public ImmutableSortedSet<State> parentless() {
        return parentless;
    }

    /** All strongly connected components, ordered by their smallest state. */
    public ImmutableList<ImmutableSortedSet<State>> components() {
        return components;
    }

    /** Indices of the components directly reachable from the given component. */
    public ImmutableSortedSet<Integer> componentSuccessors(int component) {
        checkElementIndex(component, components.size());
        return componentSuccessors.get(component);
    }

    public boolean isAttractor(int component) {
        return componentSuccessors(component).isEmpty();
    }

    /** Terminal components, i.e. components no transition leaves. */
    public ImmutableList<ImmutableSortedSet<State>> attractors() {
        return attractorIndices.stream().map(components::get).collect(ImmutableList.toImmutableList());
    }

    public ImmutableList<ImmutableSortedSet<State>> fixedPoints() {
        return attractors().stream()
                .filter(attractor -> attractor.size() == 1)
                .collect(ImmutableList.toImmutableList());
    }

    /** Non-terminal components. */
    public ImmutableList<ImmutableSortedSet<State>> transientComponents() {
        ImmutableList.Builder<ImmutableSortedSet<State>> transients = ImmutableList.builder();
        for (int i = 0; i < components.size(); i++) {
            if (!isAttractor(i)) {
                transients.add(components.get(i));
            }
        }
        return transients.build();
    }

    /** States that are neither parentless nor part of an attractor. */
    public ImmutableSortedSet<State> transientStates() {
        ImmutableSortedSet.Builder<State> states = ImmutableSortedSet.naturalOrder();
        for (int i = 0; i < components.size(); i++) {
            if (isAttractor(i)) {
                continue;
            }
            for (State state : components.get(i)) {
                if (!parentless.contains(state)) {
                    states.add(state);
                }
            }
        }
        return states.build();
    }

    /** Sizes of all attractors, largest first. */
    public ImmutableList<Integer> attractorSizes() {
        return attractorIndices.stream()
                .map(index -> components.get(index).size())
                .sorted(Comparator.reverseOrder())
                .collect(ImmutableList.toImmutableList());
    }

    public boolean everyStateReachesAttractor() {
        return everyStateReachesAttractor;
    }

    @Override
    public String toString() {
        return String.format(
                "States: %d%nTransitions: %d%nParentless: %d%nComponents: %d%nAttractors: %d (sizes: %s)",
                stateCount(),
                transitionCount,
                parentless.size(),
                components.size(),
                attractorIndices.size(),
                attractorSizes());
    }
}
