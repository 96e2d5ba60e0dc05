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
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The outgoing asynchronous transitions of the states of a network.
 *
 * <p>Every state which was registered with the builder has an entry, possibly with no successors.
 * States without entry or with an empty entry have no outgoing transition. Each recorded transition
 * flips exactly one variable.</p>
 */
public final class TransitionSet {
    private final int variableCount;
    private final ImmutableSortedMap<State, ImmutableSortedSet<State>> successors;

    private TransitionSet(int variableCount, ImmutableSortedMap<State, ImmutableSortedSet<State>> successors) {
        this.variableCount = variableCount;
        this.successors = successors;
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

    /** All states with an entry, in index order. */
    public ImmutableSortedSet<State> states() {
        return successors.keySet();
    }

    public ImmutableSortedSet<State> successors(State state) {
        checkArgument(state.variableCount() == variableCount, "State %s has wrong size", state);
        ImmutableSortedSet<State> states = successors.get(state);
        return states == null ? ImmutableSortedSet.of() : states;
    }

    public boolean contains(State source, State target) {
        return successors(source).contains(target);
    }

    public ImmutableList<Transition> transitions() {
        ImmutableList.Builder<Transition> transitions = ImmutableList.builder();
        successors.forEach((source, targets) -> {
            for (State target : targets) {
                transitions.add(Transition.of(source, target));
            }
        });
        return transitions.build();
    }

    public int transitionCount() {
        int count = 0;
        for (ImmutableSortedSet<State> targets : successors.values()) {
            count += targets.size();
        }
        return count;
    }

    public StateGraph graph() {
        return StateGraph.of(this);
    }

    public NetworkAnalysis analyse() {
        return NetworkAnalysis.of(this);
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof TransitionSet)) {
            return false;
        }
        TransitionSet that = (TransitionSet) object;
        return variableCount == that.variableCount && successors.equals(that.successors);
    }

    @Override
    public int hashCode() {
        return 31 * variableCount + successors.hashCode();
    }

    @Override
    public String toString() {
        return successors.toString();
    }

    public static final class Builder {
        private final int variableCount;
        private final Map<State, Set<State>> successors = new TreeMap<>();

        private Builder(int variableCount) {
            checkArgument(
                    0 < variableCount && variableCount <= State.MAX_VARIABLES,
                    "Variable count %s out of range",
                    variableCount);
            this.variableCount = variableCount;
        }

        /** Registers the state without adding a transition. */
        public Builder addState(State state) {
            checkArgument(
                    state.variableCount() == variableCount,
                    "State %s does not have %s variables",
                    state,
                    variableCount);
            successors.computeIfAbsent(state, s -> new TreeSet<>());
            return this;
        }

        /**
         * Adds the transition {@code source -> target}.
         *
         * @throws IllegalArgumentException if the states do not differ in exactly one variable.
         */
        public Builder add(State source, State target) {
            return add(Transition.of(source, target));
        }

        public Builder add(Transition transition) {
            addState(transition.source());
            checkArgument(
                    transition.target().variableCount() == variableCount,
                    "State %s does not have %s variables",
                    transition.target(),
                    variableCount);
            successors.get(transition.source()).add(transition.target());
            return this;
        }

        public TransitionSet build() {
            ImmutableSortedMap.Builder<State, ImmutableSortedSet<State>> map = ImmutableSortedMap.naturalOrder();
            successors.forEach((state, targets) -> map.put(state, ImmutableSortedSet.copyOf(targets)));
            return new TransitionSet(variableCount, map.build());
        }
    }
}
