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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

/** A generated transition graph together with the roles the generator assigned to its states. */
public final class StructuralNetwork {
    private final TransitionSet transitions;
    private final ImmutableSortedSet<State> parentless;
    private final ImmutableList<ImmutableList<State>> attractors;
    private final ImmutableSortedSet<State> transientStates;
    private final int attempts;

    StructuralNetwork(
            TransitionSet transitions,
            ImmutableSortedSet<State> parentless,
            ImmutableList<ImmutableList<State>> attractors,
            ImmutableSortedSet<State> transientStates,
            int attempts) {
        this.transitions = transitions;
        this.parentless = parentless;
        this.attractors = attractors;
        this.transientStates = transientStates;
        this.attempts = attempts;
    }

    public TransitionSet transitions() {
        return transitions;
    }

    public ImmutableSortedSet<State> parentless() {
        return parentless;
    }

    /** The attractor cycles, each listed in transition order, largest first. */
    public ImmutableList<ImmutableList<State>> attractors() {
        return attractors;
    }

    public ImmutableSortedSet<State> transientStates() {
        return transientStates;
    }

    /** Number of attempts the generator needed. */
    public int attempts() {
        return attempts;
    }

    public NetworkAnalysis analyse() {
        return transitions.analyse();
    }

    @Override
    public String toString() {
        return String.format(
                "Network over %d variables: %d parentless, %d transient, attractors %s",
                transitions.variableCount(),
                parentless.size(),
                transientStates.size(),
                attractors);
    }
}
