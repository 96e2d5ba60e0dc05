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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/**
 * Outcome of a bounded generate-and-verify search. Either a network meeting the attractor target was
 * accepted, or the attempt budget was exhausted.
 */
public final class GenerationResult {
    @Nullable
    private final BooleanNetwork network;
    @Nullable
    private final TransitionSet transitions;
    private final int attempts;
    private final ImmutableList<Integer> attractorSizes;

    private GenerationResult(
            @Nullable BooleanNetwork network,
            @Nullable TransitionSet transitions,
            int attempts,
            ImmutableList<Integer> attractorSizes) {
        this.network = network;
        this.transitions = transitions;
        this.attempts = attempts;
        this.attractorSizes = attractorSizes;
    }

    static GenerationResult accepted(
            BooleanNetwork network, TransitionSet transitions, int attempts, ImmutableList<Integer> attractorSizes) {
        return new GenerationResult(network, transitions, attempts, attractorSizes);
    }

    static GenerationResult exhausted(int attempts, ImmutableList<Integer> lastAttractorSizes) {
        return new GenerationResult(null, null, attempts, lastAttractorSizes);
    }

    public boolean isAccepted() {
        return network != null;
    }

    public boolean isExhausted() {
        return network == null;
    }

    /**
     * The accepted network.
     *
     * @throws IllegalStateException if the search was exhausted.
     */
    public BooleanNetwork network() {
        checkState(network != null, "Generation exhausted after %s attempts", attempts);
        return network;
    }

    /** The simulated transitions of the accepted network. */
    public TransitionSet transitions() {
        checkState(transitions != null, "Generation exhausted after %s attempts", attempts);
        return transitions;
    }

    public int attempts() {
        return attempts;
    }

    /** Attractor sizes of the accepted network, or of the last sampled one if exhausted. */
    public ImmutableList<Integer> attractorSizes() {
        return attractorSizes;
    }

    @Override
    public String toString() {
        return isAccepted()
                ? String.format("Accepted after %d attempts with attractors %s", attempts, attractorSizes)
                : String.format("Exhausted after %d attempts, last attractors %s", attempts, attractorSizes);
    }
}
