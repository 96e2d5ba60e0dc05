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

import java.util.List;
import org.immutables.value.Value;

@Value.Immutable
public abstract class StructuralNetworkConfiguration {
    public static final int DEFAULT_VARIABLE_COUNT = 7;
    public static final int DEFAULT_PARENTLESS_COUNT = 8;
    public static final int DEFAULT_MAX_ATTEMPTS = 64;
    public static final double DEFAULT_EXTRA_EDGE_PROBABILITY = 0.3d;

    @Value.Default
    public int variableCount() {
        return DEFAULT_VARIABLE_COUNT;
    }

    /** Number of states without incoming transition. */
    @Value.Default
    public int parentlessCount() {
        return DEFAULT_PARENTLESS_COUNT;
    }

    /** Sizes of the attractor cycles, one entry per attractor. */
    public abstract List<Integer> attractorSizes();

    @Value.Default
    public long seed() {
        return 0L;
    }

    @Value.Default
    public int maxAttempts() {
        return DEFAULT_MAX_ATTEMPTS;
    }

    /** Probability with which each optional single-flip edge is added to the transient region. */
    @Value.Default
    public double extraEdgeProbability() {
        return DEFAULT_EXTRA_EDGE_PROBABILITY;
    }

    @Value.Check
    protected void check() {
        checkState(
                0 < variableCount() && variableCount() <= State.MAX_VARIABLES,
                "Variable count %s out of range",
                variableCount());
        checkState(parentlessCount() >= 0, "Negative parentless count %s", parentlessCount());
        for (int size : attractorSizes()) {
            checkState(size > 0, "Attractor size %s is not positive", size);
        }
        checkState(maxAttempts() > 0, "Non-positive attempt count %s", maxAttempts());
        checkState(
                0.0d <= extraEdgeProbability() && extraEdgeProbability() <= 1.0d,
                "Probability %s out of range",
                extraEdgeProbability());
    }
}
