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
import java.util.OptionalInt;
import org.immutables.value.Value;

@Value.Immutable
public abstract class BoundedDependencyConfiguration {
    public static final int DEFAULT_VARIABLE_COUNT = 7;
    public static final int DEFAULT_DEPENDENCY_COUNT = 3;
    public static final int DEFAULT_MIN_TRUE_OUTPUTS = 2;
    public static final int DEFAULT_MAX_TRUE_OUTPUTS = 6;
    public static final int DEFAULT_MAX_ATTEMPTS = 1000;

    @Value.Default
    public int variableCount() {
        return DEFAULT_VARIABLE_COUNT;
    }

    /** Number of variables each update function depends on. */
    @Value.Default
    public int dependencyCount() {
        return DEFAULT_DEPENDENCY_COUNT;
    }

    /** Lower bound on the number of rows of a function's dependency table which evaluate to true. */
    @Value.Default
    public int minTrueOutputs() {
        return DEFAULT_MIN_TRUE_OUTPUTS;
    }

    @Value.Default
    public int maxTrueOutputs() {
        return DEFAULT_MAX_TRUE_OUTPUTS;
    }

    @Value.Default
    public long seed() {
        return 0L;
    }

    @Value.Default
    public int maxAttempts() {
        return DEFAULT_MAX_ATTEMPTS;
    }

    /** Whether a variable may be among its own dependencies. */
    @Value.Default
    public boolean allowSelfDependency() {
        return true;
    }

    /** Required number of attractors, if any. */
    public abstract OptionalInt attractorCount();

    /** Required attractor sizes as a multiset. Empty if sizes are not constrained. */
    public abstract List<Integer> attractorSizes();

    /** The upper bound on true rows, capped so that no function is constant true. */
    @Value.Derived
    public int effectiveMaxTrueOutputs() {
        return Math.min(maxTrueOutputs(), (1 << dependencyCount()) - 1);
    }

    @Value.Check
    protected void check() {
        checkState(
                0 < variableCount() && variableCount() <= State.MAX_VARIABLES,
                "Variable count %s out of range",
                variableCount());
        int available = allowSelfDependency() ? variableCount() : variableCount() - 1;
        checkState(
                0 < dependencyCount() && dependencyCount() <= available,
                "Cannot choose %s dependencies among %s variables",
                dependencyCount(),
                available);
        checkState(
                0 <= minTrueOutputs() && minTrueOutputs() <= effectiveMaxTrueOutputs(),
                "Invalid true output bounds [%s, %s]",
                minTrueOutputs(),
                effectiveMaxTrueOutputs());
        checkState(maxAttempts() > 0, "Non-positive attempt count %s", maxAttempts());
        if (attractorCount().isPresent()) {
            checkState(attractorCount().getAsInt() > 0, "Non-positive attractor count %s", attractorCount().getAsInt());
            checkState(
                    attractorSizes().isEmpty() || attractorSizes().size() == attractorCount().getAsInt(),
                    "Attractor count %s does not match sizes %s",
                    attractorCount().getAsInt(),
                    attractorSizes());
        }
        for (int size : attractorSizes()) {
            checkState(size > 0, "Attractor size %s is not positive", size);
        }
    }
}
