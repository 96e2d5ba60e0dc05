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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Builds transition graphs over the full state space with a prescribed number of parentless states
 * and prescribed attractor cycles.
 *
 * <p>The state space is split into attractor cycles, parentless states and a single transient
 * region. Each attractor of size {@code L} is a Gray cycle in the smallest subcube holding {@code L}
 * states, placed by a random choice of subcube variables, offset and rotation. The transient region
 * is wired as a bidirected random spanning tree plus random extra edges, which makes it strongly
 * connected; every attractor gets at least one entry edge from it and every parentless state at least
 * one edge into it. Each attempt is verified with {@link NetworkAnalysis} and repeated with fresh
 * random choices on failure.</p>
 */
public final class StructuralNetworkGenerator {
    private static final Logger logger = Logger.getLogger(StructuralNetworkGenerator.class.getName());

    private static final int PLACEMENT_TRIES = 256;

    private static final byte TRANSIENT = 0;
    private static final byte ATTRACTOR = 1;
    private static final byte PARENTLESS = 2;

    private final StructuralNetworkConfiguration configuration;

    public StructuralNetworkGenerator(StructuralNetworkConfiguration configuration) {
        this.configuration = configuration;
    }

    public StructuralNetworkConfiguration configuration() {
        return configuration;
    }

    /** Generates a network using a random source seeded from the configuration. */
    public StructuralNetwork generate() throws StructuralInfeasibleException {
        return generate(new Random(configuration.seed()));
    }

    /**
     * Generates a network using the given random source.
     *
     * @throws StructuralInfeasibleException if the requested structure cannot exist in the state space
     *     or no attempt succeeded.
     */
    public StructuralNetwork generate(Random random) throws StructuralInfeasibleException {
        checkFeasible();

        String failedParameter = "attractorSizes";
        String failure = "";
        for (int attempt = 1; attempt <= configuration.maxAttempts(); attempt++) {
            Construction construction = new Construction(random);
            if (!construction.partition()) {
                failedParameter = construction.failedParameter;
                failure = construction.failure;
                logger.log(Level.FINE, "Attempt {0} failed: {1}", new Object[] {attempt, failure});
                continue;
            }
            StructuralNetwork network = construction.wire(attempt);
            NetworkAnalysis analysis = network.analyse();
            String violated = violatedParameter(configuration, analysis);
            if (violated == null) {
                logger.log(Level.FINE, "Generated network after {0} attempts", attempt);
                return network;
            }
            failedParameter = violated;
            failure = "generated graph violates the requested " + violated;
            logger.log(Level.FINE, "Attempt {0} failed verification:\n{1}", new Object[] {attempt, analysis});
        }
        throw new StructuralInfeasibleException(
                failedParameter,
                String.format("No network found in %d attempts, last failure: %s", configuration.maxAttempts(), failure));
    }

    private void checkFeasible() throws StructuralInfeasibleException {
        int size = 1 << configuration.variableCount();
        List<Integer> sizes = configuration.attractorSizes();
        if (sizes.isEmpty()) {
            throw new StructuralInfeasibleException("attractorSizes", "At least one attractor is required");
        }
        long attractorStates = 0;
        boolean fixedPoint = false;
        for (int length : sizes) {
            if (length > size) {
                throw new StructuralInfeasibleException(
                        "attractorSizes", String.format("Attractor of size %d exceeds the %d states", length, size));
            }
            if (length > 1 && length % 2 != 0) {
                throw new StructuralInfeasibleException(
                        "attractorSizes",
                        String.format("Attractor of odd size %d cannot be a cycle of single flips", length));
            }
            fixedPoint |= length == 1;
            attractorStates += length;
        }
        if (attractorStates > size) {
            throw new StructuralInfeasibleException(
                    "attractorSizes",
                    String.format("Attractors need %d states, but there are only %d", attractorStates, size));
        }
        long parentless = configuration.parentlessCount();
        if (parentless + attractorStates > size) {
            throw new StructuralInfeasibleException(
                    "parentlessCount",
                    String.format(
                            "%d parentless and %d attractor states exceed the %d states",
                            parentless,
                            attractorStates,
                            size));
        }
        long transientStates = size - parentless - attractorStates;
        if (transientStates == 0 && parentless > 0) {
            throw new StructuralInfeasibleException(
                    "parentlessCount", "Parentless states need a transient region to enter");
        }
        if (transientStates == 0 && fixedPoint) {
            throw new StructuralInfeasibleException(
                    "attractorSizes", "Fixed points need a transient region to be entered from");
        }
        if (transientStates == 1 && parentless == 0) {
            throw new StructuralInfeasibleException(
                    "parentlessCount", "A single transient state needs a parentless predecessor");
        }
    }

    /**
     * Checks the generated graph against the configuration and returns the parameter whose request
     * is violated, or {@code null} if the graph has the requested structure.
     */
    @Nullable
    static String violatedParameter(StructuralNetworkConfiguration configuration, NetworkAnalysis analysis) {
        List<Integer> expectedSizes = new ArrayList<>(configuration.attractorSizes());
        expectedSizes.sort(Comparator.reverseOrder());
        if (!analysis.attractorSizes().equals(expectedSizes) || !analysis.everyStateReachesAttractor()) {
            return "attractorSizes";
        }
        int size = analysis.stateCount();
        int transientCount = size - configuration.parentlessCount()
                - expectedSizes.stream().mapToInt(Integer::intValue).sum();
        if (analysis.parentless().size() != configuration.parentlessCount()
                || analysis.transientStates().size() != transientCount
                || analysis.transientComponents().size()
                        != configuration.parentlessCount() + (transientCount > 0 ? 1 : 0)) {
            return "parentlessCount";
        }
        return null;
    }

    /** A Gray cycle of the given length in the cube with the given dimension, starting in 0. */
    static int[] grayCycle(int length, int dimension) {
        if (length == 1) {
            return new int[] {0};
        }
        int half = length / 2;
        int top = 1 << (dimension - 1);
        int[] cycle = new int[length];
        for (int j = 0; j < half; j++) {
            cycle[j] = j ^ (j >> 1);
            cycle[length - 1 - j] = cycle[j] | top;
        }
        return cycle;
    }

    /** Smallest dimension of a cube with at least the given number of states. */
    static int dimension(int length) {
        return 32 - Integer.numberOfLeadingZeros(length - 1);
    }

    private final class Construction {
        private final Random random;
        private final int variableCount;
        private final int size;
        private final byte[] role;
        private final List<int[]> cycles = new ArrayList<>();
        private final List<Integer> parentless = new ArrayList<>();
        private String failedParameter = "";
        private String failure = "";

        Construction(Random random) {
            this.random = random;
            this.variableCount = configuration.variableCount();
            this.size = 1 << variableCount;
            this.role = new byte[size];
        }

        private boolean fail(String parameter, String reason) {
            failedParameter = parameter;
            failure = reason;
            return false;
        }

        boolean partition() {
            List<Integer> sizes = new ArrayList<>(configuration.attractorSizes());
            sizes.sort(Comparator.reverseOrder());
            for (int length : sizes) {
                int[] cycle = placeCycle(length);
                if (cycle == null) {
                    return fail("attractorSizes", "could not place an attractor of size " + length);
                }
                for (int state : cycle) {
                    role[state] = ATTRACTOR;
                }
                cycles.add(cycle);
            }
            if (!isTransientConnected()) {
                return fail("attractorSizes", "the attractors split the remaining states");
            }
            return chooseParentless();
        }

        @Nullable
        private int[] placeCycle(int length) {
            int dimension = dimension(length);
            int[] local = grayCycle(length, dimension);
            int[] variables = new int[variableCount];
            for (int i = 0; i < variableCount; i++) {
                variables[i] = i;
            }

            for (int i = 0; i < PLACEMENT_TRIES; i++) {
                shuffle(variables);
                int base = random.nextInt(size);
                int offset = random.nextInt(length);
                boolean reverse = random.nextBoolean();

                int[] cycle = new int[length];
                boolean free = true;
                for (int j = 0; j < length && free; j++) {
                    int localState = local[reverse ? (offset - j + length) % length : (offset + j) % length];
                    int state = base;
                    for (int bit = 0; bit < dimension; bit++) {
                        if ((localState & (1 << bit)) != 0) {
                            state ^= 1 << variables[bit];
                        }
                    }
                    free = role[state] == TRANSIENT;
                    cycle[j] = state;
                }
                if (free) {
                    return cycle;
                }
            }
            return null;
        }

        private void shuffle(int[] values) {
            for (int i = values.length - 1; i > 0; i--) {
                int j = random.nextInt(i + 1);
                int swap = values[i];
                values[i] = values[j];
                values[j] = swap;
            }
        }

        private boolean chooseParentless() {
            List<Integer> candidates = new ArrayList<>();
            for (int state = 0; state < size; state++) {
                if (role[state] == TRANSIENT) {
                    candidates.add(state);
                }
            }
            Collections.shuffle(candidates, random);

            int needed = configuration.parentlessCount();
            for (int state : candidates) {
                if (needed == 0) {
                    break;
                }
                role[state] = PARENTLESS;
                parentless.add(state);
                if (isValidPartition()) {
                    needed -= 1;
                } else {
                    role[state] = TRANSIENT;
                    parentless.remove(parentless.size() - 1);
                }
            }
            if (needed > 0) {
                return fail("parentlessCount", needed + " parentless states could not be placed");
            }
            return isValidPartition() || fail("attractorSizes", "an attractor cannot be entered");
        }

        private boolean isValidPartition() {
            if (!isTransientConnected()) {
                return false;
            }
            for (int state : parentless) {
                if (!hasTransientNeighbour(state)) {
                    return false;
                }
            }
            if (!hasTransient()) {
                return true;
            }
            for (int[] cycle : cycles) {
                if (!hasTransientNeighbour(cycle)) {
                    return false;
                }
            }
            return true;
        }

        private boolean hasTransient() {
            for (byte value : role) {
                if (value == TRANSIENT) {
                    return true;
                }
            }
            return false;
        }

        private boolean hasTransientNeighbour(int... states) {
            for (int state : states) {
                for (int bit = 0; bit < variableCount; bit++) {
                    if (role[state ^ (1 << bit)] == TRANSIENT) {
                        return true;
                    }
                }
            }
            return false;
        }

        private boolean isTransientConnected() {
            int start = -1;
            int count = 0;
            for (int state = 0; state < size; state++) {
                if (role[state] == TRANSIENT) {
                    start = start == -1 ? state : start;
                    count += 1;
                }
            }
            if (start == -1) {
                return true;
            }

            BitSet visited = new BitSet(size);
            Deque<Integer> queue = new ArrayDeque<>();
            visited.set(start);
            queue.add(start);
            int reached = 1;
            while (!queue.isEmpty()) {
                int state = queue.poll();
                for (int bit = 0; bit < variableCount; bit++) {
                    int neighbour = state ^ (1 << bit);
                    if (role[neighbour] == TRANSIENT && !visited.get(neighbour)) {
                        visited.set(neighbour);
                        queue.add(neighbour);
                        reached += 1;
                    }
                }
            }
            return reached == count;
        }

        private List<Integer> transientNeighbours(int state) {
            List<Integer> neighbours = new ArrayList<>(variableCount);
            for (int bit = 0; bit < variableCount; bit++) {
                int neighbour = state ^ (1 << bit);
                if (role[neighbour] == TRANSIENT) {
                    neighbours.add(neighbour);
                }
            }
            return neighbours;
        }

        private State state(int index) {
            return State.of(variableCount, index);
        }

        StructuralNetwork wire(int attempt) {
            double probability = configuration.extraEdgeProbability();
            TransitionSet.Builder builder = TransitionSet.builder(variableCount);
            for (int index = 0; index < size; index++) {
                builder.addState(state(index));
            }

            ImmutableList.Builder<ImmutableList<State>> attractors = ImmutableList.builder();
            for (int[] cycle : cycles) {
                ImmutableList.Builder<State> states = ImmutableList.builder();
                for (int j = 0; j < cycle.length; j++) {
                    states.add(state(cycle[j]));
                    if (cycle.length > 1) {
                        builder.add(state(cycle[j]), state(cycle[(j + 1) % cycle.length]));
                    }
                }
                attractors.add(states.build());
            }

            ImmutableSortedSet.Builder<State> transientStates = ImmutableSortedSet.naturalOrder();
            List<Integer> transientIndices = new ArrayList<>();
            for (int index = 0; index < size; index++) {
                if (role[index] == TRANSIENT) {
                    transientIndices.add(index);
                    transientStates.add(state(index));
                }
            }

            if (!transientIndices.isEmpty()) {
                // Random spanning tree, every tree edge in both directions.
                BitSet visited = new BitSet(size);
                List<int[]> frontier = new ArrayList<>();
                int root = transientIndices.get(random.nextInt(transientIndices.size()));
                visited.set(root);
                for (int neighbour : transientNeighbours(root)) {
                    frontier.add(new int[] {root, neighbour});
                }
                while (!frontier.isEmpty()) {
                    int pick = random.nextInt(frontier.size());
                    int[] edge = frontier.get(pick);
                    frontier.set(pick, frontier.get(frontier.size() - 1));
                    frontier.remove(frontier.size() - 1);
                    if (visited.get(edge[1])) {
                        continue;
                    }
                    visited.set(edge[1]);
                    builder.add(state(edge[0]), state(edge[1]));
                    builder.add(state(edge[1]), state(edge[0]));
                    for (int neighbour : transientNeighbours(edge[1])) {
                        if (!visited.get(neighbour)) {
                            frontier.add(new int[] {edge[1], neighbour});
                        }
                    }
                }

                for (int source : transientIndices) {
                    for (int target : transientNeighbours(source)) {
                        if (random.nextDouble() < probability) {
                            builder.add(state(source), state(target));
                        }
                    }
                }

                for (int[] cycle : cycles) {
                    List<int[]> entries = new ArrayList<>();
                    for (int target : cycle) {
                        for (int source : transientNeighbours(target)) {
                            entries.add(new int[] {source, target});
                        }
                    }
                    int required = random.nextInt(entries.size());
                    for (int i = 0; i < entries.size(); i++) {
                        if (i == required || random.nextDouble() < probability) {
                            builder.add(state(entries.get(i)[0]), state(entries.get(i)[1]));
                        }
                    }
                }

                for (int source : parentless) {
                    List<Integer> targets = transientNeighbours(source);
                    int required = random.nextInt(targets.size());
                    for (int i = 0; i < targets.size(); i++) {
                        if (i == required || random.nextDouble() < probability) {
                            builder.add(state(source), state(targets.get(i)));
                        }
                    }
                }
            }

            ImmutableSortedSet.Builder<State> parentlessStates = ImmutableSortedSet.naturalOrder();
            for (int index : parentless) {
                parentlessStates.add(state(index));
            }
            logger.log(Level.FINER, "Wired {0} attractors, {1} parentless and {2} transient states",
                    new Object[] {cycles.size(), parentless.size(), transientIndices.size()});
            return new StructuralNetwork(
                    builder.build(), parentlessStates.build(), attractors.build(), transientStates.build(), attempt);
        }
    }
}
