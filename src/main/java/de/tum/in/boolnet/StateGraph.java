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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

/**
 * Directed graph over all {@code 2^n} states of a network, keyed by state index. Vertices without
 * outgoing edges are part of the graph.
 */
public final class StateGraph {
    private static final int[] NO_SUCCESSORS = new int[0];

    private final int variableCount;
    private final int[][] successors;

    private StateGraph(int variableCount, int[][] successors) {
        this.variableCount = variableCount;
        this.successors = successors;
    }

    public static StateGraph of(TransitionSet transitions) {
        int size = 1 << transitions.variableCount();
        int[][] successors = new int[size][];
        Arrays.fill(successors, NO_SUCCESSORS);
        for (State state : transitions.states()) {
            successors[state.index()] =
                    transitions.successors(state).stream().mapToInt(State::index).toArray();
        }
        return new StateGraph(transitions.variableCount(), successors);
    }

    public int variableCount() {
        return variableCount;
    }

    public int size() {
        return successors.length;
    }

    public int[] successors(int state) {
        checkElementIndex(state, successors.length);
        return successors[state].clone();
    }

    public int[] inDegrees() {
        int[] degrees = new int[successors.length];
        for (int[] targets : successors) {
            for (int target : targets) {
                degrees[target] += 1;
            }
        }
        return degrees;
    }

    /**
     * Computes the strongly connected components with an iterative variant of Tarjan's algorithm.
     * Components are emitted in reverse topological order, i.e. every component is emitted after
     * all components reachable from it. The states of each component are sorted.
     */
    public List<int[]> stronglyConnectedComponents() {
        int size = successors.length;
        int[] index = new int[size];
        int[] lowLink = new int[size];
        int[] edge = new int[size];
        boolean[] onStack = new boolean[size];
        int[] stack = new int[size];
        int[] callStack = new int[size];
        Arrays.fill(index, -1);

        List<int[]> components = new ArrayList<>();
        int counter = 0;
        int stackSize = 0;

        for (int root = 0; root < size; root++) {
            if (index[root] >= 0) {
                continue;
            }
            int callSize = 0;
            index[root] = counter;
            lowLink[root] = counter;
            counter += 1;
            edge[root] = 0;
            stack[stackSize++] = root;
            onStack[root] = true;
            callStack[callSize++] = root;

            while (callSize > 0) {
                int node = callStack[callSize - 1];
                int[] targets = successors[node];
                if (edge[node] < targets.length) {
                    int successor = targets[edge[node]];
                    edge[node] += 1;
                    if (index[successor] < 0) {
                        index[successor] = counter;
                        lowLink[successor] = counter;
                        counter += 1;
                        edge[successor] = 0;
                        stack[stackSize++] = successor;
                        onStack[successor] = true;
                        callStack[callSize++] = successor;
                    } else if (onStack[successor]) {
                        lowLink[node] = Math.min(lowLink[node], index[successor]);
                    }
                    continue;
                }

                callSize -= 1;
                if (callSize > 0) {
                    int parent = callStack[callSize - 1];
                    lowLink[parent] = Math.min(lowLink[parent], lowLink[node]);
                }
                if (lowLink[node] == index[node]) {
                    int start = stackSize;
                    do {
                        start -= 1;
                        onStack[stack[start]] = false;
                    } while (stack[start] != node);
                    int[] component = Arrays.copyOfRange(stack, start, stackSize);
                    Arrays.sort(component);
                    components.add(component);
                    stackSize = start;
                }
            }
        }
        return components;
    }

    /** Whether no edge leaves the given set of states. */
    public boolean isClosed(int[] states) {
        BitSet members = new BitSet(successors.length);
        for (int state : states) {
            members.set(state);
        }
        for (int state : states) {
            for (int successor : successors[state]) {
                if (!members.get(successor)) {
                    return false;
                }
            }
        }
        return true;
    }

    /** All states reachable from the given states, including themselves. */
    public BitSet reachableFrom(BitSet sources) {
        BitSet visited = (BitSet) sources.clone();
        int[] queue = new int[successors.length];
        int head = 0;
        int tail = 0;
        for (int state = sources.nextSetBit(0); state >= 0; state = sources.nextSetBit(state + 1)) {
            queue[tail++] = state;
        }
        while (head < tail) {
            int state = queue[head++];
            for (int successor : successors[state]) {
                if (!visited.get(successor)) {
                    visited.set(successor);
                    queue[tail++] = successor;
                }
            }
        }
        return visited;
    }

    /** All states from which one of the given states is reachable, including themselves. */
    public BitSet canReach(BitSet targets) {
        int size = successors.length;
        int[] predecessorCount = new int[size + 1];
        for (int[] next : successors) {
            for (int successor : next) {
                predecessorCount[successor + 1] += 1;
            }
        }
        for (int i = 0; i < size; i++) {
            predecessorCount[i + 1] += predecessorCount[i];
        }
        int[] predecessors = new int[predecessorCount[size]];
        int[] fill = Arrays.copyOf(predecessorCount, size);
        for (int state = 0; state < size; state++) {
            for (int successor : successors[state]) {
                predecessors[fill[successor]++] = state;
            }
        }

        BitSet visited = (BitSet) targets.clone();
        int[] queue = new int[size];
        int head = 0;
        int tail = 0;
        for (int state = targets.nextSetBit(0); state >= 0; state = targets.nextSetBit(state + 1)) {
            queue[tail++] = state;
        }
        while (head < tail) {
            int state = queue[head++];
            for (int i = predecessorCount[state]; i < predecessorCount[state + 1]; i++) {
                int predecessor = predecessors[i];
                if (!visited.get(predecessor)) {
                    visited.set(predecessor);
                    queue[tail++] = predecessor;
                }
            }
        }
        return visited;
    }
}
