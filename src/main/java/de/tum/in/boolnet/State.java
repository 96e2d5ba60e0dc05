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
import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.common.collect.ImmutableList;

/**
 * An assignment of truth values to the variables {@code x1, ..., xn} of a network.
 *
 * <p>A state is identified by its index in {@code [0, 2^n)}: the binary representation of the
 * index, most significant bit first, is the bit string of the state. Variable {@code i} (that is,
 * {@code x(i+1)}) is character {@code i} of the bit string, so flipping variable 0 of {@code 00}
 * yields {@code 10}.</p>
 */
public final class State implements Comparable<State> {
    public static final int MAX_VARIABLES = 20;

    private final int variableCount;
    private final int index;

    private State(int variableCount, int index) {
        this.variableCount = variableCount;
        this.index = index;
    }

    public static State of(int variableCount, int index) {
        checkArgument(
                0 < variableCount && variableCount <= MAX_VARIABLES,
                "Variable count %s out of range [1, %s]",
                variableCount,
                MAX_VARIABLES);
        checkArgument(0 <= index && index < (1 << variableCount), "Index %s out of range", index);
        return new State(variableCount, index);
    }

    /**
     * Parses a bit string like {@code "0110"}.
     *
     * @throws IllegalArgumentException if the string is empty, too long, or contains characters other
     *     than {@code 0} and {@code 1}.
     */
    public static State parse(String bits) {
        int length = bits.length();
        checkArgument(0 < length && length <= MAX_VARIABLES, "Invalid state length in %s", bits);
        int index = 0;
        for (int i = 0; i < length; i++) {
            char c = bits.charAt(i);
            if (c == '1') {
                index = (index << 1) | 1;
            } else if (c == '0') {
                index <<= 1;
            } else {
                throw new IllegalArgumentException("Invalid character '" + c + "' in state " + bits);
            }
        }
        return new State(length, index);
    }

    static int mask(int variableCount, int variable) {
        return 1 << (variableCount - 1 - variable);
    }

    public int variableCount() {
        return variableCount;
    }

    public int index() {
        return index;
    }

    public boolean get(int variable) {
        checkElementIndex(variable, variableCount);
        return (index & mask(variableCount, variable)) != 0;
    }

    public State flip(int variable) {
        checkElementIndex(variable, variableCount);
        return new State(variableCount, index ^ mask(variableCount, variable));
    }

    public State with(int variable, boolean value) {
        return get(variable) == value ? this : flip(variable);
    }

    /** Number of variables set to true. */
    public int weight() {
        return Integer.bitCount(index);
    }

    public int distance(State other) {
        checkArgument(other.variableCount == variableCount, "Incompatible states %s and %s", this, other);
        return Integer.bitCount(index ^ other.index);
    }

    /**
     * Returns the single variable in which the two states differ, or {@code -1} if they differ in
     * none or in more than one variable.
     */
    public int differingVariable(State other) {
        checkArgument(other.variableCount == variableCount, "Incompatible states %s and %s", this, other);
        int difference = index ^ other.index;
        if (Integer.bitCount(difference) != 1) {
            return -1;
        }
        return variableCount - 1 - Integer.numberOfTrailingZeros(difference);
    }

    /** All states at Hamming distance one, ordered by the flipped variable. */
    public ImmutableList<State> neighbours() {
        ImmutableList.Builder<State> neighbours = ImmutableList.builderWithExpectedSize(variableCount);
        for (int variable = 0; variable < variableCount; variable++) {
            neighbours.add(new State(variableCount, index ^ mask(variableCount, variable)));
        }
        return neighbours.build();
    }

    @Override
    public int compareTo(State other) {
        int result = Integer.compare(variableCount, other.variableCount);
        return result == 0 ? Integer.compare(index, other.index) : result;
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof State)) {
            return false;
        }
        State that = (State) object;
        return variableCount == that.variableCount && index == that.index;
    }

    @Override
    public int hashCode() {
        return 31 * variableCount + index;
    }

    @Override
    public String toString() {
        char[] bits = new char[variableCount];
        for (int variable = 0; variable < variableCount; variable++) {
            bits[variable] = (index & mask(variableCount, variable)) == 0 ? '0' : '1';
        }
        return new String(bits);
    }
}
