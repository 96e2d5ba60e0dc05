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

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The set of all {@code 2^n} states over {@code n} variables together with the naming scheme
 * {@code x1, ..., xn} of the variables.
 */
public final class StateSpace implements Iterable<State> {
    private static final Pattern VARIABLE_NAME = Pattern.compile("x([1-9][0-9]*)");

    private final int variableCount;

    private StateSpace(int variableCount) {
        this.variableCount = variableCount;
    }

    public static StateSpace of(int variableCount) {
        checkArgument(
                0 < variableCount && variableCount <= State.MAX_VARIABLES,
                "Variable count %s out of range [1, %s]",
                variableCount,
                State.MAX_VARIABLES);
        return new StateSpace(variableCount);
    }

    public static String variableName(int variable) {
        checkArgument(variable >= 0, "Negative variable %s", variable);
        return "x" + (variable + 1);
    }

    /**
     * Returns the index of the variable with the given name, or {@code -1} if the name does not
     * follow the {@code x<number>} scheme.
     */
    public static int variableIndex(String name) {
        Matcher matcher = VARIABLE_NAME.matcher(name);
        if (!matcher.matches()) {
            return -1;
        }
        try {
            return Integer.parseInt(matcher.group(1)) - 1;
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    public int variableCount() {
        return variableCount;
    }

    public int size() {
        return 1 << variableCount;
    }

    @Override
    public Iterator<State> iterator() {
        return new Iterator<>() {
            private int next = 0;

            @Override
            public boolean hasNext() {
                return next < size();
            }

            @Override
            public State next() {
                if (next >= size()) {
                    throw new NoSuchElementException("No next state");
                }
                State state = State.of(variableCount, next);
                next += 1;
                return state;
            }
        };
    }

    @Override
    public boolean equals(Object object) {
        return this == object
                || (object instanceof StateSpace && ((StateSpace) object).variableCount == variableCount);
    }

    @Override
    public int hashCode() {
        return variableCount;
    }

    @Override
    public String toString() {
        return "StateSpace[" + variableCount + "]";
    }
}
