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

import java.util.Objects;

/** An asynchronous update step: the target differs from the source in exactly one variable. */
public final class Transition {
    private final State source;
    private final State target;
    private final int variable;

    private Transition(State source, State target, int variable) {
        this.source = source;
        this.target = target;
        this.variable = variable;
    }

    /**
     * Creates the transition {@code source -> target}.
     *
     * @throws IllegalArgumentException if the states do not differ in exactly one variable.
     */
    public static Transition of(State source, State target) {
        int variable = source.differingVariable(target);
        if (variable < 0) {
            throw new IllegalArgumentException(
                    String.format("Transition %s -> %s does not flip exactly one variable", source, target));
        }
        return new Transition(source, target, variable);
    }

    public State source() {
        return source;
    }

    public State target() {
        return target;
    }

    /** The flipped variable. */
    public int variable() {
        return variable;
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof Transition)) {
            return false;
        }
        Transition that = (Transition) object;
        return source.equals(that.source) && target.equals(that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, target);
    }

    @Override
    public String toString() {
        return source + " -> " + target;
    }
}
