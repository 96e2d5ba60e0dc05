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

/** What a truth table records for a variable when a state has no transition flipping it. */
public enum MissingTransitionPolicy {
    /** Record the state with the variable flipped, i.e. the result of letting the variable fire. */
    FLIP,
    /** Record the state itself, i.e. the variable keeps its value. */
    SELF_LOOP;

    State resolve(State state, int variable) {
        return this == FLIP ? state.flip(variable) : state;
    }
}
