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

/**
 * Thrown by the simplifier if a minterm of the on-set is not covered by any prime implicant. This
 * indicates a defect in prime implicant generation, never invalid user input.
 */
public class UnsatisfiableCoverException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    private final int minterm;

    public UnsatisfiableCoverException(int variableCount, int minterm) {
        super("No prime implicant covers minterm " + State.of(variableCount, minterm));
        this.minterm = minterm;
    }

    public int minterm() {
        return minterm;
    }
}
