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
 * Signals that a requested network structure cannot be realised, either because it exceeds the
 * capacity of the state space or because no single-flip cycle of a requested length could be
 * placed.
 */
public class StructuralInfeasibleException extends Exception {
    private static final long serialVersionUID = 1L;

    private final String parameter;

    public StructuralInfeasibleException(String parameter, String message) {
        super(parameter + ": " + message);
        this.parameter = parameter;
    }

    /** Name of the offending configuration parameter. */
    public String parameter() {
        return parameter;
    }
}
