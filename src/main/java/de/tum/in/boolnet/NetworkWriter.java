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

import java.io.IOException;
import java.io.Writer;
import java.util.BitSet;
import java.util.StringJoiner;
import javax.annotation.Nullable;

/** Writes networks in the literal binding layout read by {@link NetworkReader}. */
public final class NetworkWriter {
    private static final String INDENT = "    ";

    private NetworkWriter() {}

    /**
     * Writes one entry per state with its successors in index order. States without successors are
     * written with themselves as only successor to mark them as fixed points.
     */
    public static void writeTransitions(TransitionSet transitions, Writer writer, @Nullable String description)
            throws IOException {
        writeDocstring(writer, description, null);
        writer.write("# Asynchronous state transitions\n");
        writer.write(NetworkReader.TRANSITIONS + " = {\n");
        for (State state : transitions.stateSpace()) {
            StringJoiner targets = new StringJoiner(", ", "[", "]");
            if (transitions.successors(state).isEmpty()) {
                targets.add(quote(state.toString()));
            }
            for (State target : transitions.successors(state)) {
                targets.add(quote(target.toString()));
            }
            writer.write(INDENT + quote(state.toString()) + ": " + targets + ",\n");
        }
        writer.write("}\n");
    }

    /** Writes one expression per variable, preceded by a docstring listing the dependencies. */
    public static void writeNetwork(BooleanNetwork network, Writer writer, @Nullable String description)
            throws IOException {
        writeDocstring(writer, description, network);
        writer.write(NetworkReader.NETWORK_FUNCTIONS + " = {\n");
        for (BooleanFunction function : network.functions()) {
            writer.write(INDENT + quote(StateSpace.variableName(function.variable())) + ": "
                    + quote(function.toString()) + ",\n");
        }
        writer.write("}\n");
    }

    public static void writeTruthTable(TruthTable table, Writer writer) throws IOException {
        writer.write(NetworkReader.TRUTH_TABLE + " = {\n");
        for (State state : table.stateSpace()) {
            StringJoiner row = new StringJoiner(", ", "{", "}");
            table.row(state).forEach((variable, result) ->
                    row.add(quote(StateSpace.variableName(variable)) + ": " + quote(result.toString())));
            writer.write(INDENT + quote(state.toString()) + ": " + row + ",\n");
        }
        writer.write("}\n");
    }

    private static void writeDocstring(Writer writer, @Nullable String description, @Nullable BooleanNetwork network)
            throws IOException {
        if (description == null && network == null) {
            return;
        }
        writer.write("\"\"\"\n");
        if (description != null) {
            writer.write(description + "\n");
        }
        if (network != null) {
            if (description != null) {
                writer.write("\n");
            }
            writer.write("Dependency Structure:\n");
            for (BooleanFunction function : network.functions()) {
                writer.write("  " + StateSpace.variableName(function.variable()) + " depends on: "
                        + dependencies(function.expression().variables()) + "\n");
            }
        }
        writer.write("\"\"\"\n\n");
    }

    private static String dependencies(BitSet variables) {
        if (variables.isEmpty()) {
            return "(constant)";
        }
        StringJoiner joiner = new StringJoiner(", ");
        variables.stream().forEach(variable -> joiner.add(StateSpace.variableName(variable)));
        return joiner.toString();
    }

    private static String quote(String text) {
        return '"' + text + '"';
    }
}
