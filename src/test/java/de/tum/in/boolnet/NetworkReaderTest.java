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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.io.StringReader;
import org.junit.jupiter.api.Test;

public class NetworkReaderTest {
    private static final String TRANSITIONS = String.join("\n",
            "\"\"\"",
            "Two variables, x1 toggles freely.",
            "transitions = {'this': 'is not the binding'}",
            "\"\"\"",
            "",
            "# Asynchronous state transitions",
            "transitions = {",
            "    '00': ['10'],",
            "    # comment inside the mapping",
            "    \"01\": [\"11\"],",
            "    \"10\": [\"00\", \"11\"],",
            "    \"11\": [\"11\"],",
            "}",
            "");

    @Test
    public void testReadTransitions() throws IOException, InvalidFormatException {
        TransitionSet transitions = NetworkReader.readTransitions(new StringReader(TRANSITIONS));
        assertThat(transitions.variableCount(), is(2));
        assertThat(transitions.states().size(), is(4));
        assertThat(transitions.transitionCount(), is(4));
        assertThat(transitions.contains(State.parse("10"), State.parse("11")), is(true));
        // A state listing itself is a fixed point
        assertThat(transitions.successors(State.parse("11")), is(empty()));
    }

    @Test
    public void testTransitionFlippingTwoVariables() {
        String text = "transitions = {\"00\": [\"11\"], \"01\": [], \"10\": [], \"11\": []}";
        InvalidFormatException exception = assertThrows(InvalidFormatException.class,
                () -> NetworkReader.readTransitions(new StringReader(text)));
        assertThat(exception.getMessage(), containsString("00 -> 11"));
    }

    @Test
    public void testTransitionsOfDifferentLength() {
        String text = "transitions = {\"00\": [\"010\"]}";
        assertThrows(InvalidFormatException.class, () -> NetworkReader.readTransitions(new StringReader(text)));
    }

    @Test
    public void testMissingBinding() {
        InvalidFormatException exception = assertThrows(InvalidFormatException.class,
                () -> NetworkReader.readTransitions(new StringReader("network_functions = {}")));
        assertThat(exception.getMessage(), containsString("transitions"));
    }

    @Test
    public void testMalformedValue() {
        assertThrows(InvalidFormatException.class,
                () -> NetworkReader.readTransitions(new StringReader("transitions = {\"00\": [\"01\"")));
        assertThrows(InvalidFormatException.class,
                () -> NetworkReader.readTransitions(new StringReader("transitions = [\"00\"]")));
    }

    @Test
    public void testReadNetwork() throws IOException, InvalidFormatException {
        String text = String.join("\n",
                "\"\"\"",
                "Dependency Structure:",
                "  x1 depends on: x2",
                "\"\"\"",
                "network_functions = {",
                "    'x2': '~x1 | (x2 & x3)',",
                "    'x1': 'x2',",
                "    'x3': '0',",
                "}");
        BooleanNetwork network = NetworkReader.readNetwork(new StringReader(text));
        assertThat(network.variableCount(), is(3));
        assertThat(network.function(0).toString(), is("x2"));
        assertThat(network.nextValue(State.parse("011"), 1), is(true));
        assertThat(network.nextValue(State.parse("110"), 1), is(false));
        assertThat(network.function(2).minterms().isEmpty(), is(true));
    }

    @Test
    public void testNetworkWithUndefinedVariable() {
        String text = "network_functions = {\"x1\": \"x1 & x3\", \"x2\": \"x1\"}";
        InvalidFormatException exception = assertThrows(InvalidFormatException.class,
                () -> NetworkReader.readNetwork(new StringReader(text)));
        assertThat(exception.getMessage(), containsString("x1"));
        assertThat(exception.getMessage(), containsString("x3"));
    }

    @Test
    public void testNetworkWithMissingFunction() {
        String text = "network_functions = {\"x1\": \"x1\", \"x3\": \"x1\"}";
        assertThrows(InvalidFormatException.class, () -> NetworkReader.readNetwork(new StringReader(text)));
    }

    @Test
    public void testReadTruthTable() throws IOException, InvalidFormatException {
        String text = String.join("\n",
                "truth_table = {",
                "    \"0\": {\"x1\": \"1\"},",
                "    \"1\": {\"x1\": \"1\"},",
                "}");
        TruthTable table = NetworkReader.readTruthTable(new StringReader(text));
        assertThat(table.variableCount(), is(1));
        assertThat(table.nextValue(State.parse("0"), 0), is(true));
        assertThat(table.next(State.parse("1"), 0), is(State.parse("1")));
    }

    @Test
    public void testIncompleteTruthTable() {
        String text = "truth_table = {\"00\": {\"x1\": \"10\", \"x2\": \"00\"}}";
        assertThrows(InvalidFormatException.class, () -> NetworkReader.readTruthTable(new StringReader(text)));
    }

    @Test
    public void testTruthTableChangingOtherVariable() {
        String text = String.join("\n",
                "truth_table = {",
                "    \"00\": {\"x1\": \"10\", \"x2\": \"00\"},",
                "    \"01\": {\"x1\": \"01\", \"x2\": \"01\"},",
                "    \"10\": {\"x1\": \"10\", \"x2\": \"01\"},",
                "    \"11\": {\"x1\": \"11\", \"x2\": \"11\"},",
                "}");
        assertThrows(InvalidFormatException.class, () -> NetworkReader.readTruthTable(new StringReader(text)));
    }
}
