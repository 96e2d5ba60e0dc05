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
import static org.hamcrest.Matchers.is;

import java.util.List;
import java.util.stream.LongStream;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

public class FunctionExtractorTest {
    static Stream<BooleanNetwork> networks() {
        return LongStream.range(0, 20).mapToObj(seed -> RandomNetworks.network(seed, 2 + (int) (seed % 5), 4));
    }

    @Test
    public void testCanonicalForm() throws InvalidFormatException {
        BooleanNetwork network = BooleanNetwork.of(List.of(
                BooleanFunction.of(0, 2, ExpressionParser.parse("x1 & x2", 2)),
                BooleanFunction.of(1, 2, ExpressionParser.parse("~x1", 2))));
        TruthTable table = TruthTables.fromNetwork(network);
        assertThat(FunctionExtractor.canonical(table, 0).toString(), is("(x1 & x2)"));
        assertThat(FunctionExtractor.canonical(table, 1).toString(), is("(~x1 & ~x2) | (~x1 & x2)"));
        assertThat(FunctionExtractor.extract(table, 1).toString(), is("(~x1 & ~x2) | (~x1 & x2)"));
    }

    @Test
    public void testConstantFunctions() throws InvalidFormatException {
        BooleanNetwork network = BooleanNetwork.of(List.of(
                BooleanFunction.of(0, 2, ExpressionParser.parse("0", 2)),
                BooleanFunction.of(1, 2, ExpressionParser.parse("x2 | ~x2", 2))));
        BooleanNetwork extracted = FunctionExtractor.extractAll(TruthTables.fromNetwork(network));
        assertThat(extracted.function(0).toString(), is("0"));
        assertThat(extracted.function(1).minterms().cardinality(), is(4));
        assertThat(extracted, is(network));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("networks")
    public void testRoundTrip(BooleanNetwork network) {
        BooleanNetwork extracted = FunctionExtractor.extractAll(TruthTables.fromNetwork(network));
        assertThat(extracted, is(network));
        for (int variable = 0; variable < network.variableCount(); variable++) {
            BooleanFunction function = extracted.function(variable);
            assertThat(function.isEquivalent(network.function(variable)), is(true));
            for (State state : StateSpace.of(network.variableCount())) {
                assertThat(function.evaluate(state), is(network.function(variable).evaluate(state)));
            }
        }
        assertThat(extracted.transitions(), is(network.transitions()));
    }

    @Test
    public void testLargeStateSpace() {
        int variableCount = 16;
        // Without transitions every variable flips, so x1 is updated to ~x1.
        TruthTable table = TruthTables.fromTransitions(TransitionSet.builder(variableCount).build());
        BooleanFunction function = FunctionExtractor.extract(table, 0);

        assertThat(function.minterms().cardinality(), is(1 << (variableCount - 1)));
        assertThat(function.support().cardinality(), is(1));
        assertThat(function.expression().variables().cardinality(), is(variableCount));
        for (State state : List.of(State.of(variableCount, 0), State.of(variableCount, (1 << variableCount) - 1))) {
            assertThat(function.evaluate(state), is(!state.get(0)));
            assertThat(function.expression().evaluate(state), is(!state.get(0)));
        }
    }
}
