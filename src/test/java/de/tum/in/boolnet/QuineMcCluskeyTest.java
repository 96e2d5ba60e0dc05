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
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasItems;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThanOrEqualTo;

import java.util.BitSet;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

public class QuineMcCluskeyTest {
    private static final QuineMcCluskey exact = new QuineMcCluskey();
    private static final QuineMcCluskey greedy =
            new QuineMcCluskey(ImmutableSimplifierConfiguration.builder().useExactCover(false).build());

    static Stream<Arguments> functions() {
        return IntStream.range(0, 40).mapToObj(seed -> {
            Random random = new Random(seed);
            int variableCount = 2 + seed % 5;
            return Arguments.of(variableCount, RandomNetworks.minterms(random, variableCount, random.nextDouble()));
        });
    }

    @Test
    public void testMergeOnMiddleBit() {
        BitSet minterms = RandomNetworks.minterms(3, List.of("000", "010", "101", "111"));
        CoverSolution solution = exact.simplify(3, minterms);
        assertThat(solution.primeImplicants(), hasItems(Implicant.parse("0-0"), Implicant.parse("1-1")));
        assertThat(solution.implicants(), contains(Implicant.parse("0-0"), Implicant.parse("1-1")));
        assertThat(solution.essentialImplicants(), contains(Implicant.parse("0-0"), Implicant.parse("1-1")));
        assertThat(solution.toString(), is("(~x1 & ~x3) | (x1 & x3)"));
        for (State state : StateSpace.of(3)) {
            assertThat(solution.covers(state.index()), is(minterms.get(state.index())));
        }
    }

    @Test
    public void testConstants() {
        CoverSolution empty = exact.simplify(3, new BitSet());
        assertThat(empty.isEmpty(), is(true));
        assertThat(empty.toSumOfProducts().toString(), is("0"));

        BitSet all = new BitSet();
        all.set(0, 8);
        CoverSolution full = exact.simplify(3, all);
        assertThat(full.implicants(), contains(Implicant.tautology(3)));
        assertThat(full.toSumOfProducts().toString(), is("1"));
        assertThat(full.literalCount(), is(0));
    }

    @Test
    public void testPrimeImplicants() {
        // f = sum m(0, 1, 2, 5, 6, 7)
        BitSet minterms = new BitSet();
        for (int minterm : new int[] {0, 1, 2, 5, 6, 7}) {
            minterms.set(minterm);
        }
        assertThat(QuineMcCluskey.primeImplicants(3, minterms), contains(
                Implicant.parse("-01"),
                Implicant.parse("-10"),
                Implicant.parse("0-0"),
                Implicant.parse("00-"),
                Implicant.parse("1-1"),
                Implicant.parse("11-")));

        // Cyclic cover, no essential implicant, three terms are needed.
        CoverSolution solution = exact.simplify(3, minterms);
        assertThat(solution.essentialImplicants(), is(empty()));
        assertThat(solution.termCount(), is(3));
        assertThat(solution.minterms(), is(minterms));
    }

    @Test
    public void testDontCares() {
        BitSet onSet = RandomNetworks.minterms(3, List.of("000", "010"));
        BitSet dontCares = RandomNetworks.minterms(3, List.of("100", "110"));
        CoverSolution solution = exact.simplify(3, onSet, dontCares);
        assertThat(solution.implicants(), contains(Implicant.parse("--0")));
        assertThat(solution.toString(), is("~x3"));

        // Don't-cares not adjacent to the on-set do not change the result.
        BitSet unrelated = RandomNetworks.minterms(3, List.of("111"));
        assertThat(exact.simplify(3, onSet, unrelated).implicants(), contains(Implicant.parse("0-0")));
    }

    @Test
    public void testDontCaresCompletingTheSpace() {
        BitSet onSet = RandomNetworks.minterms(2, List.of("00"));
        BitSet dontCares = RandomNetworks.minterms(2, List.of("01", "10", "11"));
        assertThat(exact.simplify(2, onSet, dontCares).implicants(), contains(Implicant.tautology(2)));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("functions")
    public void testEquivalentAndIrredundant(int variableCount, BitSet minterms) {
        for (QuineMcCluskey simplifier : List.of(exact, greedy)) {
            CoverSolution solution = simplifier.simplify(variableCount, minterms);
            assertThat(solution.minterms(), is(minterms));
            assertThat(solution.primeImplicants().containsAll(solution.implicants()), is(true));
            assertThat(solution.implicants().containsAll(solution.essentialImplicants()), is(true));

            for (Implicant removed : solution.implicants()) {
                BitSet remaining = new BitSet();
                for (Implicant implicant : solution.implicants()) {
                    if (!implicant.equals(removed)) {
                        remaining.or(SumOfProducts.of(variableCount, List.of(implicant)).minterms());
                    }
                }
                BitSet uncovered = (BitSet) minterms.clone();
                uncovered.andNot(remaining);
                assertThat(uncovered.isEmpty(), is(false));
            }
        }
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("functions")
    public void testExactIsNotWorseThanGreedy(int variableCount, BitSet minterms) {
        CoverSolution exactSolution = exact.simplify(variableCount, minterms);
        CoverSolution greedySolution = greedy.simplify(variableCount, minterms);
        assertThat(exactSolution.primeImplicants(), is(greedySolution.primeImplicants()));
        if (exactSolution.primeImplicants().size() <= SimplifierConfiguration.DEFAULT_EXACT_COVER_LIMIT) {
            assertThat(exactSolution.termCount(), lessThanOrEqualTo(greedySolution.termCount()));
        }
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("functions")
    public void testIdempotence(int variableCount, BitSet minterms) {
        CoverSolution once = exact.simplify(variableCount, minterms);
        CoverSolution twice = exact.simplify(variableCount, once.minterms());
        assertThat(twice.implicants(), is(once.implicants()));
    }

    @Test
    public void testSimplifyNetwork() throws InvalidFormatException {
        BooleanNetwork network = RandomNetworks.network(3, 5, 4);
        BooleanNetwork canonical = FunctionExtractor.extractAll(TruthTables.fromNetwork(network));
        BooleanNetwork simplified = exact.simplify(canonical);
        assertThat(simplified, is(network));
        for (int variable = 0; variable < network.variableCount(); variable++) {
            BooleanFunction function = simplified.function(variable);
            BooleanFunction reparsed = BooleanFunction.of(
                    variable, 5, ExpressionParser.parse(function.toString(), 5));
            assertThat(reparsed, is(function));
            assertThat(exact.simplify(function).toString(), is(function.toString()));
        }
    }
}
