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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Two-level minimisation of Boolean functions with the Quine-McCluskey method.
 *
 * <p>Prime implicants are computed by repeatedly merging terms of adjacent weight groups. The cover
 * consists of the essential prime implicants plus a selection of the remaining ones, found either
 * by an exhaustive search minimising term count and then literal count or, for larger problems, by
 * a greedy choice of the implicant covering most uncovered minterms. Ties are broken by fewer
 * literals and then by pattern order, so the result is deterministic.</p>
 */
public final class QuineMcCluskey {
    private static final Logger logger = Logger.getLogger(QuineMcCluskey.class.getName());

    private final SimplifierConfiguration configuration;

    public QuineMcCluskey() {
        this(ImmutableSimplifierConfiguration.builder().build());
    }

    public QuineMcCluskey(SimplifierConfiguration configuration) {
        this.configuration = configuration;
    }

    public SimplifierConfiguration configuration() {
        return configuration;
    }

    public CoverSolution simplify(int variableCount, BitSet onSet) {
        return simplify(variableCount, onSet, new BitSet());
    }

    /**
     * Minimises the function which is {@code true} on the given set and {@code false} outside of it
     * and the don't-care set. Don't-cares which are also part of the on-set are ignored.
     */
    public CoverSolution simplify(int variableCount, BitSet onSet, BitSet dontCares) {
        checkArgument(
                0 < variableCount && variableCount <= State.MAX_VARIABLES,
                "Variable count %s out of range",
                variableCount);
        int size = 1 << variableCount;
        checkArgument(onSet.length() <= size && dontCares.length() <= size, "Minterm out of range");

        if (onSet.isEmpty()) {
            return CoverSolution.empty(variableCount);
        }

        BitSet care = BitSets.copyOf(onSet);
        care.or(dontCares);
        if (care.cardinality() == size) {
            ImmutableSortedSet<Implicant> tautology = ImmutableSortedSet.of(Implicant.tautology(variableCount));
            return new CoverSolution(variableCount, tautology, tautology, tautology);
        }

        List<Implicant> primes = new ArrayList<>();
        List<BitSet> covered = new ArrayList<>();
        for (Implicant prime : primeImplicants(variableCount, care)) {
            BitSet members = BitSets.coveredMembers(prime, onSet);
            if (!members.isEmpty()) {
                primes.add(prime);
                covered.add(members);
            }
        }
        logger.log(Level.FINE, "Found {0} prime implicants for {1} minterms",
                new Object[] {primes.size(), onSet.cardinality()});

        BitSet essential = new BitSet(primes.size());
        for (int minterm = onSet.nextSetBit(0); minterm >= 0; minterm = onSet.nextSetBit(minterm + 1)) {
            int coveringPrime = -1;
            int coveringCount = 0;
            for (int i = 0; i < primes.size(); i++) {
                if (covered.get(i).get(minterm)) {
                    coveringPrime = i;
                    coveringCount += 1;
                }
            }
            if (coveringCount == 0) {
                throw new UnsatisfiableCoverException(variableCount, minterm);
            }
            if (coveringCount == 1) {
                essential.set(coveringPrime);
            }
        }

        BitSet uncovered = BitSets.copyOf(onSet);
        for (int i = essential.nextSetBit(0); i >= 0; i = essential.nextSetBit(i + 1)) {
            uncovered.andNot(covered.get(i));
        }

        List<Integer> candidates = new ArrayList<>();
        for (int i = 0; i < primes.size(); i++) {
            if (!essential.get(i) && covered.get(i).intersects(uncovered)) {
                candidates.add(i);
            }
        }

        BitSet selection = BitSets.copyOf(essential);
        if (!uncovered.isEmpty()) {
            if (configuration.useExactCover() && candidates.size() <= configuration.exactCoverLimit()) {
                logger.log(Level.FINER, "Searching exact cover among {0} candidates", candidates.size());
                selection.or(new ExactCover(primes, covered, candidates).search(uncovered));
            } else {
                logger.log(Level.FINER, "Choosing greedy cover among {0} candidates", candidates.size());
                selection.or(greedyCover(primes, covered, candidates, uncovered));
            }
        }
        removeRedundant(selection, essential, covered, onSet);

        ImmutableSortedSet.Builder<Implicant> implicants = ImmutableSortedSet.naturalOrder();
        ImmutableSortedSet.Builder<Implicant> essentials = ImmutableSortedSet.naturalOrder();
        for (int i = selection.nextSetBit(0); i >= 0; i = selection.nextSetBit(i + 1)) {
            implicants.add(primes.get(i));
            if (essential.get(i)) {
                essentials.add(primes.get(i));
            }
        }
        return new CoverSolution(
                variableCount, ImmutableSortedSet.copyOf(primes), essentials.build(), implicants.build());
    }

    /** Minimises the function and keeps the variable it updates. */
    public BooleanFunction simplify(BooleanFunction function) {
        CoverSolution solution = simplify(function.variableCount(), function.minterms());
        return BooleanFunction.of(function.variable(), solution.toSumOfProducts());
    }

    public BooleanNetwork simplify(BooleanNetwork network) {
        ImmutableList.Builder<BooleanFunction> functions = ImmutableList.builder();
        for (BooleanFunction function : network.functions()) {
            functions.add(simplify(function));
        }
        return BooleanNetwork.of(functions.build());
    }

    /**
     * Computes all prime implicants of the function which is {@code true} exactly on the given set.
     * Terms are grouped by weight and merged with the terms of the next group until no merge is
     * possible; every term which could not be merged in its round is prime.
     */
    public static ImmutableSortedSet<Implicant> primeImplicants(int variableCount, BitSet minterms) {
        List<Set<Implicant>> groups = emptyGroups(variableCount);
        for (int minterm = minterms.nextSetBit(0); minterm >= 0; minterm = minterms.nextSetBit(minterm + 1)) {
            Implicant implicant = Implicant.minterm(variableCount, minterm);
            groups.get(implicant.weight()).add(implicant);
        }

        TreeSet<Implicant> primes = new TreeSet<>();
        boolean nonEmpty = !minterms.isEmpty();
        int round = 0;
        while (nonEmpty) {
            Set<Implicant> combined = new HashSet<>();
            List<Set<Implicant>> next = emptyGroups(variableCount);
            for (int weight = 0; weight < variableCount; weight++) {
                for (Implicant lower : groups.get(weight)) {
                    for (Implicant upper : groups.get(weight + 1)) {
                        Implicant merged = lower.merge(upper);
                        if (merged != null) {
                            combined.add(lower);
                            combined.add(upper);
                            next.get(merged.weight()).add(merged);
                        }
                    }
                }
            }

            nonEmpty = false;
            for (int weight = 0; weight <= variableCount; weight++) {
                for (Implicant implicant : groups.get(weight)) {
                    if (!combined.contains(implicant)) {
                        primes.add(implicant);
                    }
                }
                nonEmpty |= !next.get(weight).isEmpty();
            }
            groups = next;
            round += 1;
        }
        logger.log(Level.FINEST, "Prime implicant generation took {0} rounds", round);
        return ImmutableSortedSet.copyOf(primes);
    }

    private static List<Set<Implicant>> emptyGroups(int variableCount) {
        List<Set<Implicant>> groups = new ArrayList<>(variableCount + 1);
        for (int weight = 0; weight <= variableCount; weight++) {
            groups.add(new LinkedHashSet<>());
        }
        return groups;
    }

    private static BitSet greedyCover(
            List<Implicant> primes, List<BitSet> covered, List<Integer> candidates, BitSet uncovered) {
        BitSet remaining = BitSets.copyOf(uncovered);
        BitSet selection = new BitSet(primes.size());
        while (!remaining.isEmpty()) {
            int best = -1;
            int bestGain = 0;
            for (int candidate : candidates) {
                if (selection.get(candidate)) {
                    continue;
                }
                int gain = BitSets.intersectionSize(covered.get(candidate), remaining);
                if (gain == 0) {
                    continue;
                }
                if (best == -1 || isBetter(primes.get(candidate), gain, primes.get(best), bestGain)) {
                    best = candidate;
                    bestGain = gain;
                }
            }
            if (best == -1) {
                throw new UnsatisfiableCoverException(primes.get(0).variableCount(), remaining.nextSetBit(0));
            }
            selection.set(best);
            remaining.andNot(covered.get(best));
        }
        return selection;
    }

    private static boolean isBetter(Implicant implicant, int gain, Implicant best, int bestGain) {
        if (gain != bestGain) {
            return gain > bestGain;
        }
        if (implicant.literalCount() != best.literalCount()) {
            return implicant.literalCount() < best.literalCount();
        }
        return implicant.compareTo(best) < 0;
    }

    /** Drops selected implicants whose minterms are all covered by the other selected ones. */
    private static void removeRedundant(BitSet selection, BitSet essential, List<BitSet> covered, BitSet onSet) {
        for (int i = selection.length() - 1; i >= 0; i = selection.previousSetBit(i - 1)) {
            if (essential.get(i)) {
                continue;
            }
            BitSet others = new BitSet();
            for (int j = selection.nextSetBit(0); j >= 0; j = selection.nextSetBit(j + 1)) {
                if (j != i) {
                    others.or(covered.get(j));
                }
            }
            if (BitSets.isSubset(onSet, others)) {
                selection.clear(i);
            }
        }
    }

    /**
     * Branch and bound search for a cover with the fewest implicants, and among those the fewest
     * literals. Branches on the lowest uncovered minterm.
     */
    private static final class ExactCover {
        private final List<Implicant> primes;
        private final List<BitSet> covered;
        private final List<Integer> candidates;
        @Nullable
        private BitSet best;
        private int bestTerms = Integer.MAX_VALUE;
        private int bestLiterals = Integer.MAX_VALUE;

        ExactCover(List<Implicant> primes, List<BitSet> covered, List<Integer> candidates) {
            this.primes = primes;
            this.covered = covered;
            this.candidates = candidates;
        }

        BitSet search(BitSet uncovered) {
            search(uncovered, new BitSet(primes.size()), 0, 0);
            if (best == null) {
                throw new UnsatisfiableCoverException(primes.get(0).variableCount(), uncovered.nextSetBit(0));
            }
            return best;
        }

        private void search(BitSet uncovered, BitSet selection, int terms, int literals) {
            if (uncovered.isEmpty()) {
                if (terms < bestTerms || (terms == bestTerms && literals < bestLiterals)) {
                    best = BitSets.copyOf(selection);
                    bestTerms = terms;
                    bestLiterals = literals;
                }
                return;
            }
            if (terms + 1 > bestTerms) {
                return;
            }

            int minterm = uncovered.nextSetBit(0);
            for (int candidate : candidates) {
                if (selection.get(candidate) || !covered.get(candidate).get(minterm)) {
                    continue;
                }
                BitSet remaining = BitSets.copyOf(uncovered);
                remaining.andNot(covered.get(candidate));
                selection.set(candidate);
                search(remaining, selection, terms + 1, literals + primes.get(candidate).literalCount());
                selection.clear(candidate);
            }
        }
    }
}
