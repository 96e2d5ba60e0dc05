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

import com.google.common.collect.ImmutableSortedSet;
import java.util.BitSet;

/**
 * The result of minimising a function: all prime implicants, the essential ones among them and the
 * selected cover. Every implicant of the cover is prime, the essential implicants are part of it and
 * no implicant of the cover is redundant.
 */
public final class CoverSolution {
    private final int variableCount;
    private final ImmutableSortedSet<Implicant> primeImplicants;
    private final ImmutableSortedSet<Implicant> essentialImplicants;
    private final ImmutableSortedSet<Implicant> implicants;

    CoverSolution(
            int variableCount,
            ImmutableSortedSet<Implicant> primeImplicants,
            ImmutableSortedSet<Implicant> essentialImplicants,
            ImmutableSortedSet<Implicant> implicants) {
        this.variableCount = variableCount;
        this.primeImplicants = primeImplicants;
        this.essentialImplicants = essentialImplicants;
        this.implicants = implicants;
    }

    static CoverSolution empty(int variableCount) {
        return new CoverSolution(variableCount, ImmutableSortedSet.of(), ImmutableSortedSet.of(), ImmutableSortedSet.of());
    }

    public int variableCount() {
        return variableCount;
    }

    public ImmutableSortedSet<Implicant> primeImplicants() {
        return primeImplicants;
    }

    public ImmutableSortedSet<Implicant> essentialImplicants() {
        return essentialImplicants;
    }

    /** The selected cover in pattern order. */
    public ImmutableSortedSet<Implicant> implicants() {
        return implicants;
    }

    public boolean isEmpty() {
        return implicants.isEmpty();
    }

    public int termCount() {
        return implicants.size();
    }

    public int literalCount() {
        return implicants.stream().mapToInt(Implicant::literalCount).sum();
    }

    public boolean covers(int minterm) {
        for (Implicant implicant : implicants) {
            if (implicant.covers(minterm)) {
                return true;
            }
        }
        return false;
    }

    public BitSet minterms() {
        return toSumOfProducts().minterms();
    }

    public SumOfProducts toSumOfProducts() {
        return SumOfProducts.of(variableCount, implicants);
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof CoverSolution)) {
            return false;
        }
        CoverSolution that = (CoverSolution) object;
        return variableCount == that.variableCount
                && primeImplicants.equals(that.primeImplicants)
                && essentialImplicants.equals(that.essentialImplicants)
                && implicants.equals(that.implicants);
    }

    @Override
    public int hashCode() {
        return (31 * variableCount + primeImplicants.hashCode()) * 31 + implicants.hashCode();
    }

    @Override
    public String toString() {
        return toSumOfProducts().toString();
    }
}
