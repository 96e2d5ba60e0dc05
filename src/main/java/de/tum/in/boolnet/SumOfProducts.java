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
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.PrimitiveIterator;

/** A disjunction of product terms over a fixed number of variables. */
public final class SumOfProducts {
    private final int variableCount;
    private final ImmutableList<Implicant> terms;

    private SumOfProducts(int variableCount, ImmutableList<Implicant> terms) {
        this.variableCount = variableCount;
        this.terms = terms;
    }

    public static SumOfProducts of(int variableCount, Iterable<Implicant> terms) {
        ImmutableList<Implicant> copy = ImmutableList.copyOf(terms);
        for (Implicant term : copy) {
            checkArgument(
                    term.variableCount() == variableCount,
                    "Term %s does not range over %s variables",
                    term,
                    variableCount);
        }
        return new SumOfProducts(variableCount, copy);
    }

    public static SumOfProducts constant(int variableCount, boolean value) {
        return value
                ? new SumOfProducts(variableCount, ImmutableList.of(Implicant.tautology(variableCount)))
                : new SumOfProducts(variableCount, ImmutableList.of());
    }

    /** The canonical form with one full minterm per member of the given set, in index order. */
    public static SumOfProducts canonical(int variableCount, BitSet minterms) {
        checkArgument(minterms.length() <= (1 << variableCount), "Minterm out of range");
        ImmutableList.Builder<Implicant> terms = ImmutableList.builder();
        for (int minterm = minterms.nextSetBit(0); minterm >= 0; minterm = minterms.nextSetBit(minterm + 1)) {
            terms.add(Implicant.minterm(variableCount, minterm));
        }
        return new SumOfProducts(variableCount, terms.build());
    }

    public int variableCount() {
        return variableCount;
    }

    public ImmutableList<Implicant> terms() {
        return terms;
    }

    public int termCount() {
        return terms.size();
    }

    public int literalCount() {
        return terms.stream().mapToInt(Implicant::literalCount).sum();
    }

    public boolean evaluate(State state) {
        checkArgument(state.variableCount() == variableCount, "State %s has wrong size", state);
        for (Implicant term : terms) {
            if (term.covers(state.index())) {
                return true;
            }
        }
        return false;
    }

    /** The states on which this sum evaluates to {@code true}. */
    public BitSet minterms() {
        BitSet minterms = new BitSet(1 << variableCount);
        for (Implicant term : terms) {
            PrimitiveIterator.OfInt iterator = term.minterms();
            while (iterator.hasNext()) {
                minterms.set(iterator.nextInt());
            }
        }
        return minterms;
    }

    public Expression toExpression() {
        List<Expression> products = new ArrayList<>(terms.size());
        for (Implicant term : terms) {
            if (term.literalCount() == 0) {
                return Expression.constant(true);
            }
            products.add(term.toExpression());
        }
        return Expression.disjunction(products);
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof SumOfProducts)) {
            return false;
        }
        SumOfProducts that = (SumOfProducts) object;
        return variableCount == that.variableCount && terms.equals(that.terms);
    }

    @Override
    public int hashCode() {
        return 31 * variableCount + terms.hashCode();
    }

    /** The sum written with the literal syntax, {@code 0} if there are no terms. */
    @Override
    public String toString() {
        if (terms.isEmpty()) {
            return "0";
        }
        StringBuilder builder = new StringBuilder();
        for (Implicant term : terms) {
            if (term.literalCount() == 0) {
                return "1";
            }
            if (builder.length() > 0) {
                builder.append(" | ");
            }
            builder.append(term.toFormula());
        }
        return builder.toString();
    }
}
