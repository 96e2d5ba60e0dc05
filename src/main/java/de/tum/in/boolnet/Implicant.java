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
import static com.google.common.base.Preconditions.checkElementIndex;

import java.util.ArrayList;
import java.util.List;
import java.util.PrimitiveIterator;
import javax.annotation.Nullable;

/**
 * A product term, i.e. a partial assignment where each variable is fixed to {@code 0}, fixed to
 * {@code 1} or left open ("don't care"). Stored as a pair of bit vectors using the state index
 * layout: {@code mask} marks the open variables, {@code value} holds the fixed ones and is zero on
 * all open positions.
 *
 * <p>The natural order is the lexicographic order of the patterns written with {@code -} for open
 * variables, where {@code -} precedes {@code 0} precedes {@code 1}.</p>
 */
public final class Implicant implements Comparable<Implicant> {
    private final int variableCount;
    private final int value;
    private final int mask;

    private Implicant(int variableCount, int value, int mask) {
        this.variableCount = variableCount;
        this.value = value;
        this.mask = mask;
    }

    public static Implicant of(int variableCount, int value, int mask) {
        checkArgument(
                0 < variableCount && variableCount <= State.MAX_VARIABLES,
                "Variable count %s out of range",
                variableCount);
        int full = (1 << variableCount) - 1;
        checkArgument((value & ~full) == 0 && (mask & ~full) == 0, "Bits outside of %s variables", variableCount);
        return new Implicant(variableCount, value & ~mask, mask);
    }

    public static Implicant minterm(int variableCount, int minterm) {
        return of(variableCount, minterm, 0);
    }

    /** The implicant with all variables open, i.e. the constant {@code true}. */
    public static Implicant tautology(int variableCount) {
        return of(variableCount, 0, (1 << variableCount) - 1);
    }

    /**
     * Parses a pattern like {@code "1-0"}.
     *
     * @throws IllegalArgumentException if the pattern contains characters other than {@code 0},
     *     {@code 1} and {@code -}.
     */
    public static Implicant parse(String pattern) {
        int length = pattern.length();
        checkArgument(0 < length && length <= State.MAX_VARIABLES, "Invalid pattern length in %s", pattern);
        int value = 0;
        int mask = 0;
        for (int i = 0; i < length; i++) {
            value <<= 1;
            mask <<= 1;
            switch (pattern.charAt(i)) {
                case '0':
                    break;
                case '1':
                    value |= 1;
                    break;
                case '-':
                    mask |= 1;
                    break;
                default:
                    throw new IllegalArgumentException("Invalid pattern " + pattern);
            }
        }
        return new Implicant(length, value, mask);
    }

    public int variableCount() {
        return variableCount;
    }

    public int value() {
        return value;
    }

    public int mask() {
        return mask;
    }

    /** Whether the variable is fixed by this term. */
    public boolean isFixed(int variable) {
        checkElementIndex(variable, variableCount);
        return (mask & State.mask(variableCount, variable)) == 0;
    }

    /** The value a fixed variable is fixed to. */
    public boolean isPositive(int variable) {
        checkArgument(isFixed(variable), "Variable %s is open", variable);
        return (value & State.mask(variableCount, variable)) != 0;
    }

    public int literalCount() {
        return variableCount - Integer.bitCount(mask);
    }

    /** Number of variables fixed to {@code 1}. */
    public int weight() {
        return Integer.bitCount(value);
    }

    public boolean covers(int minterm) {
        return (minterm & ~mask) == value;
    }

    public boolean covers(State state) {
        return state.variableCount() == variableCount && covers(state.index());
    }

    /** Whether every minterm of the other term is a minterm of this term. */
    public boolean covers(Implicant other) {
        return (other.mask & ~mask) == 0 && (other.value & ~mask) == value;
    }

    /**
     * Combines two terms which have the same open variables and differ in exactly one fixed variable
     * into the term where that variable is open.
     *
     * @return the combined term, or {@code null} if the terms cannot be combined.
     */
    @Nullable
    public Implicant merge(Implicant other) {
        if (other.variableCount != variableCount || other.mask != mask) {
            return null;
        }
        int difference = value ^ other.value;
        if (Integer.bitCount(difference) != 1) {
            return null;
        }
        return new Implicant(variableCount, value & ~difference, mask | difference);
    }

    public int mintermCount() {
        return 1 << Integer.bitCount(mask);
    }

    public PrimitiveIterator.OfInt minterms() {
        return new CoveredMintermIterator(value, mask);
    }

    /** The conjunction of the literals of this term, ordered by variable. */
    public Expression toExpression() {
        List<Expression> literals = new ArrayList<>(literalCount());
        for (int variable = 0; variable < variableCount; variable++) {
            if (isFixed(variable)) {
                literals.add(Expression.literal(variable, isPositive(variable)));
            }
        }
        return Expression.conjunction(literals);
    }

    /** The term written with the literal syntax, e.g. {@code (x1 & ~x3)}, {@code ~x2} or {@code 1}. */
    public String toFormula() {
        if (literalCount() == 0) {
            return "1";
        }
        StringBuilder builder = new StringBuilder();
        for (int variable = 0; variable < variableCount; variable++) {
            if (!isFixed(variable)) {
                continue;
            }
            if (builder.length() > 0) {
                builder.append(" & ");
            }
            if (!isPositive(variable)) {
                builder.append('~');
            }
            builder.append(StateSpace.variableName(variable));
        }
        return literalCount() == 1 ? builder.toString() : "(" + builder + ")";
    }

    private char symbol(int variable) {
        int bit = State.mask(variableCount, variable);
        if ((mask & bit) != 0) {
            return '-';
        }
        return (value & bit) == 0 ? '0' : '1';
    }

    @Override
    public int compareTo(Implicant other) {
        int result = Integer.compare(variableCount, other.variableCount);
        if (result != 0) {
            return result;
        }
        for (int variable = 0; variable < variableCount; variable++) {
            result = Character.compare(symbol(variable), other.symbol(variable));
            if (result != 0) {
                return result;
            }
        }
        return 0;
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof Implicant)) {
            return false;
        }
        Implicant that = (Implicant) object;
        return variableCount == that.variableCount && value == that.value && mask == that.mask;
    }

    @Override
    public int hashCode() {
        return (31 * variableCount + value) * 1_000_003 + mask;
    }

    @Override
    public String toString() {
        char[] pattern = new char[variableCount];
        for (int variable = 0; variable < variableCount; variable++) {
            pattern[variable] = symbol(variable);
        }
        return new String(pattern);
    }
}
