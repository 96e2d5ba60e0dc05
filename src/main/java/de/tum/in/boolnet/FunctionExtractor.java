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

import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.common.collect.ImmutableList;
import java.util.BitSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads the update functions off a truth table. The extracted sums are canonical, i.e. they contain
 * one full minterm for each state in which the updated variable ends up {@code 1}.
 */
public final class FunctionExtractor {
    private static final Logger logger = Logger.getLogger(FunctionExtractor.class.getName());

    private FunctionExtractor() {}

    /** The states in which the variable is {@code 1} after updating it. */
    public static BitSet onSet(TruthTable table, int variable) {
        checkElementIndex(variable, table.variableCount());
        BitSet onSet = new BitSet(1 << table.variableCount());
        for (State state : table.stateSpace()) {
            if (table.nextValue(state, variable)) {
                onSet.set(state.index());
            }
        }
        return onSet;
    }

    public static SumOfProducts canonical(TruthTable table, int variable) {
        return SumOfProducts.canonical(table.variableCount(), onSet(table, variable));
    }

    public static BooleanFunction extract(TruthTable table, int variable) {
        SumOfProducts sum = canonical(table, variable);
        logger.log(Level.FINER, "Extracted {0} minterms for {1}",
                new Object[] {sum.termCount(), StateSpace.variableName(variable)});
        return BooleanFunction.of(variable, sum);
    }

    public static BooleanNetwork extractAll(TruthTable table) {
        ImmutableList.Builder<BooleanFunction> functions = ImmutableList.builder();
        for (int variable = 0; variable < table.variableCount(); variable++) {
            functions.add(extract(table, variable));
        }
        return BooleanNetwork.of(functions.build());
    }
}
