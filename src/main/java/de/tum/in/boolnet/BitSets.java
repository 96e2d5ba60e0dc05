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

import java.util.BitSet;
import java.util.PrimitiveIterator;

final class BitSets {
    private BitSets() {}

    @SuppressWarnings("UseOfClone")
    static BitSet copyOf(BitSet set) {
        return (BitSet) set.clone();
    }

    static boolean isSubset(BitSet set, BitSet of) {
        if (set.cardinality() > of.cardinality()) {
            return false;
        }
        BitSet copy = copyOf(set);
        copy.andNot(of);
        return copy.isEmpty();
    }

    static int intersectionSize(BitSet one, BitSet other) {
        BitSet copy = copyOf(one);
        copy.and(other);
        return copy.cardinality();
    }

    /** The minterms of the term which are also members of the given set. */
    static BitSet coveredMembers(Implicant implicant, BitSet set) {
        BitSet covered = new BitSet();
        PrimitiveIterator.OfInt minterms = implicant.minterms();
        while (minterms.hasNext()) {
            int minterm = minterms.nextInt();
            if (set.get(minterm)) {
                covered.set(minterm);
            }
        }
        return covered;
    }
}
