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

import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;

/**
 * Enumerates the minterms of a product term by counting through all assignments of its open
 * variables, lowest open bit first. The first minterm is the term's value itself.
 */
final class CoveredMintermIterator implements PrimitiveIterator.OfInt {
    private final int[] openBits;
    private int current;
    private int numSetBits = -1;

    CoveredMintermIterator(int value, int mask) {
        openBits = new int[Integer.bitCount(mask)];
        int pos = 0;
        for (int remaining = mask; remaining != 0; remaining &= remaining - 1) {
            openBits[pos] = Integer.lowestOneBit(remaining);
            pos += 1;
        }
        current = value;
    }

    @Override
    public boolean hasNext() {
        return numSetBits < openBits.length;
    }

    @Override
    public int nextInt() {
        if (numSetBits == -1) {
            numSetBits = 0;
            return current;
        }

        if (numSetBits == openBits.length) {
            throw new NoSuchElementException("No next minterm");
        }

        for (int bit : openBits) {
            if ((current & bit) != 0) {
                current &= ~bit;
                numSetBits -= 1;
            } else {
                current |= bit;
                numSetBits += 1;
                break;
            }
        }

        return current;
    }
}
