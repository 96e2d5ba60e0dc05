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

import static com.google.common.base.Preconditions.checkState;

import org.immutables.value.Value;

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public class SimplifierConfiguration {
    public static final int DEFAULT_EXACT_COVER_LIMIT = 16;

    /**
     * Maximal number of candidate implicants left after selecting the essential ones for which the
     * cover is searched exhaustively. Larger problems are covered greedily.
     */
    @Value.Default
    public int exactCoverLimit() {
        return DEFAULT_EXACT_COVER_LIMIT;
    }

    @Value.Default
    public boolean useExactCover() {
        return true;
    }

    @Value.Check
    protected void check() {
        checkState(0 <= exactCoverLimit() && exactCoverLimit() <= 30, "Exact cover limit %s out of range", exactCoverLimit());
    }
}
