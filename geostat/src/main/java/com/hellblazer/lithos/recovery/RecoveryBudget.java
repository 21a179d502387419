/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Lithos.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.lithos.recovery;

import java.util.EnumSet;
import java.util.Set;

/**
 * One automatic retry per failure kind. A budget belongs to a single run, or to a single entity within a run; it is
 * not thread safe.
 *
 * @author hal.hildebrand
 */
public class RecoveryBudget {
    private final Set<ErrorKind> spent = EnumSet.noneOf(ErrorKind.class);

    public boolean isSpent(ErrorKind kind) {
        return spent.contains(kind);
    }

    /**
     * Claim the retry for the kind
     *
     * @return false if it was already claimed
     */
    public boolean tryAcquire(ErrorKind kind) {
        return spent.add(kind);
    }
}
