/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
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
package com.hellblazer.slotmap;

/**
 * Point in time snapshot of a {@link SlotMap}'s allocation state, for tuning the allocation size and bit widths.
 *
 * @author hal.hildebrand
 */
public record SlotMapStats(int size, int itemCapacity, int keyCount, int freeKeys, int retiredKeys, long keyGrowths,
                           long itemGrowths, long itemShrinks) {

    /**
     * Fraction of allocated item slots holding live items
     */
    public double itemUtilization() {
        return itemCapacity > 0 ? (double) size / itemCapacity : 0.0;
    }

    /**
     * Fraction of keys that are neither free nor retired
     */
    public double keyUtilization() {
        return keyCount > 0 ? (double) size / keyCount : 0.0;
    }
}
