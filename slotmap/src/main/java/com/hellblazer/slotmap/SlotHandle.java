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
 * Caller visible reference to an item in a {@link SlotMap}. A handle names a key table slot and the generation that
 * slot had when the handle was issued. Handles carry no ownership; the map checks them against its key table on every
 * use, so a handle to a removed item simply stops resolving.
 *
 * @param index      offset of the key in the key table
 * @param generation generation of the key when the handle was issued, 0 for the null handle
 * @author hal.hildebrand
 */
public record SlotHandle(long index, long generation) {

    /**
     * The handle that never resolves
     */
    public static final SlotHandle NULL = new SlotHandle(0, 0);

    public boolean isNull() {
        return generation == 0;
    }

    @Override
    public String toString() {
        return isNull() ? "Slot[null]" : "Slot[" + index + "@" + generation + "]";
    }
}
