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
 * What a {@link SlotMap} does when a key's generation counter runs out of bits.
 *
 * @author hal.hildebrand
 */
public enum GenerationOverflowPolicy {
    /**
     * Removing an item whose key already holds the maximum generation throws
     * {@link SlotMapException.GenerationExhaustedException}. The item stays in the map.
     */
    FAIL,

    /**
     * A key whose generation reaches the maximum on removal is never handed out again. The key table grows to
     * replace it, so no generation value is ever reissued for a slot.
     */
    RETIRE
}
