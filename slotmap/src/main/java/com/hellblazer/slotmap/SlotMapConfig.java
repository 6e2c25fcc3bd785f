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

import java.util.Objects;

/**
 * Configuration for a {@link SlotMap}. The map copies these values when it is constructed, so changing a config
 * afterwards has no effect on maps already built from it.
 *
 * @author hal.hildebrand
 */
public class SlotMapConfig {

    public static final int DEFAULT_INDEX_BITS      = 40;
    public static final int DEFAULT_ID_BITS         = Long.SIZE - DEFAULT_INDEX_BITS;
    public static final int DEFAULT_MIN_FREE_KEYS   = 32;
    public static final int DEFAULT_ALLOCATION_SIZE = 512; // items per allocation

    private int                      indexBits      = DEFAULT_INDEX_BITS;
    private int                      idBits         = DEFAULT_ID_BITS;
    private int                      minFreeKeys    = DEFAULT_MIN_FREE_KEYS;
    private int                      allocationSize = DEFAULT_ALLOCATION_SIZE;
    private GenerationOverflowPolicy overflowPolicy = GenerationOverflowPolicy.FAIL;

    public static SlotMapConfig defaults() {
        return new SlotMapConfig();
    }

    /**
     * Number of items (and keys) added or dropped by a single reallocation.
     */
    public int getAllocationSize() {
        return allocationSize;
    }

    public int getIdBits() {
        return idBits;
    }

    public int getIndexBits() {
        return indexBits;
    }

    /**
     * Number of free keys kept in reserve. The key table grows once the free list is down to this many keys, which
     * also bounds how often a single key is reused: a key goes back to the end of a queue at least this long.
     */
    public int getMinFreeKeys() {
        return minFreeKeys;
    }

    public GenerationOverflowPolicy getOverflowPolicy() {
        return overflowPolicy;
    }

    /**
     * The handle layout these bit widths describe
     *
     * @throws IllegalArgumentException if the widths are out of range
     */
    public HandleLayout layout() {
        return new HandleLayout(indexBits, idBits);
    }

    @Override
    public String toString() {
        return "SlotMapConfig[indexBits=" + indexBits + ", idBits=" + idBits + ", minFreeKeys=" + minFreeKeys
        + ", allocationSize=" + allocationSize + ", overflowPolicy=" + overflowPolicy + "]";
    }

    /**
     * @throws IllegalArgumentException describing the first invalid setting
     */
    public SlotMapConfig validate() {
        layout();
        if (minFreeKeys < 0) {
            throw new IllegalArgumentException("minFreeKeys must be >= 0: " + minFreeKeys);
        }
        if (allocationSize <= 0) {
            throw new IllegalArgumentException("allocationSize must be > 0: " + allocationSize);
        }
        return this;
    }

    public SlotMapConfig withAllocationSize(int allocationSize) {
        this.allocationSize = allocationSize;
        return this;
    }

    /**
     * Set both widths at once, the usual way to trade index space against generation space
     */
    public SlotMapConfig withBits(int indexBits, int idBits) {
        this.indexBits = indexBits;
        this.idBits = idBits;
        return this;
    }

    public SlotMapConfig withIdBits(int idBits) {
        this.idBits = idBits;
        return this;
    }

    public SlotMapConfig withIndexBits(int indexBits) {
        this.indexBits = indexBits;
        return this;
    }

    public SlotMapConfig withMinFreeKeys(int minFreeKeys) {
        this.minFreeKeys = minFreeKeys;
        return this;
    }

    public SlotMapConfig withOverflowPolicy(GenerationOverflowPolicy policy) {
        this.overflowPolicy = Objects.requireNonNull(policy, "Overflow policy cannot be null");
        return this;
    }
}
