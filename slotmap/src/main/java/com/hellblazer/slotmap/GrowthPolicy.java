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
 * Chunked reallocation policy for the key table and the item store. All sizes are multiples of the allocation size,
 * except where capped by the index space.
 *
 * @author hal.hildebrand
 */
final class GrowthPolicy {

    // Largest array the VM will reliably allocate
    static final int MAX_ARRAY_SIZE = Integer.MAX_VALUE - 8;

    private final int allocationSize;
    private final int minFreeKeys;
    private final int maxKeys;

    GrowthPolicy(SlotMapConfig config, HandleLayout layout) {
        this.allocationSize = config.getAllocationSize();
        this.minFreeKeys = config.getMinFreeKeys();
        this.maxKeys = layout.getIndexMax() >= MAX_ARRAY_SIZE ? MAX_ARRAY_SIZE : (int) (layout.getIndexMax() + 1);
    }

    int getMaxKeys() {
        return maxKeys;
    }

    int grownItemCapacity(int capacity) {
        return (int) Math.min(nextChunkAbove(capacity), maxKeys);
    }

    boolean needsMoreKeys(int freeKeys) {
        return freeKeys <= minFreeKeys;
    }

    /**
     * Key count after growth: at least one chunk more than now, and enough that the free list is above the reserve
     * again. {@code reservedKeys} counts keys that are not free (live plus retired).
     */
    int nextKeyCount(int keyCount, int reservedKeys) {
        long target = Math.max(nextChunkAbove(keyCount), chunkCeiling((long) reservedKeys + minFreeKeys + 1));
        return (int) Math.min(target, maxKeys);
    }

    boolean shouldShrinkItems(int capacity, int size) {
        return capacity >= (long) size + 2L * allocationSize;
    }

    int shrunkItemCapacity(int size) {
        return (int) Math.min(chunkCeiling(size), maxKeys);
    }

    private long chunkCeiling(long n) {
        return ((n + allocationSize - 1) / allocationSize) * allocationSize;
    }

    private long nextChunkAbove(long n) {
        return (n / allocationSize + 1) * allocationSize;
    }
}
