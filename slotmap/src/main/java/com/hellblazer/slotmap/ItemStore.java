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

import java.util.Arrays;

/**
 * Dense item storage plus the parallel table of owning key offsets. Positions {@code [0, size)} are live; removal
 * moves the last item into the hole.
 *
 * @param <T> the item type
 * @author hal.hildebrand
 */
final class ItemStore<T> {

    private static final Object[] EMPTY_ITEMS = new Object[0];
    private static final int[]    EMPTY_KEYS  = new int[0];

    private Object[] items      = EMPTY_ITEMS;
    private int[]    keyOffsets = EMPTY_KEYS;
    private int      size;

    /**
     * Append an item owned by {@code key}; capacity must already be available
     *
     * @return the position of the item
     */
    int append(T item, int key) {
        assert size < items.length : "no capacity";
        items[size] = item;
        keyOffsets[size] = key;
        return size++;
    }

    int capacity() {
        return items.length;
    }

    @SuppressWarnings("unchecked")
    T get(int position) {
        return (T) items[position];
    }

    /**
     * Identity search
     */
    int indexOf(Object item) {
        for (int i = 0; i < size; i++) {
            if (items[i] == item) {
                return i;
            }
        }
        return -1;
    }

    int keyOf(int position) {
        return keyOffsets[position];
    }

    /**
     * Remove the item at {@code position}, moving the last item and its key offset into the hole. The caller must
     * repoint the moved item's key to {@code position}.
     *
     * @return the removed item
     */
    T removeAndCompact(int position) {
        T removed = get(position);
        size--;
        if (position != size) {
            items[position] = items[size];
            keyOffsets[position] = keyOffsets[size];
        }
        items[size] = null;
        return removed;
    }

    /**
     * Drop every item and release both arrays
     */
    void reset() {
        items = EMPTY_ITEMS;
        keyOffsets = EMPTY_KEYS;
        size = 0;
    }

    /**
     * Reallocate both arrays to {@code capacity} slots
     */
    void resize(int capacity) {
        assert capacity >= size : "shrinking allocation below live items is not allowed";
        if (capacity == items.length) {
            return;
        }
        items = capacity == 0 ? EMPTY_ITEMS : Arrays.copyOf(items, capacity);
        keyOffsets = capacity == 0 ? EMPTY_KEYS : Arrays.copyOf(keyOffsets, capacity);
    }

    @SuppressWarnings("unchecked")
    T set(int position, T item) {
        T previous = (T) items[position];
        items[position] = item;
        return previous;
    }

    int size() {
        return size;
    }
}
