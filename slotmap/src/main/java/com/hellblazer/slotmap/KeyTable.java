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
 * The key table and its free list. Each key is one packed word holding an index and a generation. The index of a live
 * key is the position of its item in the store; the index of a free key links to the next free key. Free keys are
 * reused first in, first out.
 *
 * @author hal.hildebrand
 */
final class KeyTable {

    private static final long[] EMPTY = new long[0];

    private final HandleLayout layout;

    private long[] keys = EMPTY;
    private int    freeHead;
    private int    freeTail;
    private int    freeCount;
    private int    retiredCount;

    KeyTable(HandleLayout layout) {
        this.layout = layout;
    }

    /**
     * Take the key at the head of the free list and point it at an item position
     *
     * @return the offset of the acquired key
     */
    int acquire(int position) {
        assert freeCount > 0 : "free list is empty";
        int key = freeHead;
        freeHead = index(key);
        setIndex(key, position);
        freeCount--;
        return key;
    }

    int freeCount() {
        return freeCount;
    }

    /**
     * Extend the table to {@code newCount} keys, threading the new keys onto the tail of the free list
     */
    void grow(int newCount) {
        int oldCount = keys.length;
        assert newCount > oldCount : "key tables never shrink";

        keys = Arrays.copyOf(keys, newCount);
        for (int i = oldCount; i < newCount; i++) {
            // the last link points one past the end; it is relinked before anyone follows it
            keys[i] = layout.word(i + 1, 1);
        }

        if (freeCount == 0) {
            freeHead = oldCount;
        } else {
            setIndex(freeTail, oldCount);
        }
        freeTail = newCount - 1;
        freeCount += newCount - oldCount;
    }

    long id(int key) {
        return layout.id(keys[key]);
    }

    int index(int key) {
        return (int) layout.index(keys[key]);
    }

    /**
     * The key the next acquire will return
     */
    int peekFree() {
        assert freeCount > 0 : "free list is empty";
        return freeHead;
    }

    /**
     * Append a key to the tail of the free list
     */
    void release(int key) {
        if (freeCount == 0) {
            freeHead = key;
        } else {
            setIndex(freeTail, key);
        }
        freeTail = key;
        freeCount++;
    }

    /**
     * Drop all keys. Only used when the owning map is closed.
     */
    void reset() {
        keys = EMPTY;
        freeHead = 0;
        freeTail = 0;
        freeCount = 0;
        retiredCount = 0;
    }

    /**
     * Account for a key that is neither live nor free
     */
    void retire(int key) {
        setIndex(key, 0);
        retiredCount++;
    }

    int retiredCount() {
        return retiredCount;
    }

    void setId(int key, long id) {
        keys[key] = layout.word(layout.index(keys[key]), id);
    }

    void setIndex(int key, int index) {
        keys[key] = layout.word(index, layout.id(keys[key]));
    }

    int size() {
        return keys.length;
    }
}
