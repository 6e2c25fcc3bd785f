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
 * Bit layout shared by keys and handles. The index occupies the low {@code indexBits} bits of a 64 bit word and the
 * generation the {@code idBits} bits above it.
 *
 * <pre>
 *   63                 indexBits+idBits      indexBits                0
 *   |  unused            |      generation     |         index        |
 * </pre>
 *
 * @author hal.hildebrand
 */
public final class HandleLayout {

    private final int  indexBits;
    private final int  idBits;
    private final long indexMax;
    private final long idMax;

    public HandleLayout(int indexBits, int idBits) {
        if (indexBits <= 0 || indexBits >= Long.SIZE) {
            throw new IllegalArgumentException("indexBits must be in [1, 63]: " + indexBits);
        }
        if (idBits <= 0 || idBits >= Long.SIZE) {
            throw new IllegalArgumentException("idBits must be in [1, 63]: " + idBits);
        }
        if (indexBits + idBits > Long.SIZE) {
            throw new IllegalArgumentException(
            "indexBits + idBits must not exceed " + Long.SIZE + ": " + indexBits + " + " + idBits);
        }
        this.indexBits = indexBits;
        this.idBits = idBits;
        this.indexMax = -1L >>> (Long.SIZE - indexBits);
        this.idMax = -1L >>> (Long.SIZE - idBits);
    }

    public int getIdBits() {
        return idBits;
    }

    /**
     * Largest generation the layout can represent
     */
    public long getIdMax() {
        return idMax;
    }

    public int getIndexBits() {
        return indexBits;
    }

    /**
     * Largest index the layout can represent
     */
    public long getIndexMax() {
        return indexMax;
    }

    /**
     * Pack a handle into a single word
     *
     * @throws IllegalArgumentException if either field does not fit the layout
     */
    public long pack(SlotHandle handle) {
        if (handle.index() < 0 || handle.index() > indexMax) {
            throw new IllegalArgumentException("Index " + handle.index() + " exceeds " + indexBits + " bits");
        }
        if (handle.generation() < 0 || handle.generation() > idMax) {
            throw new IllegalArgumentException("Generation " + handle.generation() + " exceeds " + idBits + " bits");
        }
        return word(handle.index(), handle.generation());
    }

    public SlotHandle unpack(long packed) {
        return new SlotHandle(index(packed), id(packed));
    }

    @Override
    public String toString() {
        return "HandleLayout[index=" + indexBits + " bits, id=" + idBits + " bits]";
    }

    long id(long word) {
        return (word >>> indexBits) & idMax;
    }

    long index(long word) {
        return word & indexMax;
    }

    /**
     * Fields wider than the layout are truncated
     */
    long word(long index, long id) {
        return (index & indexMax) | ((id & idMax) << indexBits);
    }
}
