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
 * Base exception for designed-in capacity limits of a {@link SlotMap}. Stale handles are never reported through
 * exceptions; these are raised only when continuing would alias two items or revalidate a stale handle.
 * <p>
 * Exception types:
 * <ul>
 * <li>{@link IndexSpaceExhaustedException} - no free key left and the key table cannot grow within indexBits</li>
 * <li>{@link GenerationExhaustedException} - a key's generation counter cannot be advanced</li>
 * </ul>
 * In both cases the map is left exactly as it was before the failing call.
 *
 * @author hal.hildebrand
 */
public sealed class SlotMapException extends IllegalStateException
    permits SlotMapException.IndexSpaceExhaustedException, SlotMapException.GenerationExhaustedException {

    public SlotMapException(String message) {
        super(message);
    }

    /**
     * Thrown by add when every representable key is in use.
     */
    public static final class IndexSpaceExhaustedException extends SlotMapException {

        private final long keyCount;

        public IndexSpaceExhaustedException(long keyCount, int indexBits) {
            super("Reached max index: all " + keyCount + " keys addressable with " + indexBits
                  + " index bits are in use, consider increasing indexBits");
            this.keyCount = keyCount;
        }

        public long getKeyCount() {
            return keyCount;
        }
    }

    /**
     * Thrown by removal under {@link GenerationOverflowPolicy#FAIL} when the key's generation is already at the
     * maximum.
     */
    public static final class GenerationExhaustedException extends SlotMapException {

        private final SlotHandle handle;

        public GenerationExhaustedException(SlotHandle handle, int idBits) {
            super("Reached max id for " + handle + " with " + idBits
                  + " id bits, consider increasing idBits and/or minFreeKeys");
            this.handle = handle;
        }

        /**
         * The handle of the item that could not be removed
         */
        public SlotHandle getHandle() {
            return handle;
        }
    }
}
