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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class SlotMapConfigTest {

    @Test
    void testDefaults() {
        var config = SlotMapConfig.defaults();
        assertEquals(40, config.getIndexBits());
        assertEquals(24, config.getIdBits());
        assertEquals(32, config.getMinFreeKeys());
        assertEquals(512, config.getAllocationSize());
        assertEquals(GenerationOverflowPolicy.FAIL, config.getOverflowPolicy());
        assertSame(config, config.validate());
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> new SlotMapConfig().withMinFreeKeys(-1).validate());
        assertThrows(IllegalArgumentException.class, () -> new SlotMapConfig().withAllocationSize(0).validate());
        assertThrows(IllegalArgumentException.class, () -> new SlotMapConfig().withIdBits(30).validate());
        assertThrows(IllegalArgumentException.class, () -> new SlotMapConfig().withIndexBits(0).validate());
        assertThrows(NullPointerException.class, () -> new SlotMapConfig().withOverflowPolicy(null));

        new SlotMapConfig().withBits(32, 32).withMinFreeKeys(0).withAllocationSize(1).validate();
    }

    @Test
    void testInvalidConfigRejectedByMap() {
        assertThrows(IllegalArgumentException.class,
                     () -> new SlotMap<String>(new SlotMapConfig().withAllocationSize(-4)));
        assertThrows(NullPointerException.class, () -> new SlotMap<String>(null));
        assertThrows(NullPointerException.class, () -> new SlotMap<String>(new SlotMapConfig(), null));
    }

    @Test
    void testMapSnapshotsConfig() {
        var config = new SlotMapConfig().withAllocationSize(4);
        var map = new SlotMap<Integer>(config);

        config.withAllocationSize(64).withBits(8, 8);
        map.add(1);

        assertEquals(4, map.capacity());
        assertEquals(40, map.layout().getIndexBits());
    }
}
