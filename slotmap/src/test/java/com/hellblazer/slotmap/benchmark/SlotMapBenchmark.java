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
package com.hellblazer.slotmap.benchmark;

import com.hellblazer.slotmap.SlotHandle;
import com.hellblazer.slotmap.SlotMap;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Compares SlotMap against a HashMap keyed by sequential ids for the operations a slot map is meant to make cheap:
 * dense iteration, handle lookup and churn (remove one, add one).
 *
 * @author hal.hildebrand
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Thread)
@Fork(value = 1, jvmArgs = {"-Xms1G", "-Xmx1G"})
@Warmup(iterations = 3, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
public class SlotMapBenchmark {

    @Param({"1000", "100000"})
    private int itemCount;

    private SlotMap<Long>    slotMap;
    private List<SlotHandle> handles;
    private Map<Long, Long>  hashMap;
    private Random           random;
    private long             nextId;

    @Setup(Level.Trial)
    public void setup() {
        random = new Random(42);
        slotMap = new SlotMap<>();
        handles = new ArrayList<>(itemCount);
        hashMap = new HashMap<>();
        for (long i = 0; i < itemCount; i++) {
            handles.add(slotMap.add(i));
            hashMap.put(i, i);
        }
        nextId = itemCount;
    }

    @Benchmark
    public void slotMapIteration(Blackhole bh) {
        for (var item : slotMap) {
            bh.consume(item);
        }
    }

    @Benchmark
    public void hashMapIteration(Blackhole bh) {
        for (var item : hashMap.values()) {
            bh.consume(item);
        }
    }

    @Benchmark
    public Long slotMapLookup() {
        return slotMap.get(handles.get(random.nextInt(handles.size())));
    }

    @Benchmark
    public Long hashMapLookup() {
        return hashMap.get((long) random.nextInt(itemCount));
    }

    @Benchmark
    public void slotMapChurn() {
        int victim = random.nextInt(handles.size());
        slotMap.remove(handles.get(victim));
        handles.set(victim, slotMap.add(nextId++));
    }

    @Benchmark
    public void hashMapChurn() {
        hashMap.remove(nextId - itemCount);
        hashMap.put(nextId, nextId);
        nextId++;
    }
}
