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

import org.openjdk.jmh.results.format.ResultFormatType;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Runner for the SlotMap benchmarks. Results are saved with a timestamp for tracking over time.
 *
 * @author hal.hildebrand
 */
public class SlotMapBenchmarkRunner {

    public static void main(String[] args) throws RunnerException {
        String timestamp = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyy-MM-dd-HH-mm-ss"));
        String resultFile = "slotmap/target/benchmark-results-" + timestamp + ".json";

        Options opt = new OptionsBuilder().include(SlotMapBenchmark.class.getSimpleName())
                                          .resultFormat(ResultFormatType.JSON)
                                          .result(resultFile)
                                          .build();

        new Runner(opt).run();

        System.out.println("Benchmark results saved to: " + resultFile);
    }
}
