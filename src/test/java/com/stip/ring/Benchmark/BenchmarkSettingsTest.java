package com.stip.ring.Benchmark;

import com.stip.ring.optimized.CircularBuffer;
import org.junit.jupiter.api.Test;
import org.openjdk.jmh.results.format.ResultFormatType;
import org.openjdk.jmh.runner.options.Options;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BenchmarkSettingsTest {

    @Test
    void shouldUseDefaultsForMissingOrBlank() {
        BenchmarkSettings settings = BenchmarkSettings.fromEnvironment(Map.of(BenchmarkSettings.RESULT_FILE, "   "));
        assertEquals(BenchmarkSettings.DEFAULT_RESULT_FILE, settings.resultFile());
        assertEquals("com.stip.ring.Benchmark.*", settings.include());
        assertEquals(1, settings.forks());
        assertEquals(3, settings.warmupIterations());
        assertEquals(5, settings.measurementIterations());
    }

    @Test
    void shouldClampAndFallBackOnMalformed() {
        BenchmarkSettings settings = BenchmarkSettings.fromEnvironment(Map.of(
            BenchmarkSettings.FORKS, "99",
            BenchmarkSettings.WARMUP_ITERATIONS, "-4",
            BenchmarkSettings.MEASUREMENT_ITERATIONS, "lots",
            BenchmarkSettings.INCLUDE, " DequeBenchmarkSuite ",
            BenchmarkSettings.RESULT_FILE, "out.json"
        ));
        assertEquals(10, settings.forks());
        assertEquals(0, settings.warmupIterations());
        assertEquals(5, settings.measurementIterations());
        assertEquals("DequeBenchmarkSuite", settings.include());
        assertEquals("out.json", settings.resultFile());
    }

    @Test
    void shouldBuildJmhOptions() {
        Options options = BenchmarkSettings.fromEnvironment(Map.of(
            BenchmarkSettings.FORKS, "2",
            BenchmarkSettings.MEASUREMENT_ITERATIONS, "7"
        )).toOptions();

        assertEquals(List.of("com.stip.ring.Benchmark.*"), options.getIncludes());
        assertEquals(2, options.getForkCount().get());
        assertEquals(3, options.getWarmupIterations().get());
        assertEquals(7, options.getMeasurementIterations().get());
        assertEquals(ResultFormatType.JSON, options.getResultFormat().get());
        assertEquals(BenchmarkSettings.DEFAULT_RESULT_FILE, options.getResult().get());
    }

    @Test
    void shouldCreateBenchmarkedImplementations() {
        assertInstanceOf(ArrayDeque.class, DequeBenchmarkSuite.newDeque("ArrayDeque"));
        assertInstanceOf(CircularBuffer.class, DequeBenchmarkSuite.newDeque("CircularBuffer"));
        assertThrows(IllegalArgumentException.class, () -> DequeBenchmarkSuite.newDeque("TreeSet"));

        assertInstanceOf(ArrayList.class, ListBenchmarkSuite.newList("ArrayList", 8));
        CircularBuffer<?> buffer = assertInstanceOf(CircularBuffer.class, ListBenchmarkSuite.newList("CircularBuffer", 8));
        assertEquals(8, buffer.capacity());
        assertThrows(IllegalArgumentException.class, () -> ListBenchmarkSuite.newList("Vector", 8));
    }
}
