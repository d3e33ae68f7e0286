/*
 * Copyright (c) 2023. STIP and/or its affiliates.
 */

package com.stip.ring.Benchmark;

import org.openjdk.jmh.results.format.ResultFormatType;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.Map;

/**
 * 基准测试运行参数，从环境变量读取，缺失或非法时回退到默认值
 */
public final class BenchmarkSettings {

    static final String RESULT_FILE = "RING_BENCH_RESULT_FILE";
    static final String INCLUDE = "RING_BENCH_INCLUDE";
    static final String FORKS = "RING_BENCH_FORKS";
    static final String WARMUP_ITERATIONS = "RING_BENCH_WARMUP_ITERATIONS";
    static final String MEASUREMENT_ITERATIONS = "RING_BENCH_MEASUREMENT_ITERATIONS";

    static final String DEFAULT_RESULT_FILE = "circular-buffer-benchmark-results.json";
    static final String DEFAULT_INCLUDE = BenchmarkSettings.class.getPackage().getName() + ".*";

    private final String resultFile;
    private final String include;
    private final int forks;
    private final int warmupIterations;
    private final int measurementIterations;

    private BenchmarkSettings(String resultFile, String include, int forks,
                              int warmupIterations, int measurementIterations) {
        this.resultFile = resultFile;
        this.include = include;
        this.forks = forks;
        this.warmupIterations = warmupIterations;
        this.measurementIterations = measurementIterations;
    }

    public static BenchmarkSettings fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static BenchmarkSettings fromEnvironment(Map<String, String> env) {
        return new BenchmarkSettings(
                getOrDefault(env, RESULT_FILE, DEFAULT_RESULT_FILE),
                getOrDefault(env, INCLUDE, DEFAULT_INCLUDE),
                getIntClamped(env, FORKS, 1, 0, 10),
                getIntClamped(env, WARMUP_ITERATIONS, 3, 0, 50),
                getIntClamped(env, MEASUREMENT_ITERATIONS, 5, 1, 100));
    }

    /**
     * 生成JMH运行选项，结果以JSON格式写入结果文件
     */
    public Options toOptions() {
        return new OptionsBuilder()
                .include(include)
                .forks(forks)
                .warmupIterations(warmupIterations)
                .measurementIterations(measurementIterations)
                .resultFormat(ResultFormatType.JSON)
                .result(resultFile)
                .build();
    }

    public String resultFile() {
        return resultFile;
    }

    public String include() {
        return include;
    }

    public int forks() {
        return forks;
    }

    public int warmupIterations() {
        return warmupIterations;
    }

    public int measurementIterations() {
        return measurementIterations;
    }

    @Override
    public String toString() {
        return "BenchmarkSettings{include=" + include
                + ", forks=" + forks
                + ", warmupIterations=" + warmupIterations
                + ", measurementIterations=" + measurementIterations
                + ", resultFile=" + resultFile + "}";
    }

    static String getOrDefault(Map<String, String> env, String name, String defaultValue) {
        String v = env.get(name);
        return (v == null || v.isBlank()) ? defaultValue : v.trim();
    }

    static int getIntClamped(Map<String, String> env, String name, int defaultValue, int min, int max) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(raw.trim());
            if (parsed < min) return min;
            return Math.min(parsed, max);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }
}
