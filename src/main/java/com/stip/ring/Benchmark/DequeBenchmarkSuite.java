/*
 * Copyright (c) 2023. STIP and/or its affiliates.
 */

package com.stip.ring.Benchmark;

import com.stip.ring.optimized.CircularBuffer;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.results.RunResult;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedList;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * 双端队列基准测试套件
 * 比较不同双端队列实现在两端插入、删除场景下的性能表现
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Thread)
@Fork(1)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class DequeBenchmarkSuite {

    private static final Logger LOG = Logger.getLogger(DequeBenchmarkSuite.class.getName());

    /**
     * 双端队列实现类型
     */
    @Param({"ArrayDeque", "LinkedList", "CircularBuffer"})
    private String dequeType;

    /**
     * 测试数据规模
     */
    @Param({"10000", "100000", "1000000"})
    private int size;

    /**
     * 当前测试使用的双端队列
     */
    private Deque<Integer> deque;

    /**
     * 基准测试的主入口，运行本包内所有套件
     */
    public static void main(String[] args) throws RunnerException {
        BenchmarkSettings settings = BenchmarkSettings.fromEnvironment();
        LOG.info(() -> "Starting benchmarks with " + settings);
        try {
            Collection<RunResult> results = new Runner(settings.toOptions()).run();
            LOG.info(() -> "Finished " + results.size() + " benchmark runs, results written to " + settings.resultFile());
        } catch (RunnerException e) {
            LOG.log(java.util.logging.Level.SEVERE, "Benchmark run failed", e);
            throw e;
        }
    }

    static Deque<Integer> newDeque(String dequeType) {
        switch (dequeType) {
            case "ArrayDeque":
                return new ArrayDeque<>();
            case "LinkedList":
                return new LinkedList<>();
            case "CircularBuffer":
                return new CircularBuffer<>();
            default:
                throw new IllegalArgumentException("未知的双端队列类型: " + dequeType);
        }
    }

    /**
     * 在每个基准测试之前创建空队列，容量从零开始增长
     */
    @Setup(Level.Invocation)
    public void setup() {
        deque = newDeque(dequeType);
    }

    /**
     * 测试尾部追加的性能
     */
    @Benchmark
    public void testPushBack(Blackhole bh) {
        for (int i = 0; i < size; i++) {
            deque.addLast(i);
        }
        bh.consume(deque);
    }

    /**
     * 测试头部插入的性能
     */
    @Benchmark
    public void testPushFront(Blackhole bh) {
        for (int i = 0; i < size; i++) {
            deque.addFirst(i);
        }
        bh.consume(deque);
    }

    /**
     * 测试两端交替插入后再从两端交替删除
     */
    @Benchmark
    public void testAlternatingEnds(Blackhole bh) {
        for (int i = 0; i < size; i++) {
            if ((i & 1) == 0) {
                deque.addFirst(i);
            } else {
                deque.addLast(i);
            }
        }
        while (!deque.isEmpty()) {
            bh.consume(deque.pollFirst());
            bh.consume(deque.pollLast());
        }
    }

    /**
     * 测试先进先出的稳态吞吐（队列长度固定，头部不断回绕）
     */
    @Benchmark
    public void testFifoChurn(Blackhole bh) {
        int window = Math.min(size, 1024);
        for (int i = 0; i < window; i++) {
            deque.offerLast(i);
        }
        for (int i = 0; i < size; i++) {
            bh.consume(deque.pollFirst());
            deque.offerLast(i);
        }
    }

    /**
     * 测试后进先出的栈操作
     */
    @Benchmark
    public void testStackChurn(Blackhole bh) {
        for (int i = 0; i < size; i++) {
            deque.push(i);
            if (i % 3 == 2) {
                bh.consume(deque.pop());
            }
        }
        bh.consume(deque);
    }

    /**
     * 测试顺序迭代与逆序迭代
     */
    @Benchmark
    public void testIteration(Blackhole bh) {
        for (int i = 0; i < size; i++) {
            deque.addLast(i);
        }
        for (Integer value : deque) {
            bh.consume(value);
        }
        deque.descendingIterator().forEachRemaining(bh::consume);
    }
}
