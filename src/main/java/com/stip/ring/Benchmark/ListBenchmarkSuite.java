/*
 * Copyright (c) 2023. STIP and/or its affiliates.
 */

package com.stip.ring.Benchmark;

import com.stip.ring.optimized.CircularBuffer;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * 随机访问列表基准测试套件
 * 环形缓冲区的插入、删除只移动较短的一侧，这里与ArrayList对比
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Thread)
@Fork(1)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class ListBenchmarkSuite {

    /**
     * 列表实现类型
     */
    @Param({"ArrayList", "CircularBuffer"})
    private String listType;

    /**
     * 测试数据规模
     */
    @Param({"10000", "100000"})
    private int size;

    private Random random;

    /**
     * 当前测试使用的已填充列表
     */
    private List<Integer> list;

    static List<Integer> newList(String listType, int size) {
        switch (listType) {
            case "ArrayList":
                return new ArrayList<>(size);
            case "CircularBuffer":
                CircularBuffer<Integer> buffer = new CircularBuffer<>();
                buffer.reserve(size);
                return buffer;
            default:
                throw new IllegalArgumentException("未知的列表类型: " + listType);
        }
    }

    /**
     * 每次调用前重新填充列表，保证各次调用的初始状态一致
     */
    @Setup(Level.Invocation)
    public void setup() {
        random = new Random(42);
        list = newList(listType, size);
        for (int i = 0; i < size; i++) {
            list.add(i);
        }
    }

    /**
     * 测试靠近头部插入的性能（环形缓冲区只需移动前面少量元素）
     */
    @Benchmark
    public void testInsertNearFront(Blackhole bh) {
        int operations = Math.min(size / 5, 10000);
        for (int i = 0; i < operations; i++) {
            list.add(i % 8, i);
        }
        bh.consume(list);
    }

    /**
     * 测试中间插入的性能
     */
    @Benchmark
    public void testInsertMiddle(Blackhole bh) {
        int operations = Math.min(size / 5, 10000);
        for (int i = 0; i < operations; i++) {
            list.add(list.size() / 2, i);
        }
        bh.consume(list);
    }

    /**
     * 测试随机位置删除的性能
     */
    @Benchmark
    public void testRandomRemove(Blackhole bh) {
        int removalCount = Math.min(size / 2, 10000);
        for (int i = 0; i < removalCount && !list.isEmpty(); i++) {
            bh.consume(list.remove(random.nextInt(list.size())));
        }
    }

    /**
     * 测试随机访问的性能
     */
    @Benchmark
    public void testRandomAccess(Blackhole bh) {
        int accessCount = Math.min(size * 10, 1000000);
        for (int i = 0; i < accessCount; i++) {
            bh.consume(list.get(random.nextInt(size)));
        }
    }

    /**
     * 测试批量操作的性能（洗牌后排序）
     */
    @Benchmark
    public void testBulkOperations(Blackhole bh) {
        Collections.shuffle(list, random);
        Collections.sort(list);
        bh.consume(list);
    }
}
