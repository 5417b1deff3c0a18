package com.pavan.orderedmap.collection;

import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * JMH benchmark for the core OrderedMap operations.
 * Parallel variants run with 4 threads against one shared map.
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class OrderedMapBenchmark {
    
    private static final int KEY_RANGE = 1000;
    
    @Param({"1000", "10000"})
    private int size;
    
    private OrderedMap<Integer, String> map;
    private String[] values;
    
    @Setup(Level.Trial)
    public void setup() {
        values = new String[KEY_RANGE];
        for (int i = 0; i < KEY_RANGE; i++) {
            values[i] = "value-" + i;
        }
        map = new OrderedMap<>();
        for (int i = 0; i < size; i++) {
            map.put(i, values[i % KEY_RANGE]);
        }
    }
    
    @Benchmark
    public void put() {
        int key = ThreadLocalRandom.current().nextInt(size);
        map.put(key, values[key % KEY_RANGE]);
    }
    
    @Benchmark
    public String get() {
        return map.get(ThreadLocalRandom.current().nextInt(size));
    }
    
    @Benchmark
    public boolean removeAndReinsert() {
        int key = ThreadLocalRandom.current().nextInt(size);
        boolean removed = map.remove(key);
        // Put it back so the map keeps its size across iterations
        map.put(key, values[key % KEY_RANGE]);
        return removed;
    }
    
    @Benchmark
    public void iterate(Blackhole blackhole) {
        map.forEach((key, value) -> blackhole.consume(value));
    }
    
    @Benchmark
    public OrderedMap<Integer, String> copy() {
        return map.copy();
    }
    
    @Benchmark
    @Threads(4)
    public void parallelPut() {
        int key = ThreadLocalRandom.current().nextInt(size);
        map.put(key, values[key % KEY_RANGE]);
    }
    
    @Benchmark
    @Threads(4)
    public String parallelGet() {
        return map.get(ThreadLocalRandom.current().nextInt(size));
    }
    
    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(OrderedMapBenchmark.class.getSimpleName())
                .build();
        
        new Runner(opt).run();
    }
}
