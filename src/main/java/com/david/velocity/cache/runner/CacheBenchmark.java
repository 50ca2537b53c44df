package com.david.velocity.cache.runner;

import com.david.velocity.cache.config.VelocityCacheProperties;
import com.david.velocity.cache.core.VelocityCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 缓存吞吐量压测
 *
 * <p>每个场景使用新的缓存实例，只调用 set/get/stats。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CacheBenchmark {

    private static final Duration SHORT_TTL = Duration.ofSeconds(1);
    private static final Duration LONG_TTL = Duration.ofSeconds(10);
    private static final Duration CHURN_TTL = Duration.ofMillis(1);

    private final VelocityCacheProperties properties;

    /**
     * 依次运行所有场景并输出汇总
     *
     * @return 各场景结果，顺序为 set、get、mixed、ttl
     */
    public List<BenchmarkResult> runAll() {
        VelocityCacheProperties.Benchmark config = properties.getBenchmark();
        int cacheSize = config.getCacheSize();
        int operations = config.getOperations();

        List<BenchmarkResult> results = new ArrayList<>();
        results.add(benchmarkSet(cacheSize, operations));
        results.add(benchmarkGet(cacheSize, operations));
        results.add(benchmarkMixed(cacheSize, operations));
        results.add(benchmarkTtlChurn(Math.max(1, cacheSize / 10), Math.max(1, operations / 5)));

        logSummary(results, config.getTargetOpsPerSecond());
        return results;
    }

    /** 带TTL的写入 */
    public BenchmarkResult benchmarkSet(int cacheSize, int operations) {
        VelocityCache<String> cache = new VelocityCache<>(cacheSize);
        log.info("Benchmarking {} SET operations...", operations);

        long start = System.nanoTime();
        for (int i = 0; i < operations; i++) {
            cache.set("key_" + i, "value_" + i, SHORT_TTL);
        }
        return finish("set", operations, start);
    }

    /** 预热后读取，包含TTL检查 */
    public BenchmarkResult benchmarkGet(int cacheSize, int operations) {
        VelocityCache<String> cache = filledCache(cacheSize);
        log.info("Benchmarking {} GET operations...", operations);

        long start = System.nanoTime();
        for (int i = 0; i < operations; i++) {
            cache.get("key_" + (i % cacheSize));
        }
        return finish("get", operations, start);
    }

    /** 80% 读 20% 写 */
    public BenchmarkResult benchmarkMixed(int cacheSize, int operations) {
        VelocityCache<String> cache = filledCache(cacheSize);
        log.info("Benchmarking {} mixed operations (80% GET, 20% SET)...", operations);

        long start = System.nanoTime();
        for (int i = 0; i < operations; i++) {
            String key = "key_" + (i % cacheSize);
            if (i % 5 == 0) {
                cache.set(key, "value_" + i, LONG_TTL);
            } else {
                cache.get(key);
            }
        }
        return finish("mixed", operations, start);
    }

    /** 极短TTL写入后立即读取，大部分读取会遇到过期 */
    public BenchmarkResult benchmarkTtlChurn(int cacheSize, int operations) {
        VelocityCache<String> cache = new VelocityCache<>(cacheSize);
        log.info("Benchmarking {} operations with TTL expiration...", operations);

        long start = System.nanoTime();
        for (int i = 0; i < operations; i++) {
            String key = "key_" + (i % cacheSize);
            cache.set(key, "value_" + i, CHURN_TTL);
            cache.get(key);
        }
        BenchmarkResult result = finish("ttl", operations, start);
        log.info("Stats: {}", cache.stats());
        return result;
    }

    private VelocityCache<String> filledCache(int cacheSize) {
        VelocityCache<String> cache = new VelocityCache<>(cacheSize);
        for (int i = 0; i < cacheSize; i++) {
            cache.set("key_" + i, "value_" + i, LONG_TTL);
        }
        return cache;
    }

    private BenchmarkResult finish(String name, int operations, long startNanos) {
        BenchmarkResult result =
                new BenchmarkResult(name, operations, Duration.ofNanos(System.nanoTime() - startNanos));
        log.info("{}", result);
        return result;
    }

    private void logSummary(List<BenchmarkResult> results, double target) {
        log.info("=== Benchmark Summary (target {} ops/sec) ===", String.format(Locale.ROOT, "%,.0f", target));
        double total = 0;
        for (BenchmarkResult result : results) {
            total += result.opsPerSecond();
            log.info(
                    "{} {}",
                    summaryLine(result.name().toUpperCase(Locale.ROOT), result.opsPerSecond()),
                    result.meets(target) ? "PASS" : "FAIL");
        }
        double average = results.isEmpty() ? 0 : total / results.size();
        log.info("{} {}", summaryLine("OVERALL", average), average >= target ? "PASS" : "FAIL");
    }

    private static String summaryLine(String name, double opsPerSecond) {
        return String.format(Locale.ROOT, "%-10s: %,12.0f ops/sec", name, opsPerSecond);
    }
}
