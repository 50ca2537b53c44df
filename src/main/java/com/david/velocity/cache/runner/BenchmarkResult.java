package com.david.velocity.cache.runner;

import java.time.Duration;
import java.util.Locale;

/**
 * 单个压测场景的结果
 *
 * @param name 场景名称
 * @param operations 操作次数
 * @param duration 耗时
 */
public record BenchmarkResult(String name, int operations, Duration duration) {

    /** 每秒操作数 */
    public double opsPerSecond() {
        long nanos = Math.max(1L, duration.toNanos());
        return operations * 1_000_000_000.0 / nanos;
    }

    public boolean meets(double targetOpsPerSecond) {
        return opsPerSecond() >= targetOpsPerSecond;
    }

    @Override
    public String toString() {
        return String.format(
                Locale.ROOT,
                "%s: %,.0f ops/sec (%.3fs, %d ops)",
                name,
                opsPerSecond(),
                duration.toNanos() / 1_000_000_000.0,
                operations);
    }
}
