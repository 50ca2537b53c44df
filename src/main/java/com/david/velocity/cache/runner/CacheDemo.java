package com.david.velocity.cache.runner;

import com.david.velocity.cache.config.VelocityCacheProperties;
import com.david.velocity.cache.core.CacheStats;
import com.david.velocity.cache.core.VelocityCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/** 演示基本读写、统计与TTL过期 */
@Slf4j
@Component
public class CacheDemo {

    private final VelocityCacheProperties properties;

    /** 演示缓存使用的时钟 */
    private final Clock clock;

    @Autowired
    public CacheDemo(VelocityCacheProperties properties) {
        this(properties, Clock.systemUTC());
    }

    public CacheDemo(VelocityCacheProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * 运行演示
     *
     * @return 演示使用的缓存，便于调用方检查最终状态
     */
    public VelocityCache<Double> run() {
        VelocityCacheProperties.Demo config = properties.getDemo();
        log.info("VelocityCache Demo");

        VelocityCache<Double> cache = new VelocityCache<>(config.getMaxSize(), clock);

        log.info("Setting values...");
        cache.set("BTC-USD", 43250.12, Duration.ofSeconds(5));
        cache.set("ETH-USD", 2650.50, Duration.ofSeconds(10));
        cache.set("ADA-USD", 0.45, Duration.ofSeconds(3));

        log.info("Getting values...");
        log.info("BTC-USD: {}", cache.get("BTC-USD"));
        log.info("ETH-USD: {}", cache.get("ETH-USD"));
        log.info("ADA-USD: {}", cache.get("ADA-USD"));

        log.info("Cache Stats:");
        CacheStats stats = cache.stats();
        for (Map.Entry<String, Object> entry : stats.asMap().entrySet()) {
            log.info("  {}: {}", entry.getKey(), entry.getValue());
        }

        log.info("Testing expiration...");
        pause(config.getExpiryWait());
        log.info("ADA-USD after {}s: {}", config.getExpiryWait().toSeconds(), cache.get("ADA-USD"));

        log.info("Demo complete!");
        return cache;
    }

    /**
     * 等待短TTL的键过期
     *
     * @param duration 等待时间
     */
    protected void pause(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Demo interrupted while waiting for expiration", e);
        }
    }
}
