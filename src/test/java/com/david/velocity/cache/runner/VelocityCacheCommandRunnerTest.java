package com.david.velocity.cache.runner;

import com.david.velocity.cache.config.VelocityCacheProperties;
import com.david.velocity.cache.core.CacheStats;
import com.david.velocity.cache.core.VelocityCache;
import com.david.velocity.cache.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

/** 命令分发与演示测试 */
class VelocityCacheCommandRunnerTest {

    private MutableClock clock;
    private CacheDemo demo;
    private VelocityCacheCommandRunner runner;

    @BeforeEach
    void setUp() {
        VelocityCacheProperties properties = new VelocityCacheProperties();
        properties.getBenchmark().setCacheSize(50);
        properties.getBenchmark().setOperations(200);

        clock = new MutableClock();
        // 推进时钟代替真实等待
        demo =
                new CacheDemo(properties, clock) {
                    @Override
                    protected void pause(Duration duration) {
                        clock.advance(duration);
                    }
                };
        runner = new VelocityCacheCommandRunner(demo, new CacheBenchmark(properties));
    }

    @Test
    void testDemoShowsShortTtlExpiring() {
        VelocityCache<Double> cache = demo.run();

        CacheStats stats = cache.stats();
        assertThat(stats.maxSize()).isEqualTo(5);
        assertThat(stats.hits()).isEqualTo(3);
        assertThat(stats.misses()).isEqualTo(1);
        assertThat(stats.expirations()).isEqualTo(1);
        assertThat(cache.exists("ADA-USD")).isFalse();
        assertThat(cache.keys()).containsExactly("BTC-USD", "ETH-USD");
        assertThat(cache.get("BTC-USD")).isEqualTo(43250.12);
    }

    @Test
    void testDemoEntriesFollowTheirOwnTtl() {
        VelocityCache<Double> cache = demo.run();
        clock.advance(Duration.ofSeconds(2));

        assertThat(cache.get("BTC-USD")).isNull();
        assertThat(cache.get("ETH-USD")).isEqualTo(2650.50);
    }

    @Test
    void testKnownCommands() {
        assertThatCode(() -> runner.execute("demo")).doesNotThrowAnyException();
        assertThatCode(() -> runner.execute("BENCHMARK")).doesNotThrowAnyException();
        assertThatCode(() -> runner.execute("all")).doesNotThrowAnyException();
    }

    @Test
    void testUnknownCommandFails() {
        assertThatThrownBy(() -> runner.execute("bogus"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown command: bogus");
    }

    @Test
    void testNoArgumentsPrintsUsage() {
        assertThatCode(() -> runner.run(new DefaultApplicationArguments()))
                .doesNotThrowAnyException();
    }
}
