package com.david.velocity.cache.config;

import com.david.velocity.cache.VelocityCacheApplication;
import com.david.velocity.cache.core.VelocityCache;
import jakarta.annotation.Resource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest(classes = VelocityCacheApplication.class)
@TestPropertySource(
        properties = {
            "velocity.cache.max-size=42",
            "velocity.cache.demo.expiry-wait=1500ms",
            "velocity.cache.benchmark.operations=1000"
        })
class VelocityCacheAutoConfigurationTest {

    @Resource private VelocityCache<Object> velocityCache;

    @Resource private VelocityCacheProperties properties;

    @Test
    @DisplayName("自动配置按属性创建缓存")
    void testCacheBeanUsesConfiguredSize() {
        assertThat(velocityCache.getMaxSize()).isEqualTo(42);

        velocityCache.set("user:1", "alice");
        assertThat(velocityCache.get("user:1")).isEqualTo("alice");
    }

    @Test
    @DisplayName("配置属性绑定")
    void testPropertiesBinding() {
        assertThat(properties.getMaxSize()).isEqualTo(42);
        assertThat(properties.getDemo().getExpiryWait()).isEqualTo(Duration.ofMillis(1500));
        assertThat(properties.getDemo().getMaxSize()).isEqualTo(5);
        assertThat(properties.getBenchmark().getOperations()).isEqualTo(1000);
        assertThat(properties.getBenchmark().getCacheSize()).isEqualTo(10_000);
    }
}
