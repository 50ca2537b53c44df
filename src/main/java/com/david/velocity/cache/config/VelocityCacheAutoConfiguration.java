package com.david.velocity.cache.config;

import com.david.velocity.cache.core.VelocityCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * VelocityCache自动配置
 *
 * <p>职责： 1. 绑定 velocity.cache.* 配置 2. 在容器中没有缓存实例时按配置容量创建一个
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(VelocityCacheProperties.class)
public class VelocityCacheAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public VelocityCache<Object> velocityCache(VelocityCacheProperties properties) {
        VelocityCache<Object> cache = new VelocityCache<>(properties.getMaxSize());
        log.info("Created VelocityCache bean with maxSize={}", properties.getMaxSize());
        return cache;
    }
}
