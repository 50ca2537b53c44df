package com.david.velocity.cache.config;

import com.david.velocity.cache.core.VelocityCache;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * VelocityCache配置属性
 * 用于外化缓存容量以及演示、压测命令的参数
 */
@Data
@ConfigurationProperties(prefix = "velocity.cache")
public class VelocityCacheProperties {

	/**
	 * 缓存最大元素数量
	 */
	private int maxSize = VelocityCache.DEFAULT_MAX_SIZE;

	private Demo demo = new Demo();

	private Benchmark benchmark = new Benchmark();

	@Data
	public static class Demo {

		/**
		 * 演示缓存的容量
		 */
		private int maxSize = 5;

		/**
		 * 检查短TTL键之前的等待时间
		 */
		private Duration expiryWait = Duration.ofSeconds(4);
	}

	@Data
	public static class Benchmark {

		private int cacheSize = 10_000;

		/**
		 * 每个场景的操作次数
		 */
		private int operations = 50_000;

		/**
		 * 通过阈值（每秒操作数）
		 */
		private double targetOpsPerSecond = 30_000;
	}
}
