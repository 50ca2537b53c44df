/// 进程内缓存核心包
/// ## 核心组件
/// - [com.david.velocity.cache.core.VelocityCache] - LRU + TTL 缓存引擎
/// - [com.david.velocity.cache.core.CacheStats] - 统计信息快照
/// ## 使用示例
/// ```java
/// VelocityCache<Double> cache = new VelocityCache<>(1000);
/// cache.set("BTC-USD", 43250.12, Duration.ofSeconds(5));
/// Double price = cache.get("BTC-USD");
/// System.out.println(cache.stats());
/// ```
///
/// ## 过期与淘汰
/// - 过期为惰性检测，过期元素在被访问前仍占用容量，并出现在 size()/keys() 中
/// - 容量满时无条件淘汰最久未使用的元素，即使它已经过期，也只计为一次淘汰
/// - contains() 只检查结构，exists() 会检查过期
///
/// | 操作 | 时间复杂度 |
/// |------|-----------|
/// | get/set/delete/exists/contains | O(1) |
/// | keys | O(n) |
package com.david.velocity.cache.core;
