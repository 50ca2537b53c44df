package com.david.velocity.cache.core;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 缓存统计信息
 *
 * @param hits 命中次数
 * @param misses 未命中次数（包含读到过期元素）
 * @param evictions 容量淘汰次数
 * @param expirations 过期移除次数
 * @param hitRate 命中率，格式如 "66.67%"
 * @param size 当前元素数量
 * @param maxSize 最大容量
 */
public record CacheStats(
        long hits,
        long misses,
        long evictions,
        long expirations,
        String hitRate,
        int size,
        int maxSize) {

    /** 总查询次数 */
    public long requestCount() {
        return hits + misses;
    }

    /**
     * 计算命中比例
     *
     * @return 命中比例 (0.0 - 1.0)
     */
    public double hitRatio() {
        long total = requestCount();
        if (total == 0) {
            return 0.0;
        }
        return (double) hits / total;
    }

    /**
     * 按报表字段顺序转换为Map，便于逐行输出
     *
     * @return 有序的统计项
     */
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("hits", hits);
        map.put("misses", misses);
        map.put("evictions", evictions);
        map.put("expirations", expirations);
        map.put("hit_rate", hitRate);
        map.put("size", size);
        map.put("max_size", maxSize);
        return map;
    }

    @Override
    public String toString() {
        return String.format(
                "CacheStats{hits=%d, misses=%d, evictions=%d, expirations=%d, hitRate=%s, size=%d/%d}",
                hits, misses, evictions, expirations, hitRate, size, maxSize);
    }
}
