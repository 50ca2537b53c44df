package com.david.velocity.cache.core;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 进程内 LRU + TTL 缓存
 *
 * <p>特性：
 *
 * <ul>
 *   <li>HashMap + 双向链表，get/set/delete 均为 O(1)
 *   <li>容量满时淘汰链表头部（最久未使用）的元素
 *   <li>TTL 惰性过期：只在访问时检测并移除
 *   <li>所有公开操作由同一把锁保护，统计计数与数据结构同步更新
 * </ul>
 *
 * @param <V> 值类型
 */
@Slf4j
public class VelocityCache<V> {

    /** 默认最大容量 */
    public static final int DEFAULT_MAX_SIZE = 1000;

    private final int maxSize;

    private final Clock clock;

    /** 元素映射表，用于快速查找节点 */
    private final Map<String, Node<V>> nodeMap;

    /** 头哨兵节点，head.next 为最久未使用的元素 */
    private final Node<V> head;

    /** 尾哨兵节点，tail.prev 为最近使用的元素 */
    private final Node<V> tail;

    private final ReentrantLock lock;

    private long hits;
    private long misses;
    private long evictions;
    private long expirations;

    public VelocityCache() {
        this(DEFAULT_MAX_SIZE);
    }

    public VelocityCache(int maxSize) {
        this(maxSize, Clock.systemUTC());
    }

    /**
     * 创建缓存
     *
     * @param maxSize 最大元素数量，必须为正数
     * @param clock 时钟，用于计算过期时间，可在测试中替换
     */
    public VelocityCache(int maxSize, Clock clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive");
        }
        this.maxSize = maxSize;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.nodeMap = new HashMap<>();
        this.lock = new ReentrantLock();

        this.head = new Node<>(null, null, null);
        this.tail = new Node<>(null, null, null);
        head.next = tail;
        tail.prev = head;

        if (log.isInfoEnabled()) {
            log.info("Initialized VelocityCache with maxSize={}", maxSize);
        }
    }

    /**
     * 获取元素，命中时提升为最近使用
     *
     * @param key 键
     * @return 值，不存在或已过期返回null
     */
    public V get(String key) {
        requireKey(key);

        lock.lock();
        try {
            Node<V> node = nodeMap.get(key);
            if (node == null) {
                misses++;
                return null;
            }

            if (isExpired(node, clock.instant())) {
                nodeMap.remove(key);
                unlink(node);
                misses++;
                expirations++;
                if (log.isDebugEnabled()) {
                    log.debug("Expired entry on get: key={}", key);
                }
                return null;
            }

            moveToTail(node);
            hits++;
            return node.value;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 写入不过期的元素
     *
     * @param key 键
     * @param value 值
     */
    public void set(String key, V value) {
        set(key, value, null);
    }

    /**
     * 写入元素
     *
     * <p>已存在的键原地更新并提升为最近使用，不会触发淘汰。新键在容量已满时先淘汰最久未使用的元素，
     * 无论该元素是否已过期，都只计为一次淘汰。
     *
     * @param key 键
     * @param value 值
     * @param ttl 存活时间，null 表示永不过期
     */
    public void set(String key, V value, Duration ttl) {
        requireKey(key);
        if (ttl != null && ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be non-negative, got " + ttl);
        }

        lock.lock();
        try {
            Instant expiry = ttl != null ? expiryOf(ttl) : null;

            Node<V> existing = nodeMap.get(key);
            if (existing != null) {
                existing.value = value;
                existing.expiry = expiry;
                moveToTail(existing);
                return;
            }

            if (nodeMap.size() >= maxSize) {
                evictEldest();
            }

            Node<V> node = new Node<>(key, value, expiry);
            linkLast(node);
            nodeMap.put(key, node);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 删除元素
     *
     * @param key 键
     * @return 被删除的值；键不存在或已过期时返回null（已过期的会计入过期次数）
     */
    public V delete(String key) {
        requireKey(key);

        lock.lock();
        try {
            Node<V> node = nodeMap.remove(key);
            if (node == null) {
                return null;
            }
            unlink(node);

            if (isExpired(node, clock.instant())) {
                expirations++;
                return null;
            }
            return node.value;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 判断键是否存在且未过期
     *
     * <p>不改变访问顺序，也不影响命中统计；遇到已过期的元素会顺带移除。
     *
     * @param key 键，为空时直接返回false
     * @return true=存在且有效
     */
    public boolean exists(String key) {
        if (key == null || key.isEmpty()) {
            return false;
        }

        lock.lock();
        try {
            Node<V> node = nodeMap.get(key);
            if (node == null) {
                return false;
            }

            if (isExpired(node, clock.instant())) {
                nodeMap.remove(key);
                unlink(node);
                expirations++;
                if (log.isDebugEnabled()) {
                    log.debug("Expired entry on exists: key={}", key);
                }
                return false;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 判断结构中是否包含指定键，不检查过期
     *
     * @param key 键
     * @return true=包含（可能已逻辑过期），false=不包含
     */
    public boolean contains(String key) {
        lock.lock();
        try {
            return key != null && nodeMap.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    /** 当前元素数量，包含尚未被惰性清理的过期元素 */
    public int size() {
        lock.lock();
        try {
            return nodeMap.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public int getMaxSize() {
        return maxSize;
    }

    /** 清空所有元素，统计信息保留 */
    public void clear() {
        lock.lock();
        try {
            nodeMap.clear();
            head.next = tail;
            tail.prev = head;

            if (log.isDebugEnabled()) {
                log.debug("Cleared all entries");
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 按访问顺序返回所有键的快照
     *
     * @return 从最久未使用到最近使用的键列表，可能包含尚未清理的过期键
     */
    public List<String> keys() {
        lock.lock();
        try {
            List<String> keys = new ArrayList<>(nodeMap.size());
            for (Node<V> node = head.next; node != tail; node = node.next) {
                keys.add(node.key);
            }
            return keys;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 获取统计信息快照
     *
     * @return 命中、未命中、淘汰、过期次数及命中率
     */
    public CacheStats stats() {
        lock.lock();
        try {
            long total = hits + misses;
            double hitRate = total > 0 ? (double) hits / total * 100 : 0.0;
            return new CacheStats(
                    hits,
                    misses,
                    evictions,
                    expirations,
                    String.format(Locale.ROOT, "%.2f%%", hitRate),
                    nodeMap.size(),
                    maxSize);
        } finally {
            lock.unlock();
        }
    }

    private static void requireKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Key cannot be empty");
        }
    }

    /**
     * 计算过期时间点
     *
     * @param ttl 存活时间
     * @return now + ttl；超出 Instant 可表示范围时取 Instant.MAX
     */
    private Instant expiryOf(Duration ttl) {
        Instant now = clock.instant();
        try {
            return now.plus(ttl);
        } catch (ArithmeticException | DateTimeException e) {
            // 溢出的TTL等同于永不过期
            return Instant.MAX;
        }
    }

    private static boolean isExpired(Node<?> node, Instant now) {
        return node.expiry != null && now.isAfter(node.expiry);
    }

    /** 淘汰链表头部的元素（需要持有锁） */
    private void evictEldest() {
        Node<V> eldest = head.next;
        if (eldest == tail) {
            return;
        }
        unlink(eldest);
        nodeMap.remove(eldest.key);
        evictions++;

        if (log.isDebugEnabled()) {
            log.debug("Evicted entry: key={}, totalEvictions={}", eldest.key, evictions);
        }
    }

    private void moveToTail(Node<V> node) {
        if (tail.prev == node) {
            return;
        }
        unlink(node);
        linkLast(node);
    }

    private void linkLast(Node<V> node) {
        node.prev = tail.prev;
        node.next = tail;
        tail.prev.next = node;
        tail.prev = node;
    }

    private void unlink(Node<V> node) {
        node.prev.next = node.next;
        node.next.prev = node.prev;
        node.prev = null;
        node.next = null;
    }

    /**
     * 双向链表节点
     *
     * @param <V> 值类型
     */
    static class Node<V> {
        final String key;
        V value;
        Instant expiry; // null=永不过期
        Node<V> prev;
        Node<V> next;

        Node(String key, V value, Instant expiry) {
            this.key = key;
            this.value = value;
            this.expiry = expiry;
        }
    }
}
