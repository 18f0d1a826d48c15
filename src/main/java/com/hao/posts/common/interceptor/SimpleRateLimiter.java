package com.hao.posts.common.interceptor;

import com.github.benmanes.caffeine.cache.Cache;
import com.google.common.util.concurrent.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * 单机限流器
 *
 * 类职责：
 * 为每个限流键维护一个本地令牌桶，非阻塞地判断请求能否通过。
 *
 * 设计目的：
 * 1. 给 RateLimitAspect 提供"按键取令牌"的最小接口，切面不关心令牌桶的创建与回收。
 * 2. 令牌桶只存在于当前进程，与帖子存储一样不依赖外部组件。
 *
 * 为什么需要该类：
 * - Guava RateLimiter 本身不带按键管理，多个限流键需要各自的令牌桶。
 * - 限流键长期不用时需要回收，避免占用内存。
 *
 * 核心实现思路：
 * - 令牌桶使用 Guava RateLimiter（平滑突发模式），实例按键缓存在 Caffeine 中。
 * - 同一键的 QPS 配置变化时就地调整速率，不重建令牌桶。
 * - 使用 tryAcquire() 立即返回，请求线程不会被阻塞等待令牌。
 */
@Slf4j
@Component
public class SimpleRateLimiter {

    private final Cache<String, RateLimiter> limiters;

    public SimpleRateLimiter(@Qualifier("rateLimiterCache") Cache<String, RateLimiter> rateLimiterCache) {
        this.limiters = rateLimiterCache;
    }

    /**
     * 尝试获取令牌
     *
     * @param key 限流键
     * @param qps 每秒允许的请求数
     * @return true 表示通过，false 表示限流
     */
    public boolean tryAcquire(String key, double qps) {
        // 实现思路：
        // 1. 按键取出令牌桶，不存在则按当前 QPS 创建。
        // 2. QPS 与现有速率不一致时更新速率。
        // 3. 非阻塞获取一个令牌。
        RateLimiter limiter = limiters.get(key, k -> {
            log.info("创建限流器|Rate_limiter_created,key={},qps={}", k, qps);
            return RateLimiter.create(qps);
        });

        // 浮点比较留出精度余量
        if (Math.abs(limiter.getRate() - qps) > 0.0001) {
            limiter.setRate(qps);
        }
        return limiter.tryAcquire();
    }
}
