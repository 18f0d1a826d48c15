package com.hao.posts.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.google.common.util.concurrent.RateLimiter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * 本地缓存配置类
 *
 * 类职责：
 * 提供按限流键保存 Guava RateLimiter 的 Caffeine 缓存实例。
 *
 * 设计目的：
 * 1. 令牌桶的生命周期交给缓存管理，SimpleRateLimiter 只负责取用。
 * 2. 以 Bean 形式注入，测试时可以替换为自定义缓存。
 *
 * 为什么需要该类：
 * - 限流键可能来自请求路径，数量不可预知，需要过期与容量上限。
 * - ConcurrentHashMap 无法按访问时间淘汰，这里使用 Caffeine。
 */
@Configuration
public class CacheConfig {

    /**
     * 限流器缓存实例
     *
     * 实现逻辑：
     * 1. 限流键闲置 10 分钟后回收其限流器。
     * 2. 限制最大条目数，防止键数量无限增长。
     *
     * @return 限流器 Cache Bean
     */
    @Bean("rateLimiterCache")
    public Cache<String, RateLimiter> rateLimiterCache() {
        // 实现思路：按访问时间过期，并限制总条目数
        return Caffeine.newBuilder()
                .expireAfterAccess(10, TimeUnit.MINUTES)
                .maximumSize(1000)
                .build();
    }
}
