package com.hao.posts.common.constants;

/**
 * 限流阈值常量定义
 *
 * 使用说明：
 * 配合 @RateLimit 注解使用，可被 rate.limit.* 配置覆盖。
 */
public class RateLimitConstants {

    /**
     * 帖子写接口（创建、更新、删除）共享的 QPS 阈值
     */
    public static final String POST_WRITE_QPS = "50";

    /**
     * 帖子写接口共享的限流键
     */
    public static final String POST_WRITE_KEY = "posts:write";

    /**
     * QPS 配置无法解析时使用的兜底值
     */
    public static final double FALLBACK_QPS = 100.0;

    private RateLimitConstants() {
        // 禁止实例化
    }
}
