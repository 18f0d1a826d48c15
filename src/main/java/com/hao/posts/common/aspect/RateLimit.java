package com.hao.posts.common.aspect;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 单机限流注解
 *
 * 注解职责：
 * 标记需要限流的方法，由 RateLimitAspect 拦截执行。
 *
 * 使用说明：
 * 多个方法声明相同的 key 时共享同一个令牌桶。
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface RateLimit {

    /**
     * QPS 阈值，支持 ${...} 占位符从配置读取，如 "${rate.limit.write-qps:50}"。
     */
    String qps() default "100.0";

    /**
     * 限流键，为空时使用请求的匹配路径。
     */
    String key() default "";

    /**
     * 限流后返回的提示信息
     */
    String message() default "too many requests, please retry later";
}
