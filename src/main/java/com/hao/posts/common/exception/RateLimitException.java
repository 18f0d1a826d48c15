package com.hao.posts.common.exception;

/**
 * 限流异常
 *
 * 类职责：
 * 写接口触发限流时中断请求，配合 GlobalExceptionHandler 返回 HTTP 429。
 */
public class RateLimitException extends RuntimeException {

    /**
     * @param message 限流提示
     */
    public RateLimitException(String message) {
        super(message);
    }
}
