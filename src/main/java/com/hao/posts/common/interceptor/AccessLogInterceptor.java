package com.hao.posts.common.interceptor;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * 访问日志拦截器
 *
 * 类职责：
 * 记录每个请求的方法、路径、状态码与耗时。
 *
 * 核心实现思路：
 * - preHandle 把开始时间写入请求属性。
 * - afterCompletion 读取开始时间并输出一行访问日志，异常请求同样记录。
 */
@Slf4j
@Component
public class AccessLogInterceptor implements HandlerInterceptor {

    private static final String START_NANOS_ATTRIBUTE = AccessLogInterceptor.class.getName() + ".startNanos";

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        request.setAttribute(START_NANOS_ATTRIBUTE, System.nanoTime());
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        Object start = request.getAttribute(START_NANOS_ATTRIBUTE);
        long elapsedMs = start instanceof Long startNanos ? (System.nanoTime() - startNanos) / 1_000_000 : -1;
        log.info("请求完成|Request_completed,method={},path={},status={},costMs={}",
                request.getMethod(), request.getRequestURI(), response.getStatus(), elapsedMs);
    }
}
