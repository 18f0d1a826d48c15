package com.hao.posts.common.aspect;

import com.hao.posts.common.constants.RateLimitConstants;
import com.hao.posts.common.exception.RateLimitException;
import com.hao.posts.common.interceptor.SimpleRateLimiter;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import org.springframework.web.servlet.HandlerMapping;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 单机限流切面
 *
 * 类职责：
 * 拦截带有 @RateLimit 注解的方法，令牌不足时抛出 RateLimitException，由全局异常处理器转换为 429。
 *
 * 设计目的：
 * 1. 把限流逻辑从控制器中剥离，写接口只需声明注解。
 * 2. QPS 以占位符形式写在注解上，阈值随配置变化而无需改代码。
 *
 * 为什么需要该类：
 * - 单个实例承受不住突发写入时，需要一个可以按需打开的保护开关。
 * - 该开关默认关闭：只有显式配置 rate.limit.enabled=true 时才装配本切面，
 *   未配置时写接口不会返回 429。
 *
 * 核心实现思路：
 * - 使用 @Around 环绕通知拦截目标方法。
 * - 解析注解中的 QPS（支持 ${...} 占位符），非法值回退为兜底 QPS。
 * - 调用 SimpleRateLimiter 非阻塞地获取令牌，失败即中断，目标方法不执行。
 */
@Slf4j
@Aspect
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "rate.limit.enabled", havingValue = "true", matchIfMissing = false)
public class RateLimitAspect {

    private final Environment environment;

    private final SimpleRateLimiter rateLimiter;

    /**
     * 已打印过的QPS配置，每个配置只打印一次
     */
    private final Set<String> loggedQps = ConcurrentHashMap.newKeySet();

    /**
     * 环绕通知处理限流逻辑
     *
     * @param point 切点
     * @param limit 注解对象
     * @return 业务执行结果
     * @throws Throwable 业务方法抛出的异常
     */
    @Around("@annotation(limit)")
    public Object around(ProceedingJoinPoint point, RateLimit limit) throws Throwable {
        // 实现思路：
        // 1. 先确定限流键与 QPS。
        // 2. 获取不到令牌则抛出限流异常，否则放行。
        String key = resolveKey(limit);
        double qps = parseQps(limit.qps());

        if (!rateLimiter.tryAcquire(key, qps)) {
            log.warn("写接口限流拦截|Write_rate_limited,key={},qps={}", key, qps);
            throw new RateLimitException(limit.message());
        }
        return point.proceed();
    }

    /**
     * 解析 QPS 配置值
     *
     * 实现逻辑：
     * 1. 由 Environment 解析 ${...} 占位符。
     * 2. 解析失败时记录错误日志并返回兜底值。
     *
     * @param qpsExpression 注解中的 QPS 字符串
     * @return 解析后的 QPS 值
     */
    double parseQps(String qpsExpression) {
        String resolved = environment.resolvePlaceholders(qpsExpression);
        // 占位符无默认值且未配置时，resolved 仍是 ${...} 原文，按解析失败处理
        try {
            double qps = Double.parseDouble(resolved);
            if (qps <= 0) {
                throw new NumberFormatException("qps must be positive");
            }
            if (loggedQps.add(qpsExpression)) {
                log.info("加载限流配置|Loaded_rate_limit_config,expression={},value={}", qpsExpression, qps);
            }
            return qps;
        } catch (NumberFormatException e) {
            log.error("QPS解析失败_使用默认值|Qps_parse_error_use_default,expression={},value={}",
                    qpsExpression, resolved);
            return RateLimitConstants.FALLBACK_QPS;
        }
    }

    /**
     * 解析限流键
     *
     * 实现逻辑：
     * 1. 优先使用注解指定的键。
     * 2. 其次使用请求匹配路径。
     * 3. 无请求上下文时回退为 unknown。
     *
     * @param limit 限流注解
     * @return 限流键
     */
    private String resolveKey(RateLimit limit) {
        String explicitKey = limit.key();
        if (!explicitKey.isBlank()) {
            return explicitKey.trim();
        }

        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (!(attributes instanceof ServletRequestAttributes servletAttributes)) {
            return "unknown";
        }
        HttpServletRequest request = servletAttributes.getRequest();
        Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        if (pattern instanceof String matched) {
            return request.getMethod() + " " + matched;
        }
        return request.getMethod() + " " + request.getRequestURI();
    }
}
