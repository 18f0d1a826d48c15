package com.hao.posts.common.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 全局异常处理器
 *
 * 类职责：
 * 统一捕获 Controller 层抛出的异常，转换为 {"detail": ...} 格式的错误响应。
 *
 * 状态码约定：
 * - 帖子不存在 -> 404，detail 为可读消息。
 * - 请求体/路径参数校验失败 -> 422，detail 为错误项列表（loc / msg / type）。
 * - 写接口限流 -> 429。
 * - 框架层错误（路由不存在、方法不支持等）-> 沿用框架给出的状态码。
 * - 其他未预期异常 -> 500，仅记录日志，不向客户端暴露细节。
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 处理帖子不存在异常
     *
     * @param e 异常对象
     * @param request 请求上下文
     * @return 错误响应
     */
    @ExceptionHandler(PostNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handlePostNotFound(PostNotFoundException e, WebRequest request) {
        log.warn("帖子不存在|Post_not_found,path={},postId={}", getRequestPath(request), e.getPostId());
        return detail(e.getMessage());
    }

    /**
     * 处理请求体字段校验失败
     *
     * @param e 校验异常
     * @param request 请求上下文
     * @return 校验错误列表
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Map<String, Object> handleBodyInvalid(MethodArgumentNotValidException e, WebRequest request) {
        List<Map<String, Object>> errors = e.getBindingResult().getFieldErrors().stream()
                .map(this::toValidationError)
                .toList();
        log.warn("请求体校验失败|Request_body_invalid,path={},errors={}", getRequestPath(request), errors);
        return detail(errors);
    }

    /**
     * 处理请求体无法解析（JSON 语法错误、字段类型不匹配、缺失请求体）
     *
     * @param e 解析异常
     * @param request 请求上下文
     * @return 校验错误列表
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Map<String, Object> handleBodyUnreadable(HttpMessageNotReadableException e, WebRequest request) {
        log.warn("请求体解析失败|Request_body_unreadable,path={},message={}", getRequestPath(request), e.getMessage());
        return detail(List.of(validationError(List.of("body"), "request body is missing or not valid JSON for this schema",
                "json_invalid")));
    }

    /**
     * 处理路径参数类型不匹配（如 /posts/abc）
     *
     * @param e 类型不匹配异常
     * @param request 请求上下文
     * @return 校验错误列表
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Map<String, Object> handleTypeMismatch(MethodArgumentTypeMismatchException e, WebRequest request) {
        log.warn("路径参数类型错误|Path_param_type_mismatch,path={},name={},value={}",
                getRequestPath(request), e.getName(), e.getValue());
        return detail(List.of(validationError(List.of("path", e.getName()),
                "value is not a valid integer", "int_parsing")));
    }

    /**
     * 处理限流异常
     *
     * @param e 限流异常
     * @param request 请求上下文
     * @return 错误响应
     */
    @ExceptionHandler(RateLimitException.class)
    @ResponseStatus(HttpStatus.TOO_MANY_REQUESTS)
    public Map<String, Object> handleRateLimit(RateLimitException e, WebRequest request) {
        log.warn("触发限流保护|Rate_limit_triggered,path={},message={}", getRequestPath(request), e.getMessage());
        return detail(e.getMessage());
    }

    /**
     * 处理框架层错误，状态码沿用框架定义（404 路由不存在、405 方法不支持、415 媒体类型不支持）
     *
     * @param e 框架异常
     * @param request 请求上下文
     * @return 错误响应
     */
    @ExceptionHandler({ErrorResponseException.class, HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class})
    public ResponseEntity<Map<String, Object>> handleFrameworkError(Exception e, WebRequest request) {
        HttpStatusCode status = ((ErrorResponse) e).getStatusCode();
        log.warn("框架层请求错误|Framework_request_error,path={},status={},message={}",
                getRequestPath(request), status.value(), e.getMessage());
        String reason = status instanceof HttpStatus httpStatus ? httpStatus.getReasonPhrase() : e.getMessage();
        return ResponseEntity.status(status).body(detail(reason));
    }

    /**
     * 处理系统兜底异常
     *
     * @param e 未知异常
     * @param request 请求上下文
     * @return 错误响应
     */
    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleException(Exception e, WebRequest request) {
        log.error("系统未知异常|System_unknown_error,path={},message={}", getRequestPath(request), e.getMessage(), e);
        return detail("internal server error");
    }

    private Map<String, Object> toValidationError(FieldError error) {
        String type = error.getCode() == null ? "value_error" : error.getCode();
        return validationError(List.of("body", error.getField()), error.getDefaultMessage(), type);
    }

    private Map<String, Object> validationError(List<String> loc, String msg, String type) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("loc", loc);
        item.put("msg", msg);
        item.put("type", type);
        return item;
    }

    private Map<String, Object> detail(Object detail) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("detail", detail);
        return result;
    }

    /**
     * 提取请求路径，去除 WebRequest 描述中的 "uri=" 前缀
     *
     * @param request 请求上下文
     * @return 请求URI
     */
    private String getRequestPath(WebRequest request) {
        return request.getDescription(false).replace("uri=", "");
    }
}
