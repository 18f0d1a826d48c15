package com.hao.posts.config;

import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Jackson 反序列化配置类
 *
 * 类职责：
 * 收紧请求体的标量类型转换，字段类型不符时直接反序列化失败（最终返回 422）。
 *
 * 实现思路：
 * - 浮点转整数、标量转布尔由 application.yml 中的
 *   spring.jackson.deserialization.accept-float-as-int 与
 *   spring.jackson.mapper.allow-coercion-of-scalars 关闭。
 * - 数字、布尔转字符串不受上述开关控制，这里通过 coercionConfig 单独禁止。
 */
@Slf4j
@Configuration
public class JacksonConfig {

    @Bean
    public Jackson2ObjectMapperBuilderCustomizer strictScalarCoercionCustomizer() {
        return builder -> builder.postConfigurer(mapper -> {
            mapper.coercionConfigFor(LogicalType.Textual)
                    .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                    .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                    .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
            log.info("Jackson标量转换已收紧|Jackson_strict_scalar_coercion_enabled");
        });
    }
}
