package com.hao.posts;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * 帖子服务启动入口
 *
 * 类职责：
 * 引导 Spring Boot 应用启动，完成组件扫描与配置属性绑定。
 *
 * 核心实现思路：
 * - 组合 @SpringBootApplication 完成自动配置与组件扫描。
 * - 组合 @ConfigurationPropertiesScan 绑定 posts.* 配置。
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class PostsApplication {

    /**
     * 应用主入口
     *
     * @param args 命令行参数
     */
    public static void main(String[] args) {
        SpringApplication.run(PostsApplication.class, args);
    }
}
