package com.hao.posts.config;

import com.hao.posts.dal.store.ListPostStore;
import com.hao.posts.dal.store.MapPostStore;
import com.hao.posts.dal.store.PostStore;
import com.hao.posts.dal.store.id.IdGenerator;
import com.hao.posts.dal.store.id.RandomIdGenerator;
import com.hao.posts.dal.store.id.SequentialIdGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

/**
 * 帖子存储装配类
 *
 * 类职责：
 * 按 posts.* 配置创建ID发号器与帖子存储实例，并以单例 Bean 形式注入服务层。
 *
 * 核心实现思路：
 * - 存储实例由容器持有，不使用进程级静态集合。
 * - 非法配置（如随机区间为空）在启动阶段直接失败。
 */
@Slf4j
@Configuration
public class PostStoreConfig {

    /**
     * 帖子ID发号器
     *
     * @param properties 存储配置
     * @return 按策略创建的发号器
     */
    @Bean
    public IdGenerator postIdGenerator(PostStoreProperties properties) {
        PostStoreProperties.Id id = properties.getId();
        IdGenerator sequential = new SequentialIdGenerator(id.getSequenceStart());
        IdGenerator generator = switch (id.getStrategy()) {
            case SEQUENTIAL -> sequential;
            case RANDOM -> new RandomIdGenerator(id.getRandomMin(), id.getRandomMax(),
                    id.getMaxAttempts(), new Random(), sequential);
        };
        log.info("帖子ID发号器就绪|Post_id_generator_ready,strategy={}", id.getStrategy());
        return generator;
    }

    /**
     * 帖子存储
     *
     * @param properties 存储配置
     * @param postIdGenerator 发号器
     * @return 按结构类型创建的存储
     */
    @Bean
    public PostStore postStore(PostStoreProperties properties, IdGenerator postIdGenerator) {
        PostStore store = switch (properties.getStorage()) {
            case LIST -> new ListPostStore(postIdGenerator);
            case MAP -> new MapPostStore(postIdGenerator);
        };
        log.info("帖子存储就绪|Post_store_ready,storage={}", properties.getStorage());
        return store;
    }
}
