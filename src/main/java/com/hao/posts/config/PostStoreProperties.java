package com.hao.posts.config;

import com.hao.posts.common.constants.PostConstants;
import com.hao.posts.common.enums.IdStrategy;
import com.hao.posts.common.enums.StorageType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * 帖子存储配置属性
 *
 * 类职责：
 * 绑定 posts.* 配置，决定存储结构、ID分配策略与启动预置数据。
 *
 * 配置示例：
 * <pre>
 * posts:
 *   storage: MAP
 *   id:
 *     strategy: RANDOM
 *     max-attempts: 8
 *   seed:
 *     enabled: false
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "posts")
public class PostStoreProperties {

    /** 存储结构 */
    @NotNull
    private StorageType storage = StorageType.LIST;

    @Valid
    private final Id id = new Id();

    @Valid
    private final Seed seed = new Seed();

    /**
     * ID分配配置
     */
    @Data
    public static class Id {

        @NotNull
        private IdStrategy strategy = IdStrategy.SEQUENTIAL;

        /** 顺序发号起始值 */
        @Min(1)
        private long sequenceStart = PostConstants.DEFAULT_SEQUENCE_START;

        /** 随机发号下界（含） */
        @Min(1)
        private long randomMin = PostConstants.DEFAULT_RANDOM_ID_MIN;

        /** 随机发号上界（含） */
        @Min(1)
        private long randomMax = PostConstants.DEFAULT_RANDOM_ID_MAX;

        /** 随机发号冲突重试上限 */
        @Min(1)
        private int maxAttempts = PostConstants.DEFAULT_RANDOM_ID_MAX_ATTEMPTS;
    }

    /**
     * 启动预置数据配置
     */
    @Data
    public static class Seed {

        /** 存储为空时是否写入示例帖子 */
        private boolean enabled = true;
    }
}
