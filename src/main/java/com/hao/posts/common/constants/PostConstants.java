package com.hao.posts.common.constants;

/**
 * 帖子业务常量定义
 *
 * 类职责：
 * 集中管理ID分配的默认参数与示例数据，配置项缺省时使用。
 */
public class PostConstants {

    /**
     * 顺序发号起始值
     */
    public static final long DEFAULT_SEQUENCE_START = 1L;

    /**
     * 随机发号下界
     * 1、2 留给启动时预置的两条示例帖子
     */
    public static final long DEFAULT_RANDOM_ID_MIN = 3L;

    /**
     * 随机发号上界（含）
     */
    public static final long DEFAULT_RANDOM_ID_MAX = 1_000_000L;

    /**
     * 随机发号冲突重试上限
     */
    public static final int DEFAULT_RANDOM_ID_MAX_ATTEMPTS = 16;

    /**
     * 示例帖子数量
     */
    public static final int SAMPLE_POST_COUNT = 2;

    private PostConstants() {
        // 禁止实例化
    }
}
