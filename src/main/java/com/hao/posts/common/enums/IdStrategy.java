package com.hao.posts.common.enums;

/**
 * 帖子ID分配策略
 *
 * 对应配置项 posts.id.strategy。
 */
public enum IdStrategy {

    /**
     * 单调递增计数器（默认）
     */
    SEQUENTIAL,

    /**
     * 区间内随机抽取，冲突重试有上限，耗尽后回落到顺序发号
     */
    RANDOM
}
