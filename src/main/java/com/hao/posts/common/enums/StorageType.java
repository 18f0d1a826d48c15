package com.hao.posts.common.enums;

/**
 * 帖子存储结构类型
 *
 * 对应配置项 posts.storage。
 */
public enum StorageType {

    /**
     * 插入顺序列表，按ID线性查找
     */
    LIST,

    /**
     * 保留插入顺序的 ID -> 帖子 映射
     */
    MAP
}
