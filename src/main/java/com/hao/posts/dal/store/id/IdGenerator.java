package com.hao.posts.dal.store.id;

import java.util.function.LongPredicate;

/**
 * 帖子ID发号器接口
 * <p>
 * 职责：
 * 为新帖子挑选一个当前未被占用的ID。
 * <p>
 * 调用约定：
 * 调用方持有存储写锁，inUse 在调用期间保持不变。
 */
public interface IdGenerator {

    /**
     * 生成下一个可用ID。
     *
     * @param inUse 判断某个ID是否已被占用
     * @return 未被占用的ID，保证 {@code inUse.test(id) == false}
     */
    long nextId(LongPredicate inUse);
}
