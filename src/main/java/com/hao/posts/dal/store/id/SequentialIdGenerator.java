package com.hao.posts.dal.store.id;

import com.google.common.base.Preconditions;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongPredicate;

/**
 * 单调递增发号器
 *
 * 类职责：
 * 以计数器方式发放帖子ID，跳过已被占用的值。
 *
 * 核心实现思路：
 * - AtomicLong 保存下一个候选值，每次调用只增不减。
 * - 已占用ID的集合有限，跳过循环必然终止。
 */
public class SequentialIdGenerator implements IdGenerator {

    private final AtomicLong next;

    public SequentialIdGenerator(long start) {
        Preconditions.checkArgument(start >= 1, "sequence start must be >= 1, got %s", start);
        this.next = new AtomicLong(start);
    }

    @Override
    public long nextId(LongPredicate inUse) {
        long candidate;
        do {
            candidate = next.getAndIncrement();
        } while (inUse.test(candidate));
        return candidate;
    }
}
