package com.hao.posts.dal.store.id;

import com.google.common.base.Preconditions;
import lombok.extern.slf4j.Slf4j;

import java.util.Random;
import java.util.function.LongPredicate;

/**
 * 随机发号器（有界重试版）
 *
 * 类职责：
 * 在 [min, max] 区间内随机抽取帖子ID，冲突时重试。
 *
 * 设计目的：
 * 1. 保留随机ID的外部表现（ID 不可由前一个ID推算）。
 * 2. 区间被占满时调用依然能够结束，不会无限循环。
 *
 * 为什么需要该类：
 * - 只靠随机抽取，存储接近区间容量时冲突概率趋近于 1。
 * - 重试次数有上限，超出后改用兜底发号器，返回值仍然满足"未被占用"。
 *
 * 核心算法：
 * 1. 随机抽取一个候选ID。
 * 2. 未被占用 -> 直接返回。
 * 3. 已被占用 -> 重试，最多 maxAttempts 次。
 * 4. 重试耗尽 -> 交给兜底发号器（顺序发号），保证调用一定终止。
 */
@Slf4j
public class RandomIdGenerator implements IdGenerator {

    private final long min;

    private final long max;

    private final int maxAttempts;

    private final Random random;

    private final IdGenerator fallback;

    public RandomIdGenerator(long min, long max, int maxAttempts, Random random, IdGenerator fallback) {
        Preconditions.checkArgument(min >= 1, "random id min must be >= 1, got %s", min);
        Preconditions.checkArgument(min <= max, "random id range is empty: [%s, %s]", min, max);
        Preconditions.checkArgument(maxAttempts >= 1, "max attempts must be >= 1, got %s", maxAttempts);
        this.min = min;
        this.max = max;
        this.maxAttempts = maxAttempts;
        this.random = Preconditions.checkNotNull(random, "random");
        this.fallback = Preconditions.checkNotNull(fallback, "fallback");
    }

    @Override
    public long nextId(LongPredicate inUse) {
        // 实现思路：
        // 1. 最多抽取 maxAttempts 次，命中空闲ID即返回。
        // 2. 全部冲突时由兜底发号器给出一个未占用的ID。
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            long candidate = random.nextLong(min, max + 1);
            if (!inUse.test(candidate)) {
                return candidate;
            }
            log.debug("随机ID冲突_重试|Random_id_collision_retry,candidate={},attempt={}", candidate, attempt);
        }
        long id = fallback.nextId(inUse);
        log.warn("随机ID重试耗尽_使用顺序发号兜底|Random_id_attempts_exhausted_fallback,maxAttempts={},id={}", maxAttempts, id);
        return id;
    }
}
