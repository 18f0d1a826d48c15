package com.hao.posts.dal.store.id;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 随机发号器测试
 *
 * 测试目的：
 * 1. 验证未冲突时直接采用随机值。
 * 2. 验证冲突重试次数有上限，耗尽后交给兜底发号器。
 * 3. 验证非法区间在构造阶段被拒绝。
 */
class RandomIdGeneratorTest {

    @Test
    @DisplayName("未冲突_直接返回随机值")
    void testReturnsDrawWhenFree() {
        RandomIdGenerator generator = new RandomIdGenerator(3, 1_000_000, 16,
                new FixedRandom(777L), new SequentialIdGenerator(1));

        assertEquals(777L, generator.nextId(id -> false));
    }

    @Test
    @DisplayName("首次冲突_重试后返回新值")
    void testRetriesOnCollision() {
        RandomIdGenerator generator = new RandomIdGenerator(3, 1_000_000, 16,
                new FixedRandom(5L, 5L, 9L), new SequentialIdGenerator(1));
        Set<Long> inUse = Set.of(5L);

        assertEquals(9L, generator.nextId(inUse::contains));
    }

    @Test
    @DisplayName("重试耗尽_回落到顺序发号且调用次数有上限")
    void testFallsBackAfterMaxAttempts() {
        FixedRandom random = new FixedRandom(3L);
        RandomIdGenerator generator = new RandomIdGenerator(3, 1_000_000, 4,
                random, new SequentialIdGenerator(1));
        Set<Long> inUse = Set.of(1L, 3L);

        long id = generator.nextId(inUse::contains);

        assertEquals(2L, id);
        assertEquals(4, random.draws.get(), "随机抽取次数应等于重试上限");
    }

    @Test
    @DisplayName("随机值落在闭区间内")
    void testDrawsWithinInclusiveRange() {
        RandomIdGenerator generator = new RandomIdGenerator(3, 4, 16, new Random(42), new SequentialIdGenerator(1));
        for (int i = 0; i < 100; i++) {
            long id = generator.nextId(candidate -> false);
            assertTrue(id == 3 || id == 4, "ID越界: " + id);
        }
    }

    @Test
    @DisplayName("非法配置_构造阶段失败")
    void testRejectsInvalidConfiguration() {
        SequentialIdGenerator fallback = new SequentialIdGenerator(1);
        assertThrows(IllegalArgumentException.class,
                () -> new RandomIdGenerator(10, 9, 16, new Random(), fallback));
        assertThrows(IllegalArgumentException.class,
                () -> new RandomIdGenerator(0, 9, 16, new Random(), fallback));
        assertThrows(IllegalArgumentException.class,
                () -> new RandomIdGenerator(3, 9, 0, new Random(), fallback));
    }

    /**
     * 按给定序列返回值的随机源，序列用尽后重复最后一个值
     */
    private static class FixedRandom extends Random {

        private final long[] values;

        private final AtomicInteger draws = new AtomicInteger();

        FixedRandom(long... values) {
            this.values = values;
        }

        @Override
        public long nextLong(long origin, long bound) {
            int index = draws.getAndIncrement();
            return values[Math.min(index, values.length - 1)];
        }
    }
}
