package com.hao.posts.dal.store.id;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * 单调递增发号器测试
 */
class SequentialIdGeneratorTest {

    @Test
    @DisplayName("从起始值开始单调递增")
    void testMonotonicFromStart() {
        SequentialIdGenerator generator = new SequentialIdGenerator(10);

        assertEquals(10L, generator.nextId(id -> false));
        assertEquals(11L, generator.nextId(id -> false));
        assertEquals(12L, generator.nextId(id -> false));
    }

    @Test
    @DisplayName("跳过已被占用的ID")
    void testSkipsIdsInUse() {
        SequentialIdGenerator generator = new SequentialIdGenerator(1);
        Set<Long> inUse = Set.of(1L, 2L, 4L);

        assertEquals(3L, generator.nextId(inUse::contains));
        assertEquals(5L, generator.nextId(inUse::contains));
    }

    @Test
    @DisplayName("起始值小于1_启动失败")
    void testRejectsNonPositiveStart() {
        assertThrows(IllegalArgumentException.class, () -> new SequentialIdGenerator(0));
    }
}
