package com.hao.posts.dal.store;

import com.hao.posts.common.exception.PostNotFoundException;
import com.hao.posts.dal.model.Post;
import com.hao.posts.dal.store.id.RandomIdGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * 映射版帖子存储测试
 */
class MapPostStoreTest extends AbstractPostStoreTest {

    @Override
    protected PostStore newStore() {
        return new MapPostStore(sequential());
    }

    @Test
    @DisplayName("随机发号_区间被占满后仍能分配唯一ID")
    void testRandomStrategyWithSaturatedRange() {
        // 区间只有 3..5 三个值，后续创建只能依赖顺序兜底
        PostStore tinyRange = new MapPostStore(new RandomIdGenerator(3, 5, 4, new Random(1), sequential()));
        Set<Long> ids = new HashSet<>();
        for (int i = 0; i < 10; i++) {
            Post created = tinyRange.create(draft("t" + i, "c"));
            ids.add(created.getId());
        }
        assertEquals(10, ids.size());
        assertEquals(10, tinyRange.size());
    }

    @Test
    @DisplayName("删除最新帖子后_最新帖子回退为前一个_删除其他帖子不影响最新")
    void testLatestTracksDeletes() {
        PostStore store = newStore();
        Post first = store.create(draft("first", "1"));
        Post second = store.create(draft("second", "2"));
        Post third = store.create(draft("third", "3"));

        store.delete(second.getId());
        assertEquals(third.getId(), store.getLatest().getId());

        store.delete(third.getId());
        assertEquals(first.getId(), store.getLatest().getId());

        Post fourth = store.create(draft("fourth", "4"));
        assertEquals(fourth.getId(), store.getLatest().getId());

        store.delete(fourth.getId());
        store.delete(first.getId());
        assertThrows(PostNotFoundException.class, store::getLatest);
    }
}
