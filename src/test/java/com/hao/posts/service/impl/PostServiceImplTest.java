package com.hao.posts.service.impl;

import com.hao.posts.common.exception.PostNotFoundException;
import com.hao.posts.dal.model.Post;
import com.hao.posts.dal.model.PostRequest;
import com.hao.posts.dal.store.PostStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * 帖子服务单元测试
 *
 * 测试目的：
 * 1. 验证请求到帖子草稿的转换（published 默认值、id 不透传）。
 * 2. 验证不存在异常原样上抛。
 *
 * 设计思路：
 * - 使用 Mockito 模拟 PostStore，只验证服务层自身逻辑。
 */
@ExtendWith(MockitoExtension.class)
class PostServiceImplTest {

    @Mock
    private PostStore postStore;

    @InjectMocks
    private PostServiceImpl postService;

    @Test
    @DisplayName("创建帖子_published缺省时按true处理")
    void testCreateDefaultsPublishedToTrue() {
        PostRequest request = PostRequest.builder().title("A").content("B").build();
        Post stored = Post.builder().id(3L).title("A").content("B").build();
        when(postStore.create(any(Post.class))).thenReturn(stored);

        Post created = postService.createPost(request);

        ArgumentCaptor<Post> captor = ArgumentCaptor.forClass(Post.class);
        verify(postStore).create(captor.capture());
        Post draft = captor.getValue();
        assertNull(draft.getId(), "草稿不应携带ID");
        assertTrue(draft.isPublished());
        assertNull(draft.getRating());
        assertSame(stored, created);
    }

    @Test
    @DisplayName("更新帖子_显式传入的字段全部透传")
    void testUpdatePassesAllFields() {
        PostRequest request = PostRequest.builder().title("X").content("Y").published(false).rating(2).build();
        when(postStore.update(eq(5L), any(Post.class)))
                .thenAnswer(invocation -> ((Post) invocation.getArgument(1)).toBuilder().id(5L).build());

        Post updated = postService.updatePost(5L, request);

        assertEquals(5L, updated.getId());
        assertEquals("X", updated.getTitle());
        assertEquals("Y", updated.getContent());
        assertFalse(updated.isPublished());
        assertEquals(2, updated.getRating());
    }

    @Test
    @DisplayName("查询不存在的帖子_异常原样上抛")
    void testGetMissingPropagatesNotFound() {
        when(postStore.get(9L)).thenThrow(new PostNotFoundException(9L));

        PostNotFoundException e = assertThrows(PostNotFoundException.class, () -> postService.getPost(9L));
        assertEquals("post with id: 9 was not found", e.getMessage());
    }

    @Test
    @DisplayName("删除不存在的帖子_异常原样上抛且不再读取数量")
    void testDeleteMissingPropagatesNotFound() {
        doThrow(new PostNotFoundException(9L)).when(postStore).delete(9L);

        assertThrows(PostNotFoundException.class, () -> postService.deletePost(9L));
        verify(postStore, never()).size();
    }

    @Test
    @DisplayName("空存储查询最新帖子_异常原样上抛")
    void testLatestOnEmptyStore() {
        when(postStore.getLatest()).thenThrow(PostNotFoundException.noPosts());

        assertThrows(PostNotFoundException.class, () -> postService.getLatestPost());
    }
}
