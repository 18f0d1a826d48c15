package com.hao.posts.service.impl;

import com.hao.posts.dal.model.Post;
import com.hao.posts.dal.model.PostRequest;
import com.hao.posts.dal.store.PostStore;
import com.hao.posts.service.PostService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 帖子业务服务实现
 *
 * 类职责：
 * 把已校验的请求转换为帖子草稿并委托给 PostStore，记录写操作日志。
 *
 * 核心实现思路：
 * - 存储实例由容器注入，服务本身无状态。
 * - 帖子不存在的异常由存储层抛出，原样上抛给全局异常处理器。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PostServiceImpl implements PostService {

    private final PostStore postStore;

    @Override
    public List<Post> listPosts() {
        return postStore.list();
    }

    @Override
    public Post getLatestPost() {
        return postStore.getLatest();
    }

    @Override
    public Post getPost(long id) {
        return postStore.get(id);
    }

    @Override
    public Post createPost(PostRequest request) {
        Post created = postStore.create(request.toDraft());
        log.info("帖子已创建|Post_created,postId={},title={}", created.getId(), created.getTitle());
        return created;
    }

    @Override
    public Post updatePost(long id, PostRequest request) {
        Post updated = postStore.update(id, request.toDraft());
        log.info("帖子已更新|Post_updated,postId={}", id);
        return updated;
    }

    @Override
    public void deletePost(long id) {
        postStore.delete(id);
        log.info("帖子已删除|Post_deleted,postId={},remaining={}", id, postStore.size());
    }
}
