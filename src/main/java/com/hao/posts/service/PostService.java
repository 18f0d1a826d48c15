package com.hao.posts.service;

import com.hao.posts.common.exception.PostNotFoundException;
import com.hao.posts.dal.model.Post;
import com.hao.posts.dal.model.PostRequest;

import java.util.List;

/**
 * 帖子业务服务接口
 *
 * 类职责：
 * 提供帖子增删改查能力，控制层只依赖该接口。
 */
public interface PostService {

    /**
     * 按插入顺序获取全部帖子
     *
     * @return 帖子列表
     */
    List<Post> listPosts();

    /**
     * 获取最近插入的帖子
     *
     * @return 最新帖子
     * @throws PostNotFoundException 暂无帖子
     */
    Post getLatestPost();

    /**
     * 按ID获取帖子
     *
     * @param id 帖子ID
     * @return 帖子
     * @throws PostNotFoundException 帖子不存在
     */
    Post getPost(long id);

    /**
     * 发布帖子
     *
     * 实现逻辑：
     * 1. 将请求转换为帖子草稿，补全 published 默认值。
     * 2. 由存储层分配ID并保存。
     *
     * @param request 已校验的请求体
     * @return 已分配ID的帖子
     */
    Post createPost(PostRequest request);

    /**
     * 全量更新帖子
     *
     * @param id 帖子ID
     * @param request 已校验的请求体
     * @return 更新后的帖子
     * @throws PostNotFoundException 帖子不存在
     */
    Post updatePost(long id, PostRequest request);

    /**
     * 删除帖子
     *
     * @param id 帖子ID
     * @throws PostNotFoundException 帖子不存在
     */
    void deletePost(long id);
}
