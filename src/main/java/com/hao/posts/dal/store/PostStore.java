package com.hao.posts.dal.store;

import com.hao.posts.common.exception.PostNotFoundException;
import com.hao.posts.dal.model.Post;

import java.util.List;

/**
 * 帖子存储接口
 *
 * 类职责：
 * 持有当前全部帖子，负责分配唯一ID并按ID提供增删改查。
 *
 * 约定：
 * 1. 任意时刻不存在两个ID相同的帖子。
 * 2. 返回值均为副本，调用方修改返回对象不会影响存储状态。
 * 3. 单个操作对调用方是原子的。
 */
public interface PostStore {

    /**
     * 按插入顺序返回全部帖子
     *
     * @return 帖子列表，存储为空时返回空列表
     */
    List<Post> list();

    /**
     * 返回最近插入的帖子
     *
     * @return 最新帖子
     * @throws PostNotFoundException 存储为空
     */
    Post getLatest();

    /**
     * 按ID查询帖子
     *
     * @param id 帖子ID
     * @return 帖子
     * @throws PostNotFoundException 帖子不存在
     */
    Post get(long id);

    /**
     * 分配新ID并保存帖子
     *
     * @param fields 帖子字段，其中的 id 会被忽略
     * @return 已分配ID的帖子
     */
    Post create(Post fields);

    /**
     * 全量替换帖子的可变字段，ID保持不变
     *
     * @param id 帖子ID
     * @param fields 新字段，其中的 id 会被忽略
     * @return 更新后的帖子
     * @throws PostNotFoundException 帖子不存在
     */
    Post update(long id, Post fields);

    /**
     * 删除帖子
     *
     * @param id 帖子ID
     * @throws PostNotFoundException 帖子不存在
     */
    void delete(long id);

    /**
     * @return 当前帖子数量
     */
    int size();
}
