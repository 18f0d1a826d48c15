package com.hao.posts.common.exception;

import lombok.Getter;

/**
 * 帖子不存在异常
 *
 * 类职责：
 * 目标帖子不存在时由存储层抛出，经全局异常处理器转换为 HTTP 404。
 *
 * 实现思路：
 * - 继承 RuntimeException，业务层无需显式捕获。
 * - 携带缺失的帖子ID；查询最新帖子而存储为空时 postId 为 null。
 */
@Getter
public class PostNotFoundException extends RuntimeException {

    /** 缺失的帖子ID */
    private final Long postId;

    /**
     * 指定ID的帖子不存在
     *
     * @param postId 帖子ID
     */
    public PostNotFoundException(long postId) {
        super("post with id: " + postId + " was not found");
        this.postId = postId;
    }

    private PostNotFoundException(String message) {
        super(message);
        this.postId = null;
    }

    /**
     * 存储为空，无最新帖子
     *
     * @return 异常实例
     */
    public static PostNotFoundException noPosts() {
        return new PostNotFoundException("no posts available");
    }
}
