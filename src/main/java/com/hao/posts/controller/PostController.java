package com.hao.posts.controller;

import com.hao.posts.common.aspect.RateLimit;
import com.hao.posts.common.constants.RateLimitConstants;
import com.hao.posts.dal.model.Post;
import com.hao.posts.dal.model.PostRequest;
import com.hao.posts.service.PostService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 帖子控制器
 *
 * 类职责：
 * 暴露 /posts 下的增删改查接口，负责请求映射、请求体校验与状态码。
 *
 * 核心实现思路：
 * - 业务逻辑委托给 PostService。
 * - 写接口共享一个限流键。
 * - 异常统一由 GlobalExceptionHandler 转换。
 */
@RestController
@RequestMapping("/posts")
@RequiredArgsConstructor
public class PostController {

    private static final String WRITE_QPS = "${rate.limit.write-qps:" + RateLimitConstants.POST_WRITE_QPS + "}";

    private final PostService postService;

    /**
     * 获取全部帖子
     *
     * @return 按插入顺序排列的帖子列表
     */
    @GetMapping
    public List<Post> listPosts() {
        return postService.listPosts();
    }

    /**
     * 获取最新帖子
     *
     * @return 最近插入的帖子
     */
    @GetMapping("/latest")
    public Post getLatestPost() {
        return postService.getLatestPost();
    }

    /**
     * 按ID获取帖子
     *
     * @param id 帖子ID
     * @return 帖子
     */
    @GetMapping("/{id}")
    public Post getPost(@PathVariable("id") long id) {
        return postService.getPost(id);
    }

    /**
     * 发布帖子
     *
     * @param body 帖子字段
     * @return 已分配ID的帖子
     */
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @RateLimit(qps = WRITE_QPS, key = RateLimitConstants.POST_WRITE_KEY)
    public Post createPost(@Valid @RequestBody PostRequest body) {
        return postService.createPost(body);
    }

    /**
     * 全量更新帖子
     *
     * @param id 帖子ID
     * @param body 新的帖子字段
     * @return 更新后的帖子
     */
    @PutMapping("/{id}")
    @ResponseStatus(HttpStatus.ACCEPTED)
    @RateLimit(qps = WRITE_QPS, key = RateLimitConstants.POST_WRITE_KEY)
    public Post updatePost(@PathVariable("id") long id, @Valid @RequestBody PostRequest body) {
        return postService.updatePost(id, body);
    }

    /**
     * 删除帖子，不需要请求体
     *
     * @param id 帖子ID
     */
    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @RateLimit(qps = WRITE_QPS, key = RateLimitConstants.POST_WRITE_KEY)
    public void deletePost(@PathVariable("id") long id) {
        postService.deletePost(id);
    }
}
