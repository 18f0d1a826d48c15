package com.hao.posts.dal.model;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 帖子请求体
 *
 * 类职责：
 * 承载创建与全量更新时客户端提交的字段，不包含 id。
 *
 * 核心实现思路：
 * - 使用 Bean Validation 声明字段约束，校验失败由全局异常处理器转换为 422。
 * - published 缺省或为 null 时按 true 处理。
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class PostRequest {

    /** 标题 */
    @NotEmpty(message = "title must not be empty")
    private String title;

    /** 正文（允许为空串） */
    @NotNull(message = "content is required")
    private String content;

    /** 是否发布 */
    private Boolean published;

    /** 评分 */
    private Integer rating;

    /**
     * 转换为尚未分配ID的帖子草稿
     *
     * @return 帖子草稿，id 为空
     */
    public Post toDraft() {
        return Post.builder()
                .title(title)
                .content(content)
                .published(published == null || published)
                .rating(rating)
                .build();
    }
}
