package com.hao.posts.dal.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 帖子实体
 *
 * 类职责：
 * 描述一条帖子的全部字段，既是存储单元也是接口响应体。
 *
 * 核心实现思路：
 * - id 由存储层分配，客户端无法指定。
 * - 通过 toBuilder 生成副本，存储层只向外暴露副本。
 */
@Data                           // 自动生成访问器与字符串表示方法
@Builder(toBuilder = true)      // 副本构造
@AllArgsConstructor
@NoArgsConstructor
public class Post {

    /** 帖子ID（唯一标识，由存储层分配） */
    private Long id;

    /** 标题（非空） */
    private String title;

    /** 正文 */
    private String content;

    /** 是否发布，默认发布 */
    @Builder.Default
    private boolean published = true;

    /** 评分，可为空 */
    private Integer rating;

    /**
     * 生成当前帖子的独立副本
     *
     * @return 字段相同的新对象
     */
    public Post copy() {
        return toBuilder().build();
    }
}
