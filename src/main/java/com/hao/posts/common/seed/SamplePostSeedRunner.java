package com.hao.posts.common.seed;

import com.hao.posts.common.constants.PostConstants;
import com.hao.posts.dal.model.Post;
import com.hao.posts.dal.store.PostStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 示例帖子预置执行器
 *
 * 类职责：
 * 应用启动后，若存储为空则写入两条未发布的示例帖子。
 *
 * 核心实现思路：
 * - 通过 PostStore.create 写入，ID 按当前发号策略分配。
 * - 通过 posts.seed.enabled 控制是否启用，默认启用。
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "posts.seed.enabled", havingValue = "true", matchIfMissing = true)
public class SamplePostSeedRunner implements ApplicationRunner {

    private final PostStore postStore;

    @Override
    public void run(ApplicationArguments args) {
        if (postStore.size() > 0) {
            log.info("存储非空_跳过示例数据|Store_not_empty_skip_seed,size={}", postStore.size());
            return;
        }
        for (int i = 1; i <= PostConstants.SAMPLE_POST_COUNT; i++) {
            Post sample = Post.builder()
                    .title("title of post " + i)
                    .content("content of post " + i)
                    .published(false)
                    .build();
            Post created = postStore.create(sample);
            log.info("写入示例帖子|Seed_post_created,postId={}", created.getId());
        }
    }
}
