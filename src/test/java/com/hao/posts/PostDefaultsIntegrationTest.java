package com.hao.posts;

import com.hao.posts.common.aspect.RateLimitAspect;
import com.jayway.jsonpath.JsonPath;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 默认配置全链路测试
 *
 * 测试目的：
 * 不覆盖任何配置项，验证开箱即用时连续写入全部成功，不会出现 429。
 */
@Slf4j
@SpringBootTest
@AutoConfigureMockMvc
@DirtiesContext
class PostDefaultsIntegrationTest {

    private static final int CREATE_COUNT = 300;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ApplicationContext applicationContext;

    @Test
    @DisplayName("默认配置_限流切面不装配")
    void testRateLimitAspectAbsentByDefault() {
        assertNull(applicationContext.getBeanProvider(RateLimitAspect.class).getIfAvailable());
    }

    @Test
    @DisplayName("默认配置_连续创建300条帖子全部返回201")
    void testBurstOfCreatesAllSucceed() throws Exception {
        int before = countPosts();

        for (int i = 0; i < CREATE_COUNT; i++) {
            int statusCode = mockMvc.perform(post("/posts")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"title\":\"t" + i + "\",\"content\":\"c\"}"))
                    .andReturn().getResponse().getStatus();
            assertEquals(201, statusCode, "第 " + (i + 1) + " 次创建应返回201");
        }

        log.info("默认配置连续创建完成|Default_burst_create_done,count={}", CREATE_COUNT);
        mockMvc.perform(get("/posts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(before + CREATE_COUNT)));
    }

    private int countPosts() throws Exception {
        String body = mockMvc.perform(get("/posts")).andReturn().getResponse().getContentAsString();
        return JsonPath.<List<Object>>read(body, "$").size();
    }
}
