package com.hao.posts.dal.store;

import com.google.common.collect.Iterables;
import com.hao.posts.dal.model.Post;
import com.hao.posts.dal.store.id.IdGenerator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 映射版帖子存储
 *
 * 类职责：
 * 以 ID -> 帖子 的映射保存帖子，按ID查找、插入、替换为常数时间。
 *
 * 核心实现思路：
 * - LinkedHashMap 保留插入顺序，覆盖已有键不改变顺序，满足更新后位置不变。
 * - lastId 记录最近插入的帖子ID，getLatest 直接按ID查找，为常数时间。
 * - 删除的恰好是最新帖子时，需要遍历一次映射重新确定 lastId（O(n)），其余删除为常数时间。
 */
public class MapPostStore extends AbstractPostStore {

    private final Map<Long, Post> posts = new LinkedHashMap<>();

    /**
     * 最近插入的帖子ID，存储为空时为 null
     */
    private Long lastId;

    public MapPostStore(IdGenerator idGenerator) {
        super(idGenerator);
    }

    @Override
    protected List<Post> doList() {
        return new ArrayList<>(posts.values());
    }

    @Override
    protected Post doLatest() {
        return lastId == null ? null : posts.get(lastId);
    }

    @Override
    protected Post doFind(long id) {
        return posts.get(id);
    }

    @Override
    protected boolean doContains(long id) {
        return posts.containsKey(id);
    }

    @Override
    protected void doInsert(Post post) {
        posts.put(post.getId(), post);
        lastId = post.getId();
    }

    @Override
    protected boolean doReplace(long id, Post post) {
        if (!posts.containsKey(id)) {
            return false;
        }
        posts.put(id, post);
        return true;
    }

    @Override
    protected boolean doRemove(long id) {
        if (posts.remove(id) == null) {
            return false;
        }
        if (lastId != null && lastId == id) {
            lastId = Iterables.getLast(posts.keySet(), null);
        }
        return true;
    }

    @Override
    protected int doSize() {
        return posts.size();
    }
}
