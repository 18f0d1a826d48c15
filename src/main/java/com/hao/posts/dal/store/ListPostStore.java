package com.hao.posts.dal.store;

import com.hao.posts.dal.model.Post;
import com.hao.posts.dal.store.id.IdGenerator;

import java.util.ArrayList;
import java.util.List;

/**
 * 列表版帖子存储
 *
 * 类职责：
 * 以插入顺序的列表保存帖子，按ID查找为线性扫描。
 */
public class ListPostStore extends AbstractPostStore {

    private final List<Post> posts = new ArrayList<>();

    public ListPostStore(IdGenerator idGenerator) {
        super(idGenerator);
    }

    @Override
    protected List<Post> doList() {
        return posts;
    }

    @Override
    protected Post doLatest() {
        return posts.isEmpty() ? null : posts.get(posts.size() - 1);
    }

    @Override
    protected Post doFind(long id) {
        int index = indexOf(id);
        return index < 0 ? null : posts.get(index);
    }

    @Override
    protected boolean doContains(long id) {
        return indexOf(id) >= 0;
    }

    @Override
    protected void doInsert(Post post) {
        posts.add(post);
    }

    @Override
    protected boolean doReplace(long id, Post post) {
        int index = indexOf(id);
        if (index < 0) {
            return false;
        }
        posts.set(index, post);
        return true;
    }

    @Override
    protected boolean doRemove(long id) {
        int index = indexOf(id);
        if (index < 0) {
            return false;
        }
        posts.remove(index);
        return true;
    }

    @Override
    protected int doSize() {
        return posts.size();
    }

    private int indexOf(long id) {
        for (int i = 0; i < posts.size(); i++) {
            if (posts.get(i).getId() == id) {
                return i;
            }
        }
        return -1;
    }
}
