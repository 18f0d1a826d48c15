package com.hao.posts.dal.store;

import com.google.common.base.Preconditions;
import com.hao.posts.common.exception.PostNotFoundException;
import com.hao.posts.dal.model.Post;
import com.hao.posts.dal.store.id.IdGenerator;

import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 帖子存储模板类
 * <p>
 * 类职责：
 * 统一处理加锁、ID分配、副本隔离与不存在判定，子类只负责具体数据结构的读写。
 * <p>
 * 设计目的：
 * 1. 列表版与映射版存储共享同一套并发与错误语义，行为只在查找复杂度上不同。
 * 2. ID 分配交给 IdGenerator，存储本身不关心顺序发号还是随机发号。
 * <p>
 * 为什么需要该类：
 * - 如果每个存储各自加锁、各自判断不存在，两种实现的语义容易出现偏差。
 * - 调用方拿到的必须是副本，修改返回值不能影响已存储的帖子。
 * <p>
 * 核心实现思路（模板方法）：
 * - 公开方法负责：加锁 -> 调用子类钩子 -> 判空抛 PostNotFoundException -> 返回副本。
 * - 子类钩子只操作自己的数据结构，约定"不存在"用 null 或 false 表示。
 * <p>
 * 并发模型：
 * - create / update / delete 持有写锁，同一时刻只有一个写者，保证ID唯一。
 * - list / get / getLatest / size 持有读锁，读与读并发，读与写互斥。
 * <p>
 * 子类钩子方法均在锁内调用，自身无需同步。
 */
public abstract class AbstractPostStore implements PostStore {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final IdGenerator idGenerator;

    protected AbstractPostStore(IdGenerator idGenerator) {
        this.idGenerator = Preconditions.checkNotNull(idGenerator, "idGenerator");
    }

    @Override
    public List<Post> list() {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return doList().stream().map(Post::copy).toList();
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public Post getLatest() {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            Post latest = doLatest();
            if (latest == null) {
                throw PostNotFoundException.noPosts();
            }
            return latest.copy();
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public Post get(long id) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            Post post = doFind(id);
            if (post == null) {
                throw new PostNotFoundException(id);
            }
            return post.copy();
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public Post create(Post fields) {
        Preconditions.checkNotNull(fields, "fields");
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            // 实现思路：
            // 1. 写锁内发号，doContains 看到的是最新状态，ID 不会重复。
            // 2. 丢弃调用方带来的 id，使用新分配的 id。
            // 3. 存入后返回副本。
            long id = idGenerator.nextId(this::doContains);
            Post stored = fields.toBuilder().id(id).build();
            doInsert(stored);
            return stored.copy();
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Post update(long id, Post fields) {
        Preconditions.checkNotNull(fields, "fields");
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            // 全量替换，id 保持路径中的值
            Post replacement = fields.toBuilder().id(id).build();
            if (!doReplace(id, replacement)) {
                throw new PostNotFoundException(id);
            }
            return replacement.copy();
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void delete(long id) {
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            if (!doRemove(id)) {
                throw new PostNotFoundException(id);
            }
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int size() {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return doSize();
        } finally {
            readLock.unlock();
        }
    }

    /** @return 按插入顺序排列的存储对象（非副本） */
    protected abstract List<Post> doList();

    /** @return 最近插入的帖子，存储为空时返回 null */
    protected abstract Post doLatest();

    /** @return 指定ID的帖子，不存在时返回 null */
    protected abstract Post doFind(long id);

    protected abstract boolean doContains(long id);

    /** 追加到插入顺序末尾 */
    protected abstract void doInsert(Post post);

    /** 原位替换，保持插入顺序；不存在时返回 false */
    protected abstract boolean doReplace(long id, Post post);

    /** 不存在时返回 false */
    protected abstract boolean doRemove(long id);

    protected abstract int doSize();
}
