package org.readbar.recent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * 有容量上限、按文件名去重、按时间戳降序排列的“最近文件”集合（内存版）。
 * <p>
 * 不变量（每次修改之后都成立）：
 * <ol>
 *   <li>任意两条记录的 {@code displayName} 不相同。</li>
 *   <li>条目数不超过 {@link #capacity()}。</li>
 *   <li>顺序严格按 {@code primaryTimestamp} 降序；时间戳相同时，后写入的排在前面。</li>
 * </ol>
 * <p>
 * 并发：
 * <ul>
 *   <li>所有读写都在同一把锁内完成，事件线程、扫描线程与展示线程可以同时调用。</li>
 *   <li>{@link #snapshot()} 只在锁内复制列表，文件存在性检查在锁外进行，因此返回结果可能比并发修改略旧。</li>
 *   <li>变更回调在锁释放之后、在修改线程上同步触发；纯 no-op 的调用不会触发回调。</li>
 * </ul>
 */
public class RecentSet {

    private static final Logger log = LoggerFactory.getLogger(RecentSet.class);

    private final int capacity;
    private final Predicate<Path> existenceCheck;
    private final Object lock = new Object();

    // 受 lock 保护；外部永远拿不到这个列表的引用
    private final List<TrackedItem> items = new ArrayList<>();

    private final CopyOnWriteArrayList<RecentSetListener> listeners = new CopyOnWriteArrayList<>();

    public RecentSet(int capacity) {
        this(capacity, Files::exists);
    }

    /**
     * @param capacity       容量上限（至少为 1）
     * @param existenceCheck 读取快照时判断路径是否仍然存在
     */
    public RecentSet(int capacity, Predicate<Path> existenceCheck) {
        if (capacity < 1) {
            throw new IllegalArgumentException("容量必须大于 0：" + capacity);
        }
        this.capacity = capacity;
        this.existenceCheck = Objects.requireNonNull(existenceCheck, "existenceCheck 不能为空");
    }

    public int capacity() {
        return capacity;
    }

    /**
     * 内部存储的条目数（不做存在性过滤）。
     */
    public int size() {
        synchronized (lock) {
            return items.size();
        }
    }

    public void addListener(RecentSetListener listener) {
        listeners.addIfAbsent(Objects.requireNonNull(listener, "listener 不能为空"));
    }

    public void removeListener(RecentSetListener listener) {
        listeners.remove(listener);
    }

    /**
     * 插入或覆盖一条记录。
     * <p>
     * 同名记录直接被新记录替换（按调用顺序后写者胜，不比较新旧时间戳），然后按时间戳放到正确位置，超出容量的尾部被淘汰。
     */
    public void upsert(TrackedItem item) {
        Objects.requireNonNull(item, "item 不能为空");
        boolean changed;
        synchronized (lock) {
            List<TrackedItem> before = List.copyOf(items);
            applyUpsert(item);
            changed = !before.equals(items);
        }
        if (changed) {
            log.debug("最近文件已更新：{} ({})", item.displayName(), item.primaryTimestamp());
            fireChanged();
        }
    }

    /**
     * 按迭代顺序逐条执行 {@link #upsert(TrackedItem)} 的语义，但整个批次只占用一次临界区、最多触发一次回调。
     */
    public void upsertAll(Collection<TrackedItem> batch) {
        if (batch == null || batch.isEmpty()) {
            return;
        }
        boolean changed;
        synchronized (lock) {
            List<TrackedItem> before = List.copyOf(items);
            for (TrackedItem item : batch) {
                if (item != null) {
                    applyUpsert(item);
                }
            }
            changed = !before.equals(items);
        }
        if (changed) {
            log.debug("最近文件批量更新：{} 条输入", batch.size());
            fireChanged();
        }
    }

    /**
     * 删除路径完全相同的记录；不存在时什么也不做。
     */
    public void remove(String path) {
        if (path == null) {
            return;
        }
        boolean removed;
        synchronized (lock) {
            removed = items.removeIf(i -> i.pathString().equals(path));
        }
        if (removed) {
            log.debug("最近文件已移除：{}", path);
            fireChanged();
        }
    }

    /**
     * 返回当前排序后的列表，并过滤掉磁盘上已经不存在的路径。
     * <p>
     * 过滤只影响返回值，不会清理内部存储；被过滤掉的条目会在收到删除事件或被淘汰时自然离开集合。
     */
    public List<TrackedItem> snapshot() {
        List<TrackedItem> copy;
        synchronized (lock) {
            copy = List.copyOf(items);
        }
        List<TrackedItem> result = new ArrayList<>(copy.size());
        for (TrackedItem item : copy) {
            if (existenceCheck.test(item.path())) {
                result.add(item);
            }
        }
        return List.copyOf(result);
    }

    // 调用方必须持有 lock
    private void applyUpsert(TrackedItem item) {
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i).displayName().equals(item.displayName())) {
                items.remove(i);
                break;
            }
        }

        int pos = 0;
        while (pos < items.size() && items.get(pos).primaryTimestamp().isAfter(item.primaryTimestamp())) {
            pos++;
        }
        items.add(pos, item);

        while (items.size() > capacity) {
            items.remove(items.size() - 1);
        }
    }

    private void fireChanged() {
        for (RecentSetListener listener : listeners) {
            try {
                listener.onRecentSetChanged();
            } catch (RuntimeException e) {
                log.warn("最近文件变更回调执行失败：{}", listener, e);
            }
        }
    }
}
