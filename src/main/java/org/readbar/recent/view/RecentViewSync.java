package org.readbar.recent.view;

import org.readbar.recent.RecentSet;
import org.readbar.recent.RecentSetListener;
import org.readbar.recent.TrackedItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 展示层同步器：监听 {@link RecentSet} 的变更，在自己的线程上拉取快照并发布新的 {@link RecentView}。
 * <p>
 * 变更回调可能来自事件线程或扫描线程，回调里只负责排队一次刷新；
 * 连续多次变更在刷新执行前会被合并成一次。
 */
public class RecentViewSync implements RecentSetListener, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RecentViewSync.class);

    private final RecentSet recentSet;
    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "readbar-view");
        t.setDaemon(true);
        return t;
    });
    private final AtomicBoolean refreshQueued = new AtomicBoolean(false);
    private long nextVersion = 1;
    private volatile RecentView current = RecentView.empty();

    public RecentViewSync(RecentSet recentSet) {
        this.recentSet = Objects.requireNonNull(recentSet, "recentSet 不能为空");
    }

    /**
     * 注册监听并排队第一次刷新。
     */
    public void start() {
        recentSet.addListener(this);
        onRecentSetChanged();
    }

    @Override
    public void onRecentSetChanged() {
        if (!refreshQueued.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::runQueuedRefresh);
        } catch (RejectedExecutionException e) {
            refreshQueued.set(false);
            log.debug("视图同步已关闭，忽略刷新请求");
        }
    }

    /**
     * 最近一次发布的视图；不触发刷新。
     */
    public RecentView current() {
        return current;
    }

    /**
     * 立即在调用线程上拉取快照并发布新视图。
     */
    public synchronized RecentView refreshNow() {
        List<TrackedItem> snapshot = recentSet.snapshot();
        RecentView view = new RecentView(nextVersion++, Instant.now(), snapshot);
        current = view;
        log.debug("视图已刷新：版本 {}，{} 个条目", view.version(), snapshot.size());
        return view;
    }

    private void runQueuedRefresh() {
        // 先清标记再刷新：刷新期间发生的变更会再排队一次
        refreshQueued.set(false);
        try {
            refreshNow();
        } catch (RuntimeException e) {
            log.warn("刷新最近文件视图失败", e);
        }
    }

    @Override
    public void close() {
        recentSet.removeListener(this);
        executor.shutdownNow();
    }
}
