package org.readbar.recent;

/**
 * {@link RecentSet} 的变更回调。
 * <p>
 * 回调在执行修改的线程上同步触发（锁已释放之后），可能来自任意线程；实现方只应排队一次刷新，不要在回调里做耗时工作。
 */
@FunctionalInterface
public interface RecentSetListener {

    void onRecentSetChanged();
}
