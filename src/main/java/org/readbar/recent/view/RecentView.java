package org.readbar.recent.view;

import org.readbar.recent.TrackedItem;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 某一时刻渲染出的最近文件视图（不可变）。
 *
 * @param version    单调递增的视图版本号
 * @param renderedAt 渲染时间
 * @param items      已过滤掉不存在路径的条目，按时间戳降序
 */
public record RecentView(long version, Instant renderedAt, List<TrackedItem> items) {

    public static final String EMPTY_PLACEHOLDER = "No recent files";

    public RecentView {
        items = List.copyOf(items);
    }

    static RecentView empty() {
        return new RecentView(0, Instant.EPOCH, List.of());
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    /**
     * 以菜单的形式渲染：每个条目一行显示文件名；没有条目时只有一行占位文字。
     */
    public List<String> menuLines() {
        if (items.isEmpty()) {
            return List.of(EMPTY_PLACEHOLDER);
        }
        List<String> lines = new ArrayList<>(items.size());
        for (TrackedItem item : items) {
            lines.add(item.displayName());
        }
        return List.copyOf(lines);
    }
}
