package org.readbar.recent.dto;

import java.time.Instant;

/**
 * 最近文件视图中的一条记录。
 *
 * @param index            在视图中的位置（从 0 开始，可传给 {@code readbar_resolve_entry}）
 * @param name             文件名
 * @param path             文件绝对路径
 * @param primaryTimestamp 排序用时间戳
 */
public record RecentFileEntry(
        int index,
        String name,
        String path,
        Instant primaryTimestamp
) {
}
