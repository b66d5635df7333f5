package org.readbar.recent.dto;

import java.time.Instant;
import java.util.List;

/**
 * {@code readbar_list_recent} 的返回结果。
 *
 * @param version    视图版本号（每次刷新递增）
 * @param renderedAt 视图渲染时间
 * @param capacity   最近文件列表容量上限
 * @param entries    条目列表（按时间戳降序）
 * @param menuLines  按菜单渲染的文本行；没有条目时只有占位文字
 */
public record RecentFilesResult(
        long version,
        Instant renderedAt,
        int capacity,
        List<RecentFileEntry> entries,
        List<String> menuLines
) {
}
