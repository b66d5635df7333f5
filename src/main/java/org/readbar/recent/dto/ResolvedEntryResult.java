package org.readbar.recent.dto;

/**
 * {@code readbar_resolve_entry} 的返回结果。
 *
 * @param index 条目位置
 * @param name  文件名
 * @param path  文件绝对路径（已确认存在）
 */
public record ResolvedEntryResult(int index, String name, String path) {
}
