package org.readbar.recent.dto;

import java.util.List;

/**
 * {@code readbar_list_roots} 的返回结果。
 *
 * @param roots      被监控的根目录
 * @param extensions 追踪的扩展名白名单
 * @param watching   目录监听是否在运行
 */
public record WatchedRootsResult(List<WatchedRootEntry> roots, List<String> extensions, boolean watching) {
}
