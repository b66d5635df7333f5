package org.readbar.recent.dto;

/**
 * 被监控的根目录信息。
 *
 * @param id             根目录标识（root0、root1...）
 * @param path           根目录绝对路径
 * @param usesAccessTime 是否按访问时间排序
 * @param exists         当前是否存在且为目录
 */
public record WatchedRootEntry(String id, String path, boolean usesAccessTime, boolean exists) {
}
