package org.readbar.recent;

/**
 * 一条已解码的文件变更通知。
 *
 * @param path 文件绝对路径
 * @param kind 变更类型
 */
public record FileChange(String path, ChangeKind kind) {
}
