package org.readbar.recent;

/**
 * 文件变更类型。
 */
public enum ChangeKind {
    CREATED,
    MODIFIED,
    REMOVED
}
