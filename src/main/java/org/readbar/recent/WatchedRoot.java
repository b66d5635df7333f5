package org.readbar.recent;

import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;

/**
 * 一个被监控的根目录及其时间戳策略。
 *
 * @param id                  根目录标识（root0、root1...）
 * @param path                根目录绝对路径
 * @param usesAccessSemantics true 时用访问时间排序，否则用修改时间
 */
public record WatchedRoot(String id, Path path, boolean usesAccessSemantics) {

    public Instant primaryTimestamp(BasicFileAttributes attributes) {
        return timestampOf(attributes, usesAccessSemantics);
    }

    static Instant timestampOf(BasicFileAttributes attributes, boolean accessSemantics) {
        return accessSemantics
                ? attributes.lastAccessTime().toInstant()
                : attributes.lastModifiedTime().toInstant();
    }
}
