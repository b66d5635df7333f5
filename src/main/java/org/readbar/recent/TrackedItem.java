package org.readbar.recent;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * 最近文件集合中的一条记录。
 * <p>
 * 说明：
 * <ul>
 *   <li>{@code displayName} 是去重键：不同目录下的同名文件被视为同一条目，只保留最后一次写入的那条。</li>
 *   <li>{@code primaryTimestamp} 是排序键，来源由所属根目录的策略决定（修改时间或访问时间）。</li>
 *   <li>生产代码只通过 {@link ExtensionAllowList#itemFor(Path, Instant)} 构造，保证扩展名合法。</li>
 * </ul>
 *
 * @param path             文件绝对路径
 * @param displayName      文件名（不含目录）
 * @param primaryTimestamp 排序用时间戳
 */
public record TrackedItem(Path path, String displayName, Instant primaryTimestamp) {

    public TrackedItem {
        Objects.requireNonNull(path, "path 不能为空");
        Objects.requireNonNull(primaryTimestamp, "primaryTimestamp 不能为空");
        if (displayName == null || displayName.isBlank()) {
            throw new IllegalArgumentException("displayName 不能为空：" + path);
        }
    }

    /**
     * 路径的字符串形式，与 {@link RecentSet#remove(String)} 的匹配口径一致。
     */
    public String pathString() {
        return path.toString();
    }
}
