package org.readbar.recent;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * 文件扩展名白名单（不区分大小写）。
 * <p>
 * 只有扩展名在白名单内的文件才会被构造成 {@link TrackedItem}；其余文件在事件适配层与扫描层都会被直接忽略。
 */
public final class ExtensionAllowList {

    private final Set<String> extensions;

    public ExtensionAllowList(Collection<String> extensions) {
        Set<String> normalized = new LinkedHashSet<>();
        if (extensions != null) {
            for (String ext : extensions) {
                if (ext == null || ext.isBlank()) {
                    continue;
                }
                String e = ext.trim().toLowerCase(Locale.ROOT);
                // 兼容 ".pdf" 与 "pdf" 两种写法
                normalized.add(e.startsWith(".") ? e.substring(1) : e);
            }
        }
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("扩展名白名单不能为空（app.readbar.extensions）");
        }
        this.extensions = Set.copyOf(normalized);
    }

    public Set<String> extensions() {
        return extensions;
    }

    public boolean allows(Path path) {
        if (path == null || path.getFileName() == null) {
            return false;
        }
        return allows(path.getFileName().toString());
    }

    /**
     * 判断文件名是否命中白名单。
     * <p>
     * 没有扩展名的文件名、只有扩展名的隐藏文件（例如 {@code .pdf}）一律不命中。
     */
    public boolean allows(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return false;
        }
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return false;
        }
        return extensions.contains(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    /**
     * 为白名单内的文件构造条目；不在白名单内则返回空。
     */
    public Optional<TrackedItem> itemFor(Path path, Instant timestamp) {
        if (!allows(path) || timestamp == null) {
            return Optional.empty();
        }
        Path absolute = path.toAbsolutePath().normalize();
        return Optional.of(new TrackedItem(absolute, absolute.getFileName().toString(), timestamp));
    }
}
