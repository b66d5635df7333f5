package org.readbar.recent;

import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 被监控根目录的集合，负责把配置解析成绝对路径，并为任意文件找到它所属的根目录。
 * <p>
 * 说明：
 * <ul>
 *   <li>配置里以 {@code ~} 开头的路径会展开为 {@code user.home}。</li>
 *   <li>根目录可以互相嵌套；一个文件属于路径层级最长的那个根目录。</li>
 *   <li>不在任何根目录下的文件按修改时间排序。</li>
 * </ul>
 */
public final class WatchedRoots {

    private final List<WatchedRoot> roots;

    public WatchedRoots(List<WatchedRoot> roots) {
        this.roots = List.copyOf(roots);
    }

    public static WatchedRoots fromProperties(ReadBarProperties properties) {
        List<ReadBarProperties.Root> configured = properties.getRoots();
        if (configured == null || configured.isEmpty()) {
            return new WatchedRoots(List.of());
        }
        List<WatchedRoot> result = new ArrayList<>(configured.size());
        for (int i = 0; i < configured.size(); i++) {
            ReadBarProperties.Root root = Objects.requireNonNull(configured.get(i), "配置项 app.readbar.roots[" + i + "] 不能为空");
            String value = root.getPath();
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException("配置项 app.readbar.roots[" + i + "].path 不能为空");
            }
            result.add(new WatchedRoot("root" + i, expand(value), root.isUsesAccessTime()));
        }
        return new WatchedRoots(result);
    }

    public List<WatchedRoot> list() {
        return roots;
    }

    public List<Path> paths() {
        List<Path> result = new ArrayList<>(roots.size());
        for (WatchedRoot root : roots) {
            result.add(root.path());
        }
        return result;
    }

    public Optional<WatchedRoot> rootFor(Path path) {
        if (path == null) {
            return Optional.empty();
        }
        Path absolute = path.toAbsolutePath().normalize();
        return roots.stream()
                .filter(r -> absolute.startsWith(r.path()))
                .max(Comparator.comparingInt(r -> r.path().getNameCount()));
    }

    /**
     * 按所属根目录的策略取排序时间戳。
     */
    public Instant primaryTimestamp(Path path, BasicFileAttributes attributes) {
        return rootFor(path)
                .map(root -> root.primaryTimestamp(attributes))
                .orElseGet(() -> WatchedRoot.timestampOf(attributes, false));
    }

    static Path expand(String value) {
        String trimmed = value.trim();
        if (trimmed.equals("~") || trimmed.startsWith("~/")) {
            String home = System.getProperty("user.home");
            trimmed = home + trimmed.substring(1);
        }
        return Path.of(trimmed).toAbsolutePath().normalize();
    }
}
