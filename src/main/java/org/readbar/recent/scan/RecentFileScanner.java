package org.readbar.recent.scan;

import org.readbar.recent.ExtensionAllowList;
import org.readbar.recent.RecentSet;
import org.readbar.recent.TrackedItem;
import org.readbar.recent.WatchedRoot;
import org.readbar.recent.WatchedRoots;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 对所有根目录做一次全量扫描，把全局最新的 K 个文件写入 {@link RecentSet}。
 * <p>
 * 设计目标：
 * <ul>
 *   <li>只列根目录本身（不递归），每个根目录最多收集 {@code app.readbar.scan-max-files-per-root} 个文件。</li>
 *   <li>根目录不存在、不可读或遍历中途出错：丢弃该根目录本轮的部分结果，继续扫描其它根目录。</li>
 *   <li>单个文件读取属性失败只跳过该文件。</li>
 *   <li>任何扫描错误都不会中断进程；可以反复执行，每次语义相同。</li>
 * </ul>
 * <p>
 * 扫描是阻塞 IO，调用方负责把它放到后台线程（见 {@link RescanScheduler}）。
 */
public class RecentFileScanner {

    private static final Logger log = LoggerFactory.getLogger(RecentFileScanner.class);

    private static final Comparator<TrackedItem> NEWEST_FIRST =
            Comparator.comparing(TrackedItem::primaryTimestamp).reversed();

    private final WatchedRoots roots;
    private final ExtensionAllowList allowList;
    private final RecentSet recentSet;
    private final int maxFilesPerRoot;

    public RecentFileScanner(WatchedRoots roots, ExtensionAllowList allowList, RecentSet recentSet, int maxFilesPerRoot) {
        this.roots = Objects.requireNonNull(roots, "roots 不能为空");
        this.allowList = Objects.requireNonNull(allowList, "allowList 不能为空");
        this.recentSet = Objects.requireNonNull(recentSet, "recentSet 不能为空");
        if (maxFilesPerRoot < 1) {
            throw new IllegalArgumentException("maxFilesPerRoot 必须大于 0：" + maxFilesPerRoot);
        }
        this.maxFilesPerRoot = maxFilesPerRoot;
    }

    /**
     * 扫描并把结果写入最近文件集合。
     */
    public ScanReport rescan() {
        ScanResult result = scanRoots();
        List<TrackedItem> top = topK(result.candidates());
        // 按时间戳升序写入：同名文件以更新的那个为准，和“后写者胜”的语义保持一致
        List<TrackedItem> oldestFirst = new ArrayList<>(top);
        oldestFirst.sort(Comparator.comparing(TrackedItem::primaryTimestamp));
        recentSet.upsertAll(oldestFirst);

        ScanReport report = new ScanReport(result.scannedRoots(), result.skippedRoots(), result.candidates().size(), top.size());
        log.info("全量扫描完成：扫描根目录 {} 个，跳过 {} 个，候选文件 {} 个，写入 {} 个",
                report.scannedRoots().size(), report.skippedRoots().size(), report.candidateCount(), report.fedCount());
        return report;
    }

    /**
     * 只扫描，不写入集合；返回全局最新的 K 个文件（按时间戳降序）。
     */
    public List<TrackedItem> scan() {
        return topK(scanRoots().candidates());
    }

    private List<TrackedItem> topK(List<TrackedItem> candidates) {
        List<TrackedItem> sorted = new ArrayList<>(candidates);
        sorted.sort(NEWEST_FIRST);
        int k = Math.min(recentSet.capacity(), sorted.size());
        return List.copyOf(sorted.subList(0, k));
    }

    private ScanResult scanRoots() {
        List<TrackedItem> candidates = new ArrayList<>();
        List<String> scanned = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (WatchedRoot root : roots.list()) {
            Optional<List<TrackedItem>> found = scanRoot(root);
            if (found.isPresent()) {
                candidates.addAll(found.get());
                scanned.add(root.id());
            } else {
                skipped.add(root.id());
            }
        }
        return new ScanResult(candidates, scanned, skipped);
    }

    private Optional<List<TrackedItem>> scanRoot(WatchedRoot root) {
        Path dir = root.path();
        if (!Files.isDirectory(dir)) {
            log.warn("根目录不存在或不是目录，跳过：{}", dir);
            return Optional.empty();
        }

        List<TrackedItem> found = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path child : stream) {
                if (found.size() >= maxFilesPerRoot) {
                    log.warn("根目录 {} 达到单目录上限 {}，其余文件本轮不再收集", dir, maxFilesPerRoot);
                    break;
                }
                if (!allowList.allows(child)) {
                    continue;
                }
                readItem(root, child).ifPresent(found::add);
            }
        } catch (IOException | DirectoryIteratorException e) {
            log.warn("读取根目录失败，跳过：{}（{}）", dir, e.toString());
            return Optional.empty();
        }
        log.debug("根目录 {} 找到 {} 个候选文件", dir, found.size());
        return Optional.of(found);
    }

    private Optional<TrackedItem> readItem(WatchedRoot root, Path file) {
        BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(file, BasicFileAttributes.class);
        } catch (IOException e) {
            log.debug("读取文件属性失败，跳过：{}（{}）", file, e.toString());
            return Optional.empty();
        }
        if (!attributes.isRegularFile()) {
            return Optional.empty();
        }
        return allowList.itemFor(file, root.primaryTimestamp(attributes));
    }

    private record ScanResult(List<TrackedItem> candidates, List<String> scannedRoots, List<String> skippedRoots) {
    }

    /**
     * 一次全量扫描的结果摘要。
     *
     * @param scannedRoots   成功扫描的根目录 id
     * @param skippedRoots   被跳过的根目录 id
     * @param candidateCount 所有根目录收集到的候选文件数
     * @param fedCount       写入最近文件集合的条目数
     */
    public record ScanReport(List<String> scannedRoots, List<String> skippedRoots, int candidateCount, int fedCount) {
        public ScanReport {
            scannedRoots = List.copyOf(scannedRoots);
            skippedRoots = List.copyOf(skippedRoots);
        }
    }
}
