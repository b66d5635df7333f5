package org.readbar.recent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * 把文件变更通知翻译成 {@link RecentSet} 的 upsert/remove 调用。
 * <p>
 * 规则：
 * <ul>
 *   <li>扩展名不在白名单内的通知直接忽略。</li>
 *   <li>删除通知调用 {@link RecentSet#remove(String)}。</li>
 *   <li>创建/修改通知先读取文件属性；读取失败（文件在通知与读取之间被删掉）属于正常竞态，静默跳过。</li>
 *   <li>批次内逐条独立处理；条数超限或含有非法条目的批次整批丢弃，不做部分处理。</li>
 * </ul>
 * <p>
 * 文件属性读取是阻塞 IO，调用方应在事件线程上调用，不要放在展示线程上。
 */
public class ChangeEventAdapter {

    private static final Logger log = LoggerFactory.getLogger(ChangeEventAdapter.class);

    private final RecentSet recentSet;
    private final ExtensionAllowList allowList;
    private final WatchedRoots roots;
    private final int maxBatchSize;

    public ChangeEventAdapter(RecentSet recentSet, ExtensionAllowList allowList, WatchedRoots roots, int maxBatchSize) {
        this.recentSet = Objects.requireNonNull(recentSet, "recentSet 不能为空");
        this.allowList = Objects.requireNonNull(allowList, "allowList 不能为空");
        this.roots = Objects.requireNonNull(roots, "roots 不能为空");
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("maxBatchSize 必须大于 0：" + maxBatchSize);
        }
        this.maxBatchSize = maxBatchSize;
    }

    /**
     * 处理一批通知。
     */
    public void onChanges(List<FileChange> batch) {
        if (batch == null || batch.isEmpty()) {
            return;
        }
        if (batch.size() > maxBatchSize) {
            log.warn("丢弃变更通知批次：条数 {} 超过上限 {}", batch.size(), maxBatchSize);
            return;
        }
        for (FileChange change : batch) {
            if (change == null || change.kind() == null || change.path() == null || change.path().isBlank()) {
                log.warn("丢弃变更通知批次：包含非法条目 {}", change);
                return;
            }
        }

        for (FileChange change : batch) {
            handle(change);
        }
    }

    private void handle(FileChange change) {
        Path path;
        try {
            path = Path.of(change.path()).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            log.debug("忽略无法解析的路径：{}", change.path());
            return;
        }
        if (!allowList.allows(path)) {
            return;
        }

        switch (change.kind()) {
            case REMOVED -> recentSet.remove(path.toString());
            case CREATED, MODIFIED -> upsertFromDisk(path);
        }
    }

    private void upsertFromDisk(Path path) {
        BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(path, BasicFileAttributes.class);
        } catch (IOException e) {
            log.debug("读取文件属性失败，跳过：{}（{}）", path, e.toString());
            return;
        }
        if (!attributes.isRegularFile()) {
            return;
        }
        Instant timestamp = roots.primaryTimestamp(path, attributes);
        allowList.itemFor(path, timestamp).ifPresent(recentSet::upsert);
    }
}
