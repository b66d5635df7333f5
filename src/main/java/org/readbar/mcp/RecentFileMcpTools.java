package org.readbar.mcp;

import org.readbar.recent.ExtensionAllowList;
import org.readbar.recent.RecentSet;
import org.readbar.recent.TrackedItem;
import org.readbar.recent.WatchedRoot;
import org.readbar.recent.WatchedRoots;
import org.readbar.recent.dto.RecentFileEntry;
import org.readbar.recent.dto.RecentFilesResult;
import org.readbar.recent.dto.RescanResult;
import org.readbar.recent.dto.ResolvedEntryResult;
import org.readbar.recent.dto.WatchedRootEntry;
import org.readbar.recent.dto.WatchedRootsResult;
import org.readbar.recent.scan.RecentFileScanner;
import org.readbar.recent.scan.RescanScheduler;
import org.readbar.recent.view.RecentView;
import org.readbar.recent.view.RecentViewSync;
import org.readbar.recent.watch.DirectoryChangeFeed;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

/**
 * 最近文件 MCP 工具集合（展示层）。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>查看最近文件列表（{@code readbar_list_recent}）。</li>
 *   <li>查看被监控的根目录（{@code readbar_list_roots}）。</li>
 *   <li>手动触发一次全量扫描（{@code readbar_rescan}）。</li>
 *   <li>按列表位置取出文件路径（{@code readbar_resolve_entry}）。</li>
 * </ul>
 * <p>
 * 列表默认返回 {@link RecentViewSync} 最近一次发布的视图，不在调用线程上做文件 IO；需要最新结果时传 {@code refresh=true}。
 */
@Component
public class RecentFileMcpTools {

    private final RecentSet recentSet;
    private final RecentViewSync viewSync;
    private final RescanScheduler rescanScheduler;
    private final WatchedRoots roots;
    private final ExtensionAllowList allowList;
    private final DirectoryChangeFeed changeFeed;

    public RecentFileMcpTools(
            RecentSet recentSet,
            RecentViewSync viewSync,
            RescanScheduler rescanScheduler,
            WatchedRoots roots,
            ExtensionAllowList allowList,
            @Nullable DirectoryChangeFeed changeFeed
    ) {
        this.recentSet = recentSet;
        this.viewSync = viewSync;
        this.rescanScheduler = rescanScheduler;
        this.roots = roots;
        this.allowList = allowList;
        // changeFeed：app.readbar.watch-enabled=false 时为 null
        this.changeFeed = changeFeed;
    }

    @Tool(
            name = "readbar_list_recent",
            description = "列出最近的 PDF/EPUB 文件（按时间从新到旧，已过滤掉不存在的文件）。"
    )
    public RecentFilesResult listRecent(
            @ToolParam(required = false, description = "是否立即刷新（true 时重新读取最近文件集合并检查文件是否存在；默认 false）") Boolean refresh
    ) {
        RecentView view = Boolean.TRUE.equals(refresh) ? viewSync.refreshNow() : viewSync.current();
        List<RecentFileEntry> entries = new ArrayList<>(view.items().size());
        for (int i = 0; i < view.items().size(); i++) {
            TrackedItem item = view.items().get(i);
            entries.add(new RecentFileEntry(i, item.displayName(), item.pathString(), item.primaryTimestamp()));
        }
        return new RecentFilesResult(view.version(), view.renderedAt(), recentSet.capacity(), entries, view.menuLines());
    }

    @Tool(
            name = "readbar_list_roots",
            description = "列出被监控的根目录（rootId + path + 排序策略）以及扩展名白名单。"
    )
    public WatchedRootsResult listRoots() {
        List<WatchedRootEntry> result = new ArrayList<>(roots.list().size());
        for (WatchedRoot root : roots.list()) {
            result.add(new WatchedRootEntry(
                    root.id(),
                    root.path().toString(),
                    root.usesAccessSemantics(),
                    Files.isDirectory(root.path())
            ));
        }
        List<String> extensions = new ArrayList<>(allowList.extensions());
        extensions.sort(null);
        return new WatchedRootsResult(result, extensions, changeFeed != null && changeFeed.isRunning());
    }

    @Tool(
            name = "readbar_rescan",
            description = "立即对所有根目录做一次全量扫描，并把最新的文件合并进最近文件列表。"
    )
    /**
     * 扫描在后台扫描线程上执行，这里只等待它完成，保证与定时扫描串行。
     */
    public RescanResult rescan() {
        RecentFileScanner.ScanReport report = rescanScheduler.rescanAndWait();
        RecentView view = viewSync.refreshNow();
        return new RescanResult(
                report.scannedRoots(),
                report.skippedRoots(),
                report.candidateCount(),
                report.fedCount(),
                view.items().size()
        );
    }

    @Tool(
            name = "readbar_resolve_entry",
            description = "按 readbar_list_recent 返回的 index 取出对应文件的绝对路径（会再次确认文件存在）。"
    )
    public ResolvedEntryResult resolveEntry(
            @ToolParam(description = "条目位置（从 0 开始）") Integer index
    ) {
        RecentView view = viewSync.current();
        if (index == null || index < 0 || index >= view.items().size()) {
            throw new IllegalArgumentException("无效的条目位置：" + index + "（当前共 " + view.items().size() + " 条）");
        }
        TrackedItem item = view.items().get(index);
        if (!Files.exists(item.path())) {
            throw new IllegalArgumentException("文件已不存在：" + item.pathString());
        }
        return new ResolvedEntryResult(index, item.displayName(), item.pathString());
    }
}
