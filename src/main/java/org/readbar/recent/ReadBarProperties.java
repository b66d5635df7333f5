package org.readbar.recent;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 最近文件追踪的业务配置（{@code app.readbar.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>通过 {@link #roots} 指定被监控的目录，每个目录可以单独选择按修改时间或访问时间排序。</li>
 *   <li>通过 {@link #extensions} 指定需要追踪的文件类型（默认 pdf/epub）。</li>
 *   <li>通过各种上限配置控制内存占用与扫描耗时，避免超大目录拖慢启动。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.readbar")
public class ReadBarProperties {

    /**
     * 被监控的根目录列表。
     * <p>
     * 说明：每个 root 会自动分配一个 {@code rootId}（root0、root1...）；路径支持 {@code ~} 开头。
     */
    @Valid
    @NotNull
    private List<Root> roots = defaultRoots();

    /**
     * 需要追踪的文件扩展名（不区分大小写，可带或不带前导点）。
     */
    @NotEmpty
    private List<String> extensions = new ArrayList<>(List.of("pdf", "epub"));

    /**
     * 最近文件列表的容量上限。
     */
    @Min(1)
    @Max(1_000)
    private int maxItems = 15;

    /**
     * 全量扫描时每个根目录最多收集多少个文件（上限保护，避免超大目录导致扫描过慢）。
     */
    @Min(1)
    @Max(1_000_000)
    private int scanMaxFilesPerRoot = 200;

    /**
     * 单批文件变更通知允许的最大条数；超过则整批丢弃。
     */
    @Min(1)
    @Max(1_000_000)
    private int maxEventBatch = 1_000;

    /**
     * 周期性全量扫描的间隔；为 0 时只在启动时扫描一次。
     */
    @NotNull
    private Duration rescanInterval = Duration.ZERO;

    /**
     * 是否启用目录变更监听。
     */
    private boolean watchEnabled = true;

    /**
     * 是否递归监听子目录（全量扫描始终只看根目录本身）。
     */
    private boolean watchRecursive = true;

    private static List<Root> defaultRoots() {
        List<Root> roots = new ArrayList<>();
        roots.add(new Root("~/Downloads", false));
        roots.add(new Root("~/Desktop", false));
        roots.add(new Root("~/Library/Mobile Documents/com~apple~CloudDocs/reading", false));
        return roots;
    }

    public List<Root> getRoots() {
        return roots;
    }

    public void setRoots(List<Root> roots) {
        this.roots = roots;
    }

    public List<String> getExtensions() {
        return extensions;
    }

    public void setExtensions(List<String> extensions) {
        this.extensions = extensions;
    }

    public int getMaxItems() {
        return maxItems;
    }

    public void setMaxItems(int maxItems) {
        this.maxItems = maxItems;
    }

    public int getScanMaxFilesPerRoot() {
        return scanMaxFilesPerRoot;
    }

    public void setScanMaxFilesPerRoot(int scanMaxFilesPerRoot) {
        this.scanMaxFilesPerRoot = scanMaxFilesPerRoot;
    }

    public int getMaxEventBatch() {
        return maxEventBatch;
    }

    public void setMaxEventBatch(int maxEventBatch) {
        this.maxEventBatch = maxEventBatch;
    }

    public Duration getRescanInterval() {
        return rescanInterval;
    }

    public void setRescanInterval(Duration rescanInterval) {
        this.rescanInterval = rescanInterval;
    }

    public boolean isWatchEnabled() {
        return watchEnabled;
    }

    public void setWatchEnabled(boolean watchEnabled) {
        this.watchEnabled = watchEnabled;
    }

    public boolean isWatchRecursive() {
        return watchRecursive;
    }

    public void setWatchRecursive(boolean watchRecursive) {
        this.watchRecursive = watchRecursive;
    }

    /**
     * 单个根目录的配置。
     */
    public static class Root {

        /**
         * 目录路径（绝对路径，或以 {@code ~} 开头）。
         */
        @NotNull
        private String path;

        /**
         * 是否按访问时间（而不是修改时间）排序。
         */
        private boolean usesAccessTime = false;

        public Root() {
        }

        public Root(String path, boolean usesAccessTime) {
            this.path = path;
            this.usesAccessTime = usesAccessTime;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public boolean isUsesAccessTime() {
            return usesAccessTime;
        }

        public void setUsesAccessTime(boolean usesAccessTime) {
            this.usesAccessTime = usesAccessTime;
        }
    }
}
