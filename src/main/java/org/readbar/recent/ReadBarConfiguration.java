package org.readbar.recent;

import org.readbar.recent.scan.RecentFileScanner;
import org.readbar.recent.scan.RescanScheduler;
import org.readbar.recent.view.RecentViewSync;
import org.readbar.recent.watch.DirectoryChangeFeed;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 最近文件追踪的 Bean 装配。
 * <p>
 * 说明：
 * <ul>
 *   <li>核心集合 {@link RecentSet} 是普通对象，不依赖 Spring，可单独构造与测试。</li>
 *   <li>监听、扫描、视图同步各自有独立线程，随应用启动而启动、随应用关闭而关闭。</li>
 * </ul>
 */
@Configuration(proxyBeanMethods = false)
public class ReadBarConfiguration {

    @Bean
    public ExtensionAllowList extensionAllowList(ReadBarProperties properties) {
        return new ExtensionAllowList(properties.getExtensions());
    }

    @Bean
    public WatchedRoots watchedRoots(ReadBarProperties properties) {
        return WatchedRoots.fromProperties(properties);
    }

    @Bean
    public RecentSet recentSet(ReadBarProperties properties) {
        return new RecentSet(properties.getMaxItems());
    }

    @Bean
    public ChangeEventAdapter changeEventAdapter(RecentSet recentSet, ExtensionAllowList allowList, WatchedRoots roots,
                                                 ReadBarProperties properties) {
        return new ChangeEventAdapter(recentSet, allowList, roots, properties.getMaxEventBatch());
    }

    @Bean
    public RecentFileScanner recentFileScanner(WatchedRoots roots, ExtensionAllowList allowList, RecentSet recentSet,
                                               ReadBarProperties properties) {
        return new RecentFileScanner(roots, allowList, recentSet, properties.getScanMaxFilesPerRoot());
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public RescanScheduler rescanScheduler(RecentFileScanner scanner, ReadBarProperties properties) {
        return new RescanScheduler(scanner, properties.getRescanInterval());
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public RecentViewSync recentViewSync(RecentSet recentSet) {
        return new RecentViewSync(recentSet);
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnProperty(prefix = "app.readbar", name = "watch-enabled", havingValue = "true", matchIfMissing = true)
    public DirectoryChangeFeed directoryChangeFeed(WatchedRoots roots, ChangeEventAdapter adapter,
                                                   RescanScheduler rescanScheduler, ReadBarProperties properties) {
        return new DirectoryChangeFeed(
                roots.paths(),
                properties.isWatchRecursive(),
                adapter::onChanges,
                rescanScheduler::requestRescan
        );
    }
}
