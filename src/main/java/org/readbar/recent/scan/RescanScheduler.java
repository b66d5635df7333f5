package org.readbar.recent.scan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * 全量扫描的后台执行器。
 * <p>
 * 所有扫描都在单线程 {@code readbar-scan} 上串行执行，不会阻塞事件线程和展示线程：
 * <ul>
 *   <li>{@link #start()} 立即排队一次初始扫描；配置了周期时按固定延迟重复扫描。</li>
 *   <li>{@link #requestRescan()} 额外排队一次扫描（例如监听队列溢出、通知可能丢失时）。</li>
 * </ul>
 */
public class RescanScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RescanScheduler.class);

    private final RecentFileScanner scanner;
    private final Duration interval;
    private final ScheduledExecutorService executor;
    private ScheduledFuture<?> periodic;
    private volatile RecentFileScanner.ScanReport lastReport;

    public RescanScheduler(RecentFileScanner scanner, Duration interval) {
        this.scanner = Objects.requireNonNull(scanner, "scanner 不能为空");
        this.interval = (interval == null || interval.isNegative()) ? Duration.ZERO : interval;
        this.executor = Executors.newSingleThreadScheduledExecutor(scanThreadFactory());
    }

    public synchronized void start() {
        executor.execute(this::runOnce);
        if (!interval.isZero() && periodic == null) {
            long ms = interval.toMillis();
            periodic = executor.scheduleWithFixedDelay(this::runOnce, ms, ms, TimeUnit.MILLISECONDS);
            log.info("已启用周期性全量扫描：每 {} 秒一次", interval.toSeconds());
        }
    }

    /**
     * 额外排队一次扫描，立即返回。
     */
    public Future<RecentFileScanner.ScanReport> requestRescan() {
        return executor.submit(this::runOnce);
    }

    /**
     * 在扫描线程上执行一次扫描并等待结果（与其它扫描串行）。
     */
    public RecentFileScanner.ScanReport rescanAndWait() {
        try {
            RecentFileScanner.ScanReport report = requestRescan().get();
            if (report == null) {
                throw new IllegalStateException("全量扫描失败，详见日志");
            }
            return report;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("等待全量扫描时被中断", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("全量扫描失败：" + e.getCause().getMessage(), e.getCause());
        }
    }

    public RecentFileScanner.ScanReport lastReport() {
        return lastReport;
    }

    private RecentFileScanner.ScanReport runOnce() {
        try {
            RecentFileScanner.ScanReport report = scanner.rescan();
            lastReport = report;
            return report;
        } catch (RuntimeException e) {
            // 周期任务一旦抛出异常就不会再被调度
            log.error("全量扫描失败", e);
            return null;
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static ThreadFactory scanThreadFactory() {
        return r -> {
            Thread t = new Thread(r, "readbar-scan");
            t.setDaemon(true);
            return t;
        };
    }
}
