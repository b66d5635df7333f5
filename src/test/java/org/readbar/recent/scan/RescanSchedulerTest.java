package org.readbar.recent.scan;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.readbar.recent.ExtensionAllowList;
import org.readbar.recent.RecentSet;
import org.readbar.recent.WatchedRoot;
import org.readbar.recent.WatchedRoots;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RescanSchedulerTest {

    @TempDir
    Path root;

    private RecentFileScanner scanner(RecentSet set) {
        WatchedRoots roots = new WatchedRoots(List.of(new WatchedRoot("root0", root, false)));
        return new RecentFileScanner(roots, new ExtensionAllowList(List.of("pdf")), set, 200);
    }

    @Test
    void start_runsInitialScanOffTheCallerThread() throws Exception {
        Files.writeString(root.resolve("a.pdf"), "a");
        RecentSet set = new RecentSet(15);
        CountDownLatch changed = new CountDownLatch(1);
        String[] threadName = new String[1];
        set.addListener(() -> {
            threadName[0] = Thread.currentThread().getName();
            changed.countDown();
        });

        try (RescanScheduler scheduler = new RescanScheduler(scanner(set), Duration.ZERO)) {
            scheduler.start();

            assertThat(changed.await(10, TimeUnit.SECONDS)).isTrue();
            assertThat(threadName[0]).isEqualTo("readbar-scan");
            assertThat(set.snapshot()).hasSize(1);
        }
    }

    @Test
    void rescanAndWait_returnsReport() throws Exception {
        Files.writeString(root.resolve("a.pdf"), "a");
        Files.writeString(root.resolve("b.pdf"), "b");

        try (RescanScheduler scheduler = new RescanScheduler(scanner(new RecentSet(15)), null)) {
            RecentFileScanner.ScanReport report = scheduler.rescanAndWait();

            assertThat(report.fedCount()).isEqualTo(2);
            assertThat(scheduler.lastReport()).isEqualTo(report);
        }
    }

    @Test
    void periodicInterval_repeatsScans() throws Exception {
        RecentSet set = new RecentSet(15);
        CountDownLatch twoFiles = new CountDownLatch(1);
        set.addListener(() -> {
            if (set.size() == 2) {
                twoFiles.countDown();
            }
        });
        Files.writeString(root.resolve("a.pdf"), "a");

        try (RescanScheduler scheduler = new RescanScheduler(scanner(set), Duration.ofMillis(50))) {
            scheduler.start();
            Files.writeString(root.resolve("b.pdf"), "b");

            assertThat(twoFiles.await(10, TimeUnit.SECONDS)).isTrue();
        }
    }
}
