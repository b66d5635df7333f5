package org.readbar.recent.watch;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.readbar.recent.ChangeEventAdapter;
import org.readbar.recent.ChangeKind;
import org.readbar.recent.ExtensionAllowList;
import org.readbar.recent.FileChange;
import org.readbar.recent.RecentSet;
import org.readbar.recent.TrackedItem;
import org.readbar.recent.WatchedRoot;
import org.readbar.recent.WatchedRoots;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class DirectoryChangeFeedTest {

    @TempDir
    Path root;

    private static FileChange awaitChange(BlockingQueue<FileChange> queue, Path path, ChangeKind kind) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(15);
        while (System.nanoTime() < deadline) {
            FileChange change = queue.poll(200, TimeUnit.MILLISECONDS);
            if (change != null && change.path().equals(path.toString()) && change.kind() == kind) {
                return change;
            }
        }
        return null;
    }

    @Test
    void deliversCreateAndDeleteAsBatches() throws Exception {
        BlockingQueue<FileChange> received = new LinkedBlockingQueue<>();
        try (DirectoryChangeFeed feed = new DirectoryChangeFeed(List.of(root), false, received::addAll, null)) {
            feed.start();
            assertThat(feed.isRunning()).isTrue();

            Path pdf = Files.writeString(root.resolve("new.pdf"), "x");
            assertThat(awaitChange(received, pdf, ChangeKind.CREATED)).isNotNull();

            Files.delete(pdf);
            assertThat(awaitChange(received, pdf, ChangeKind.REMOVED)).isNotNull();
        }
    }

    @Test
    void recursiveFeed_registersNewSubdirectories() throws Exception {
        BlockingQueue<FileChange> received = new LinkedBlockingQueue<>();
        try (DirectoryChangeFeed feed = new DirectoryChangeFeed(List.of(root), true, received::addAll, null)) {
            feed.start();

            Path sub = Files.createDirectory(root.resolve("sub"));
            // 子目录的 CREATED 送达时，监听线程已经完成了对它的注册
            assertThat(awaitChange(received, sub, ChangeKind.CREATED)).isNotNull();

            Path nested = Files.writeString(sub.resolve("nested.epub"), "x");
            assertThat(awaitChange(received, nested, ChangeKind.CREATED)).isNotNull();
        }
    }

    @Test
    void missingRoot_isSkipped() throws Exception {
        BlockingQueue<FileChange> received = new LinkedBlockingQueue<>();
        try (DirectoryChangeFeed feed = new DirectoryChangeFeed(
                List.of(root.resolve("missing"), root), false, received::addAll, null)) {
            feed.start();

            Path pdf = Files.writeString(root.resolve("still-watched.pdf"), "x");
            assertThat(awaitChange(received, pdf, ChangeKind.CREATED)).isNotNull();
        }
    }

    @Test
    void consumerFailure_doesNotStopTheLoop() throws Exception {
        BlockingQueue<FileChange> received = new LinkedBlockingQueue<>();
        boolean[] failedOnce = {false};
        try (DirectoryChangeFeed feed = new DirectoryChangeFeed(List.of(root), false, batch -> {
            if (!failedOnce[0]) {
                failedOnce[0] = true;
                throw new IllegalStateException("boom");
            }
            received.addAll(batch);
        }, null)) {
            feed.start();

            Files.writeString(root.resolve("first.pdf"), "x");
            Path second = root.resolve("second.pdf");
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(15);
            FileChange seen = null;
            while (seen == null && System.nanoTime() < deadline) {
                Files.writeString(second, "y" + System.nanoTime());
                seen = awaitChangeBriefly(received, second);
            }
            assertThat(seen).isNotNull();
        }
    }

    @Test
    void endToEnd_feedAdapterAndRecentSet() throws Exception {
        RecentSet set = new RecentSet(15);
        CountDownLatch added = new CountDownLatch(1);
        set.addListener(added::countDown);
        WatchedRoots roots = new WatchedRoots(List.of(new WatchedRoot("root0", root, false)));
        ChangeEventAdapter adapter = new ChangeEventAdapter(set, new ExtensionAllowList(List.of("pdf")), roots, 1_000);

        try (DirectoryChangeFeed feed = new DirectoryChangeFeed(roots.paths(), true, adapter::onChanges, null)) {
            feed.start();
            Files.writeString(root.resolve("ignored.txt"), "x");
            Path pdf = Files.writeString(root.resolve("paper.pdf"), "x");

            assertThat(added.await(15, TimeUnit.SECONDS)).isTrue();
            assertThat(set.snapshot()).extracting(TrackedItem::path).containsExactly(pdf);
        }
    }

    @Test
    void close_stopsTheFeed() throws Exception {
        DirectoryChangeFeed feed = new DirectoryChangeFeed(List.of(root), false, batch -> { }, null);
        feed.start();

        feed.close();

        assertThat(feed.isRunning()).isFalse();
    }

    private static FileChange awaitChangeBriefly(BlockingQueue<FileChange> queue, Path path) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(1);
        while (System.nanoTime() < deadline) {
            FileChange change = queue.poll(100, TimeUnit.MILLISECONDS);
            if (change != null && change.path().equals(path.toString())) {
                return change;
            }
        }
        return null;
    }
}
