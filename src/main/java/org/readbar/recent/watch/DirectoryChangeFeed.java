package org.readbar.recent.watch;

import org.readbar.recent.ChangeKind;
import org.readbar.recent.FileChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

/**
 * 基于 {@link WatchService} 的目录变更通知源。
 * <p>
 * 工作方式：
 * <ul>
 *   <li>启动时注册所有存在的根目录（可选递归注册子目录）；不存在的根目录记录告警后跳过。</li>
 *   <li>后台线程 {@code readbar-watch} 阻塞等待 {@link WatchKey}，同一次 poll 到的事件组成一个批次交给消费者。</li>
 *   <li>{@code OVERFLOW} 表示有通知丢失，会调用溢出回调（通常是排队一次全量扫描）。</li>
 *   <li>消费者抛出的异常只记录日志，不会终止监听线程。</li>
 * </ul>
 */
public class DirectoryChangeFeed implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DirectoryChangeFeed.class);

    private final List<Path> roots;
    private final boolean recursive;
    private final Consumer<List<FileChange>> consumer;
    private final Runnable overflowHandler;
    private final Map<WatchKey, Path> keyToDir = new ConcurrentHashMap<>();
    private final ExecutorService loop = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "readbar-watch");
        t.setDaemon(true);
        return t;
    });
    private WatchService watchService;
    private volatile boolean running;

    public DirectoryChangeFeed(List<Path> roots, boolean recursive, Consumer<List<FileChange>> consumer, Runnable overflowHandler) {
        this.roots = List.copyOf(roots);
        this.recursive = recursive;
        this.consumer = Objects.requireNonNull(consumer, "consumer 不能为空");
        this.overflowHandler = (overflowHandler == null) ? () -> { } : overflowHandler;
    }

    public synchronized void start() throws IOException {
        if (running) {
            return;
        }
        watchService = FileSystems.getDefault().newWatchService();
        running = true;
        for (Path root : roots) {
            if (!Files.isDirectory(root)) {
                log.warn("监听根目录不存在或不是目录，跳过：{}", root);
                continue;
            }
            if (recursive) {
                registerTree(root);
            } else {
                registerDir(root);
            }
        }
        log.info("开始监听 {} 个目录", keyToDir.size());
        loop.submit(this::runLoop);
    }

    public boolean isRunning() {
        return running;
    }

    private void runLoop() {
        while (running) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ClosedWatchServiceException e) {
                break;
            }

            Path dir = keyToDir.get(key);
            if (dir == null) {
                key.reset();
                continue;
            }

            List<FileChange> batch = new ArrayList<>();
            boolean overflow = false;
            for (WatchEvent<?> event : key.pollEvents()) {
                WatchEvent.Kind<?> kind = event.kind();
                if (kind == OVERFLOW) {
                    overflow = true;
                    continue;
                }
                Path child = dir.resolve((Path) event.context());
                if (kind == ENTRY_CREATE && recursive && Files.isDirectory(child)) {
                    registerTree(child);
                }
                batch.add(new FileChange(child.toString(), toChangeKind(kind)));
            }

            if (!key.reset()) {
                keyToDir.remove(key);
                log.info("目录已不可监听（可能被删除）：{}", dir);
            }

            if (!batch.isEmpty()) {
                deliver(batch);
            }
            if (overflow) {
                log.warn("目录 {} 的变更通知溢出，部分事件已丢失", dir);
                runOverflowHandler();
            }
        }
        log.debug("监听线程退出");
    }

    private void deliver(List<FileChange> batch) {
        try {
            consumer.accept(List.copyOf(batch));
        } catch (RuntimeException e) {
            log.warn("处理变更通知失败（{} 条）", batch.size(), e);
        }
    }

    private void runOverflowHandler() {
        try {
            overflowHandler.run();
        } catch (RuntimeException e) {
            log.warn("处理通知溢出失败", e);
        }
    }

    private static ChangeKind toChangeKind(WatchEvent.Kind<?> kind) {
        if (kind == ENTRY_CREATE) {
            return ChangeKind.CREATED;
        }
        if (kind == ENTRY_DELETE) {
            return ChangeKind.REMOVED;
        }
        return ChangeKind.MODIFIED;
    }

    private void registerTree(Path start) {
        try {
            Files.walkFileTree(start, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    registerDir(dir);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.debug("无法访问，跳过：{}（{}）", file, exc.toString());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warn("递归注册监听目录失败：{}（{}）", start, e.toString());
        }
    }

    private void registerDir(Path dir) {
        try {
            WatchKey key = dir.register(watchService, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);
            keyToDir.put(key, dir);
        } catch (IOException | ClosedWatchServiceException e) {
            log.warn("注册监听目录失败：{}（{}）", dir, e.toString());
        }
    }

    @Override
    public synchronized void close() {
        if (!running) {
            loop.shutdownNow();
            return;
        }
        running = false;
        try {
            watchService.close();
        } catch (IOException e) {
            log.warn("关闭 WatchService 失败", e);
        }
        loop.shutdownNow();
        keyToDir.clear();
        log.info("目录监听已停止");
    }
}
