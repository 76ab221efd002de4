package io.github.drompincen.devgateway.runtime.watch;

import io.github.drompincen.devgateway.protocol.api.FileChange;
import io.github.drompincen.devgateway.protocol.api.FileChangeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Recursive watcher over one root directory. {@link WatchService} only watches single
 * directories, so every non-ignored subdirectory gets its own key, and directories created
 * later are registered as their creation events arrive.
 */
public class WatchServiceFileWatcher implements FileWatcher {

    private static final Logger log = LoggerFactory.getLogger(WatchServiceFileWatcher.class);

    private final Path root;
    private final IgnoreRules ignoreRules;
    private final Debouncer<DebounceKey> debouncer;
    private final FileChangeListener listener;
    private final Map<WatchKey, Path> keys = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private WatchService watchService;
    private Thread watchThread;

    public WatchServiceFileWatcher(Path root, IgnoreRules ignoreRules, Debouncer<DebounceKey> debouncer,
                                   FileChangeListener listener) {
        this.root = root;
        this.ignoreRules = ignoreRules;
        this.debouncer = debouncer;
        this.listener = listener;
    }

    @Override
    public Path root() {
        return root;
    }

    public void start() throws IOException {
        if (!running.compareAndSet(false, true)) return;
        watchService = FileSystems.getDefault().newWatchService();
        try {
            registerTree(root);
        } catch (IOException e) {
            running.set(false);
            watchService.close();
            throw e;
        }
        watchThread = new Thread(this::loop, "file-watcher-" + root.getFileName());
        watchThread.setDaemon(true);
        watchThread.start();
        log.info("Watching {} ({} directories)", root, keys.size());
    }

    private void registerTree(Path dir) throws IOException {
        Files.walkFileTree(dir, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path d, BasicFileAttributes attrs) throws IOException {
                if (!d.equals(root) && ignoreRules.isIgnored(root.relativize(d))) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                WatchKey key = d.register(watchService, StandardWatchEventKinds.ENTRY_CREATE,
                        StandardWatchEventKinds.ENTRY_MODIFY, StandardWatchEventKinds.ENTRY_DELETE);
                keys.put(key, d);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                log.debug("Cannot watch {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private void loop() {
        while (running.get()) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ClosedWatchServiceException e) {
                break;
            }

            Path dir = keys.get(key);
            if (dir != null) {
                for (WatchEvent<?> event : key.pollEvents()) {
                    if (event.kind() == StandardWatchEventKinds.OVERFLOW) continue;
                    try {
                        handle(event.kind(), dir.resolve((Path) event.context()));
                    } catch (RuntimeException e) {
                        log.error("File watcher error under {}", root, e);
                    }
                }
            }
            if (!key.reset()) {
                keys.remove(key);
            }
        }
        log.debug("File watcher loop for {} stopped", root);
    }

    private void handle(WatchEvent.Kind<?> kind, Path child) {
        Path relative = root.relativize(child);
        if (ignoreRules.isIgnored(relative)) return;

        FileChangeType type;
        if (kind == StandardWatchEventKinds.ENTRY_CREATE) {
            if (Files.isDirectory(child)) {
                type = FileChangeType.ADD_DIR;
                try {
                    registerTree(child);
                } catch (IOException e) {
                    log.warn("Failed to watch new directory {}: {}", child, e.getMessage());
                }
            } else {
                type = FileChangeType.ADD;
            }
        } else if (kind == StandardWatchEventKinds.ENTRY_MODIFY) {
            if (Files.isDirectory(child)) return;
            type = FileChangeType.CHANGE;
        } else {
            type = keys.containsValue(child) ? FileChangeType.UNLINK_DIR : FileChangeType.UNLINK;
            keys.values().remove(child);
        }

        String relativePath = relative.toString().replace(File.separatorChar, '/');
        debouncer.submit(new DebounceKey(type, relativePath), () ->
                listener.onChange(new FileChange(type, relativePath, child.toString(), Instant.now())));
    }

    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) return;
        debouncer.cancelAll();
        try {
            watchService.close();
        } catch (IOException e) {
            log.warn("Error closing watch service for {}: {}", root, e.getMessage());
        }
        if (watchThread != null) {
            watchThread.interrupt();
        }
        log.info("Stopped watching {}", root);
    }
}
