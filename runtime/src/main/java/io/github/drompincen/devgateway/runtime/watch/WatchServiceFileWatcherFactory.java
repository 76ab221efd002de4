package io.github.drompincen.devgateway.runtime.watch;

import org.springframework.scheduling.TaskScheduler;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

public class WatchServiceFileWatcherFactory implements FileWatcherFactory {

    private final TaskScheduler scheduler;
    private final Duration debounce;
    private final IgnoreRules ignoreRules;

    public WatchServiceFileWatcherFactory(TaskScheduler scheduler, Duration debounce, IgnoreRules ignoreRules) {
        this.scheduler = scheduler;
        this.debounce = debounce;
        this.ignoreRules = ignoreRules;
    }

    @Override
    public FileWatcher watch(Path root, FileChangeListener listener) throws IOException {
        WatchServiceFileWatcher watcher = new WatchServiceFileWatcher(
                root, ignoreRules, new Debouncer<>(scheduler, debounce), listener);
        watcher.start();
        return watcher;
    }
}
