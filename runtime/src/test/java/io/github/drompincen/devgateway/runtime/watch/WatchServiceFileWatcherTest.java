package io.github.drompincen.devgateway.runtime.watch;

import io.github.drompincen.devgateway.protocol.api.FileChange;
import io.github.drompincen.devgateway.protocol.api.FileChangeType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class WatchServiceFileWatcherTest {

    @TempDir
    Path root;

    private ThreadPoolTaskScheduler scheduler;
    private FileWatcher watcher;
    private final List<FileChange> changes = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("watch-test-");
        scheduler.initialize();
    }

    @AfterEach
    void tearDown() {
        if (watcher != null) watcher.close();
        scheduler.shutdown();
    }

    private boolean awaitChange(FileChangeType type, String path) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(15).toNanos();
        while (System.nanoTime() < deadline) {
            if (changes.stream().anyMatch(c -> c.type() == type && c.path().equals(path))) return true;
            Thread.sleep(25);
        }
        return false;
    }

    @Test
    void reportsNewFilesWithRelativePaths() throws Exception {
        Files.createDirectories(root.resolve("node_modules"));
        Files.createDirectories(root.resolve("src"));
        watcher = new WatchServiceFileWatcherFactory(scheduler, Duration.ofMillis(50), IgnoreRules.defaults())
                .watch(root, changes::add);

        Files.writeString(root.resolve("node_modules/ignored.js"), "x");
        Files.writeString(root.resolve("src/App.java"), "class App {}");

        assertThat(awaitChange(FileChangeType.ADD, "src/App.java")).isTrue();
        assertThat(changes).noneMatch(c -> c.path().startsWith("node_modules"));
        assertThat(watcher.root()).isEqualTo(root);
    }

    @Test
    void directoriesCreatedLaterAreWatchedToo() throws Exception {
        watcher = new WatchServiceFileWatcherFactory(scheduler, Duration.ofMillis(50), IgnoreRules.defaults())
                .watch(root, changes::add);

        Files.createDirectories(root.resolve("pkg"));
        assertThat(awaitChange(FileChangeType.ADD_DIR, "pkg")).isTrue();

        Files.writeString(root.resolve("pkg/mod.txt"), "hello");
        assertThat(awaitChange(FileChangeType.ADD, "pkg/mod.txt")).isTrue();
    }
}
