package io.github.drompincen.devgateway.runtime.channel.files;

import io.github.drompincen.devgateway.runtime.watch.FileWatcher;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * One watcher per distinct root, shared by every connection watching that root. The refcount
 * is the number of distinct connections holding it.
 */
public class WatchRegistration {

    private final Path root;
    private final FileWatcher watcher;
    private final Set<String> holders = new HashSet<>();

    public WatchRegistration(Path root, FileWatcher watcher) {
        this.root = root;
        this.watcher = watcher;
    }

    public Path root() {
        return root;
    }

    public FileWatcher watcher() {
        return watcher;
    }

    boolean acquire(String connectionId) {
        return holders.add(connectionId);
    }

    /** @return true once no holder is left */
    boolean release(String connectionId) {
        holders.remove(connectionId);
        return holders.isEmpty();
    }

    public int refcount() {
        return holders.size();
    }
}
