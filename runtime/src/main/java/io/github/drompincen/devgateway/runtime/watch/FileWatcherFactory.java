package io.github.drompincen.devgateway.runtime.watch;

import java.io.IOException;
import java.nio.file.Path;

public interface FileWatcherFactory {

    /** Starts watching {@code root} recursively; debounced changes go to the listener. */
    FileWatcher watch(Path root, FileChangeListener listener) throws IOException;
}
