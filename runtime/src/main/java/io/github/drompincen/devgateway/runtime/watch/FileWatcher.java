package io.github.drompincen.devgateway.runtime.watch;

import java.nio.file.Path;

public interface FileWatcher extends AutoCloseable {

    Path root();

    @Override
    void close();
}
