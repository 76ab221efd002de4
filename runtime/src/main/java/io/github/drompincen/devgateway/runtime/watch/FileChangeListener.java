package io.github.drompincen.devgateway.runtime.watch;

import io.github.drompincen.devgateway.protocol.api.FileChange;

@FunctionalInterface
public interface FileChangeListener {

    void onChange(FileChange change);
}
