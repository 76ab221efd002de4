package io.github.drompincen.devgateway.runtime.process;

import java.io.IOException;

/**
 * Handle on one running pseudo-terminal process.
 */
public interface TerminalProcess {

    long pid();

    void write(String data) throws IOException;

    void resize(int cols, int rows);

    /** Kills the process. Safe to call more than once. */
    void kill();

    boolean isAlive();
}
