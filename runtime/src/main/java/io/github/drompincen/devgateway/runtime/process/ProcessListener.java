package io.github.drompincen.devgateway.runtime.process;

/**
 * Receives output and exit notifications from a spawned process. Callbacks arrive on the
 * driver's reader thread, in output order, and {@link #onExit} is always the last call.
 */
public interface ProcessListener {

    void onOutput(String data);

    void onExit(int exitCode);
}
