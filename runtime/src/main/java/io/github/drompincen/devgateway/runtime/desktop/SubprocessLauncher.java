package io.github.drompincen.devgateway.runtime.desktop;

import io.github.drompincen.devgateway.runtime.process.ProcessSpawnException;

import java.util.List;
import java.util.Map;

/**
 * Starts detached helper processes (display server, desktop session).
 */
public interface SubprocessLauncher {

    boolean isInstalled(String executable);

    Process launch(List<String> command, Map<String, String> extraEnv) throws ProcessSpawnException;
}
