package io.github.drompincen.devgateway.runtime.desktop;

import io.github.drompincen.devgateway.runtime.process.ProcessSpawnException;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

public class OsSubprocessLauncher implements SubprocessLauncher {

    @Override
    public boolean isInstalled(String executable) {
        if (executable.contains(File.separator)) {
            return Files.isExecutable(Path.of(executable));
        }
        String path = System.getenv("PATH");
        if (path == null) return false;
        for (String dir : path.split(File.pathSeparator)) {
            if (!dir.isEmpty() && Files.isExecutable(Path.of(dir, executable))) return true;
        }
        return false;
    }

    @Override
    public Process launch(List<String> command, Map<String, String> extraEnv) throws ProcessSpawnException {
        ProcessBuilder pb = new ProcessBuilder(command)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .redirectError(ProcessBuilder.Redirect.DISCARD);
        pb.environment().putAll(extraEnv);
        try {
            return pb.start();
        } catch (IOException e) {
            throw new ProcessSpawnException("Failed to launch " + command.get(0) + ": " + e.getMessage(), e);
        }
    }
}
