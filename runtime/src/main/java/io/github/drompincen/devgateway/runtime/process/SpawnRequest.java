package io.github.drompincen.devgateway.runtime.process;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

public record SpawnRequest(
        List<String> command,
        Path cwd,
        Map<String, String> environment,
        int cols,
        int rows
) {
    public SpawnRequest {
        command = List.copyOf(command);
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }
}
