package io.github.drompincen.devgateway.runtime.agent;

import io.github.drompincen.devgateway.protocol.event.ChatEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Runs the agent CLI in print mode with {@code --output-format stream-json} and turns each
 * NDJSON line on its stdout into chat events.
 */
public class ClaudeCliAgentRunner implements AgentRunner {

    private static final Logger log = LoggerFactory.getLogger(ClaudeCliAgentRunner.class);

    private static final int STDERR_TAIL_LINES = 20;

    private final String command;
    private final ObjectMapper objectMapper;

    public ClaudeCliAgentRunner(String command, ObjectMapper objectMapper) {
        this.command = command;
        this.objectMapper = objectMapper;
    }

    List<String> buildCommand(AgentRequest request) {
        List<String> cmd = new ArrayList<>(List.of(command, "-p", request.prompt(),
                "--output-format", "stream-json", "--verbose", "--include-partial-messages"));
        if (request.resumeToken() != null) {
            cmd.add("--resume");
            cmd.add(request.resumeToken());
        }
        if (request.model() != null && !request.model().isBlank()) {
            cmd.add("--model");
            cmd.add(request.model());
        }
        if (request.permissionMode() != null) {
            cmd.add("--permission-mode");
            cmd.add(request.permissionMode());
        }
        return cmd;
    }

    @Override
    public AgentRun start(AgentRequest request, CancellationToken cancellation) throws AgentRunnerException {
        List<String> cmd = buildCommand(request);
        ProcessBuilder pb = new ProcessBuilder(cmd)
                .directory(new File(request.cwd()))
                .redirectInput(ProcessBuilder.Redirect.from(new File("/dev/null")));
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new AgentRunnerException("Failed to start agent CLI '" + command + "': " + e.getMessage(), e);
        }
        log.info("Agent CLI started (pid {}) in {}{}", process.pid(), request.cwd(),
                request.resumeToken() != null ? ", resuming " + request.resumeToken() : "");
        CliAgentRun run = new CliAgentRun(process, cancellation, request.resumeToken());
        cancellation.onCancel(run::close);
        return run;
    }

    private final class CliAgentRun implements AgentRun {

        private final Process process;
        private final CancellationToken cancellation;
        private final BufferedReader stdout;
        private final Deque<String> stderrTail = new ArrayDeque<>();
        private final Deque<ChatEvent> pending = new ArrayDeque<>();
        private final StreamJsonEventMapper mapper = new StreamJsonEventMapper();
        private final String initialResumeToken;

        CliAgentRun(Process process, CancellationToken cancellation, String initialResumeToken) {
            this.process = process;
            this.cancellation = cancellation;
            this.initialResumeToken = initialResumeToken;
            this.stdout = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
            Thread drain = new Thread(this::drainStderr, "agent-stderr-" + process.pid());
            drain.setDaemon(true);
            drain.start();
        }

        private void drainStderr() {
            try (BufferedReader err = new BufferedReader(
                    new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = err.readLine()) != null) {
                    log.debug("agent stderr: {}", line);
                    synchronized (stderrTail) {
                        stderrTail.addLast(line);
                        if (stderrTail.size() > STDERR_TAIL_LINES) stderrTail.removeFirst();
                    }
                }
            } catch (IOException e) {
                log.debug("agent stderr closed: {}", e.getMessage());
            }
        }

        @Override
        public Optional<ChatEvent> next() throws AgentRunnerException {
            while (pending.isEmpty()) {
                if (cancellation.isCancelled()) return Optional.empty();
                String line;
                try {
                    line = stdout.readLine();
                } catch (IOException e) {
                    if (cancellation.isCancelled()) return Optional.empty();
                    throw new AgentRunnerException("Failed reading agent output: " + e.getMessage(), e);
                }
                if (line == null) {
                    checkExit();
                    return Optional.empty();
                }
                if (line.isBlank()) continue;
                try {
                    JsonNode msg = objectMapper.readTree(line);
                    pending.addAll(mapper.map(msg));
                } catch (JsonProcessingException e) {
                    log.debug("Skipping non-JSON agent output: {}", line);
                }
            }
            return Optional.of(pending.removeFirst());
        }

        private void checkExit() throws AgentRunnerException {
            int code;
            try {
                code = process.waitFor();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AgentRunnerException("Interrupted waiting for agent CLI", e);
            }
            if (code != 0 && !cancellation.isCancelled()) {
                String tail;
                synchronized (stderrTail) {
                    tail = String.join("\n", stderrTail);
                }
                throw new AgentRunnerException("Agent CLI exited with code " + code
                        + (tail.isEmpty() ? "" : ": " + tail));
            }
        }

        @Override
        public String resumeToken() {
            return mapper.sessionId() != null ? mapper.sessionId() : initialResumeToken;
        }

        @Override
        public void close() {
            if (process.isAlive()) {
                process.destroy();
            }
        }
    }
}
