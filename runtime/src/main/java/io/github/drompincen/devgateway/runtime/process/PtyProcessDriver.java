package io.github.drompincen.devgateway.runtime.process;

import com.pty4j.PtyProcess;
import com.pty4j.PtyProcessBuilder;
import com.pty4j.WinSize;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Spawns shells on a pseudo-terminal through pty4j. Each process gets one daemon reader
 * thread that forwards output to the listener and reports the exit code once the stream closes.
 */
public class PtyProcessDriver implements ProcessDriver {

    private static final Logger log = LoggerFactory.getLogger(PtyProcessDriver.class);

    private static final int READ_BUFFER = 8192;

    @Override
    public TerminalProcess spawn(SpawnRequest request, ProcessListener listener) throws ProcessSpawnException {
        Map<String, String> env = new HashMap<>(System.getenv());
        env.put("TERM", "xterm-256color");
        env.putAll(request.environment());

        PtyProcess process;
        try {
            process = new PtyProcessBuilder(request.command().toArray(new String[0]))
                    .setDirectory(request.cwd().toString())
                    .setEnvironment(env)
                    .setInitialColumns(request.cols())
                    .setInitialRows(request.rows())
                    .start();
        } catch (IOException | RuntimeException e) {
            throw new ProcessSpawnException("Failed to spawn " + request.command() + ": " + e.getMessage(), e);
        }

        PtyTerminalProcess handle = new PtyTerminalProcess(process);
        Thread reader = new Thread(() -> pump(handle, listener), "pty-reader-" + handle.pid());
        reader.setDaemon(true);
        reader.start();
        log.info("Spawned pty process {} ({}) in {}", handle.pid(), request.command(), request.cwd());
        return handle;
    }

    private void pump(PtyTerminalProcess handle, ProcessListener listener) {
        char[] buf = new char[READ_BUFFER];
        try (Reader in = new InputStreamReader(handle.process.getInputStream(), StandardCharsets.UTF_8)) {
            int n;
            while ((n = in.read(buf)) != -1) {
                if (n > 0) listener.onOutput(new String(buf, 0, n));
            }
        } catch (IOException e) {
            // the pty reports EIO once the child side closes
            log.debug("pty {} output closed: {}", handle.pid(), e.getMessage());
        }

        int exitCode;
        try {
            exitCode = handle.process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            exitCode = -1;
        }
        log.info("pty process {} exited with {}", handle.pid(), exitCode);
        listener.onExit(exitCode);
    }

    private static final class PtyTerminalProcess implements TerminalProcess {

        private final PtyProcess process;
        private final OutputStream stdin;

        PtyTerminalProcess(PtyProcess process) {
            this.process = process;
            this.stdin = process.getOutputStream();
        }

        @Override
        public long pid() {
            try {
                return process.pid();
            } catch (UnsupportedOperationException e) {
                return -1;
            }
        }

        @Override
        public synchronized void write(String data) throws IOException {
            stdin.write(data.getBytes(StandardCharsets.UTF_8));
            stdin.flush();
        }

        @Override
        public void resize(int cols, int rows) {
            if (process.isAlive()) {
                process.setWinSize(new WinSize(cols, rows));
            }
        }

        @Override
        public void kill() {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }
    }
}
