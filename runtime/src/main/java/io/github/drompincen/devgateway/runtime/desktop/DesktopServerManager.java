package io.github.drompincen.devgateway.runtime.desktop;

import io.github.drompincen.devgateway.protocol.api.DesktopStatus;
import io.github.drompincen.devgateway.runtime.process.ProcessSpawnException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Best-effort bootstrap of the local VNC display server the desktop tunnel dials. The gateway
 * only probes the port and, on request, launches the server and its desktop session.
 */
public class DesktopServerManager {

    private static final Logger log = LoggerFactory.getLogger(DesktopServerManager.class);

    static final String SESSION_SCRIPT = """
            #!/bin/bash
            unset SESSION_MANAGER
            unset DBUS_SESSION_BUS_ADDRESS
            if command -v startxfce4 &> /dev/null; then
              exec startxfce4
            elif command -v xterm &> /dev/null; then
              exec xterm
            else
              sleep infinity
            fi
            """;

    private final DesktopSettings settings;
    private final SubprocessLauncher launcher;
    private final AtomicBoolean starting = new AtomicBoolean(false);
    private volatile Process serverProcess;
    private volatile Process sessionProcess;

    public DesktopServerManager(DesktopSettings settings, SubprocessLauncher launcher) {
        this.settings = settings;
        this.launcher = launcher;
    }

    public boolean probe() {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(settings.host(), settings.port()),
                    (int) settings.probeTimeout().toMillis());
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    public DesktopStatus status() {
        boolean running = probe();
        return new DesktopStatus(running, running ? "Desktop server is running" : "Desktop server is not running",
                settings.port(), settings.display());
    }

    public DesktopStatus ensureRunning() {
        if (!starting.compareAndSet(false, true)) {
            return DesktopStatus.of(false, "Desktop server is already starting");
        }
        try {
            if (probe()) {
                return DesktopStatus.of(true, "Desktop server is already running");
            }
            if (!launcher.isInstalled(settings.serverCommand())) {
                log.warn("Desktop server command '{}' not found on PATH", settings.serverCommand());
                return DesktopStatus.of(false, settings.serverCommand() + " is not installed");
            }
            writeSessionScript();
            launchServer();

            for (int attempt = 0; attempt < settings.startAttempts(); attempt++) {
                Thread.sleep(settings.pollInterval().toMillis());
                if (attempt == 0) launchSession();
                if (probe()) {
                    log.info("Desktop server is up on port {}", settings.port());
                    return DesktopStatus.of(true, "Desktop server started");
                }
            }
            log.warn("Desktop server did not open port {} after {} attempts", settings.port(), settings.startAttempts());
            return DesktopStatus.of(false, "Desktop server start timed out");
        } catch (ProcessSpawnException | IOException e) {
            log.error("Failed to start desktop server", e);
            return DesktopStatus.of(false, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DesktopStatus.of(false, "Interrupted while starting desktop server");
        } finally {
            starting.set(false);
        }
    }

    List<String> serverCommand() {
        List<String> cmd = new ArrayList<>();
        cmd.add(settings.serverCommand());
        cmd.add(settings.display());
        cmd.addAll(List.of("-rfbport", String.valueOf(settings.port()),
                "-SecurityTypes", "None",
                "-AlwaysShared",
                "-AcceptSetDesktopSize",
                "-localhost",
                "-geometry", settings.geometry(),
                "-depth", String.valueOf(settings.depth())));
        return cmd;
    }

    private void launchServer() throws ProcessSpawnException {
        Process previous = serverProcess;
        if (previous != null && previous.isAlive()) {
            previous.destroy();
        }
        log.info("Starting desktop server on display {} (port {})", settings.display(), settings.port());
        serverProcess = launcher.launch(serverCommand(), Map.of());
    }

    private void launchSession() {
        try {
            sessionProcess = launcher.launch(List.of("bash", settings.sessionScript().toString()),
                    Map.of("DISPLAY", settings.display()));
        } catch (ProcessSpawnException e) {
            log.warn("Desktop session script failed to start: {}", e.getMessage());
        }
    }

    private void writeSessionScript() throws IOException {
        Path script = settings.sessionScript();
        if (Files.exists(script)) return;
        Files.createDirectories(script.getParent());
        Files.writeString(script, SESSION_SCRIPT);
        try {
            Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
        } catch (UnsupportedOperationException e) {
            log.debug("Cannot mark {} executable on this filesystem", script);
        }
    }

    public void shutdown() {
        Process session = sessionProcess;
        if (session != null && session.isAlive()) session.destroy();
        Process server = serverProcess;
        if (server != null && server.isAlive()) {
            log.info("Stopping desktop server");
            server.destroy();
        }
    }
}
