package io.github.drompincen.devgateway.runtime.channel.files;

import io.github.drompincen.devgateway.protocol.ws.WsMessage;
import io.github.drompincen.devgateway.runtime.channel.Channel;
import io.github.drompincen.devgateway.runtime.channel.ChannelContext;
import io.github.drompincen.devgateway.runtime.channel.ChannelException;
import io.github.drompincen.devgateway.runtime.channel.Connection;
import io.github.drompincen.devgateway.runtime.channel.ErrorCode;
import io.github.drompincen.devgateway.runtime.watch.FileWatcher;
import io.github.drompincen.devgateway.runtime.watch.FileWatcherFactory;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Filesystem change notifications for a root directory. Present tense only: nothing is
 * buffered for connections that subscribe later.
 */
public class FilesChannel implements Channel {

    private static final Logger log = LoggerFactory.getLogger(FilesChannel.class);

    public static final String NAME = "files";

    private final FileWatcherFactory watcherFactory;
    private final Path defaultRoot;
    private final Map<Path, WatchRegistration> registrations = new HashMap<>();
    /** connection id -> root it watches */
    private final Map<String, Path> watching = new HashMap<>();

    private ChannelContext context;

    public FilesChannel(FileWatcherFactory watcherFactory, Path defaultRoot) {
        this.watcherFactory = watcherFactory;
        this.defaultRoot = defaultRoot;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void onRegister(ChannelContext context) {
        this.context = context;
    }

    @Override
    public String roomFor(JsonNode params) {
        return roomOf(resolve(params));
    }

    static String roomOf(Path root) {
        return NAME + ":" + root;
    }

    Path resolve(JsonNode params) {
        String path = params != null && params.hasNonNull("path") ? params.get("path").asText() : null;
        Path root = path == null || path.isBlank() ? defaultRoot : defaultRoot.resolve(path);
        return root.toAbsolutePath().normalize();
    }

    @Override
    public boolean supportsMessages() {
        return false;
    }

    @Override
    public synchronized void onSubscribe(Connection connection, String room, JsonNode params) {
        Path root = resolve(params);
        if (!Files.isDirectory(root)) {
            throw ChannelException.invalidRequest("Not a directory: " + root);
        }

        Path previous = watching.get(connection.id());
        if (previous != null && !previous.equals(root)) {
            release(connection, previous);
        }

        WatchRegistration registration = registrations.get(root);
        if (registration == null) {
            FileWatcher watcher;
            try {
                watcher = watcherFactory.watch(root, change ->
                        context.broadcast(roomOf(root), WsMessage.of("files:change", change)));
            } catch (IOException e) {
                throw new ChannelException(ErrorCode.INVALID_REQUEST, "Cannot watch " + root + ": " + e.getMessage(),
                        null, e);
            }
            registration = new WatchRegistration(root, watcher);
            registrations.put(root, registration);
            log.info("Started watcher for {}", root);
        }
        registration.acquire(connection.id());
        watching.put(connection.id(), root);
        context.join(room, connection);
        connection.send(WsMessage.of("files:subscribed", Map.of("path", root.toString())));
    }

    @Override
    public synchronized void onUnsubscribe(Connection connection, String room) {
        Path root = watching.get(connection.id());
        if (root != null) release(connection, root);
    }

    @Override
    public synchronized void onDisconnect(Connection connection) {
        Path root = watching.get(connection.id());
        if (root != null) release(connection, root);
    }

    private void release(Connection connection, Path root) {
        watching.remove(connection.id());
        context.leave(roomOf(root), connection);
        WatchRegistration registration = registrations.get(root);
        if (registration != null && registration.release(connection.id())) {
            registrations.remove(root);
            registration.watcher().close();
            log.info("Closed watcher for {}", root);
        }
    }

    public synchronized Optional<WatchRegistration> registration(Path root) {
        return Optional.ofNullable(registrations.get(root.toAbsolutePath().normalize()));
    }

    public synchronized int watcherCount() {
        return registrations.size();
    }

    @Override
    public synchronized void onShutdown() {
        registrations.values().forEach(r -> r.watcher().close());
        log.info("Closed {} file watchers on shutdown", registrations.size());
        registrations.clear();
        watching.clear();
    }
}
