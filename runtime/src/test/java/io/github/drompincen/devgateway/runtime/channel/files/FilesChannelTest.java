package io.github.drompincen.devgateway.runtime.channel.files;

import io.github.drompincen.devgateway.protocol.api.FileChange;
import io.github.drompincen.devgateway.protocol.api.FileChangeType;
import io.github.drompincen.devgateway.protocol.ws.WsMessage;
import io.github.drompincen.devgateway.runtime.channel.ChannelManager;
import io.github.drompincen.devgateway.runtime.channel.RecordingConnection;
import io.github.drompincen.devgateway.runtime.channel.RoomRegistry;
import io.github.drompincen.devgateway.runtime.watch.FileChangeListener;
import io.github.drompincen.devgateway.runtime.watch.FileWatcher;
import io.github.drompincen.devgateway.runtime.watch.FileWatcherFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FilesChannelTest {

    @TempDir
    Path workspace;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final RecordingWatcherFactory factory = new RecordingWatcherFactory();
    private FilesChannel channel;
    private ChannelManager manager;
    private Path web;
    private Path api;

    @BeforeEach
    void setUp() throws Exception {
        web = Files.createDirectories(workspace.resolve("web"));
        api = Files.createDirectories(workspace.resolve("api"));
        channel = new FilesChannel(factory, workspace);
        manager = new ChannelManager(new RoomRegistry(), List.of(channel));
    }

    private RecordingConnection connect(String id) {
        RecordingConnection c = new RecordingConnection(id);
        manager.onConnect(c);
        return c;
    }

    private ObjectNode path(String p) {
        return objectMapper.createObjectNode().put("path", p);
    }

    @Test
    void subscribersOfTheSameRootShareOneWatcher() {
        RecordingConnection a = connect("a");
        RecordingConnection b = connect("b");

        manager.subscribe(a, FilesChannel.NAME, path("web"));
        manager.subscribe(b, FilesChannel.NAME, path("web"));

        assertThat(factory.watchers).hasSize(1);
        assertThat(channel.registration(web).get().refcount()).isEqualTo(2);
        assertThat(a.last("files:subscribed").data()).isEqualTo(Map.of("path", web.toAbsolutePath().normalize().toString()));
    }

    @Test
    void watcherClosesWhenTheLastHolderLeaves() {
        RecordingConnection a = connect("a");
        RecordingConnection b = connect("b");
        manager.subscribe(a, FilesChannel.NAME, path("web"));
        manager.subscribe(b, FilesChannel.NAME, path("web"));

        manager.unsubscribe(a, FilesChannel.NAME);
        assertThat(factory.watchers.get(0).closed).isFalse();

        manager.onDisconnect(b);
        assertThat(factory.watchers.get(0).closed).isTrue();
        assertThat(channel.watcherCount()).isZero();
    }

    @Test
    void changesReachOnlySubscribersOfThatRoot() {
        RecordingConnection a = connect("a");
        RecordingConnection b = connect("b");
        manager.subscribe(a, FilesChannel.NAME, path("web"));
        manager.subscribe(b, FilesChannel.NAME, path("api"));

        FileChange change = new FileChange(FileChangeType.CHANGE, "index.html",
                web.resolve("index.html").toString(), Instant.now());
        factory.watcherFor(web).listener.onChange(change);

        assertThat(a.last("files:change").data()).isEqualTo(change);
        assertThat(b.sent("files:change")).isEmpty();
    }

    @Test
    void switchingRootReleasesThePreviousWatcher() {
        RecordingConnection a = connect("a");
        manager.subscribe(a, FilesChannel.NAME, path("web"));

        manager.subscribe(a, FilesChannel.NAME, path("api"));

        assertThat(factory.watcherFor(web).closed).isTrue();
        assertThat(channel.registration(api)).isPresent();
        assertThat(channel.registration(web)).isEmpty();
    }

    @Test
    void resubscribingToTheSameRootKeepsOneHold() {
        RecordingConnection a = connect("a");
        manager.subscribe(a, FilesChannel.NAME, path("web"));
        manager.subscribe(a, FilesChannel.NAME, path("web"));

        assertThat(channel.registration(web).get().refcount()).isEqualTo(1);
        assertThat(factory.watchers).hasSize(1);
    }

    @Test
    void missingPathDefaultsToTheWorkspace() {
        RecordingConnection a = connect("a");

        manager.subscribe(a, FilesChannel.NAME, null);

        assertThat(factory.watchers.get(0).root).isEqualTo(workspace.toAbsolutePath().normalize());
    }

    @Test
    void nonDirectoryIsRejected() {
        RecordingConnection a = connect("a");

        manager.subscribe(a, FilesChannel.NAME, path("nope"));

        @SuppressWarnings("unchecked")
        Map<String, Object> error = (Map<String, Object>) a.last(WsMessage.ERROR).data();
        assertThat(error).containsEntry("code", "INVALID_REQUEST");
        assertThat(factory.watchers).isEmpty();
    }

    @Test
    void messagesAreUnsupported() {
        RecordingConnection a = connect("a");

        manager.dispatch(a, FilesChannel.NAME, "refresh", null);

        @SuppressWarnings("unchecked")
        Map<String, Object> error = (Map<String, Object>) a.last(WsMessage.ERROR).data();
        assertThat(error).containsEntry("code", "UNSUPPORTED_MESSAGE");
    }

    @Test
    void shutdownClosesEveryWatcher() {
        manager.subscribe(connect("a"), FilesChannel.NAME, path("web"));
        manager.subscribe(connect("b"), FilesChannel.NAME, path("api"));

        manager.shutdown();

        assertThat(factory.watchers).allMatch(w -> w.closed);
    }

    static class RecordingWatcherFactory implements FileWatcherFactory {
        final List<RecordingWatcher> watchers = new ArrayList<>();

        @Override
        public FileWatcher watch(Path root, FileChangeListener listener) {
            RecordingWatcher watcher = new RecordingWatcher(root, listener);
            watchers.add(watcher);
            return watcher;
        }

        RecordingWatcher watcherFor(Path root) {
            Path normalized = root.toAbsolutePath().normalize();
            return watchers.stream().filter(w -> w.root.equals(normalized)).findFirst().orElseThrow();
        }
    }

    static class RecordingWatcher implements FileWatcher {
        final Path root;
        final FileChangeListener listener;
        boolean closed;

        RecordingWatcher(Path root, FileChangeListener listener) {
            this.root = root;
            this.listener = listener;
        }

        @Override
        public Path root() {
            return root;
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
