package io.github.drompincen.devgateway.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.devgateway.persistence.store.ChatSessionRepository;
import io.github.drompincen.devgateway.persistence.store.JsonFileChatSessionRepository;
import io.github.drompincen.devgateway.persistence.transcript.AgentTranscriptReader;
import io.github.drompincen.devgateway.runtime.agent.AgentRunner;
import io.github.drompincen.devgateway.runtime.agent.ClaudeCliAgentRunner;
import io.github.drompincen.devgateway.runtime.channel.Channel;
import io.github.drompincen.devgateway.runtime.channel.ChannelManager;
import io.github.drompincen.devgateway.runtime.channel.RoomRegistry;
import io.github.drompincen.devgateway.runtime.channel.chat.ChatChannel;
import io.github.drompincen.devgateway.runtime.channel.chat.ChatSessionRegistry;
import io.github.drompincen.devgateway.runtime.channel.chat.ChatSettings;
import io.github.drompincen.devgateway.runtime.channel.files.FilesChannel;
import io.github.drompincen.devgateway.runtime.channel.terminal.TerminalChannel;
import io.github.drompincen.devgateway.runtime.channel.terminal.TerminalSettings;
import io.github.drompincen.devgateway.runtime.desktop.DesktopServerManager;
import io.github.drompincen.devgateway.runtime.desktop.DesktopSettings;
import io.github.drompincen.devgateway.runtime.desktop.OsSubprocessLauncher;
import io.github.drompincen.devgateway.runtime.process.ProcessDriver;
import io.github.drompincen.devgateway.runtime.process.PtyProcessDriver;
import io.github.drompincen.devgateway.runtime.watch.FileWatcherFactory;
import io.github.drompincen.devgateway.runtime.watch.IgnoreRules;
import io.github.drompincen.devgateway.runtime.watch.WatchServiceFileWatcherFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Wires the runtime channels from {@link GatewayProperties}. The runtime module carries no Spring
 * stereotypes, so every collaborator is declared here.
 */
@Configuration
public class ChannelConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    ChatSessionRepository chatSessionRepository(GatewayProperties props, ObjectMapper objectMapper) {
        GatewayProperties.Chat chat = props.getChat();
        return new JsonFileChatSessionRepository(chat.getStoreDir(), objectMapper, chat.getMaxStoredSessions());
    }

    @Bean
    AgentTranscriptReader agentTranscriptReader(GatewayProperties props, ObjectMapper objectMapper) {
        return new AgentTranscriptReader(props.getChat().getTranscriptsDir(), objectMapper);
    }

    @Bean
    AgentRunner agentRunner(GatewayProperties props, ObjectMapper objectMapper) {
        return new ClaudeCliAgentRunner(props.getChat().getAgentCommand(), objectMapper);
    }

    @Bean
    ProcessDriver processDriver() {
        return new PtyProcessDriver();
    }

    @Bean
    FileWatcherFactory fileWatcherFactory(GatewayProperties props, TaskScheduler taskScheduler) {
        GatewayProperties.Files files = props.getFiles();
        return new WatchServiceFileWatcherFactory(taskScheduler, files.getDebounce(), new IgnoreRules(files.getIgnored()));
    }

    @Bean
    ChatChannel chatChannel(GatewayProperties props, AgentRunner agentRunner, ChatSessionRepository repository,
                            AgentTranscriptReader transcripts, TaskScheduler taskScheduler,
                            ExecutorService agentExecutor, Clock clock) {
        GatewayProperties.Chat chat = props.getChat();
        ChatSettings settings = new ChatSettings(
                chat.getMaxBufferEvents(),
                chat.getPersistedEvents(),
                chat.getEvictionDelay(),
                chat.getDefaultCwd(),
                chat.getPermissionMode(),
                chat.getHistoryLimit(),
                chat.getModels());
        return new ChatChannel(settings, new ChatSessionRegistry(), agentRunner, repository, transcripts,
                taskScheduler, agentExecutor, clock);
    }

    @Bean
    TerminalChannel terminalChannel(GatewayProperties props, ProcessDriver processDriver,
                                    TaskScheduler taskScheduler, Clock clock) {
        GatewayProperties.Terminal t = props.getTerminal();
        TerminalSettings settings = new TerminalSettings(
                t.getMaxSessions(),
                t.getScrollbackChars(),
                t.getIdleTimeout(),
                t.getSweepInterval(),
                t.getShell(),
                t.getDefaultCwd(),
                t.getCols(),
                t.getRows());
        return new TerminalChannel(settings, processDriver, taskScheduler, clock);
    }

    @Bean
    FilesChannel filesChannel(GatewayProperties props, FileWatcherFactory fileWatcherFactory) {
        return new FilesChannel(fileWatcherFactory, props.getFiles().getRoot());
    }

    @Bean(destroyMethod = "shutdown")
    ChannelManager channelManager(List<Channel> channels) {
        return new ChannelManager(new RoomRegistry(), channels);
    }

    @Bean(destroyMethod = "shutdown")
    DesktopServerManager desktopServerManager(GatewayProperties props) {
        GatewayProperties.Desktop d = props.getDesktop();
        DesktopSettings settings = new DesktopSettings(
                d.getHost(),
                d.getPort(),
                d.getDisplay(),
                d.getGeometry(),
                d.getDepth(),
                d.getProbeTimeout(),
                d.getStartAttempts(),
                d.getPollInterval(),
                d.getServerCommand(),
                d.getSessionCommand());
        return new DesktopServerManager(settings, new OsSubprocessLauncher());
    }
}
