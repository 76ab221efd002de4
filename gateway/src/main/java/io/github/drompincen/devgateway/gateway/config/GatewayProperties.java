package io.github.drompincen.devgateway.gateway.config;

import io.github.drompincen.devgateway.protocol.api.ModelOption;
import io.github.drompincen.devgateway.runtime.watch.IgnoreRules;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    private static final String USER_HOME = System.getProperty("user.home", ".");

    private final Auth auth = new Auth();
    private final Chat chat = new Chat();
    private final Terminal terminal = new Terminal();
    private final Files files = new Files();
    private final Desktop desktop = new Desktop();
    private final DevServer devServer = new DevServer();

    public Auth getAuth() { return auth; }
    public Chat getChat() { return chat; }
    public Terminal getTerminal() { return terminal; }
    public Files getFiles() { return files; }
    public Desktop getDesktop() { return desktop; }
    public DevServer getDevServer() { return devServer; }

    public static class Auth {
        /** Shared secret; empty disables authentication. */
        private String secret = "";
        private String cookieName = "gateway_auth";
        /** Query parameter accepted on WebSocket upgrades, where browsers cannot set headers. */
        private String queryParam = "token";

        public String getSecret() { return secret; }
        public void setSecret(String secret) { this.secret = secret; }
        public String getCookieName() { return cookieName; }
        public void setCookieName(String cookieName) { this.cookieName = cookieName; }
        public String getQueryParam() { return queryParam; }
        public void setQueryParam(String queryParam) { this.queryParam = queryParam; }
    }

    public static class Chat {
        private int maxBufferEvents = 5000;
        private int persistedEvents = 100;
        private int maxStoredSessions = 200;
        private Duration evictionDelay = Duration.ofMinutes(30);
        private Path storeDir = Path.of(USER_HOME, ".devgateway");
        private String agentCommand = "claude";
        private String defaultCwd = USER_HOME;
        private String permissionMode = "bypassPermissions";
        private Path transcriptsDir = Path.of(USER_HOME, ".claude", "projects");
        private int historyLimit = 30;
        private List<ModelOption> models = new ArrayList<>(List.of(
                new ModelOption("claude-sonnet-4-20250514", "Claude Sonnet 4", "Best balance of speed and intelligence"),
                new ModelOption("claude-opus-4-20250514", "Claude Opus 4", "Most capable model"),
                new ModelOption("claude-haiku-3-5-20250414", "Claude Haiku 3.5", "Fastest model")));

        public int getMaxBufferEvents() { return maxBufferEvents; }
        public void setMaxBufferEvents(int maxBufferEvents) { this.maxBufferEvents = maxBufferEvents; }
        public int getPersistedEvents() { return persistedEvents; }
        public void setPersistedEvents(int persistedEvents) { this.persistedEvents = persistedEvents; }
        public int getMaxStoredSessions() { return maxStoredSessions; }
        public void setMaxStoredSessions(int maxStoredSessions) { this.maxStoredSessions = maxStoredSessions; }
        public Duration getEvictionDelay() { return evictionDelay; }
        public void setEvictionDelay(Duration evictionDelay) { this.evictionDelay = evictionDelay; }
        public Path getStoreDir() { return storeDir; }
        public void setStoreDir(Path storeDir) { this.storeDir = storeDir; }
        public String getAgentCommand() { return agentCommand; }
        public void setAgentCommand(String agentCommand) { this.agentCommand = agentCommand; }
        public String getDefaultCwd() { return defaultCwd; }
        public void setDefaultCwd(String defaultCwd) { this.defaultCwd = defaultCwd; }
        public String getPermissionMode() { return permissionMode; }
        public void setPermissionMode(String permissionMode) { this.permissionMode = permissionMode; }
        public Path getTranscriptsDir() { return transcriptsDir; }
        public void setTranscriptsDir(Path transcriptsDir) { this.transcriptsDir = transcriptsDir; }
        public int getHistoryLimit() { return historyLimit; }
        public void setHistoryLimit(int historyLimit) { this.historyLimit = historyLimit; }
        public List<ModelOption> getModels() { return models; }
        public void setModels(List<ModelOption> models) { this.models = models; }
    }

    public static class Terminal {
        private int maxSessions = 10;
        private int scrollbackChars = 100 * 1024;
        private Duration idleTimeout = Duration.ofHours(1);
        private Duration sweepInterval = Duration.ofMinutes(1);
        private String shell = System.getenv().getOrDefault("SHELL", "/bin/bash");
        private String defaultCwd = USER_HOME;
        private int cols = 120;
        private int rows = 30;

        public int getMaxSessions() { return maxSessions; }
        public void setMaxSessions(int maxSessions) { this.maxSessions = maxSessions; }
        public int getScrollbackChars() { return scrollbackChars; }
        public void setScrollbackChars(int scrollbackChars) { this.scrollbackChars = scrollbackChars; }
        public Duration getIdleTimeout() { return idleTimeout; }
        public void setIdleTimeout(Duration idleTimeout) { this.idleTimeout = idleTimeout; }
        public Duration getSweepInterval() { return sweepInterval; }
        public void setSweepInterval(Duration sweepInterval) { this.sweepInterval = sweepInterval; }
        public String getShell() { return shell; }
        public void setShell(String shell) { this.shell = shell; }
        public String getDefaultCwd() { return defaultCwd; }
        public void setDefaultCwd(String defaultCwd) { this.defaultCwd = defaultCwd; }
        public int getCols() { return cols; }
        public void setCols(int cols) { this.cols = cols; }
        public int getRows() { return rows; }
        public void setRows(int rows) { this.rows = rows; }
    }

    public static class Files {
        private Path root = Path.of(USER_HOME);
        private Duration debounce = Duration.ofMillis(50);
        private List<String> ignored = new ArrayList<>(IgnoreRules.DEFAULT_DIRECTORIES);

        public Path getRoot() { return root; }
        public void setRoot(Path root) { this.root = root; }
        public Duration getDebounce() { return debounce; }
        public void setDebounce(Duration debounce) { this.debounce = debounce; }
        public List<String> getIgnored() { return ignored; }
        public void setIgnored(List<String> ignored) { this.ignored = ignored; }
    }

    public static class Desktop {
        private String host = "127.0.0.1";
        private int port = 5999;
        private String display = ":99";
        private String geometry = "1280x720";
        private int depth = 24;
        private Duration probeTimeout = Duration.ofSeconds(1);
        private int startAttempts = 30;
        private Duration pollInterval = Duration.ofMillis(500);
        private String serverCommand = "Xvnc";
        private Path sessionCommand = Path.of(USER_HOME, ".vnc", "xstartup");

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }
        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }
        public String getDisplay() { return display; }
        public void setDisplay(String display) { this.display = display; }
        public String getGeometry() { return geometry; }
        public void setGeometry(String geometry) { this.geometry = geometry; }
        public int getDepth() { return depth; }
        public void setDepth(int depth) { this.depth = depth; }
        public Duration getProbeTimeout() { return probeTimeout; }
        public void setProbeTimeout(Duration probeTimeout) { this.probeTimeout = probeTimeout; }
        public int getStartAttempts() { return startAttempts; }
        public void setStartAttempts(int startAttempts) { this.startAttempts = startAttempts; }
        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
        public String getServerCommand() { return serverCommand; }
        public void setServerCommand(String serverCommand) { this.serverCommand = serverCommand; }
        public Path getSessionCommand() { return sessionCommand; }
        public void setSessionCommand(Path sessionCommand) { this.sessionCommand = sessionCommand; }
    }

    public static class DevServer {
        private String host = "127.0.0.1";
        private int port = 3000;
        private String path = "/_next/webpack-hmr";

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }
        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }
        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
    }
}
