package com.taskrelay.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings under {@code relay.*}.
 */
@ConfigurationProperties(prefix = "relay")
public class RelayProperties {

    private Dispatch dispatch = new Dispatch();
    private Workspace workspace = new Workspace();
    private Worker worker = new Worker();
    private Broadcast broadcast = new Broadcast();
    private Watchdog watchdog = new Watchdog();
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    public Dispatch getDispatch() { return dispatch; }
    public void setDispatch(Dispatch dispatch) { this.dispatch = dispatch; }
    public Workspace getWorkspace() { return workspace; }
    public void setWorkspace(Workspace workspace) { this.workspace = workspace; }
    public Worker getWorker() { return worker; }
    public void setWorker(Worker worker) { this.worker = worker; }
    public Broadcast getBroadcast() { return broadcast; }
    public void setBroadcast(Broadcast broadcast) { this.broadcast = broadcast; }
    public Watchdog getWatchdog() { return watchdog; }
    public void setWatchdog(Watchdog watchdog) { this.watchdog = watchdog; }
    public Duration getShutdownTimeout() { return shutdownTimeout; }
    public void setShutdownTimeout(Duration shutdownTimeout) { this.shutdownTimeout = shutdownTimeout; }

    public static class Dispatch {
        private boolean enabled = true;
        private Duration interval = Duration.ofSeconds(1);
        private int maxParallelAgents = 3;
        private int batchSize = 50;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
        public int getMaxParallelAgents() { return maxParallelAgents; }
        public void setMaxParallelAgents(int maxParallelAgents) { this.maxParallelAgents = maxParallelAgents; }
        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }
    }

    public static class Workspace {
        private Path repoPath = Path.of(".");
        // Blank means: ask git for the repository's default branch.
        private String baseBranch = "";
        private Path worktreesPath = Path.of(System.getProperty("user.home"), ".task-relay", "worktrees");
        private String gitExecutable = "git";

        public Path getRepoPath() { return repoPath; }
        public void setRepoPath(Path repoPath) { this.repoPath = repoPath; }
        public String getBaseBranch() { return baseBranch; }
        public void setBaseBranch(String baseBranch) { this.baseBranch = baseBranch; }
        public Path getWorktreesPath() { return worktreesPath; }
        public void setWorktreesPath(Path worktreesPath) { this.worktreesPath = worktreesPath; }
        public String getGitExecutable() { return gitExecutable; }
        public void setGitExecutable(String gitExecutable) { this.gitExecutable = gitExecutable; }
    }

    public static class Worker {
        private String executable = "claude";
        private List<String> extraArgs = new ArrayList<>(List.of("--dangerously-skip-permissions"));
        private String defaultModel = "claude-sonnet-4-5";
        private Map<String, Role> roles = new LinkedHashMap<>();
        private int supervisorThreads = 8;

        public String getExecutable() { return executable; }
        public void setExecutable(String executable) { this.executable = executable; }
        public List<String> getExtraArgs() { return extraArgs; }
        public void setExtraArgs(List<String> extraArgs) { this.extraArgs = extraArgs; }
        public String getDefaultModel() { return defaultModel; }
        public void setDefaultModel(String defaultModel) { this.defaultModel = defaultModel; }
        public Map<String, Role> getRoles() { return roles; }
        public void setRoles(Map<String, Role> roles) { this.roles = roles; }
        public int getSupervisorThreads() { return supervisorThreads; }
        public void setSupervisorThreads(int supervisorThreads) { this.supervisorThreads = supervisorThreads; }
    }

    public static class Role {
        private String model;

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
    }

    public static class Broadcast {
        private boolean enabled = true;
        private Duration interval = Duration.ofMillis(500);
        private int batchSize = 100;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }
    }

    public static class Watchdog {
        private boolean enabled = false;
        private Duration runTimeout = Duration.ofMinutes(60);
        private Duration checkInterval = Duration.ofSeconds(30);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getRunTimeout() { return runTimeout; }
        public void setRunTimeout(Duration runTimeout) { this.runTimeout = runTimeout; }
        public Duration getCheckInterval() { return checkInterval; }
        public void setCheckInterval(Duration checkInterval) { this.checkInterval = checkInterval; }
    }
}
