package com.opsagent.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

@ConfigurationProperties(prefix = "dispatch")
public class DispatchProperties {

    private String endpointPath = "/ws/agent";
    private List<String> enabledSkills = new ArrayList<>();
    private DataSize maxMessageSize = DataSize.ofMegabytes(16);
    private ExecutorConfig executor = new ExecutorConfig();
    private FallbackConfig fallback = new FallbackConfig();
    private WorkerConfig worker = new WorkerConfig();

    public static class ExecutorConfig {
        private String binary = "codex";
        private String workspaceRoot;
        private String envPrefix = "CODEX_";
        private String mcpGatewayUrl;

        public String getBinary() { return binary; }
        public void setBinary(String binary) { this.binary = binary; }
        public String getWorkspaceRoot() { return workspaceRoot; }
        public void setWorkspaceRoot(String workspaceRoot) { this.workspaceRoot = workspaceRoot; }
        public String getEnvPrefix() { return envPrefix; }
        public void setEnvPrefix(String envPrefix) { this.envPrefix = envPrefix; }
        public String getMcpGatewayUrl() { return mcpGatewayUrl; }
        public void setMcpGatewayUrl(String mcpGatewayUrl) { this.mcpGatewayUrl = mcpGatewayUrl; }
    }

    public static class FallbackConfig {
        private Duration timeout = Duration.ofMinutes(60);

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    public static class WorkerConfig {
        private boolean enabled;
        private String orchestratorUrl = "ws://localhost:8080/ws/agent";
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        private Duration reconnectDelay = Duration.ofSeconds(5);
        private String sessionsFile = "data/worker-sessions.json";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getOrchestratorUrl() { return orchestratorUrl; }
        public void setOrchestratorUrl(String orchestratorUrl) { this.orchestratorUrl = orchestratorUrl; }
        public Duration getHeartbeatInterval() { return heartbeatInterval; }
        public void setHeartbeatInterval(Duration heartbeatInterval) { this.heartbeatInterval = heartbeatInterval; }
        public Duration getReconnectDelay() { return reconnectDelay; }
        public void setReconnectDelay(Duration reconnectDelay) { this.reconnectDelay = reconnectDelay; }
        public String getSessionsFile() { return sessionsFile; }
        public void setSessionsFile(String sessionsFile) { this.sessionsFile = sessionsFile; }
    }

    public String getEndpointPath() {
        return endpointPath;
    }

    public void setEndpointPath(String endpointPath) {
        this.endpointPath = endpointPath;
    }

    public DataSize getMaxMessageSize() {
        return maxMessageSize;
    }

    public void setMaxMessageSize(DataSize maxMessageSize) {
        this.maxMessageSize = maxMessageSize;
    }

    public List<String> getEnabledSkills() {
        return enabledSkills;
    }

    public void setEnabledSkills(List<String> enabledSkills) {
        if (enabledSkills == null) {
            return;
        }
        this.enabledSkills = new ArrayList<>(enabledSkills);
    }

    public ExecutorConfig getExecutor() {
        return executor;
    }

    public void setExecutor(ExecutorConfig executor) {
        this.executor = executor != null ? executor : new ExecutorConfig();
    }

    public FallbackConfig getFallback() {
        return fallback;
    }

    public void setFallback(FallbackConfig fallback) {
        this.fallback = fallback != null ? fallback : new FallbackConfig();
    }

    public WorkerConfig getWorker() {
        return worker;
    }

    public void setWorker(WorkerConfig worker) {
        this.worker = worker != null ? worker : new WorkerConfig();
    }
}
