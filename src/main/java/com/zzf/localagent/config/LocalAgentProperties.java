package com.zzf.localagent.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "localagent")
public class LocalAgentProperties {
    /** Repository opened at startup; blank leaves the context uninitialised until init is called. */
    private String repoRoot = "";
    private String sessionId = "default";
    /** Directory under the repository root holding all agent state. */
    private String stateDir = ".agent";
    /** Task records location; defaults to {@code <repoRoot or user.dir>/<stateDir>/tasks}. */
    private String tasksDir = "";
    private final Snapshot snapshot = new Snapshot();
    private final Worker worker = new Worker();
    private final PlanGenerator planGenerator = new PlanGenerator();

    public String getRepoRoot() {
        return repoRoot;
    }

    public void setRepoRoot(String repoRoot) {
        this.repoRoot = repoRoot;
    }

    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    public String getStateDir() {
        return stateDir;
    }

    public void setStateDir(String stateDir) {
        this.stateDir = stateDir;
    }

    public String getTasksDir() {
        return tasksDir;
    }

    public void setTasksDir(String tasksDir) {
        this.tasksDir = tasksDir;
    }

    public Snapshot getSnapshot() {
        return snapshot;
    }

    public Worker getWorker() {
        return worker;
    }

    public PlanGenerator getPlanGenerator() {
        return planGenerator;
    }

    public static class Snapshot {
        private int maxSnapshots = 3;
        private long maxFileBytes = 10_000_000L;

        public int getMaxSnapshots() {
            return maxSnapshots;
        }

        public void setMaxSnapshots(int maxSnapshots) {
            this.maxSnapshots = maxSnapshots;
        }

        public long getMaxFileBytes() {
            return maxFileBytes;
        }

        public void setMaxFileBytes(long maxFileBytes) {
            this.maxFileBytes = maxFileBytes;
        }
    }

    public static class Worker {
        private boolean autostart = true;
        private Duration pollInterval = Duration.ofSeconds(1);

        public boolean isAutostart() {
            return autostart;
        }

        public void setAutostart(boolean autostart) {
            this.autostart = autostart;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }
    }

    public static class PlanGenerator {
        private boolean enabled = false;
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey = "";
        private String modelName = "gpt-4o-mini";
        private Duration timeout = Duration.ofSeconds(60);
        private int maxSteps = 8;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModelName() {
            return modelName;
        }

        public void setModelName(String modelName) {
            this.modelName = modelName;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getMaxSteps() {
            return maxSteps;
        }

        public void setMaxSteps(int maxSteps) {
            this.maxSteps = maxSteps;
        }
    }
}
