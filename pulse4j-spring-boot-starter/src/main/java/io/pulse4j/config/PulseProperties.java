package io.pulse4j.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runtime configuration for the scheduler, the pipelines and the live-event hub.
 */
@Validated
@ConfigurationProperties(prefix = "pulse")
public class PulseProperties {
    private boolean enabled = true;
    @NotBlank
    private String timezone = "America/New_York";
    @Min(1)
    private int workerThreads = 4;
    @NotNull
    private Duration shutdownGracePeriod = Duration.ofSeconds(30);
    @Valid
    @NotNull
    private History history = new History();
    @Valid
    @NotNull
    private Hub hub = new Hub();
    @Valid
    private Map<String, JobOverride> jobs = new LinkedHashMap<>();
    @Valid
    private Map<String, Pipeline> pipelines = new LinkedHashMap<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public Duration getShutdownGracePeriod() {
        return shutdownGracePeriod;
    }

    public void setShutdownGracePeriod(Duration shutdownGracePeriod) {
        this.shutdownGracePeriod = shutdownGracePeriod;
    }

    public History getHistory() {
        return history;
    }

    public void setHistory(History history) {
        this.history = history;
    }

    public Hub getHub() {
        return hub;
    }

    public void setHub(Hub hub) {
        this.hub = hub;
    }

    public Map<String, JobOverride> getJobs() {
        return jobs;
    }

    public void setJobs(Map<String, JobOverride> jobs) {
        this.jobs = jobs;
    }

    public Map<String, Pipeline> getPipelines() {
        return pipelines;
    }

    public void setPipelines(Map<String, Pipeline> pipelines) {
        this.pipelines = pipelines;
    }

    public enum HistoryStore {
        MEMORY,
        MONGO
    }

    public static class History {
        @Min(1)
        private int limit = 50;
        @NotNull
        private HistoryStore store = HistoryStore.MEMORY;
        private boolean ensureIndexes = false;
        private Duration retention; // null keeps runs forever

        public int getLimit() {
            return limit;
        }

        public void setLimit(int limit) {
            this.limit = limit;
        }

        public HistoryStore getStore() {
            return store;
        }

        public void setStore(HistoryStore store) {
            this.store = store;
        }

        public boolean isEnsureIndexes() {
            return ensureIndexes;
        }

        public void setEnsureIndexes(boolean ensureIndexes) {
            this.ensureIndexes = ensureIndexes;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }
    }

    public static class Hub {
        @NotNull
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        @Min(1)
        private int heartbeatThreads = 1;
        @NotNull
        private Duration writeTimeout = Duration.ofSeconds(10);
        // 0 disables the servlet async timeout
        private Duration emitterTimeout = Duration.ZERO;
        private boolean publishJobRuns = false;

        public Duration getHeartbeatInterval() {
            return heartbeatInterval;
        }

        public void setHeartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
        }

        public int getHeartbeatThreads() {
            return heartbeatThreads;
        }

        public void setHeartbeatThreads(int heartbeatThreads) {
            this.heartbeatThreads = heartbeatThreads;
        }

        public Duration getWriteTimeout() {
            return writeTimeout;
        }

        public void setWriteTimeout(Duration writeTimeout) {
            this.writeTimeout = writeTimeout;
        }

        public Duration getEmitterTimeout() {
            return emitterTimeout;
        }

        public void setEmitterTimeout(Duration emitterTimeout) {
            this.emitterTimeout = emitterTimeout;
        }

        public boolean isPublishJobRuns() {
            return publishJobRuns;
        }

        public void setPublishJobRuns(boolean publishJobRuns) {
            this.publishJobRuns = publishJobRuns;
        }
    }

    /**
     * Per-job overrides applied when a {@link JobRegistration} of the same name is registered.
     */
    public static class JobOverride {
        private String cron;
        private String timezone;
        private Boolean enabled;

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }

        public String getTimezone() {
            return timezone;
        }

        public void setTimezone(String timezone) {
            this.timezone = timezone;
        }

        public Boolean getEnabled() {
            return enabled;
        }

        public void setEnabled(Boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class Pipeline {
        @NotBlank
        private String cron;
        private String timezone;
        private boolean enabled = true;
        private String source;
        @Valid
        @NotEmpty
        private List<Step> steps = new ArrayList<>();

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }

        public String getTimezone() {
            return timezone;
        }

        public void setTimezone(String timezone) {
            this.timezone = timezone;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getSource() {
            return source;
        }

        public void setSource(String source) {
            this.source = source;
        }

        public List<Step> getSteps() {
            return steps;
        }

        public void setSteps(List<Step> steps) {
            this.steps = steps;
        }
    }

    public static class Step {
        @NotBlank
        private String name;
        @NotBlank
        private String url;
        @NotNull
        private Duration timeout = Duration.ofMinutes(5);
        private Duration delayAfter = Duration.ZERO;
        private Map<String, Object> payload = new LinkedHashMap<>();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Duration getDelayAfter() {
            return delayAfter;
        }

        public void setDelayAfter(Duration delayAfter) {
            this.delayAfter = delayAfter;
        }

        public Map<String, Object> getPayload() {
            return payload;
        }

        public void setPayload(Map<String, Object> payload) {
            this.payload = payload;
        }
    }
}
