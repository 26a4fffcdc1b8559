package docbuild.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for docbuild.
 *
 * @see DocBuildAutoConfiguration
 */
@ConfigurationProperties(prefix = "docbuild")
public class DocBuildProperties {

    /**
     * Deployment topology: combined, watcher or build-server.
     */
    private Mode mode = Mode.COMBINED;

    /**
     * Registry-of-origin tag stored on queue entries; empty for the default registry.
     */
    private String registry;

    private final Sync sync = new Sync();
    private final Workers workers = new Workers();
    private final Queue queue = new Queue();
    private final Retry retry = new Retry();
    private final Sandbox sandbox = new Sandbox();
    private final Reaper reaper = new Reaper();
    private final Rebuilds rebuilds = new Rebuilds();
    private final Webhook webhook = new Webhook();
    private final Metrics metrics = new Metrics();

    public Mode getMode() {
        return mode;
    }

    public void setMode(Mode mode) {
        this.mode = mode;
    }

    public String getRegistry() {
        return registry;
    }

    public void setRegistry(String registry) {
        this.registry = registry;
    }

    public Sync getSync() {
        return sync;
    }

    public Workers getWorkers() {
        return workers;
    }

    public Queue getQueue() {
        return queue;
    }

    public Retry getRetry() {
        return retry;
    }

    public Sandbox getSandbox() {
        return sandbox;
    }

    public Reaper getReaper() {
        return reaper;
    }

    public Rebuilds getRebuilds() {
        return rebuilds;
    }

    public Webhook getWebhook() {
        return webhook;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public enum Mode {
        COMBINED,
        WATCHER,
        BUILD_SERVER
    }

    public static class Sync {
        private long intervalMs = 60_000;
        private Duration lockTimeout = Duration.ofMinutes(10);
        private int batchSize = 200;
        private String checkpointName = "registry";

        /**
         * Local clone of the git package index. Enables the git-backed registry index.
         */
        private String indexDirectory;
        private String ref = "HEAD";
        private boolean fetch;
        private String remote = "origin";

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public Duration getLockTimeout() {
            return lockTimeout;
        }

        public void setLockTimeout(Duration lockTimeout) {
            this.lockTimeout = lockTimeout;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public String getCheckpointName() {
            return checkpointName;
        }

        public void setCheckpointName(String checkpointName) {
            this.checkpointName = checkpointName;
        }

        public String getIndexDirectory() {
            return indexDirectory;
        }

        public void setIndexDirectory(String indexDirectory) {
            this.indexDirectory = indexDirectory;
        }

        public String getRef() {
            return ref;
        }

        public void setRef(String ref) {
            this.ref = ref;
        }

        public boolean isFetch() {
            return fetch;
        }

        public void setFetch(boolean fetch) {
            this.fetch = fetch;
        }

        public String getRemote() {
            return remote;
        }

        public void setRemote(String remote) {
            this.remote = remote;
        }
    }

    public static class Workers {
        private int count = 1;
        private long idleBackoffMs = 1000;
        private long pausedBackoffMs = 60_000;
        private long drainTimeoutMs = 30_000;
        private String builderVersion = "docbuild";

        /**
         * Fixed claim lifetime. Unset, claims outlive the longest sandbox
         * timeout, default or per-package, by 5 minutes.
         */
        private Duration claimTimeout;

        /**
         * Identity recorded on build attempts. Defaults to the host name.
         */
        private String buildServerName;

        public int getCount() {
            return count;
        }

        public void setCount(int count) {
            this.count = count;
        }

        public long getIdleBackoffMs() {
            return idleBackoffMs;
        }

        public void setIdleBackoffMs(long idleBackoffMs) {
            this.idleBackoffMs = idleBackoffMs;
        }

        public long getPausedBackoffMs() {
            return pausedBackoffMs;
        }

        public void setPausedBackoffMs(long pausedBackoffMs) {
            this.pausedBackoffMs = pausedBackoffMs;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }

        public Duration getClaimTimeout() {
            return claimTimeout;
        }

        public void setClaimTimeout(Duration claimTimeout) {
            this.claimTimeout = claimTimeout;
        }

        public String getBuilderVersion() {
            return builderVersion;
        }

        public void setBuilderVersion(String builderVersion) {
            this.builderVersion = builderVersion;
        }

        public String getBuildServerName() {
            return buildServerName;
        }

        public void setBuildServerName(String buildServerName) {
            this.buildServerName = buildServerName;
        }
    }

    public static class Queue {
        private int maxAttempts = 5;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }
    }

    public static class Retry {
        private long baseDelayMs = 60_000;
        private long maxDelayMs = 3_600_000;

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class Sandbox {
        /**
         * Command template for process sandboxes. See {@code ProcessSandbox} for placeholders.
         */
        private List<String> command = new ArrayList<>();

        /**
         * Root for per-release working directories. Enables the process sandbox.
         */
        private String workRoot;
        private String toolchainVersion;
        private String defaultTarget = "x86_64-unknown-linux-gnu";
        private List<String> targets = new ArrayList<>();
        private long memoryBytes = 3L * 1024 * 1024 * 1024;
        private Duration timeout = Duration.ofMinutes(15);
        private int maxTargets = 10;
        private boolean networking;
        private long maxLogBytes = 5L * 1024 * 1024;

        public List<String> getCommand() {
            return command;
        }

        public void setCommand(List<String> command) {
            this.command = command;
        }

        public String getWorkRoot() {
            return workRoot;
        }

        public void setWorkRoot(String workRoot) {
            this.workRoot = workRoot;
        }

        public String getToolchainVersion() {
            return toolchainVersion;
        }

        public void setToolchainVersion(String toolchainVersion) {
            this.toolchainVersion = toolchainVersion;
        }

        public String getDefaultTarget() {
            return defaultTarget;
        }

        public void setDefaultTarget(String defaultTarget) {
            this.defaultTarget = defaultTarget;
        }

        public List<String> getTargets() {
            return targets;
        }

        public void setTargets(List<String> targets) {
            this.targets = targets;
        }

        public long getMemoryBytes() {
            return memoryBytes;
        }

        public void setMemoryBytes(long memoryBytes) {
            this.memoryBytes = memoryBytes;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getMaxTargets() {
            return maxTargets;
        }

        public void setMaxTargets(int maxTargets) {
            this.maxTargets = maxTargets;
        }

        public boolean isNetworking() {
            return networking;
        }

        public void setNetworking(boolean networking) {
            this.networking = networking;
        }

        public long getMaxLogBytes() {
            return maxLogBytes;
        }

        public void setMaxLogBytes(long maxLogBytes) {
            this.maxLogBytes = maxLogBytes;
        }
    }

    public static class Reaper {
        private Duration grace = Duration.ofMinutes(5);
        private long intervalSeconds = 300;

        public Duration getGrace() {
            return grace;
        }

        public void setGrace(Duration grace) {
            this.grace = grace;
        }

        public long getIntervalSeconds() {
            return intervalSeconds;
        }

        public void setIntervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }
    }

    public static class Rebuilds {
        private boolean enabled;
        private int maxQueued = 10;
        private long intervalSeconds = 3600;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxQueued() {
            return maxQueued;
        }

        public void setMaxQueued(int maxQueued) {
            this.maxQueued = maxQueued;
        }

        public long getIntervalSeconds() {
            return intervalSeconds;
        }

        public void setIntervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }
    }

    public static class Webhook {
        /**
         * Shared secret for {@code sha256=} signatures. Unsigned notifications are accepted when empty.
         */
        private String secret;

        public String getSecret() {
            return secret;
        }

        public void setSecret(String secret) {
            this.secret = secret;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "docbuild";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
