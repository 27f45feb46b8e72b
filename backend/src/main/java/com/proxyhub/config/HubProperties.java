package com.proxyhub.config;

import com.proxyhub.aggregator.model.MergeStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

@ConfigurationProperties(prefix = "hub")
public class HubProperties {
    private static final String DEFAULT_USER_AGENT = "proxy-hub/0.1";

    private String userAgent;
    private int requestTimeoutSeconds = 30;
    private int globalConcurrency = 4;
    private Storage storage = new Storage();
    private Subscription subscription = new Subscription();
    private Probe probe = new Probe();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public Subscription getSubscription() {
        return subscription;
    }

    public void setSubscription(Subscription subscription) {
        this.subscription = subscription;
    }

    public Probe getProbe() {
        return probe;
    }

    public void setProbe(Probe probe) {
        this.probe = probe;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Storage {
        private String dir = Path.of(System.getProperty("user.home"), ".proxy-hub", "subscriptions").toString();

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }
    }

    public static class Subscription {
        private long defaultUpdateIntervalSeconds = 86400;
        private int base64MinLength = 16;
        private int refreshMaxSleepSeconds = 60;
        private boolean resumeAutoUpdate = true;
        private MergeStrategy mergeStrategy = MergeStrategy.EXACT_DESCRIPTOR;

        public long getDefaultUpdateIntervalSeconds() {
            return Math.max(1, defaultUpdateIntervalSeconds);
        }

        public void setDefaultUpdateIntervalSeconds(long defaultUpdateIntervalSeconds) {
            this.defaultUpdateIntervalSeconds = Math.max(1, defaultUpdateIntervalSeconds);
        }

        public int getBase64MinLength() {
            return Math.max(1, base64MinLength);
        }

        public void setBase64MinLength(int base64MinLength) {
            this.base64MinLength = Math.max(1, base64MinLength);
        }

        public int getRefreshMaxSleepSeconds() {
            return Math.max(1, refreshMaxSleepSeconds);
        }

        public void setRefreshMaxSleepSeconds(int refreshMaxSleepSeconds) {
            this.refreshMaxSleepSeconds = Math.max(1, refreshMaxSleepSeconds);
        }

        public boolean isResumeAutoUpdate() {
            return resumeAutoUpdate;
        }

        public void setResumeAutoUpdate(boolean resumeAutoUpdate) {
            this.resumeAutoUpdate = resumeAutoUpdate;
        }

        public MergeStrategy getMergeStrategy() {
            return mergeStrategy == null ? MergeStrategy.EXACT_DESCRIPTOR : mergeStrategy;
        }

        public void setMergeStrategy(MergeStrategy mergeStrategy) {
            this.mergeStrategy = mergeStrategy;
        }
    }

    public static class Probe {
        private int maxWorkers = 10;
        private int tierTimeoutSeconds = 10;
        private int fullProbeAttempts = 1;
        private int defaultTopN = 5;

        public int getMaxWorkers() {
            return Math.max(1, maxWorkers);
        }

        public void setMaxWorkers(int maxWorkers) {
            this.maxWorkers = Math.max(1, maxWorkers);
        }

        public int getTierTimeoutSeconds() {
            return Math.max(1, tierTimeoutSeconds);
        }

        public void setTierTimeoutSeconds(int tierTimeoutSeconds) {
            this.tierTimeoutSeconds = Math.max(1, tierTimeoutSeconds);
        }

        public int getFullProbeAttempts() {
            return Math.max(1, fullProbeAttempts);
        }

        public void setFullProbeAttempts(int fullProbeAttempts) {
            this.fullProbeAttempts = Math.max(1, fullProbeAttempts);
        }

        public int getDefaultTopN() {
            return Math.max(1, defaultTopN);
        }

        public void setDefaultTopN(int defaultTopN) {
            this.defaultTopN = Math.max(1, defaultTopN);
        }
    }

    public static class Cli {
        private boolean run;
        private boolean updateBeforeRank = true;
        private boolean parallel = true;
        private int topN = 5;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isUpdateBeforeRank() {
            return updateBeforeRank;
        }

        public void setUpdateBeforeRank(boolean updateBeforeRank) {
            this.updateBeforeRank = updateBeforeRank;
        }

        public boolean isParallel() {
            return parallel;
        }

        public void setParallel(boolean parallel) {
            this.parallel = parallel;
        }

        public int getTopN() {
            return topN;
        }

        public void setTopN(int topN) {
            this.topN = topN;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
