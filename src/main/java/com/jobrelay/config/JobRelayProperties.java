package com.jobrelay.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "jobrelay")
public class JobRelayProperties {

    private final Database database = new Database();
    private final Jobs jobs = new Jobs();
    private final BackgroundJobServer backgroundJobServer = new BackgroundJobServer();
    private final Dispatcher dispatcher = new Dispatcher();
    private final Reaper reaper = new Reaper();
    private final Cron cron = new Cron();
    private final Map<String, RateLimit> rateLimits = new LinkedHashMap<>();

    public Database getDatabase() {
        return database;
    }

    public Jobs getJobs() {
        return jobs;
    }

    public BackgroundJobServer getBackgroundJobServer() {
        return backgroundJobServer;
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public Reaper getReaper() {
        return reaper;
    }

    public Cron getCron() {
        return cron;
    }

    public Map<String, RateLimit> getRateLimits() {
        return rateLimits;
    }

    public static class Database {
        private String tablePrefix = "";
        private boolean skipCreate = false;
        private boolean failOnMigrationError = true;

        public String getTablePrefix() {
            return tablePrefix;
        }

        public void setTablePrefix(String tablePrefix) {
            this.tablePrefix = tablePrefix;
        }

        public boolean isSkipCreate() {
            return skipCreate;
        }

        public void setSkipCreate(boolean skipCreate) {
            this.skipCreate = skipCreate;
        }

        public boolean isFailOnMigrationError() {
            return failOnMigrationError;
        }

        public void setFailOnMigrationError(boolean failOnMigrationError) {
            this.failOnMigrationError = failOnMigrationError;
        }
    }

    /**
     * Defaults applied to submitted jobs that do not carry their own settings.
     */
    public static class Jobs {
        private int defaultMaxAttempts = 3;
        private Duration defaultBaseDelay = Duration.ofSeconds(1);
        private Duration defaultMaxDelay = Duration.ofMinutes(5);
        private Duration defaultLeaseDuration = Duration.ofSeconds(30);

        public int getDefaultMaxAttempts() {
            return defaultMaxAttempts;
        }

        public void setDefaultMaxAttempts(int defaultMaxAttempts) {
            this.defaultMaxAttempts = defaultMaxAttempts;
        }

        public Duration getDefaultBaseDelay() {
            return defaultBaseDelay;
        }

        public void setDefaultBaseDelay(Duration defaultBaseDelay) {
            this.defaultBaseDelay = defaultBaseDelay;
        }

        public Duration getDefaultMaxDelay() {
            return defaultMaxDelay;
        }

        public void setDefaultMaxDelay(Duration defaultMaxDelay) {
            this.defaultMaxDelay = defaultMaxDelay;
        }

        public Duration getDefaultLeaseDuration() {
            return defaultLeaseDuration;
        }

        public void setDefaultLeaseDuration(Duration defaultLeaseDuration) {
            this.defaultLeaseDuration = defaultLeaseDuration;
        }
    }

    public static class BackgroundJobServer {
        private boolean enabled = true;
        private int workerCount = Math.max(2, Runtime.getRuntime().availableProcessors());
        private long pollIntervalInSeconds = 15;
        private long storeUnavailableBackoffInSeconds = 30;
        private String deleteSucceededJobsAfter = "";
        private String deleteDeadLetteredJobsAfter = "";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public long getPollIntervalInSeconds() {
            return pollIntervalInSeconds;
        }

        public void setPollIntervalInSeconds(long pollIntervalInSeconds) {
            this.pollIntervalInSeconds = pollIntervalInSeconds;
        }

        public long getStoreUnavailableBackoffInSeconds() {
            return storeUnavailableBackoffInSeconds;
        }

        public void setStoreUnavailableBackoffInSeconds(long storeUnavailableBackoffInSeconds) {
            this.storeUnavailableBackoffInSeconds = storeUnavailableBackoffInSeconds;
        }

        public String getDeleteSucceededJobsAfter() {
            return deleteSucceededJobsAfter;
        }

        public void setDeleteSucceededJobsAfter(String deleteSucceededJobsAfter) {
            this.deleteSucceededJobsAfter = deleteSucceededJobsAfter;
        }

        public String getDeleteDeadLetteredJobsAfter() {
            return deleteDeadLetteredJobsAfter;
        }

        public void setDeleteDeadLetteredJobsAfter(String deleteDeadLetteredJobsAfter) {
            this.deleteDeadLetteredJobsAfter = deleteDeadLetteredJobsAfter;
        }
    }

    public static class Dispatcher {
        private int scanBatchSize = 50;
        private int maxScanPages = 4;
        private int maxClaimAttempts = 5;

        public int getScanBatchSize() {
            return scanBatchSize;
        }

        public void setScanBatchSize(int scanBatchSize) {
            this.scanBatchSize = scanBatchSize;
        }

        public int getMaxScanPages() {
            return maxScanPages;
        }

        public void setMaxScanPages(int maxScanPages) {
            this.maxScanPages = maxScanPages;
        }

        public int getMaxClaimAttempts() {
            return maxClaimAttempts;
        }

        public void setMaxClaimAttempts(int maxClaimAttempts) {
            this.maxClaimAttempts = maxClaimAttempts;
        }
    }

    public static class Reaper {
        private boolean enabled = true;
        private long intervalInSeconds = 5;
        private int batchSize = 100;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalInSeconds() {
            return intervalInSeconds;
        }

        public void setIntervalInSeconds(long intervalInSeconds) {
            this.intervalInSeconds = intervalInSeconds;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class Cron {
        private boolean enabled = true;
        private long tickIntervalInSeconds = 1;
        private int maxBackfillPerTick = 10;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getTickIntervalInSeconds() {
            return tickIntervalInSeconds;
        }

        public void setTickIntervalInSeconds(long tickIntervalInSeconds) {
            this.tickIntervalInSeconds = tickIntervalInSeconds;
        }

        public int getMaxBackfillPerTick() {
            return maxBackfillPerTick;
        }

        public void setMaxBackfillPerTick(int maxBackfillPerTick) {
            this.maxBackfillPerTick = maxBackfillPerTick;
        }
    }

    /**
     * Token bucket parameters for one rate key.
     */
    public static class RateLimit {
        private double capacity = 1;
        private double refillPerSecond = 1;

        public double getCapacity() {
            return capacity;
        }

        public void setCapacity(double capacity) {
            this.capacity = capacity;
        }

        public double getRefillPerSecond() {
            return refillPerSecond;
        }

        public void setRefillPerSecond(double refillPerSecond) {
            this.refillPerSecond = refillPerSecond;
        }
    }
}
