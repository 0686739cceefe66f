package jobqueue.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the job worker.
 *
 * @see JobQueueAutoConfiguration
 */
@ConfigurationProperties(prefix = "jobqueue")
public class JobQueueProperties {

    /**
     * Database table name for job records.
     */
    private String tableName = "job_record";

    private final Worker worker = new Worker();
    private final Queue queue = new Queue();
    private final Reclaim reclaim = new Reclaim();
    private final Purge purge = new Purge();
    private final Metrics metrics = new Metrics();

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public Worker getWorker() {
        return worker;
    }

    public Queue getQueue() {
        return queue;
    }

    public Reclaim getReclaim() {
        return reclaim;
    }

    public Purge getPurge() {
        return purge;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Worker {
        private boolean enabled = true;
        private int batchSize = 10;
        private Duration visibility = Duration.ofMinutes(30);
        private int maxRetries = 5;
        private Duration idleSleep = Duration.ofSeconds(5);
        private Duration maxIdleSleep = Duration.ofSeconds(60);
        private Duration stalenessThreshold = Duration.ofMinutes(35);
        private Duration pollInterval = Duration.ofSeconds(5);
        private Duration startupDelay = Duration.ofSeconds(5);
        private int concurrency = 4;
        private Duration shutdownTimeout = Duration.ofSeconds(120);
        private String ownerId = "";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getVisibility() {
            return visibility;
        }

        public void setVisibility(Duration visibility) {
            this.visibility = visibility;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getIdleSleep() {
            return idleSleep;
        }

        public void setIdleSleep(Duration idleSleep) {
            this.idleSleep = idleSleep;
        }

        public Duration getMaxIdleSleep() {
            return maxIdleSleep;
        }

        public void setMaxIdleSleep(Duration maxIdleSleep) {
            this.maxIdleSleep = maxIdleSleep;
        }

        public Duration getStalenessThreshold() {
            return stalenessThreshold;
        }

        public void setStalenessThreshold(Duration stalenessThreshold) {
            this.stalenessThreshold = stalenessThreshold;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getStartupDelay() {
            return startupDelay;
        }

        public void setStartupDelay(Duration startupDelay) {
            this.startupDelay = startupDelay;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }

        public String getOwnerId() {
            return ownerId;
        }

        public void setOwnerId(String ownerId) {
            this.ownerId = ownerId;
        }
    }

    public static class Queue {
        private String name = "jobs";
        private boolean createOnStartup = false;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public boolean isCreateOnStartup() {
            return createOnStartup;
        }

        public void setCreateOnStartup(boolean createOnStartup) {
            this.createOnStartup = createOnStartup;
        }
    }

    public static class Reclaim {
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(1);
        /** Unset means the worker's visibility timeout. */
        private Duration skipRecent;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public Duration getSkipRecent() {
            return skipRecent;
        }

        public void setSkipRecent(Duration skipRecent) {
            this.skipRecent = skipRecent;
        }
    }

    public static class Purge {
        private boolean enabled = false;
        private Duration retention = Duration.ofDays(30);
        private int batchSize = 500;
        private Duration interval = Duration.ofHours(1);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "jobqueue";

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
