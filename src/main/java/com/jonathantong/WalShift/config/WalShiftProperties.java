package com.jonathantong.WalShift.config;

import com.jonathantong.WalShift.consumer.RetryPolicy;
import com.jonathantong.WalShift.model.TrackedTable;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Binds the walshift.* section of application.yml
 */
@ConfigurationProperties(prefix = "walshift")
public class WalShiftProperties {

    /**
     * Ordered list of replicated tables. The publication, the connector include
     * list and the dump all have to agree with it.
     */
    private List<String> tables = new ArrayList<>();

    private String schema = "public";

    private String topicPrefix = "walshift";

    private final Slot slot = new Slot();
    private final Dump dump = new Dump();
    private final Consumer consumer = new Consumer();
    private final Connector connector = new Connector();
    private final Readiness readiness = new Readiness();
    private final Verification verification = new Verification();

    public List<TrackedTable> trackedTables() {
        return tables.stream()
                .map(table -> new TrackedTable(schema, table, topicPrefix))
                .toList();
    }

    public List<String> getTables() { return tables; }
    public void setTables(List<String> tables) { this.tables = tables; }

    public String getSchema() { return schema; }
    public void setSchema(String schema) { this.schema = schema; }

    public String getTopicPrefix() { return topicPrefix; }
    public void setTopicPrefix(String topicPrefix) { this.topicPrefix = topicPrefix; }

    public Slot getSlot() { return slot; }
    public Dump getDump() { return dump; }
    public Consumer getConsumer() { return consumer; }
    public Connector getConnector() { return connector; }
    public Readiness getReadiness() { return readiness; }
    public Verification getVerification() { return verification; }

    public static class Slot {
        private String name = "debezium_slot";
        private String plugin = "pgoutput";
        private String publication = "dbz_publication";

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getPlugin() { return plugin; }
        public void setPlugin(String plugin) { this.plugin = plugin; }

        public String getPublication() { return publication; }
        public void setPublication(String publication) { this.publication = publication; }
    }

    public static class Dump {
        private String path = "/tmp/walshift.dump";
        private String pgDumpCommand = "pg_dump";
        private String pgRestoreCommand = "pg_restore";

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }

        public String getPgDumpCommand() { return pgDumpCommand; }
        public void setPgDumpCommand(String pgDumpCommand) { this.pgDumpCommand = pgDumpCommand; }

        public String getPgRestoreCommand() { return pgRestoreCommand; }
        public void setPgRestoreCommand(String pgRestoreCommand) { this.pgRestoreCommand = pgRestoreCommand; }
    }

    public static class Consumer {
        private Duration pollTimeout = Duration.ofSeconds(1);
        private Duration retryInterval = Duration.ofSeconds(2);
        private double retryMultiplier = 1.0;
        private Duration maxRetryInterval = Duration.ofSeconds(30);

        // 0 means retry forever
        private int maxAttempts = 0;

        public RetryPolicy retryPolicy() {
            return new RetryPolicy(retryInterval, retryMultiplier, maxRetryInterval, maxAttempts);
        }

        public Duration getPollTimeout() { return pollTimeout; }
        public void setPollTimeout(Duration pollTimeout) { this.pollTimeout = pollTimeout; }

        public Duration getRetryInterval() { return retryInterval; }
        public void setRetryInterval(Duration retryInterval) { this.retryInterval = retryInterval; }

        public double getRetryMultiplier() { return retryMultiplier; }
        public void setRetryMultiplier(double retryMultiplier) { this.retryMultiplier = retryMultiplier; }

        public Duration getMaxRetryInterval() { return maxRetryInterval; }
        public void setMaxRetryInterval(Duration maxRetryInterval) { this.maxRetryInterval = maxRetryInterval; }

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    }

    public static class Connector {
        private boolean deploy = true;
        private String connectUrl = "http://localhost:8083";
        private String name = "walshift-source";
        private int statusAttempts = 60;
        private Duration statusInterval = Duration.ofSeconds(3);

        public boolean isDeploy() { return deploy; }
        public void setDeploy(boolean deploy) { this.deploy = deploy; }

        public String getConnectUrl() { return connectUrl; }
        public void setConnectUrl(String connectUrl) { this.connectUrl = connectUrl; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public int getStatusAttempts() { return statusAttempts; }
        public void setStatusAttempts(int statusAttempts) { this.statusAttempts = statusAttempts; }

        public Duration getStatusInterval() { return statusInterval; }
        public void setStatusInterval(Duration statusInterval) { this.statusInterval = statusInterval; }
    }

    public static class Readiness {
        private boolean enabled = true;
        private String probeTable;
        private int databaseAttempts = 120;
        private int kafkaAttempts = 90;
        private int connectAttempts = 120;
        private Duration interval = Duration.ofSeconds(2);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getProbeTable() { return probeTable; }
        public void setProbeTable(String probeTable) { this.probeTable = probeTable; }

        public int getDatabaseAttempts() { return databaseAttempts; }
        public void setDatabaseAttempts(int databaseAttempts) { this.databaseAttempts = databaseAttempts; }

        public int getKafkaAttempts() { return kafkaAttempts; }
        public void setKafkaAttempts(int kafkaAttempts) { this.kafkaAttempts = kafkaAttempts; }

        public int getConnectAttempts() { return connectAttempts; }
        public void setConnectAttempts(int connectAttempts) { this.connectAttempts = connectAttempts; }

        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
    }

    public static class Verification {
        private boolean enabled = true;
        private Duration delay = Duration.ofSeconds(15);
        private int sampleSize = 5;
        private Duration tolerance = Duration.ofSeconds(1);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Duration getDelay() { return delay; }
        public void setDelay(Duration delay) { this.delay = delay; }

        public int getSampleSize() { return sampleSize; }
        public void setSampleSize(int sampleSize) { this.sampleSize = sampleSize; }

        public Duration getTolerance() { return tolerance; }
        public void setTolerance(Duration tolerance) { this.tolerance = tolerance; }
    }
}
