package com.jonathantong.WalShift.readiness;

import com.jonathantong.WalShift.config.WalShiftProperties;
import org.apache.kafka.clients.consumer.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Blocks until the services the migration depends on answer.
 */
@Service
public class ReadinessService {

    private static final Logger logger = LoggerFactory.getLogger(ReadinessService.class);

    private final JdbcTemplate sourceJdbcTemplate;
    private final JdbcTemplate targetAdminJdbcTemplate;
    private final ConsumerFactory<String, String> consumerFactory;
    private final RestTemplate connectRestTemplate;
    private final WalShiftProperties properties;

    public ReadinessService(
            @Qualifier("sourceJdbcTemplate") JdbcTemplate sourceJdbcTemplate,
            @Qualifier("targetAdminJdbcTemplate") JdbcTemplate targetAdminJdbcTemplate,
            ConsumerFactory<String, String> consumerFactory,
            @Qualifier("connectRestTemplate") RestTemplate connectRestTemplate,
            WalShiftProperties properties) {
        this.sourceJdbcTemplate = sourceJdbcTemplate;
        this.targetAdminJdbcTemplate = targetAdminJdbcTemplate;
        this.consumerFactory = consumerFactory;
        this.connectRestTemplate = connectRestTemplate;
        this.properties = properties;
    }

    public void awaitAll() {
        awaitSource();
        awaitTarget();
        awaitKafka();
        if (properties.getConnector().isDeploy()) {
            awaitConnect();
        }
    }

    /**
     * The source is ready once it answers and, if configured, the probe table has rows.
     */
    public void awaitSource() {
        String probeTable = properties.getReadiness().getProbeTable();
        String sql = probeTable != null
                ? "SELECT COUNT(*) FROM " + probeTable
                : "SELECT 1";
        await("source database", properties.getReadiness().getDatabaseAttempts(), () -> {
            Long rows = sourceJdbcTemplate.queryForObject(sql, Long.class);
            return rows != null && rows > 0;
        });
    }

    public void awaitTarget() {
        await("target database", properties.getReadiness().getDatabaseAttempts(), () -> {
            Integer one = targetAdminJdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return one != null;
        });
    }

    public void awaitKafka() {
        await("Kafka", properties.getReadiness().getKafkaAttempts(), () -> {
            try (Consumer<String, String> consumer = consumerFactory.createConsumer()) {
                consumer.listTopics(Duration.ofSeconds(5));
                return true;
            }
        });
    }

    public void awaitConnect() {
        await("Kafka Connect", properties.getReadiness().getConnectAttempts(), () -> {
            ResponseEntity<String> response = connectRestTemplate.getForEntity("/connectors", String.class);
            return response.getStatusCode().is2xxSuccessful();
        });
    }

    void await(String name, int attempts, BooleanSupplier probe) {
        Duration interval = properties.getReadiness().getInterval();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                if (probe.getAsBoolean()) {
                    logger.info("  {} ready", name);
                    return;
                }
            } catch (RuntimeException e) {
                logger.debug("  {} not ready (attempt {}/{}): {}", name, attempt, attempts, e.getMessage());
            }
            if (attempt < attempts) {
                pause(interval);
            }
        }
        throw new ReadinessTimeoutException(name + " not ready after " + attempts + " attempts");
    }

    private void pause(Duration interval) {
        try {
            Thread.sleep(interval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReadinessTimeoutException("Interrupted while waiting for dependencies");
        }
    }
}
