package com.jonathantong.WalShift.connector;

import com.fasterxml.jackson.databind.JsonNode;
import com.jonathantong.WalShift.config.PostgresEndpoint;
import com.jonathantong.WalShift.config.WalShiftProperties;
import com.jonathantong.WalShift.model.ReplicationBookmark;
import com.jonathantong.WalShift.model.TrackedTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Registers the Debezium PostgreSQL connector with Kafka Connect and waits for it to run.
 */
@Service
public class ConnectorDeployer {

    private static final Logger logger = LoggerFactory.getLogger(ConnectorDeployer.class);

    private final RestTemplate connectRestTemplate;
    private final PostgresEndpoint sourceEndpoint;
    private final WalShiftProperties properties;

    public ConnectorDeployer(
            @Qualifier("connectRestTemplate") RestTemplate connectRestTemplate,
            @Qualifier("sourceEndpoint") PostgresEndpoint sourceEndpoint,
            WalShiftProperties properties) {
        this.connectRestTemplate = connectRestTemplate;
        this.sourceEndpoint = sourceEndpoint;
        this.properties = properties;
    }

    /**
     * Connector definition bound to the bookmark's slot.
     * <ul>
     *   <li>snapshot.mode=never: the bulk copy already happened, the connector only reads the slot</li>
     *   <li>time.precision.mode=isostring: temporal values arrive as ISO-8601 text</li>
     *   <li>decimal.handling.mode=string: no precision loss on NUMERIC columns</li>
     * </ul>
     */
    public Map<String, Object> buildConnectorDefinition(ReplicationBookmark bookmark) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("connector.class", "io.debezium.connector.postgresql.PostgresConnector");
        config.put("database.hostname", sourceEndpoint.getHost());
        config.put("database.port", String.valueOf(sourceEndpoint.getPort()));
        config.put("database.user", sourceEndpoint.getUsername());
        config.put("database.password", sourceEndpoint.getPassword());
        config.put("database.dbname", sourceEndpoint.getDatabase());
        config.put("topic.prefix", properties.getTopicPrefix());
        config.put("slot.name", bookmark.getSlotName());
        config.put("plugin.name", properties.getSlot().getPlugin());
        config.put("publication.name", properties.getSlot().getPublication());
        config.put("snapshot.mode", "never");
        config.put("table.include.list", tableIncludeList());
        config.put("key.converter", "org.apache.kafka.connect.json.JsonConverter");
        config.put("key.converter.schemas.enable", "false");
        config.put("value.converter", "org.apache.kafka.connect.json.JsonConverter");
        config.put("value.converter.schemas.enable", "false");
        config.put("tombstones.on.delete", "false");
        config.put("decimal.handling.mode", "string");
        config.put("time.precision.mode", "isostring");

        Map<String, Object> definition = new LinkedHashMap<>();
        definition.put("name", properties.getConnector().getName());
        definition.put("config", config);
        return definition;
    }

    public void deploy(ReplicationBookmark bookmark) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<Map<String, Object>> request = new HttpEntity<>(buildConnectorDefinition(bookmark), headers);

        try {
            connectRestTemplate.postForEntity("/connectors", request, String.class);
            logger.info("  Connector {} deployed", properties.getConnector().getName());
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.CONFLICT.value()) {
                logger.info("  Connector {} already exists", properties.getConnector().getName());
                return;
            }
            throw new ConnectorDeploymentException("Deploy error (" + e.getStatusCode().value() + "): "
                    + e.getResponseBodyAsString(), e);
        } catch (RestClientException e) {
            throw new ConnectorDeploymentException("Deploy failed: " + e.getMessage(), e);
        }
    }

    /**
     * Poll the connector status until it reports RUNNING.
     */
    public void awaitRunning() {
        String name = properties.getConnector().getName();
        int attempts = properties.getConnector().getStatusAttempts();
        Duration interval = properties.getConnector().getStatusInterval();

        String lastState = "UNKNOWN";
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                JsonNode status = connectRestTemplate.getForObject("/connectors/{name}/status", JsonNode.class, name);
                if (status != null) {
                    lastState = status.path("connector").path("state").asText("UNKNOWN");
                    if ("RUNNING".equals(lastState)) {
                        logger.info("  Connector RUNNING");
                        return;
                    }
                }
            } catch (RestClientException e) {
                logger.debug("  Connector status unavailable (attempt {}/{}): {}", attempt, attempts, e.getMessage());
            }
            if (attempt < attempts) {
                try {
                    Thread.sleep(interval.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ConnectorDeploymentException("Interrupted while waiting for connector " + name, e);
                }
            }
        }
        throw new ConnectorDeploymentException("Connector " + name + " not RUNNING after "
                + attempts + " attempts (last state " + lastState + ")");
    }

    private String tableIncludeList() {
        return properties.trackedTables().stream()
                .map(TrackedTable::getQualifiedName)
                .collect(Collectors.joining(","));
    }
}
