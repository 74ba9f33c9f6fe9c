package com.jonathantong.WalShift.readiness;

import com.jonathantong.WalShift.config.WalShiftProperties;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.common.errors.TimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class ReadinessServiceTest {

    @Mock
    private JdbcTemplate sourceJdbcTemplate;

    @Mock
    private JdbcTemplate targetAdminJdbcTemplate;

    @Mock
    private ConsumerFactory<String, String> consumerFactory;

    @Mock
    private Consumer<String, String> kafkaConsumer;

    @Mock
    private RestTemplate connectRestTemplate;

    private WalShiftProperties properties;
    private ReadinessService readinessService;

    @BeforeEach
    void setUp() {
        properties = new WalShiftProperties();
        properties.getReadiness().setProbeTable("devices");
        properties.getReadiness().setInterval(Duration.ZERO);
        properties.getReadiness().setDatabaseAttempts(3);
        properties.getReadiness().setKafkaAttempts(3);
        properties.getReadiness().setConnectAttempts(3);

        readinessService = new ReadinessService(
                sourceJdbcTemplate, targetAdminJdbcTemplate, consumerFactory, connectRestTemplate, properties);
    }

    @Test
    void awaitSource_shouldWaitUntilProbeTableIsSeeded() {
        // Arrange
        when(sourceJdbcTemplate.queryForObject("SELECT COUNT(*) FROM devices", Long.class))
                .thenThrow(new DataAccessResourceFailureException("Connection refused"))
                .thenReturn(0L)
                .thenReturn(13L);

        // Act & Assert
        assertThatCode(() -> readinessService.awaitSource()).doesNotThrowAnyException();
        verify(sourceJdbcTemplate, times(3)).queryForObject("SELECT COUNT(*) FROM devices", Long.class);
    }

    @Test
    void awaitSource_shouldFailAfterConfiguredAttempts() {
        // Arrange
        when(sourceJdbcTemplate.queryForObject("SELECT COUNT(*) FROM devices", Long.class)).thenReturn(0L);

        // Act & Assert
        assertThatThrownBy(() -> readinessService.awaitSource())
                .isInstanceOf(ReadinessTimeoutException.class)
                .hasMessage("source database not ready after 3 attempts");
    }

    @Test
    void awaitSource_withoutProbeTable_shouldOnlyCheckConnectivity() {
        // Arrange
        properties.getReadiness().setProbeTable(null);
        when(sourceJdbcTemplate.queryForObject("SELECT 1", Long.class)).thenReturn(1L);

        // Act & Assert
        assertThatCode(() -> readinessService.awaitSource()).doesNotThrowAnyException();
    }

    @Test
    void awaitKafka_shouldRetryUntilBrokerAnswers() {
        // Arrange
        when(consumerFactory.createConsumer()).thenReturn(kafkaConsumer);
        when(kafkaConsumer.listTopics(Duration.ofSeconds(5)))
                .thenThrow(new TimeoutException("Timeout expired while fetching topic metadata"))
                .thenReturn(Map.of());

        // Act
        readinessService.awaitKafka();

        // Assert
        verify(kafkaConsumer, times(2)).close();
    }

    @Test
    void awaitAll_shouldSkipConnectWhenConnectorIsNotDeployed() {
        // Arrange
        properties.getConnector().setDeploy(false);
        when(sourceJdbcTemplate.queryForObject("SELECT COUNT(*) FROM devices", Long.class)).thenReturn(13L);
        when(targetAdminJdbcTemplate.queryForObject("SELECT 1", Integer.class)).thenReturn(1);
        when(consumerFactory.createConsumer()).thenReturn(kafkaConsumer);
        when(kafkaConsumer.listTopics(Duration.ofSeconds(5))).thenReturn(Map.of());

        // Act
        readinessService.awaitAll();

        // Assert
        verifyNoInteractions(connectRestTemplate);
    }

    @Test
    void awaitConnect_shouldRetryWhileRestApiIsDown() {
        // Arrange
        when(connectRestTemplate.getForEntity("/connectors", String.class))
                .thenThrow(new ResourceAccessException("Connection refused"))
                .thenReturn(new ResponseEntity<>("[]", HttpStatus.OK));

        // Act & Assert
        assertThatCode(() -> readinessService.awaitConnect()).doesNotThrowAnyException();
    }
}
