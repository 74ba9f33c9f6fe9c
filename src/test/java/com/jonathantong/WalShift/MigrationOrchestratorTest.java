package com.jonathantong.WalShift;

import com.jonathantong.WalShift.bootstrap.BootstrapException;
import com.jonathantong.WalShift.bootstrap.BootstrapSequencer;
import com.jonathantong.WalShift.config.WalShiftProperties;
import com.jonathantong.WalShift.connector.ConnectorDeployer;
import com.jonathantong.WalShift.connector.ConnectorDeploymentException;
import com.jonathantong.WalShift.consumer.ChangeStreamConsumerManager;
import com.jonathantong.WalShift.model.BootstrapReport;
import com.jonathantong.WalShift.model.BulkTransferResult;
import com.jonathantong.WalShift.model.ReplicationBookmark;
import com.jonathantong.WalShift.readiness.ReadinessService;
import com.jonathantong.WalShift.verify.ReplicationVerifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class MigrationOrchestratorTest {

    private static final ReplicationBookmark BOOKMARK = new ReplicationBookmark("debezium_slot", "0/16B3748");

    @Mock
    private ReadinessService readinessService;

    @Mock
    private BootstrapSequencer bootstrapSequencer;

    @Mock
    private ConnectorDeployer connectorDeployer;

    @Mock
    private ChangeStreamConsumerManager consumerManager;

    @Mock
    private ReplicationVerifier replicationVerifier;

    @Mock
    private JdbcTemplate targetJdbcTemplate;

    @Mock
    private TaskScheduler taskScheduler;

    private WalShiftProperties properties;
    private MigrationOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        properties = new WalShiftProperties();
        properties.setTables(List.of("devices"));
        orchestrator = new MigrationOrchestrator(readinessService, bootstrapSequencer, connectorDeployer,
                consumerManager, replicationVerifier, targetJdbcTemplate, taskScheduler, properties);
    }

    @Test
    void run_shouldBootstrapBeforeDeployingAndDeployBeforeConsuming() {
        // Arrange
        when(bootstrapSequencer.run()).thenReturn(report());

        // Act
        orchestrator.run(new DefaultApplicationArguments());

        // Assert
        InOrder inOrder = inOrder(readinessService, bootstrapSequencer, connectorDeployer, consumerManager, taskScheduler);
        inOrder.verify(readinessService).awaitAll();
        inOrder.verify(bootstrapSequencer).run();
        inOrder.verify(connectorDeployer).deploy(BOOKMARK);
        inOrder.verify(connectorDeployer).awaitRunning();
        inOrder.verify(consumerManager).start();
        inOrder.verify(taskScheduler).schedule(any(Runnable.class), any(Instant.class));
    }

    @Test
    void run_shouldSkipOptionalStepsWhenDisabled() {
        // Arrange
        properties.getReadiness().setEnabled(false);
        properties.getConnector().setDeploy(false);
        properties.getVerification().setEnabled(false);
        when(bootstrapSequencer.run()).thenReturn(report());

        // Act
        orchestrator.run(new DefaultApplicationArguments());

        // Assert
        verifyNoInteractions(readinessService, connectorDeployer, taskScheduler);
        verify(consumerManager).start();
    }

    @Test
    void run_shouldAbortBeforeConsumingWhenBootstrapFails() {
        // Arrange
        when(bootstrapSequencer.run()).thenThrow(new BootstrapException("pg_restore exited with status 1:\n"));

        // Act & Assert
        assertThatThrownBy(() -> orchestrator.run(new DefaultApplicationArguments()))
                .isInstanceOf(BootstrapException.class);
        verifyNoInteractions(connectorDeployer, consumerManager);
    }

    @Test
    void run_shouldAbortWhenConnectorCannotBeDeployed() {
        // Arrange
        when(bootstrapSequencer.run()).thenReturn(report());
        doThrow(new ConnectorDeploymentException("Deploy error (500): boom"))
                .when(connectorDeployer).deploy(BOOKMARK);

        // Act & Assert
        assertThatThrownBy(() -> orchestrator.run(new DefaultApplicationArguments()))
                .isInstanceOf(ConnectorDeploymentException.class);
        verify(consumerManager, never()).start();
    }

    private static BootstrapReport report() {
        BulkTransferResult export = new BulkTransferResult("/tmp/omedb.dump", Duration.ofSeconds(1), 1024);
        BulkTransferResult restore = new BulkTransferResult("/tmp/omedb.dump", Duration.ofSeconds(2), 1024);
        return new BootstrapReport(BOOKMARK, export, restore);
    }
}
