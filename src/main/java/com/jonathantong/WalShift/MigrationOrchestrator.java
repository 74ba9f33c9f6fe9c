package com.jonathantong.WalShift;

import com.jonathantong.WalShift.bootstrap.BootstrapSequencer;
import com.jonathantong.WalShift.config.WalShiftProperties;
import com.jonathantong.WalShift.connector.ConnectorDeployer;
import com.jonathantong.WalShift.consumer.ChangeStreamConsumerManager;
import com.jonathantong.WalShift.model.BootstrapReport;
import com.jonathantong.WalShift.readiness.ReadinessService;
import com.jonathantong.WalShift.verify.ReplicationVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Startup sequence: wait for dependencies, bookmark + bulk copy, deploy the connector,
 * then start streaming. Any exception escaping {@link #run} aborts startup.
 */
@Component
public class MigrationOrchestrator implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(MigrationOrchestrator.class);

    private final ReadinessService readinessService;
    private final BootstrapSequencer bootstrapSequencer;
    private final ConnectorDeployer connectorDeployer;
    private final ChangeStreamConsumerManager consumerManager;
    private final ReplicationVerifier replicationVerifier;
    private final JdbcTemplate targetJdbcTemplate;
    private final TaskScheduler taskScheduler;
    private final WalShiftProperties properties;

    public MigrationOrchestrator(
            ReadinessService readinessService,
            BootstrapSequencer bootstrapSequencer,
            ConnectorDeployer connectorDeployer,
            ChangeStreamConsumerManager consumerManager,
            ReplicationVerifier replicationVerifier,
            @Qualifier("targetJdbcTemplate") JdbcTemplate targetJdbcTemplate,
            TaskScheduler taskScheduler,
            WalShiftProperties properties) {
        this.readinessService = readinessService;
        this.bootstrapSequencer = bootstrapSequencer;
        this.connectorDeployer = connectorDeployer;
        this.consumerManager = consumerManager;
        this.replicationVerifier = replicationVerifier;
        this.targetJdbcTemplate = targetJdbcTemplate;
        this.taskScheduler = taskScheduler;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        logger.info("Replicating {} tables: {}", properties.getTables().size(), properties.getTables());

        if (properties.getReadiness().isEnabled()) {
            logger.info("[STEP 1] Waiting for dependencies...");
            readinessService.awaitAll();
        }

        logger.info("[STEP 2] Bookmark and bulk copy...");
        BootstrapReport report = bootstrapSequencer.run();
        replicationVerifier.logCounts("replica AFTER RESTORE", targetJdbcTemplate);

        if (properties.getConnector().isDeploy()) {
            logger.info("[STEP 3] Deploying connector on slot {}...", report.getBookmark().getSlotName());
            connectorDeployer.deploy(report.getBookmark());
            connectorDeployer.awaitRunning();
        }

        logger.info("[STEP 4] Starting change stream consumers...");
        consumerManager.start();

        if (properties.getVerification().isEnabled()) {
            taskScheduler.schedule(replicationVerifier::verify,
                    Instant.now().plus(properties.getVerification().getDelay()));
        }

        logger.info("Bootstrap complete: slot {} at LSN {}, dump {}, restore {}",
                report.getBookmark().getSlotName(), report.getBookmark().getLsn(),
                report.getExport().getDuration(), report.getRestore().getDuration());
    }
}
