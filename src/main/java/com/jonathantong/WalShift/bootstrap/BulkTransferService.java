package com.jonathantong.WalShift.bootstrap;

import com.jonathantong.WalShift.config.PostgresEndpoint;
import com.jonathantong.WalShift.config.WalShiftProperties;
import com.jonathantong.WalShift.model.BulkTransferResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Copies existing rows with pg_dump (custom format) and pg_restore.
 * Both tools run as child processes against a single dump file.
 */
@Service
public class BulkTransferService {

    private static final Logger logger = LoggerFactory.getLogger(BulkTransferService.class);

    private final PostgresEndpoint sourceEndpoint;
    private final PostgresEndpoint targetEndpoint;
    private final JdbcTemplate targetAdminJdbcTemplate;
    private final ExternalCommandRunner commandRunner;
    private final WalShiftProperties properties;

    public BulkTransferService(
            @Qualifier("sourceEndpoint") PostgresEndpoint sourceEndpoint,
            @Qualifier("targetEndpoint") PostgresEndpoint targetEndpoint,
            @Qualifier("targetAdminJdbcTemplate") JdbcTemplate targetAdminJdbcTemplate,
            ExternalCommandRunner commandRunner,
            WalShiftProperties properties) {
        this.sourceEndpoint = sourceEndpoint;
        this.targetEndpoint = targetEndpoint;
        this.targetAdminJdbcTemplate = targetAdminJdbcTemplate;
        this.commandRunner = commandRunner;
        this.properties = properties;
    }

    /**
     * Dump the source database. The dump's MVCC snapshot is taken when pg_dump starts.
     */
    public BulkTransferResult bulkExport() {
        String dumpPath = properties.getDump().getPath();
        List<String> command = List.of(
                properties.getDump().getPgDumpCommand(),
                "-h", sourceEndpoint.getHost(),
                "-p", String.valueOf(sourceEndpoint.getPort()),
                "-U", sourceEndpoint.getUsername(),
                "-d", sourceEndpoint.getDatabase(),
                "-F", "c",
                "-f", dumpPath,
                "--no-owner", "--no-privileges");

        long start = System.nanoTime();
        execute("pg_dump", command, sourceEndpoint);
        Duration duration = Duration.ofNanos(System.nanoTime() - start);

        long size;
        try {
            size = Files.size(Path.of(dumpPath));
        } catch (IOException e) {
            throw new BootstrapException("pg_dump reported success but " + dumpPath + " is unreadable", e);
        }

        logger.info("  Dump: {} bytes in {}", size, duration);
        return new BulkTransferResult(dumpPath, duration, size);
    }

    /**
     * Recreate the replica database and restore the dump into it.
     */
    public BulkTransferResult bulkImport(BulkTransferResult dump) {
        long start = System.nanoTime();
        recreateTargetDatabase();

        List<String> command = List.of(
                properties.getDump().getPgRestoreCommand(),
                "-h", targetEndpoint.getHost(),
                "-p", String.valueOf(targetEndpoint.getPort()),
                "-U", targetEndpoint.getUsername(),
                "-d", targetEndpoint.getDatabase(),
                "--no-owner", "--no-privileges",
                dump.getDumpPath());
        execute("pg_restore", command, targetEndpoint);

        Duration duration = Duration.ofNanos(System.nanoTime() - start);
        logger.info("  Restore: {}", duration);
        return new BulkTransferResult(dump.getDumpPath(), duration, dump.getSizeBytes());
    }

    private void recreateTargetDatabase() {
        String database = "\"" + targetEndpoint.getDatabase().replace("\"", "\"\"") + "\"";
        try {
            targetAdminJdbcTemplate.execute("DROP DATABASE IF EXISTS " + database);
            targetAdminJdbcTemplate.execute("CREATE DATABASE " + database);
        } catch (DataAccessException e) {
            throw new BootstrapException("Could not recreate replica database " + database, e);
        }
    }

    private void execute(String tool, List<String> command, PostgresEndpoint endpoint) {
        CommandResult result;
        try {
            Map<String, String> environment = endpoint.getPassword() == null
                    ? Map.of()
                    : Map.of("PGPASSWORD", endpoint.getPassword());
            result = commandRunner.run(command, environment);
        } catch (IOException e) {
            throw new BootstrapException(tool + " could not be started", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BootstrapException(tool + " was interrupted", e);
        }
        if (!result.isSuccess()) {
            throw new BootstrapException(tool + " exited with status " + result.getExitCode() + ":\n" + result.getStderr());
        }
    }
}
