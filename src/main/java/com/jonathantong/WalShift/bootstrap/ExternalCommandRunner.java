package com.jonathantong.WalShift.bootstrap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Runs a command line tool to completion, capturing stderr
 */
@Component
public class ExternalCommandRunner {

    private static final Logger logger = LoggerFactory.getLogger(ExternalCommandRunner.class);

    public CommandResult run(List<String> command, Map<String, String> environment)
            throws IOException, InterruptedException {
        ProcessBuilder processBuilder = new ProcessBuilder(command);
        processBuilder.environment().putAll(environment);
        processBuilder.redirectOutput(ProcessBuilder.Redirect.DISCARD);

        logger.debug("Running {}", command);
        Process process = processBuilder.start();
        String stderr = new String(process.getErrorStream().readAllBytes(), StandardCharsets.UTF_8);
        int exitCode = process.waitFor();
        return new CommandResult(exitCode, stderr);
    }
}
