package com.jonathantong.WalShift.consumer;

import com.jonathantong.WalShift.config.WalShiftProperties;
import com.jonathantong.WalShift.model.TrackedTable;
import com.jonathantong.WalShift.service.ChangeApplier;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Starts one {@link ChangeStreamConsumer} thread per tracked table
 */
@Component
public class ChangeStreamConsumerManager {

    private static final Logger logger = LoggerFactory.getLogger(ChangeStreamConsumerManager.class);

    private final WalShiftProperties properties;
    private final ConsumerFactory<String, String> consumerFactory;
    private final ChangeApplier changeApplier;

    private final List<ChangeStreamConsumer> workers = new ArrayList<>();
    private ExecutorService executor;

    public ChangeStreamConsumerManager(
            WalShiftProperties properties,
            ConsumerFactory<String, String> consumerFactory,
            ChangeApplier changeApplier) {
        this.properties = properties;
        this.consumerFactory = consumerFactory;
        this.changeApplier = changeApplier;
    }

    public synchronized void start() {
        if (executor != null) {
            logger.warn("Consumers already started");
            return;
        }

        List<TrackedTable> tables = properties.trackedTables();
        if (tables.isEmpty()) {
            logger.warn("No tables configured under walshift.tables, nothing to consume");
            return;
        }

        RetryPolicy retryPolicy = properties.getConsumer().retryPolicy();
        AtomicInteger threadIndex = new AtomicInteger();
        executor = Executors.newFixedThreadPool(tables.size(),
                runnable -> new Thread(runnable, "cdc-consumer-" + threadIndex.incrementAndGet()));

        for (TrackedTable table : tables) {
            ChangeStreamConsumer worker = new ChangeStreamConsumer(
                    table, consumerFactory, changeApplier, properties.getConsumer().getPollTimeout(), retryPolicy);
            workers.add(worker);
            executor.submit(worker);
        }
        logger.info("Started {} consumers with {}", workers.size(), retryPolicy);
    }

    @PreDestroy
    public synchronized void stop() {
        if (executor == null) {
            return;
        }
        workers.forEach(ChangeStreamConsumer::stop);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("Consumers did not stop within 10s, interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        logger.info("Stopped {} consumers", workers.size());
    }

    public synchronized List<ChangeStreamConsumer> getWorkers() {
        return Collections.unmodifiableList(new ArrayList<>(workers));
    }
}
