package com.jonathantong.WalShift.consumer;

import com.jonathantong.WalShift.model.TrackedTable;
import com.jonathantong.WalShift.service.ChangeApplier;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.ConsumerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Reads one table's change topic and applies every record, in order, until stopped.
 * <p>
 * Partition 0 is assigned directly (no consumer group) and read from the beginning on
 * every (re)connect. Offsets are never saved, so each reconnect replays events that were
 * already applied; that is only correct because application is idempotent.
 */
public class ChangeStreamConsumer implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(ChangeStreamConsumer.class);

    private final TrackedTable table;
    private final ConsumerFactory<String, String> consumerFactory;
    private final ChangeApplier changeApplier;
    private final Duration pollTimeout;
    private final RetryPolicy retryPolicy;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile boolean stopRequested;
    private final AtomicLong recordsProcessed = new AtomicLong();
    private final AtomicLong reconnects = new AtomicLong();
    private volatile Consumer<String, String> currentConsumer;

    public ChangeStreamConsumer(
            TrackedTable table,
            ConsumerFactory<String, String> consumerFactory,
            ChangeApplier changeApplier,
            Duration pollTimeout,
            RetryPolicy retryPolicy) {
        this.table = table;
        this.consumerFactory = consumerFactory;
        this.changeApplier = changeApplier;
        this.pollTimeout = pollTimeout;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public void run() {
        running.set(true);
        logger.info("[consumer] {} -> {}", table.getTopic(), table.getQualifiedName());

        int failures = 0;
        while (!stopRequested) {
            Duration backoff = null;
            try {
                currentConsumer = open();
                while (!stopRequested) {
                    ConsumerRecords<String, String> records = currentConsumer.poll(pollTimeout);
                    failures = 0;
                    for (ConsumerRecord<String, String> record : records) {
                        applyRecord(record);
                    }
                }
            } catch (WakeupException e) {
                if (!stopRequested) {
                    logger.warn("[consumer] {} woken up unexpectedly, reconnecting", table.getTableName());
                    backoff = retryPolicy.getInterval();
                }
            } catch (InterruptException e) {
                logger.info("[consumer] {} interrupted", table.getTableName());
                stopRequested = true;
            } catch (Exception e) {
                failures++;
                if (!retryPolicy.canRetry(failures)) {
                    logger.error("[consumer] {} read error, giving up after {} attempts: {}",
                            table.getTableName(), failures, e.getMessage(), e);
                    stopRequested = true;
                } else {
                    backoff = retryPolicy.delayFor(failures);
                    logger.warn("[consumer] {} read error (attempt {}), reconnecting in {}: {}",
                            table.getTableName(), failures, backoff, e.getMessage());
                }
            } finally {
                close();
            }

            if (backoff != null && !stopRequested) {
                reconnects.incrementAndGet();
                try {
                    Thread.sleep(backoff.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    stopRequested = true;
                }
            }
        }
        running.set(false);
        logger.info("[consumer] {} stopped after {} records", table.getTableName(), recordsProcessed.get());
    }

    /**
     * Ask the loop to exit. Safe to call from any thread, before or after {@link #run}
     * starts; an in-flight poll is interrupted.
     */
    public void stop() {
        stopRequested = true;
        Consumer<String, String> consumer = currentConsumer;
        if (consumer != null) {
            consumer.wakeup();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public TrackedTable getTable() {
        return table;
    }

    public long getRecordsProcessed() {
        return recordsProcessed.get();
    }

    public long getReconnects() {
        return reconnects.get();
    }

    private Consumer<String, String> open() {
        Consumer<String, String> consumer = consumerFactory.createConsumer();
        TopicPartition partition = new TopicPartition(table.getTopic(), 0);
        consumer.assign(List.of(partition));
        consumer.seekToBeginning(List.of(partition));
        return consumer;
    }

    private void applyRecord(ConsumerRecord<String, String> record) {
        try {
            changeApplier.apply(table, record.value());
        } catch (RuntimeException e) {
            logger.error("[consumer] {} unexpected failure at offset {}, record dropped",
                    table.getTableName(), record.offset(), e);
        }
        recordsProcessed.incrementAndGet();
    }

    private void close() {
        Consumer<String, String> consumer = currentConsumer;
        currentConsumer = null;
        if (consumer != null) {
            try {
                consumer.close();
            } catch (Exception e) {
                logger.debug("[consumer] {} error closing reader: {}", table.getTableName(), e.getMessage());
            }
        }
    }
}
