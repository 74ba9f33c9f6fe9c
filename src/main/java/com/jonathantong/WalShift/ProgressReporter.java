package com.jonathantong.WalShift;

import com.jonathantong.WalShift.service.AppliedEventCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class ProgressReporter {

    private static final Logger logger = LoggerFactory.getLogger(ProgressReporter.class);

    private final AppliedEventCounter appliedEventCounter;

    public ProgressReporter(AppliedEventCounter appliedEventCounter) {
        this.appliedEventCounter = appliedEventCounter;
    }

    @Scheduled(fixedDelayString = "${walshift.progress-interval:PT10S}",
            initialDelayString = "${walshift.progress-interval:PT10S}")
    public void report() {
        logger.info("[writer] CDC events written: {}", appliedEventCounter.get());
    }
}
