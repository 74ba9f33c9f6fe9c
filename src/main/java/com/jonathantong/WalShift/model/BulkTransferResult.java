package com.jonathantong.WalShift.model;

import java.time.Duration;

public class BulkTransferResult {

    private final String dumpPath;
    private final Duration duration;
    private final long sizeBytes;

    public BulkTransferResult(String dumpPath, Duration duration, long sizeBytes) {
        this.dumpPath = dumpPath;
        this.duration = duration;
        this.sizeBytes = sizeBytes;
    }

    public String getDumpPath() { return dumpPath; }

    public Duration getDuration() { return duration; }

    public long getSizeBytes() { return sizeBytes; }

    @Override
    public String toString() {
        return "BulkTransferResult{" +
                "dumpPath='" + dumpPath + '\'' +
                ", duration=" + duration +
                ", sizeBytes=" + sizeBytes +
                '}';
    }
}
