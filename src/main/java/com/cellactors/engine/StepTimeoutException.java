package com.cellactors.engine;

import java.time.Duration;

/**
 * A step did not collect every neighbour report in time. The board has not advanced and the
 * step may be retried.
 */
public class StepTimeoutException extends RuntimeException {

    private final long targetGeneration;
    private final int reportsReceived;
    private final int reportsExpected;

    public StepTimeoutException(long targetGeneration, int reportsReceived, int reportsExpected, Duration timeout) {
        super("Step to generation " + targetGeneration + " timed out after " + timeout.toMillis()
                + " ms with " + reportsReceived + "/" + reportsExpected + " neighbor reports");
        this.targetGeneration = targetGeneration;
        this.reportsReceived = reportsReceived;
        this.reportsExpected = reportsExpected;
    }

    public long targetGeneration() {
        return targetGeneration;
    }

    public int reportsReceived() {
        return reportsReceived;
    }

    public int reportsExpected() {
        return reportsExpected;
    }
}
