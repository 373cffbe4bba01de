package com.cellactors.engine;

import java.time.Duration;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import com.cellactors.actor.Actor;
import com.cellactors.actor.ActorFailureException;
import com.cellactors.actor.ActorRuntime;
import com.cellactors.actor.ProtocolViolationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Barrier for a single step. Buffers one {@link NeighborReport} per cell and only once all of
 * them are in does it tell every cell to apply its count, so no cell can move to the target
 * generation while a counter might still be reading the previous one.
 *
 * <p>The barrier either broadcasts or is abandoned by a timed-out caller, never both: whichever
 * side moves the state away from collecting first decides the outcome of the step.
 */
final class StepAggregator extends Actor<NeighborReport> {

    private static final Logger log = LoggerFactory.getLogger(StepAggregator.class);

    private static final int COLLECTING = 0;
    private static final int BROADCASTING = 1;
    private static final int ABANDONED = 2;

    private final long targetGeneration;
    private final int expectedReports;
    private final Map<CellHandle, Integer> counts;
    private final CompletableFuture<Void> completion = new CompletableFuture<>();
    private final AtomicInteger state = new AtomicInteger(COLLECTING);

    private volatile int reportsReceived;

    StepAggregator(long targetGeneration, int expectedReports) {
        this.targetGeneration = targetGeneration;
        this.expectedReports = expectedReports;
        this.counts = new IdentityHashMap<>(expectedReports);
    }

    @Override
    protected void receive(NeighborReport report) {
        if (counts.size() >= expectedReports) {
            throw new ProtocolViolationException(self().name(), report, "report after all "
                    + expectedReports + " were collected");
        }
        if (counts.putIfAbsent(report.cell(), report.count()) != null) {
            throw new ProtocolViolationException(self().name(), report, "duplicate report for " + report.cell());
        }
        reportsReceived = counts.size();
        if (counts.size() < expectedReports) {
            return;
        }
        if (!state.compareAndSet(COLLECTING, BROADCASTING)) {
            log.debug("Step to generation {} completed after being abandoned, discarding counts", targetGeneration);
            return;
        }
        for (Map.Entry<CellHandle, Integer> entry : counts.entrySet()) {
            entry.getKey().tell(new CellMessage.ApplyNeighborCount(targetGeneration, entry.getValue()));
        }
        completion.complete(null);
    }

    /**
     * Blocks until the broadcast for the target generation has been sent.
     *
     * <p>If the reports are not all in when {@code timeout} expires the step is abandoned. A
     * broadcast that already started at that point is waited for instead, and the step succeeds.
     *
     * @throws StepTimeoutException if the step was abandoned after {@code timeout}
     * @throws ActorFailureException if an actor failed while waiting
     */
    void await(ActorRuntime runtime, Duration timeout) {
        try {
            runtime.await(completion, timeout);
        } catch (TimeoutException ex) {
            if (state.compareAndSet(COLLECTING, ABANDONED)) {
                throw new StepTimeoutException(targetGeneration, reportsReceived, expectedReports, timeout);
            }
            log.debug("Step to generation {} timed out during its broadcast, waiting for it", targetGeneration);
            awaitBroadcast(runtime, timeout);
        } catch (ActorFailureException ex) {
            state.compareAndSet(COLLECTING, ABANDONED);
            throw ex;
        } catch (InterruptedException ex) {
            state.compareAndSet(COLLECTING, ABANDONED);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while stepping to generation " + targetGeneration, ex);
        }
    }

    private void awaitBroadcast(ActorRuntime runtime, Duration timeout) {
        try {
            runtime.await(completion, timeout);
        } catch (TimeoutException ex) {
            throw new IllegalStateException("Broadcast for generation " + targetGeneration + " did not finish", ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while stepping to generation " + targetGeneration, ex);
        }
    }

    int reportsReceived() {
        return reportsReceived;
    }
}
