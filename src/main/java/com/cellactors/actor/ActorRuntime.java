package com.cellactors.actor;

import java.time.Duration;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs actors on a shared fixed-size pool. Every actor owns a FIFO mailbox which is drained by at
 * most one pool thread at a time; a drain pass handles at most {@value #THROUGHPUT} messages
 * before the actor is rescheduled behind the others.
 *
 * <p>The first exception or error escaping any handler terminates the runtime: the
 * {@link ActorFailureHandler} is notified, every caller blocked in {@link #await} is released with
 * the {@link ActorFailureException} and the pool is shut down. Messages sent afterwards are
 * dropped.
 */
public final class ActorRuntime implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ActorRuntime.class);
    private static final int THROUGHPUT = 64;
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

    private final ExecutorService executor;
    private final ActorFailureHandler failureHandler;
    private final CompletableFuture<ActorFailureException> failure = new CompletableFuture<>();
    private final Set<CompletableFuture<?>> waiters = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean terminated = new AtomicBoolean(false);

    public ActorRuntime(int parallelism) {
        this(parallelism, failure -> {
        });
    }

    public ActorRuntime(int parallelism, ActorFailureHandler failureHandler) {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("Parallelism must be positive");
        }
        this.failureHandler = Objects.requireNonNull(failureHandler, "failureHandler");
        this.executor = Executors.newFixedThreadPool(parallelism, new ActorThreadFactory());
        log.debug("Actor runtime started with {} threads", parallelism);
    }

    public <M> ActorRef<M> spawn(String name, Actor<M> actor) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(actor, "actor");
        if (terminated.get()) {
            throw new IllegalStateException("Actor runtime has terminated, cannot spawn " + name);
        }
        Mailbox<M> mailbox = new Mailbox<>(name, actor);
        actor.bind(mailbox);
        return mailbox;
    }

    /**
     * Sends a request built around a one-shot reply address and returns the future reply.
     */
    public <M, R> CompletableFuture<R> ask(ActorRef<M> target, Function<ActorRef<R>, M> request) {
        CompletableFuture<R> reply = new CompletableFuture<>();
        target.tell(request.apply(new ReplyRef<>(target.name() + "/reply", reply)));
        return reply;
    }

    /**
     * Waits for {@code future} from outside the actor pool. The future is registered only for the
     * duration of the call, so nothing accumulates on the runtime between waits.
     *
     * @throws ActorFailureException if an actor failed before or during the wait
     * @throws TimeoutException if {@code future} did not complete within {@code timeout}
     */
    public <T> T await(CompletableFuture<T> future, Duration timeout) throws TimeoutException, InterruptedException {
        waiters.add(future);
        try {
            ActorFailureException cause = failure.getNow(null);
            if (cause != null) {
                throw cause;
            }
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException ex) {
            if (ex.getCause() instanceof ActorFailureException actorFailure) {
                throw actorFailure;
            }
            throw new IllegalStateException("Awaited work failed", ex.getCause());
        } finally {
            waiters.remove(future);
        }
    }

    public boolean isTerminated() {
        return terminated.get();
    }

    @Override
    public void close() {
        if (!terminated.compareAndSet(false, true)) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Actor threads did not stop within {}, interrupting", SHUTDOWN_GRACE);
                executor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.debug("Actor runtime closed");
    }

    int waiterCount() {
        return waiters.size();
    }

    private void fail(String actorName, Object message, Throwable ex) {
        ActorFailureException failureCause = ex instanceof ActorFailureException actorFailure
                ? actorFailure
                : new ActorFailureException(actorName, message, String.valueOf(ex.getMessage()), ex);
        if (!terminated.compareAndSet(false, true)) {
            log.debug("Ignoring failure of {} after termination", actorName, failureCause);
            return;
        }
        log.error("Actor {} failed while handling {}", actorName, message, failureCause);
        try {
            failureHandler.onFailure(failureCause);
        } catch (RuntimeException handlerEx) {
            log.error("Actor failure handler threw", handlerEx);
        }
        failure.complete(failureCause);
        for (CompletableFuture<?> waiter : waiters) {
            waiter.completeExceptionally(failureCause);
        }
        executor.shutdownNow();
    }

    private final class Mailbox<M> implements ActorRef<M> {

        private final String name;
        private final Actor<M> actor;
        private final Queue<M> queue = new ConcurrentLinkedQueue<>();
        private final AtomicBoolean scheduled = new AtomicBoolean(false);

        private Mailbox(String name, Actor<M> actor) {
            this.name = name;
            this.actor = actor;
        }

        @Override
        public void tell(M message) {
            if (terminated.get()) {
                log.debug("Dead letter to {}: {}", name, message);
                return;
            }
            if (message == null) {
                fail(name, null, new ProtocolViolationException(name, null, "null message"));
                return;
            }
            queue.offer(message);
            schedule();
        }

        @Override
        public String name() {
            return name;
        }

        private void schedule() {
            if (!scheduled.compareAndSet(false, true)) {
                return;
            }
            try {
                executor.execute(this::drain);
            } catch (RejectedExecutionException ex) {
                scheduled.set(false);
                log.debug("Dead letters to {}: runtime no longer accepts work", name);
            }
        }

        private void drain() {
            try {
                for (int processed = 0; processed < THROUGHPUT && !terminated.get(); processed++) {
                    M message = queue.poll();
                    if (message == null) {
                        break;
                    }
                    try {
                        actor.receive(message);
                    } catch (Throwable ex) {
                        fail(name, message, ex);
                        return;
                    }
                }
            } finally {
                scheduled.set(false);
            }
            if (!queue.isEmpty() && !terminated.get()) {
                schedule();
            }
        }

        @Override
        public String toString() {
            return name;
        }
    }

    private static final class ReplyRef<R> implements ActorRef<R> {

        private final String name;
        private final CompletableFuture<R> reply;

        private ReplyRef(String name, CompletableFuture<R> reply) {
            this.name = name;
            this.reply = reply;
        }

        @Override
        public void tell(R message) {
            reply.complete(message);
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    private static final class ActorThreadFactory implements ThreadFactory {

        private static final AtomicInteger RUNTIME_IDS = new AtomicInteger();

        private final int runtimeId = RUNTIME_IDS.incrementAndGet();
        private final AtomicInteger threadIds = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "actors-" + runtimeId + "-" + threadIds.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
