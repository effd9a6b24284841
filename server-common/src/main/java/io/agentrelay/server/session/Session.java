package io.agentrelay.server.session;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

import io.agentrelay.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A single execution of an agent for one task: the job running the agent plus the
 * {@link SessionEventProcessor} it publishes to.
 * <p>
 * A session moves through {@link SessionState#CREATED}, {@link SessionState#STARTED},
 * {@link SessionState#FINISHED} and {@link SessionState#CLOSED}. Closing a running session
 * interrupts its job. Sessions registered with a {@link SessionManager} are closed by the
 * manager once their job finishes.
 */
public class Session implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(Session.class);

    /**
     * The work a session runs.
     */
    @FunctionalInterface
    public interface Job {
        void run() throws Exception;
    }

    private final SessionEventProcessor eventProcessor;
    private final Executor executor;
    private final FutureTask<Void> job;

    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.CREATED);
    private final CompletableFuture<Void> finished = new CompletableFuture<>();
    private final CompletableFuture<Void> closed = new CompletableFuture<>();
    private final CompletableFuture<Void> finalized = new CompletableFuture<>();
    private volatile boolean managed;
    private volatile @Nullable Throwable failure;

    public Session(SessionEventProcessor eventProcessor, Executor executor, Job job) {
        this.eventProcessor = Assert.checkNotNullParam("eventProcessor", eventProcessor);
        this.executor = Assert.checkNotNullParam("executor", executor);
        Assert.checkNotNullParam("job", job);
        this.job = new FutureTask<>(() -> {
            job.run();
            return null;
        }) {
            @Override
            protected void done() {
                onJobDone(this);
            }
        };
    }

    public String getContextId() {
        return eventProcessor.getContextId();
    }

    public String getTaskId() {
        return eventProcessor.getTaskId();
    }

    public SessionEventProcessor getEventProcessor() {
        return eventProcessor;
    }

    public SessionState getState() {
        return state.get();
    }

    /**
     * Returns the exception the job failed with.
     *
     * @return the failure, or {@code null} if the job has not failed
     */
    public @Nullable Throwable getFailure() {
        return failure;
    }

    /**
     * Starts the job. Has no effect if the session was already started or closed.
     *
     * @throws RejectedExecutionException if the executor refuses the job, in which case the
     * session is finished without having run
     */
    public void start() {
        if (!state.compareAndSet(SessionState.CREATED, SessionState.STARTED)) {
            return;
        }
        LOGGER.debug("Starting session for task {}", getTaskId());
        try {
            executor.execute(job);
        } catch (RejectedExecutionException e) {
            failure = e;
            job.cancel(false);
            throw e;
        }
    }

    private void onJobDone(FutureTask<Void> task) {
        try {
            task.get();
        } catch (CancellationException e) {
            LOGGER.debug("Job of session for task {} was cancelled", getTaskId());
        } catch (ExecutionException e) {
            failure = e.getCause();
            LOGGER.debug("Job of session for task {} failed", getTaskId(), e.getCause());
        } catch (InterruptedException e) {
            // done() runs once the outcome is set, get() does not block here
            Thread.currentThread().interrupt();
        }
        state.compareAndSet(SessionState.STARTED, SessionState.FINISHED);
        finished.complete(null);
    }

    /**
     * Returns a future completed once the job has finished, whatever its outcome. The future
     * never completes exceptionally.
     *
     * @return the completion future
     */
    public CompletableFuture<Void> whenFinished() {
        return finished;
    }

    /**
     * Waits for the job to finish without raising its failure.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void awaitFinished() throws InterruptedException {
        await(finished);
    }

    /**
     * Starts the session if needed, then waits until the job has finished, the session has been
     * closed and finalized by its manager, and every subscriber has consumed the stream.
     * <p>
     * A subscription obtained from {@link SessionEventProcessor#subscribe()} counts as consumed
     * once its consumer reads the end of the stream or cancels it; joining while such a
     * subscription is abandoned blocks. A subscription exposed through
     * {@link EventSubscription#toPublisher} that never gets a subscriber counts as consumed once
     * the stream ends.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void join() throws InterruptedException {
        start();
        await(finished);
        await(closed);
        if (managed) {
            await(finalized);
        }
        eventProcessor.awaitDrained();
    }

    /**
     * Closes the session: ends the event stream and interrupts the job if it is still running.
     * Idempotent; a concurrent call returns once the event stream is closed.
     * <p>
     * Interrupting the job completes {@link #whenFinished()} on the calling thread, so callers
     * must not hold a lock that the completion's dependents acquire.
     */
    @Override
    public void close() {
        SessionState previous = state.getAndSet(SessionState.CLOSED);
        if (previous == SessionState.CLOSED) {
            closed.join();
            return;
        }
        LOGGER.debug("Closing session for task {} in state {}", getTaskId(), previous);
        try {
            eventProcessor.close();
        } finally {
            closed.complete(null);
        }
        job.cancel(true);
    }

    public boolean isClosed() {
        return closed.isDone();
    }

    void markManaged() {
        managed = true;
    }

    void markFinalized() {
        finalized.complete(null);
    }

    private static void await(CompletableFuture<Void> future) throws InterruptedException {
        try {
            future.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Session future completed exceptionally", e.getCause());
        }
    }
}
