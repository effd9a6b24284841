package io.agentrelay.server.session;

import static io.agentrelay.server.util.async.AsyncUtils.createTubeConfig;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import io.agentrelay.spec.Event;
import mutiny.zero.Tube;
import mutiny.zero.ZeroPublisher;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One subscriber's view of a {@link SessionEventProcessor}: the events published after the
 * subscription was created, in publication order, followed by the end of the stream.
 * <p>
 * Events are buffered without bound until consumed. The subscription counts as drained once its
 * consumer has observed the end of the stream, or has cancelled it. A subscription exposed as a
 * publisher that has no subscriber when the stream ends counts as drained right away, since a
 * client that went away before subscribing never will.
 */
public class EventSubscription {

    private static final Logger LOGGER = LoggerFactory.getLogger(EventSubscription.class);

    private final SessionEventProcessor processor;
    private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean ended = new AtomicBoolean();
    private final CountDownLatch drained = new CountDownLatch(1);
    private final AtomicBoolean awaitingSubscriber = new AtomicBoolean();

    EventSubscription(SessionEventProcessor processor) {
        this.processor = processor;
    }

    void deliver(Event event) {
        if (ended.get()) {
            LOGGER.debug("Subscription for task {} has ended, dropping {}", processor.getTaskId(), event.kind());
            return;
        }
        queue.add(event);
    }

    void end(@Nullable Throwable cause) {
        if (ended.compareAndSet(false, true)) {
            queue.add(new EndOfStream(cause));
            if (awaitingSubscriber.get()) {
                drained.countDown();
            }
        }
    }

    /**
     * Waits for the next event.
     *
     * @return the next event
     * @throws EventStreamClosedException once the stream has ended, carrying the session failure if any
     * @throws InterruptedException if interrupted while waiting
     */
    public Event next() throws EventStreamClosedException, InterruptedException {
        return unwrap(queue.take());
    }

    /**
     * Waits up to the given time for the next event.
     *
     * @return the next event, or {@code null} on timeout
     * @throws EventStreamClosedException once the stream has ended
     * @throws InterruptedException if interrupted while waiting
     */
    public @Nullable Event poll(long timeout, TimeUnit unit) throws EventStreamClosedException, InterruptedException {
        Object item = queue.poll(timeout, unit);
        return item == null ? null : unwrap(item);
    }

    private Event unwrap(Object item) throws EventStreamClosedException {
        if (item instanceof EndOfStream end) {
            // keep the marker so that later calls fail the same way
            queue.add(end);
            drained.countDown();
            throw new EventStreamClosedException(end.cause());
        }
        return (Event) item;
    }

    /**
     * Detaches from the processor. Pending events are discarded and a consumer blocked in
     * {@link #next()} sees the end of the stream.
     */
    public void cancel() {
        processor.unsubscribe(this);
        end(null);
        drained.countDown();
    }

    public boolean isDrained() {
        return drained.getCount() == 0;
    }

    void awaitDrained() throws InterruptedException {
        drained.await();
    }

    /**
     * Exposes the subscription as a publisher. Once subscribed, events are forwarded on the
     * given executor; a stream that ended with a failure terminates the publisher with it.
     * Cancelling the downstream subscription cancels this subscription.
     *
     * @param executor the executor running the forwarding loop
     * @return the publisher
     */
    public Flow.Publisher<Event> toPublisher(Executor executor) {
        awaitingSubscriber.set(true);
        if (ended.get()) {
            drained.countDown();
        }
        return ZeroPublisher.create(createTubeConfig(), tube -> {
            awaitingSubscriber.set(false);
            tube.whenCancelled(this::cancel);
            executor.execute(() -> forward(tube));
        });
    }

    private void forward(Tube<Event> tube) {
        try {
            while (true) {
                tube.send(next());
            }
        } catch (EventStreamClosedException e) {
            if (e.getCause() != null) {
                tube.fail(e.getCause());
            } else {
                tube.complete();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            tube.fail(e);
        }
    }

    private record EndOfStream(@Nullable Throwable cause) {
    }
}
