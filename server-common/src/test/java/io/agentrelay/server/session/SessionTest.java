package io.agentrelay.server.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import io.agentrelay.server.tasks.InMemoryTaskStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

public class SessionTest {

    private final ExecutorService executor = Executors.newCachedThreadPool();

    @AfterEach
    public void cleanup() {
        executor.shutdownNow();
    }

    @Test
    public void testLifecycle() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        Session session = new Session(processor("task-1"), executor, release::await);

        assertEquals(SessionState.CREATED, session.getState());
        session.start();
        session.start();
        assertEquals(SessionState.STARTED, session.getState());

        release.countDown();
        session.awaitFinished();
        assertEquals(SessionState.FINISHED, session.getState());
        assertNull(session.getFailure());

        session.close();
        assertEquals(SessionState.CLOSED, session.getState());
        assertTrue(session.getEventProcessor().isClosed());
    }

    @Test
    public void testJobRunsOnce() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        Session session = new Session(processor("task-1"), executor, runs::incrementAndGet);

        session.start();
        session.start();
        session.awaitFinished();
        session.close();
        session.join();

        assertEquals(1, runs.get());
    }

    @Test
    public void testFailureIsRecordedWithoutRaising() throws Exception {
        IllegalStateException failure = new IllegalStateException("boom");
        Session session = new Session(processor("task-1"), executor, () -> {
            throw failure;
        });

        session.start();
        session.awaitFinished();

        assertSame(failure, session.getFailure());
        assertEquals(SessionState.FINISHED, session.getState());
    }

    @Test
    public void testCloseInterruptsRunningJob() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        Session session = new Session(processor("task-1"), executor, () -> {
            started.countDown();
            try {
                Thread.sleep(TimeUnit.MINUTES.toMillis(1));
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
        });

        session.start();
        assertTrue(started.await(5, TimeUnit.SECONDS));
        session.close();

        assertTrue(interrupted.await(5, TimeUnit.SECONDS));
        session.awaitFinished();
        assertTrue(session.isClosed());
        assertEquals(SessionState.CLOSED, session.getState());
    }

    @Test
    public void testCloseBeforeStartFinishesSession() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        Session session = new Session(processor("task-1"), executor, runs::incrementAndGet);

        session.close();
        session.start();
        session.join();

        assertEquals(0, runs.get());
        assertTrue(session.whenFinished().isDone());
    }

    @Test
    public void testCloseIsIdempotentAcrossThreads() throws Exception {
        Session session = new Session(processor("task-1"), executor, () -> { });
        session.start();
        session.awaitFinished();

        Thread other = new Thread(session::close);
        other.start();
        session.close();
        other.join(5000);

        assertFalse(other.isAlive());
        assertTrue(session.isClosed());
    }

    @Test
    public void testRejectedStartFinishesSession() throws Exception {
        Session session = new Session(processor("task-1"), command -> {
            throw new RejectedExecutionException("saturated");
        }, () -> { });

        assertThrows(RejectedExecutionException.class, session::start);
        session.awaitFinished();
        assertInstanceOf(RejectedExecutionException.class, session.getFailure());
    }

    @Test
    public void testJoinWaitsForSubscribers() throws Exception {
        SessionEventProcessor processor = processor("task-1");
        EventSubscription subscription = processor.subscribe();
        Session session = new Session(processor, executor, processor::close);
        session.start();
        session.awaitFinished();
        session.close();

        Thread joiner = new Thread(() -> {
            try {
                session.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        joiner.start();
        joiner.join(200);
        assertTrue(joiner.isAlive(), "join must wait for the subscriber to drain");

        assertThrows(EventStreamClosedException.class, subscription::next);
        joiner.join(5000);
        assertFalse(joiner.isAlive());
    }

    private static SessionEventProcessor processor(String taskId) {
        return new SessionEventProcessor("ctx-1", taskId, new InMemoryTaskStore(), null);
    }
}
