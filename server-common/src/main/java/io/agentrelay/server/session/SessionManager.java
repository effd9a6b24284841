package io.agentrelay.server.session;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.agentrelay.server.tasks.PushNotificationConfigStore;
import io.agentrelay.server.tasks.PushNotificationSender;
import io.agentrelay.server.tasks.TaskStore;
import io.agentrelay.server.util.async.Internal;
import io.agentrelay.spec.PushNotificationConfig;
import io.agentrelay.spec.Task;
import io.agentrelay.spec.TaskEvent;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of the running {@link Session}s, at most one per task.
 * <p>
 * Registering a session attaches a monitor to it. Once the session's job finishes, the monitor
 * removes the session from the registry and closes it while holding the task lock, then pushes
 * the final task snapshot to the task's push notification targets if the session worked on a
 * task. An explicit cancel goes through {@link #closeSession(Session)}, which unregisters the
 * session under the same lock and interrupts the job only after releasing it: interrupting the
 * job completes it on the cancelling thread, and its monitor takes the task lock.
 * <p>
 * Task locks are not reentrant. They are created on first use and dropped once released with no
 * waiter left.
 */
@ApplicationScoped
public class SessionManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(SessionManager.class);

    /**
     * Work run while holding a task lock.
     *
     * @param <T> the result type
     * @param <E> the exception type
     */
    @FunctionalInterface
    public interface TaskLockAction<T, E extends Exception> {
        T run() throws E;
    }

    private final ReadWriteLock registryLock = new ReentrantReadWriteLock();
    private final Map<String, Session> sessions = new HashMap<>();

    // guarded by itself
    private final Map<String, TaskLock> taskLocks = new HashMap<>();

    // Fields set by constructor injection cannot be final. We need a noargs constructor for
    // Jakarta compatibility, and it seems that making fields set by constructor injection
    // final, is not proxyable in all runtimes
    private Executor executor;
    private TaskStore taskStore;
    private @Nullable PushNotificationConfigStore pushConfigStore;
    private @Nullable PushNotificationSender pushSender;

    @SuppressWarnings("NullAway")
    protected SessionManager() {
        // For CDI proxy creation
        this.executor = null;
        this.taskStore = null;
    }

    @Inject
    public SessionManager(@Internal Executor executor, TaskStore taskStore,
                          @Nullable PushNotificationConfigStore pushConfigStore,
                          @Nullable PushNotificationSender pushSender) {
        this.executor = executor;
        this.taskStore = taskStore;
        this.pushConfigStore = pushConfigStore;
        this.pushSender = pushSender;
    }

    public SessionManager(Executor executor, TaskStore taskStore) {
        this(executor, taskStore, null, null);
    }

    /**
     * Registers a session and attaches its completion monitor. The session is not started.
     *
     * @param session the session
     * @throws TaskSessionExistsException if a session is already registered for the task
     */
    public void addSession(Session session) {
        String taskId = session.getTaskId();
        registryLock.writeLock().lock();
        try {
            if (sessions.containsKey(taskId)) {
                throw new TaskSessionExistsException(taskId);
            }
            sessions.put(taskId, session);
            session.markManaged();
        } finally {
            registryLock.writeLock().unlock();
        }
        LOGGER.debug("Registered session for task {}", taskId);

        session.whenFinished()
                .thenRunAsync(() -> finalizeSession(session), executor)
                .exceptionally(t -> {
                    LOGGER.error("Failed to finalize session for task {}", taskId, t);
                    session.markFinalized();
                    return null;
                });
    }

    public @Nullable Session sessionForTask(String taskId) {
        registryLock.readLock().lock();
        try {
            return sessions.get(taskId);
        } finally {
            registryLock.readLock().unlock();
        }
    }

    public int activeSessions() {
        registryLock.readLock().lock();
        try {
            return sessions.size();
        } finally {
            registryLock.readLock().unlock();
        }
    }

    /**
     * Removes a session from the registry, if still registered, while holding its task lock, then
     * closes it. Idempotent.
     *
     * @param session the session
     */
    public void closeSession(Session session) {
        withTaskLock(session.getTaskId(), () -> {
            unregister(session);
            return null;
        });
        session.close();
    }

    private void finalizeSession(Session session) {
        String taskId = session.getTaskId();
        try {
            boolean taskSession = session.getEventProcessor().getFirstEvent() instanceof TaskEvent;
            // the job is done, so closing does not complete anything on this thread
            withTaskLock(taskId, () -> {
                unregister(session);
                session.close();
                return null;
            });
            LOGGER.debug("Finalized session for task {}", taskId);
            if (taskSession) {
                sendPushNotifications(taskId);
            }
        } finally {
            session.markFinalized();
        }
    }

    private void unregister(Session session) {
        registryLock.writeLock().lock();
        try {
            sessions.remove(session.getTaskId(), session);
        } finally {
            registryLock.writeLock().unlock();
        }
    }

    private void sendPushNotifications(String taskId) {
        if (pushConfigStore == null || pushSender == null) {
            return;
        }
        List<PushNotificationConfig> configs = pushConfigStore.getAll(taskId);
        if (configs.isEmpty()) {
            return;
        }
        Task task = taskStore.get(taskId, 0, false);
        if (task == null) {
            LOGGER.warn("Task {} no longer exists, skipping {} push notifications", taskId, configs.size());
            return;
        }
        for (PushNotificationConfig config : configs) {
            try {
                pushSender.send(config, task);
            } catch (Exception e) {
                LOGGER.warn("Failed to send push notification for task {} to {}", taskId, config.url(), e);
            }
        }
    }

    /**
     * Acquires the lock of a task, waiting if another caller holds it.
     *
     * @param taskId the task id
     */
    public void taskLock(String taskId) {
        TaskLock lock;
        synchronized (taskLocks) {
            lock = taskLocks.computeIfAbsent(taskId, id -> new TaskLock());
            lock.references++;
        }
        lock.semaphore.acquireUninterruptibly();
    }

    /**
     * Releases the lock of a task.
     *
     * @param taskId the task id
     * @throws IllegalStateException if the task is not locked
     */
    public void taskUnlock(String taskId) {
        synchronized (taskLocks) {
            TaskLock lock = taskLocks.get(taskId);
            if (lock == null || lock.semaphore.availablePermits() > 0) {
                throw new IllegalStateException("Task '" + taskId + "' is not locked");
            }
            lock.semaphore.release();
            if (--lock.references == 0) {
                taskLocks.remove(taskId);
            }
        }
    }

    public boolean isTaskLocked(String taskId) {
        synchronized (taskLocks) {
            TaskLock lock = taskLocks.get(taskId);
            return lock != null && lock.semaphore.availablePermits() == 0;
        }
    }

    /**
     * Runs an action while holding the lock of a task. The lock is released however the action
     * completes.
     *
     * @param taskId the task id
     * @param action the action
     * @return the action result
     * @throws E the action failure
     */
    public <T, E extends Exception> T withTaskLock(String taskId, TaskLockAction<T, E> action) throws E {
        taskLock(taskId);
        try {
            return action.run();
        } finally {
            taskUnlock(taskId);
        }
    }

    private static final class TaskLock {
        private final Semaphore semaphore = new Semaphore(1);
        // holder and waiters
        private int references;
    }
}
