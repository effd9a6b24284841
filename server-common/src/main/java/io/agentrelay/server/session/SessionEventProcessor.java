package io.agentrelay.server.session;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

import io.agentrelay.server.tasks.TaskStore;
import io.agentrelay.spec.Event;
import io.agentrelay.spec.Message;
import io.agentrelay.spec.Task;
import io.agentrelay.spec.TaskEvent;
import io.agentrelay.spec.TaskState;
import io.agentrelay.spec.TaskStatusUpdateEvent;
import io.agentrelay.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The event stream of one session.
 * <p>
 * The agent publishes through {@link #sendMessage(Message)} and {@link #sendTaskEvent(TaskEvent)};
 * every current {@link EventSubscription} receives every event in publication order. Task events
 * are merged into the {@link TaskStore} before they are delivered, so a subscriber never sees an
 * event the store does not reflect yet.
 * <p>
 * A session either answers with a single {@link Message}, or works on exactly one task, the one
 * identified by {@link #getTaskId()}. Events breaking these rules are rejected with an
 * {@link InvalidEventException}:
 * <ul>
 *   <li>events must carry the session's context id, and task events its task id;</li>
 *   <li>at most one message may be sent, and messages and task events cannot be mixed;</li>
 *   <li>the first task event of a new task must be the {@link Task} itself;</li>
 *   <li>nothing may follow a final status update, or be sent for a task in a terminal state;</li>
 *   <li>a status update to a terminal state must be final.</li>
 * </ul>
 * Once closed, the stream ends for all subscribers after they consumed the pending events, and
 * further sends fail with {@link SessionClosedException}.
 */
public class SessionEventProcessor {

    private static final Logger LOGGER = LoggerFactory.getLogger(SessionEventProcessor.class);

    private final String contextId;
    private final String taskId;
    private final TaskStore taskStore;

    private final ReentrantLock lock = new ReentrantLock();
    private final List<EventSubscription> subscriptions = new CopyOnWriteArrayList<>();

    // guarded by lock
    private boolean closed;
    private @Nullable Throwable closeCause;
    private boolean taskExists;
    private boolean messageSent;
    private boolean taskEventSent;
    private boolean finalEventSent;
    private @Nullable TaskState currentState;

    private volatile @Nullable Event firstEvent;

    /**
     * Creates a processor for a new task, or for an existing one when {@code existingTask} is given.
     *
     * @param contextId the conversation id
     * @param taskId the task id
     * @param taskStore the store task events are merged into
     * @param existingTask the task this session continues, if any
     */
    public SessionEventProcessor(String contextId, String taskId, TaskStore taskStore, @Nullable Task existingTask) {
        this.contextId = Assert.checkNotBlankParam("contextId", contextId);
        this.taskId = Assert.checkNotBlankParam("taskId", taskId);
        this.taskStore = Assert.checkNotNullParam("taskStore", taskStore);
        if (existingTask != null) {
            if (!taskId.equals(existingTask.id()) || !contextId.equals(existingTask.contextId())) {
                throw new IllegalArgumentException("Task '" + existingTask.id() + "' does not match session task '"
                        + taskId + "' in context '" + contextId + "'");
            }
            this.taskExists = true;
            this.currentState = existingTask.status().state();
        }
    }

    public String getContextId() {
        return contextId;
    }

    public String getTaskId() {
        return taskId;
    }

    /**
     * Returns the first event published on this stream.
     *
     * @return the first event, or {@code null} if nothing was published yet
     */
    public @Nullable Event getFirstEvent() {
        return firstEvent;
    }

    /**
     * Publishes the message answering the request.
     *
     * @param message the message
     * @throws InvalidEventException if the message breaks the session rules
     * @throws SessionClosedException if the processor is closed
     */
    public void sendMessage(Message message) {
        lock.lock();
        try {
            ensureOpen();
            if (!contextId.equals(message.contextId())) {
                throw new InvalidEventException("Message contextId '" + message.contextId()
                        + "' does not match session context '" + contextId + "'");
            }
            if (messageSent) {
                throw new InvalidEventException("Only one message can be sent per session");
            }
            if (taskEventSent) {
                throw new InvalidEventException("Cannot send a message after task events");
            }
            messageSent = true;
            publish(message);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Merges a task event into the task store and publishes it.
     *
     * @param event the event
     * @throws InvalidEventException if the event breaks the session rules
     * @throws SessionClosedException if the processor is closed
     * @throws io.agentrelay.server.tasks.TaskStoreException if the store rejects the event
     */
    public void sendTaskEvent(TaskEvent event) {
        lock.lock();
        try {
            ensureOpen();
            validate(event);
            taskStore.update(event);

            taskEventSent = true;
            taskExists = true;
            if (event instanceof Task task) {
                currentState = task.status().state();
            } else if (event instanceof TaskStatusUpdateEvent statusUpdate) {
                currentState = statusUpdate.status().state();
                finalEventSent = statusUpdate.isFinal();
            }
            publish(event);
        } finally {
            lock.unlock();
        }
    }

    private void validate(TaskEvent event) {
        if (!contextId.equals(event.contextId())) {
            throw new InvalidEventException("Event contextId '" + event.contextId()
                    + "' does not match session context '" + contextId + "'");
        }
        if (!taskId.equals(event.taskId())) {
            throw new InvalidEventException("Event taskId '" + event.taskId()
                    + "' does not match session task '" + taskId + "'");
        }
        if (messageSent) {
            throw new InvalidEventException("Cannot send task events after a message");
        }
        if (!taskExists && !(event instanceof Task)) {
            throw new InvalidEventException("The first event of a new task must be the task itself, got " + event.kind());
        }
        if (finalEventSent) {
            throw new InvalidEventException("Cannot send events after the final event of task '" + taskId + "'");
        }
        if (currentState != null && currentState.isFinal()) {
            throw new InvalidEventException("Task '" + taskId + "' is in terminal state " + currentState.asString());
        }
        if (event instanceof TaskStatusUpdateEvent statusUpdate
                && statusUpdate.status().state().isFinal() && !statusUpdate.isFinal()) {
            throw new InvalidEventException("A status update to terminal state "
                    + statusUpdate.status().state().asString() + " must be final");
        }
    }

    private void publish(Event event) {
        if (firstEvent == null) {
            firstEvent = event;
        }
        LOGGER.debug("Publishing {} for task {} to {} subscribers", event.kind(), taskId, subscriptions.size());
        for (EventSubscription subscription : subscriptions) {
            subscription.deliver(event);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new SessionClosedException("Session for task '" + taskId + "' is closed");
        }
    }

    /**
     * Subscribes to the events published from now on. Subscribing to a closed processor returns
     * an already ended subscription.
     *
     * @return the subscription
     */
    public EventSubscription subscribe() {
        lock.lock();
        try {
            EventSubscription subscription = new EventSubscription(this);
            if (closed) {
                subscription.end(closeCause);
            } else {
                subscriptions.add(subscription);
            }
            return subscription;
        } finally {
            lock.unlock();
        }
    }

    void unsubscribe(EventSubscription subscription) {
        subscriptions.remove(subscription);
    }

    /**
     * Ends the stream normally. Idempotent.
     */
    public void close() {
        close(null);
    }

    /**
     * Ends the stream with a failure which subscribers receive after the pending events. Has no
     * effect if the processor is already closed.
     *
     * @param cause the failure
     */
    public void closeExceptionally(Throwable cause) {
        close(Assert.checkNotNullParam("cause", cause));
    }

    private void close(@Nullable Throwable cause) {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            closeCause = cause;
            LOGGER.debug("Closing event processor for task {}{}", taskId, cause == null ? "" : " with failure " + cause);
            for (EventSubscription subscription : subscriptions) {
                subscription.end(cause);
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits until every subscriber has consumed the whole stream or detached. Publishers that
     * were never subscribed to do not hold this up once the stream has ended.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void awaitDrained() throws InterruptedException {
        for (EventSubscription subscription : subscriptions) {
            subscription.awaitDrained();
        }
    }
}
