package io.agentrelay.server.requesthandlers;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.agentrelay.server.ServerCallContext;
import io.agentrelay.server.agentexecution.AgentExecutor;
import io.agentrelay.server.agentexecution.RequestContext;
import io.agentrelay.server.messages.ContextMessageStore;
import io.agentrelay.server.messages.MessageStore;
import io.agentrelay.server.session.EventStreamClosedException;
import io.agentrelay.server.session.EventSubscription;
import io.agentrelay.server.session.Session;
import io.agentrelay.server.session.SessionEventProcessor;
import io.agentrelay.server.session.SessionManager;
import io.agentrelay.server.session.TaskSessionExistsException;
import io.agentrelay.server.tasks.ContextTaskStore;
import io.agentrelay.server.tasks.PushNotificationConfigStore;
import io.agentrelay.server.tasks.TaskStore;
import io.agentrelay.server.util.async.Internal;
import io.agentrelay.spec.A2AError;
import io.agentrelay.spec.DeleteTaskPushNotificationConfigParams;
import io.agentrelay.spec.Event;
import io.agentrelay.spec.GetTaskPushNotificationConfigParams;
import io.agentrelay.spec.InternalError;
import io.agentrelay.spec.InvalidParamsError;
import io.agentrelay.spec.ListTaskPushNotificationConfigParams;
import io.agentrelay.spec.Message;
import io.agentrelay.spec.MessageSendConfiguration;
import io.agentrelay.spec.MessageSendParams;
import io.agentrelay.spec.PushNotificationConfig;
import io.agentrelay.spec.Task;
import io.agentrelay.spec.TaskEvent;
import io.agentrelay.spec.TaskIdParams;
import io.agentrelay.spec.TaskNotFoundError;
import io.agentrelay.spec.TaskPushNotificationConfig;
import io.agentrelay.spec.TaskQueryParams;
import io.agentrelay.spec.TaskState;
import io.agentrelay.spec.TaskStatus;
import io.agentrelay.spec.TaskStatusUpdateEvent;
import io.agentrelay.spec.UnsupportedOperationError;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves the protocol operations by running the {@link AgentExecutor} in {@link Session}s.
 * <p>
 * Every message send creates a session for its task and registers it with the
 * {@link SessionManager} before the agent starts. Requests are validated synchronously, so an
 * invalid request fails without leaving a registered session behind. Once the agent runs, its
 * failures end the event stream instead of failing the call.
 */
@ApplicationScoped
public class DefaultRequestHandler implements RequestHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultRequestHandler.class);

    // Fields set by constructor injection cannot be final. We need a noargs constructor for
    // Jakarta compatibility, and it seems that making fields set by constructor injection
    // final, is not proxyable in all runtimes
    private AgentExecutor agentExecutor;
    private TaskStore taskStore;
    private MessageStore messageStore;
    private @Nullable PushNotificationConfigStore pushConfigStore;
    private SessionManager sessionManager;
    private Executor executor;

    @SuppressWarnings("NullAway")
    protected DefaultRequestHandler() {
        // For CDI proxy creation
        this.agentExecutor = null;
        this.taskStore = null;
        this.messageStore = null;
        this.sessionManager = null;
        this.executor = null;
    }

    @Inject
    public DefaultRequestHandler(AgentExecutor agentExecutor, TaskStore taskStore, MessageStore messageStore,
                                 @Nullable PushNotificationConfigStore pushConfigStore, SessionManager sessionManager,
                                 @Internal Executor executor) {
        this.agentExecutor = agentExecutor;
        this.taskStore = taskStore;
        this.messageStore = messageStore;
        this.pushConfigStore = pushConfigStore;
        this.sessionManager = sessionManager;
        this.executor = executor;
    }

    @Override
    public Task onGetTask(TaskQueryParams params, @Nullable ServerCallContext context) throws A2AError {
        LOGGER.debug("onGetTask {}", params.id());
        Task task = taskStore.get(params.id(), params.historyLength(), true);
        if (task == null) {
            throw new TaskNotFoundError("Task '" + params.id() + "' not found");
        }
        return task;
    }

    @Override
    public Task onCancelTask(TaskIdParams params, @Nullable ServerCallContext context) throws A2AError {
        String taskId = params.id();
        Session session = sessionManager.sessionForTask(taskId);
        if (session == null) {
            cancelStoredTask(taskId);
        } else {
            LOGGER.debug("Cancelling running session of task {}", taskId);
            RequestContext<TaskIdParams> requestContext = requestContext(session.getContextId(), taskId, params, context);
            agentExecutor.cancel(requestContext, session);
            sessionManager.closeSession(session);
        }

        Task task = taskStore.get(taskId, 0, true);
        if (task == null) {
            throw new TaskNotFoundError("Task '" + taskId + "' not found");
        }
        return task;
    }

    private void cancelStoredTask(String taskId) {
        Task task = taskStore.get(taskId, 0, false);
        if (task == null) {
            throw new TaskNotFoundError("Task '" + taskId + "' not found");
        }
        TaskState state = task.status().state();
        if (state == TaskState.CANCELED) {
            return;
        }
        if (state.isFinal()) {
            throw new UnsupportedOperationError("Task '" + taskId + "' is in terminal state "
                    + state.asString() + " and cannot be canceled");
        }
        LOGGER.debug("Cancelling task {} without running session", taskId);
        taskStore.update(TaskStatusUpdateEvent.builder()
                .taskId(taskId)
                .contextId(task.contextId())
                .status(new TaskStatus(TaskState.CANCELED, null, OffsetDateTime.now(ZoneOffset.UTC)))
                .isFinal(true)
                .build());
    }

    @Override
    public Event onMessageSend(MessageSendParams params, @Nullable ServerCallContext context) throws A2AError {
        MessageSendConfiguration configuration = params.configuration();
        boolean blocking = configuration != null && Boolean.TRUE.equals(configuration.blocking());
        EventSubscription subscription = startSession(params, context);

        if (!blocking) {
            Event first = nextEventOrNull(subscription);
            subscription.cancel();
            if (first instanceof Message || first instanceof Task) {
                return first;
            }
            throw new InternalError("Expected the agent to answer with a message or a task, got "
                    + (first == null ? "no event" : first.kind()));
        }

        Event last = null;
        try {
            while (true) {
                last = subscription.next();
            }
        } catch (EventStreamClosedException e) {
            if (e.getCause() != null) {
                throw asA2AError(e.getCause());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            subscription.cancel();
            throw new InternalError("Interrupted while waiting for the agent", e);
        }

        if (last instanceof TaskEvent taskEvent) {
            Integer historyLength = configuration.historyLength();
            Task task = taskStore.get(taskEvent.taskId(), historyLength, true);
            if (task == null) {
                throw new TaskNotFoundError("Task '" + taskEvent.taskId() + "' not found");
            }
            return task;
        }
        if (last == null) {
            throw new InternalError("Agent finished without producing any event");
        }
        return last;
    }

    private @Nullable Event nextEventOrNull(EventSubscription subscription) {
        try {
            return subscription.next();
        } catch (EventStreamClosedException e) {
            if (e.getCause() != null) {
                throw asA2AError(e.getCause());
            }
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            subscription.cancel();
            throw new InternalError("Interrupted while waiting for the agent", e);
        }
    }

    @Override
    public Flow.Publisher<Event> onMessageSendStream(MessageSendParams params, @Nullable ServerCallContext context)
            throws A2AError {
        return startSession(params, context).toPublisher(executor);
    }

    @Override
    public Flow.Publisher<Event> onResubscribeToTask(TaskIdParams params, @Nullable ServerCallContext context)
            throws A2AError {
        Session session = sessionManager.sessionForTask(params.id());
        if (session == null) {
            throw new UnsupportedOperationError("Task '" + params.id() + "' has no running session to resubscribe to");
        }
        LOGGER.debug("Resubscribing to task {}", params.id());
        return session.getEventProcessor().subscribe().toPublisher(executor);
    }

    /**
     * Validates the request, registers a session for its task, subscribes to the session and
     * starts it. The subscription sees every event the agent publishes.
     */
    private EventSubscription startSession(MessageSendParams params, @Nullable ServerCallContext context) {
        Message message = params.message();
        SessionEventProcessor processor;
        if (message.taskId() != null) {
            String taskId = message.taskId();
            if (sessionManager.sessionForTask(taskId) != null) {
                throw new UnsupportedOperationError("Task '" + taskId + "' is still running");
            }
            Task task = taskStore.get(taskId);
            if (task == null) {
                throw new TaskNotFoundError("Task '" + taskId + "' not found");
            }
            if (!Objects.equals(message.contextId(), task.contextId())) {
                throw new InvalidParamsError("Message contextId '" + message.contextId()
                        + "' does not match the contextId '" + task.contextId() + "' of task '" + taskId + "'");
            }
            processor = new SessionEventProcessor(task.contextId(), taskId, taskStore, task);
        } else {
            String contextId = message.contextId() != null ? message.contextId() : UUID.randomUUID().toString();
            processor = new SessionEventProcessor(contextId, UUID.randomUUID().toString(), taskStore, null);
        }

        RequestContext<MessageSendParams> requestContext =
                requestContext(processor.getContextId(), processor.getTaskId(), params, context);
        SessionEventProcessor eventProcessor = processor;
        Session session = new Session(processor, executor, () -> {
            try {
                agentExecutor.execute(requestContext, eventProcessor);
                eventProcessor.close();
            } catch (Throwable t) {
                eventProcessor.closeExceptionally(t);
                throw t;
            }
        });

        try {
            sessionManager.addSession(session);
        } catch (TaskSessionExistsException e) {
            throw new UnsupportedOperationError("Task '" + e.getTaskId() + "' is still running");
        }

        EventSubscription subscription = null;
        try {
            MessageSendConfiguration configuration = params.configuration();
            if (configuration != null && configuration.pushNotificationConfig() != null && pushConfigStore != null) {
                pushConfigStore.save(processor.getTaskId(), configuration.pushNotificationConfig());
            }
            subscription = processor.subscribe();
            session.start();
        } catch (RuntimeException e) {
            LOGGER.debug("Failed to start session for task {}, discarding it", processor.getTaskId(), e);
            if (subscription != null) {
                subscription.cancel();
            }
            sessionManager.closeSession(session);
            throw e;
        }
        LOGGER.debug("Started session for task {} in context {}", processor.getTaskId(), processor.getContextId());
        return subscription;
    }

    private <P> RequestContext<P> requestContext(String contextId, String taskId, P params,
                                                 @Nullable ServerCallContext context) {
        return new RequestContext<>(contextId, taskId, params, context,
                new ContextTaskStore(contextId, taskStore),
                new ContextMessageStore(contextId, messageStore));
    }

    private static A2AError asA2AError(Throwable failure) {
        if (failure instanceof A2AError error) {
            return error;
        }
        return new InternalError(failure.getMessage(), failure);
    }

    @Override
    public TaskPushNotificationConfig onSetTaskPushNotificationConfig(TaskPushNotificationConfig params,
                                                                      @Nullable ServerCallContext context) throws A2AError {
        PushNotificationConfigStore store = requirePushConfigStore();
        requireTask(params.taskId());
        PushNotificationConfig saved = store.save(params.taskId(), params.pushNotificationConfig());
        return new TaskPushNotificationConfig(params.taskId(), saved);
    }

    @Override
    public TaskPushNotificationConfig onGetTaskPushNotificationConfig(GetTaskPushNotificationConfigParams params,
                                                                      @Nullable ServerCallContext context) throws A2AError {
        PushNotificationConfigStore store = requirePushConfigStore();
        requireTask(params.id());
        String configId = params.pushNotificationConfigId();
        for (PushNotificationConfig config : store.getAll(params.id())) {
            if (configId == null || configId.equals(config.id())) {
                return new TaskPushNotificationConfig(params.id(), config);
            }
        }
        throw new InternalError("No push notification config found");
    }

    @Override
    public List<TaskPushNotificationConfig> onListTaskPushNotificationConfig(ListTaskPushNotificationConfigParams params,
                                                                             @Nullable ServerCallContext context) throws A2AError {
        PushNotificationConfigStore store = requirePushConfigStore();
        requireTask(params.id());
        return store.getAll(params.id()).stream()
                .map(config -> new TaskPushNotificationConfig(params.id(), config))
                .toList();
    }

    @Override
    public void onDeleteTaskPushNotificationConfig(DeleteTaskPushNotificationConfigParams params,
                                                   @Nullable ServerCallContext context) throws A2AError {
        PushNotificationConfigStore store = requirePushConfigStore();
        requireTask(params.id());
        store.delete(params.id(), params.pushNotificationConfigId());
    }

    private PushNotificationConfigStore requirePushConfigStore() {
        if (pushConfigStore == null) {
            throw new UnsupportedOperationError("Push notifications are not configured");
        }
        return pushConfigStore;
    }

    private void requireTask(String taskId) {
        if (taskStore.get(taskId, 0, false) == null) {
            throw new TaskNotFoundError("Task '" + taskId + "' not found");
        }
    }
}
