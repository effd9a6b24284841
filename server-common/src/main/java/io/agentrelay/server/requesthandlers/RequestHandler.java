package io.agentrelay.server.requesthandlers;

import java.util.List;
import java.util.concurrent.Flow;

import io.agentrelay.server.ServerCallContext;
import io.agentrelay.spec.A2AError;
import io.agentrelay.spec.DeleteTaskPushNotificationConfigParams;
import io.agentrelay.spec.Event;
import io.agentrelay.spec.GetTaskPushNotificationConfigParams;
import io.agentrelay.spec.ListTaskPushNotificationConfigParams;
import io.agentrelay.spec.MessageSendParams;
import io.agentrelay.spec.Task;
import io.agentrelay.spec.TaskIdParams;
import io.agentrelay.spec.TaskPushNotificationConfig;
import io.agentrelay.spec.TaskQueryParams;
import org.jspecify.annotations.Nullable;

/**
 * The protocol operations, independent of any transport.
 */
public interface RequestHandler {

    Task onGetTask(TaskQueryParams params, @Nullable ServerCallContext context) throws A2AError;

    Task onCancelTask(TaskIdParams params, @Nullable ServerCallContext context) throws A2AError;

    /**
     * @return a {@link io.agentrelay.spec.Message} or a {@link Task}
     */
    Event onMessageSend(MessageSendParams params, @Nullable ServerCallContext context) throws A2AError;

    Flow.Publisher<Event> onMessageSendStream(MessageSendParams params, @Nullable ServerCallContext context) throws A2AError;

    Flow.Publisher<Event> onResubscribeToTask(TaskIdParams params, @Nullable ServerCallContext context) throws A2AError;

    TaskPushNotificationConfig onSetTaskPushNotificationConfig(TaskPushNotificationConfig params,
                                                               @Nullable ServerCallContext context) throws A2AError;

    TaskPushNotificationConfig onGetTaskPushNotificationConfig(GetTaskPushNotificationConfigParams params,
                                                               @Nullable ServerCallContext context) throws A2AError;

    List<TaskPushNotificationConfig> onListTaskPushNotificationConfig(ListTaskPushNotificationConfigParams params,
                                                                      @Nullable ServerCallContext context) throws A2AError;

    void onDeleteTaskPushNotificationConfig(DeleteTaskPushNotificationConfigParams params,
                                            @Nullable ServerCallContext context) throws A2AError;
}
