package io.agentrelay.server.agentexecution;

import io.agentrelay.server.session.Session;
import io.agentrelay.server.session.SessionEventProcessor;
import io.agentrelay.spec.A2AError;
import io.agentrelay.spec.MessageSendParams;
import io.agentrelay.spec.TaskIdParams;

/**
 * The agent logic served by the request handler.
 * <p>
 * {@link #execute} runs on a worker thread inside a {@link Session}. It answers either with a
 * single message or by working on the session's task, publishing every change through the
 * {@link SessionEventProcessor}. The event stream ends when {@code execute} returns; an exception
 * ends it with that failure.
 * <pre>{@code
 * public void execute(RequestContext<MessageSendParams> context, SessionEventProcessor processor) {
 *     processor.sendTaskEvent(Task.builder()
 *             .id(context.getTaskId())
 *             .contextId(context.getContextId())
 *             .status(new TaskStatus(TaskState.WORKING))
 *             .build());
 *     // ... do the work, publish artifacts ...
 *     processor.sendTaskEvent(TaskStatusUpdateEvent.builder()
 *             .taskId(context.getTaskId())
 *             .contextId(context.getContextId())
 *             .status(new TaskStatus(TaskState.COMPLETED))
 *             .isFinal(true)
 *             .build());
 * }
 * }</pre>
 */
public interface AgentExecutor {

    /**
     * Serves a message send.
     *
     * @param context the request context, scoped to the conversation
     * @param eventProcessor the stream to publish to
     * @throws A2AError to fail the request with a protocol error
     */
    void execute(RequestContext<MessageSendParams> context, SessionEventProcessor eventProcessor) throws A2AError;

    /**
     * Called when a client cancels the task of a running session, before the session is closed.
     * Implementations typically publish a final {@code CANCELED} status update through
     * {@link Session#getEventProcessor()}. Throwing aborts the cancellation and leaves the session
     * running.
     *
     * @param context the request context of the cancel request
     * @param session the running session
     * @throws A2AError if the task cannot be cancelled
     */
    default void cancel(RequestContext<TaskIdParams> context, Session session) throws A2AError {
    }
}
