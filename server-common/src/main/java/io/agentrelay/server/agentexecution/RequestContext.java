package io.agentrelay.server.agentexecution;

import io.agentrelay.server.ServerCallContext;
import io.agentrelay.server.messages.ContextMessageStore;
import io.agentrelay.server.tasks.ContextTaskStore;
import io.agentrelay.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * What an agent knows about the request it serves: the conversation and task ids, the request
 * parameters, the caller and storage views limited to the conversation.
 *
 * @param <P> the request parameters type
 */
public class RequestContext<P> {

    private final String contextId;
    private final String taskId;
    private final P params;
    private final @Nullable ServerCallContext callContext;
    private final ContextTaskStore taskStore;
    private final ContextMessageStore messageStore;

    public RequestContext(String contextId, String taskId, P params, @Nullable ServerCallContext callContext,
                          ContextTaskStore taskStore, ContextMessageStore messageStore) {
        this.contextId = Assert.checkNotNullParam("contextId", contextId);
        this.taskId = Assert.checkNotNullParam("taskId", taskId);
        this.params = Assert.checkNotNullParam("params", params);
        this.callContext = callContext;
        this.taskStore = Assert.checkNotNullParam("taskStore", taskStore);
        this.messageStore = Assert.checkNotNullParam("messageStore", messageStore);
    }

    public String getContextId() {
        return contextId;
    }

    public String getTaskId() {
        return taskId;
    }

    public P getParams() {
        return params;
    }

    public @Nullable ServerCallContext getCallContext() {
        return callContext;
    }

    public ContextTaskStore getTaskStore() {
        return taskStore;
    }

    public ContextMessageStore getMessageStore() {
        return messageStore;
    }
}
