package io.agentrelay.server.tasks;

import java.util.List;

import io.agentrelay.spec.Task;
import io.agentrelay.spec.TaskEvent;
import io.agentrelay.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * A view of a {@link TaskStore} limited to the tasks of one conversation. Agents receive this
 * view through their request context, so they cannot read or update tasks of other conversations.
 */
public class ContextTaskStore {

    private final String contextId;
    private final TaskStore taskStore;

    public ContextTaskStore(String contextId, TaskStore taskStore) {
        this.contextId = Assert.checkNotNullParam("contextId", contextId);
        this.taskStore = Assert.checkNotNullParam("taskStore", taskStore);
    }

    public String getContextId() {
        return contextId;
    }

    public @Nullable Task get(String taskId, @Nullable Integer historyLength, boolean includeArtifacts) {
        Task task = taskStore.get(taskId, historyLength, includeArtifacts);
        if (task == null || !contextId.equals(task.contextId())) {
            return null;
        }
        return task;
    }

    public @Nullable Task get(String taskId) {
        return get(taskId, null, true);
    }

    public List<Task> getAll() {
        return taskStore.getByContext(contextId);
    }

    /**
     * Merges an event of this conversation into the store.
     *
     * @throws IllegalArgumentException if the event belongs to another conversation
     */
    public Task update(TaskEvent event) {
        if (!contextId.equals(event.contextId())) {
            throw new IllegalArgumentException("Event contextId '" + event.contextId()
                    + "' does not match the current context '" + contextId + "'");
        }
        return taskStore.update(event);
    }

    public void delete(String taskId) {
        if (get(taskId, 0, false) != null) {
            taskStore.delete(taskId);
        }
    }
}
