package io.agentrelay.server.tasks;

import java.util.List;

import io.agentrelay.spec.Task;
import io.agentrelay.spec.TaskEvent;
import org.jspecify.annotations.Nullable;

/**
 * Storage of task snapshots.
 * <p>
 * Tasks are never written directly: every change arrives as a {@link TaskEvent} which the store
 * merges into the current snapshot (see {@link TaskStateProcessor} for the merge rules). The
 * session event processor mirrors each emitted task event here before delivering it, so the
 * store always reflects what subscribers have seen.
 * <p>
 * Implementations must be thread-safe: concurrent sessions update different tasks in parallel,
 * while readers query any task at any time.
 *
 * @see InMemoryTaskStore
 */
public interface TaskStore {

    /**
     * Returns a task snapshot.
     *
     * @param taskId the task id
     * @param historyLength the number of most recent history messages to keep; {@code null}
     *                      keeps the whole history and {@code 0} none
     * @param includeArtifacts whether the artifacts are returned
     * @return the task, or {@code null} if it does not exist
     */
    @Nullable Task get(String taskId, @Nullable Integer historyLength, boolean includeArtifacts);

    /**
     * Returns the full snapshot of a task, with its whole history and all artifacts.
     *
     * @param taskId the task id
     * @return the task, or {@code null} if it does not exist
     */
    default @Nullable Task get(String taskId) {
        return get(taskId, null, true);
    }

    /**
     * Returns every task of a conversation.
     *
     * @param contextId the conversation id
     * @return the tasks, possibly empty
     */
    List<Task> getByContext(String contextId);

    /**
     * Merges an event into the stored snapshot of its task.
     *
     * @param event the event
     * @return the updated snapshot
     * @throws TaskStoreException if the event updates a task that does not exist
     */
    Task update(TaskEvent event) throws TaskStoreException;

    void delete(String taskId);
}
