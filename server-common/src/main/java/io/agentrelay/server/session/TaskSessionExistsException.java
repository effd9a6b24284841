package io.agentrelay.server.session;

/**
 * Thrown when a session is registered for a task that already has a running session. This is a
 * caller error: retrying will fail the same way until the running session ends.
 */
public class TaskSessionExistsException extends IllegalStateException {

    private final String taskId;

    public TaskSessionExistsException(String taskId) {
        super("Session for task '" + taskId + "' already exists");
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
