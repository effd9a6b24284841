package io.agentrelay.server.tasks;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;

import io.agentrelay.spec.Artifact;
import io.agentrelay.spec.Message;
import io.agentrelay.spec.Task;
import io.agentrelay.spec.TaskEvent;
import org.jspecify.annotations.Nullable;

@ApplicationScoped
public class InMemoryTaskStore implements TaskStore {

    private final ConcurrentMap<String, Task> tasks = new ConcurrentHashMap<>();
    private final TaskStateProcessor stateProcessor = new TaskStateProcessor();

    @Override
    public @Nullable Task get(String taskId, @Nullable Integer historyLength, boolean includeArtifacts) {
        Task task = tasks.get(taskId);
        if (task == null) {
            return null;
        }
        return transformTask(task, historyLength, includeArtifacts);
    }

    @Override
    public List<Task> getByContext(String contextId) {
        return tasks.values().stream()
                .filter(task -> contextId.equals(task.contextId()))
                .toList();
    }

    @Override
    public Task update(TaskEvent event) throws TaskStoreException {
        // compute() leaves the map untouched when the merge throws
        return tasks.compute(event.taskId(), (id, current) -> stateProcessor.apply(current, event));
    }

    @Override
    public void delete(String taskId) {
        tasks.remove(taskId);
    }

    private Task transformTask(Task task, @Nullable Integer historyLength, boolean includeArtifacts) {
        List<Message> history = task.history();
        if (historyLength != null && history.size() > historyLength) {
            history = history.subList(history.size() - historyLength, history.size());
        }

        List<Artifact> artifacts = includeArtifacts ? task.artifacts() : List.of();

        if (history == task.history() && artifacts == task.artifacts()) {
            return task;
        }
        return Task.builder(task)
                .artifacts(artifacts)
                .history(history)
                .build();
    }
}
