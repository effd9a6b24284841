package io.agentrelay.server.tasks;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import io.agentrelay.spec.Artifact;
import io.agentrelay.spec.Message;
import io.agentrelay.spec.Part;
import io.agentrelay.spec.Task;
import io.agentrelay.spec.TaskArtifactUpdateEvent;
import io.agentrelay.spec.TaskEvent;
import io.agentrelay.spec.TaskStatusUpdateEvent;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the next snapshot of a task from its current snapshot and a {@link TaskEvent}.
 * <ul>
 *   <li>a {@link Task} replaces the snapshot;</li>
 *   <li>a {@link TaskStatusUpdateEvent} replaces the status, moving the message of the previous
 *   status into the history, and merges its metadata into the task metadata;</li>
 *   <li>a {@link TaskArtifactUpdateEvent} adds its artifact, replaces the artifact with the same id,
 *   or, when appending, adds its parts to that artifact.</li>
 * </ul>
 */
public class TaskStateProcessor {

    private static final Logger LOGGER = LoggerFactory.getLogger(TaskStateProcessor.class);

    public Task apply(@Nullable Task current, TaskEvent event) throws TaskStoreException {
        if (event instanceof Task task) {
            return task;
        }
        if (current == null) {
            throw new TaskStoreException(event.taskId(), "Task '" + event.taskId() + "' does not exist");
        }
        if (event instanceof TaskStatusUpdateEvent statusUpdate) {
            return applyStatusUpdate(current, statusUpdate);
        }
        return applyArtifactUpdate(current, (TaskArtifactUpdateEvent) event);
    }

    private Task applyStatusUpdate(Task task, TaskStatusUpdateEvent event) {
        Task.Builder builder = Task.builder(task)
                .status(event.status());

        Message previousMessage = task.status().message();
        if (previousMessage != null) {
            List<Message> history = new ArrayList<>(task.history());
            history.add(previousMessage);
            builder.history(history);
        }

        if (event.metadata() != null) {
            Map<String, Object> metadata = task.metadata() == null ? new HashMap<>() : new HashMap<>(task.metadata());
            metadata.putAll(event.metadata());
            builder.metadata(metadata);
        }
        return builder.build();
    }

    private Task applyArtifactUpdate(Task task, TaskArtifactUpdateEvent event) {
        Artifact artifact = event.artifact();
        List<Artifact> artifacts = new ArrayList<>(task.artifacts());

        int existingIndex = -1;
        for (int i = 0; i < artifacts.size(); i++) {
            if (artifacts.get(i).artifactId().equals(artifact.artifactId())) {
                existingIndex = i;
                break;
            }
        }

        if (!event.appending()) {
            if (existingIndex >= 0) {
                LOGGER.debug("Replacing artifact {} of task {}", artifact.artifactId(), task.id());
                artifacts.set(existingIndex, artifact);
            } else {
                artifacts.add(artifact);
            }
        } else if (existingIndex >= 0) {
            Artifact existing = artifacts.get(existingIndex);
            List<Part> parts = new ArrayList<>(existing.parts());
            parts.addAll(artifact.parts());
            artifacts.set(existingIndex, Artifact.builder(existing).parts(parts).build());
        } else {
            // Chunks of an artifact that was never started are ignored
            LOGGER.warn("Received append=true for nonexistent artifact {} of task {}, ignoring chunk",
                    artifact.artifactId(), task.id());
            return task;
        }
        return Task.builder(task).artifacts(artifacts).build();
    }
}
