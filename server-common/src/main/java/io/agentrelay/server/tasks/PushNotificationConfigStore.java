package io.agentrelay.server.tasks;

import java.util.List;

import io.agentrelay.spec.PushNotificationConfig;
import org.jspecify.annotations.Nullable;

/**
 * Storage of the push notification targets registered for tasks.
 */
public interface PushNotificationConfigStore {

    /**
     * Returns the configs registered for a task.
     *
     * @param taskId the task id
     * @return the configs, possibly empty
     */
    List<PushNotificationConfig> getAll(String taskId);

    /**
     * Saves a config for a task, replacing the config with the same id. A config without id is
     * saved under the task id.
     *
     * @param taskId the task id
     * @param config the config
     * @return the saved config, with its id set
     */
    PushNotificationConfig save(String taskId, PushNotificationConfig config);

    /**
     * Deletes a config of a task.
     *
     * @param taskId the task id
     * @param configId the config id; {@code null} deletes every config of the task
     */
    void delete(String taskId, @Nullable String configId);
}
