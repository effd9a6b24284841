package io.agentrelay.server.tasks;

import io.agentrelay.spec.PushNotificationConfig;
import io.agentrelay.spec.Task;

/**
 * Delivers the final snapshot of a task to a push notification target once its session ends.
 * Delivery failures are reported by throwing; the caller logs them and moves on to the next target.
 */
public interface PushNotificationSender {

    void send(PushNotificationConfig config, Task task);
}
