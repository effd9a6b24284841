package io.agentrelay.server.tasks;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;

import io.agentrelay.spec.PushNotificationConfig;
import org.jspecify.annotations.Nullable;

@ApplicationScoped
public class InMemoryPushNotificationConfigStore implements PushNotificationConfigStore {

    private final Map<String, List<PushNotificationConfig>> configs = new ConcurrentHashMap<>();

    @Override
    public List<PushNotificationConfig> getAll(String taskId) {
        List<PushNotificationConfig> taskConfigs = configs.get(taskId);
        return taskConfigs == null ? List.of() : taskConfigs;
    }

    @Override
    public PushNotificationConfig save(String taskId, PushNotificationConfig config) {
        PushNotificationConfig toSave = config.id() == null ? config.withId(taskId) : config;
        configs.compute(taskId, (id, existing) -> {
            List<PushNotificationConfig> updated = new ArrayList<>();
            if (existing != null) {
                existing.stream()
                        .filter(c -> !toSave.id().equals(c.id()))
                        .forEach(updated::add);
            }
            updated.add(toSave);
            return List.copyOf(updated);
        });
        return toSave;
    }

    @Override
    public void delete(String taskId, @Nullable String configId) {
        if (configId == null) {
            configs.remove(taskId);
            return;
        }
        configs.computeIfPresent(taskId, (id, existing) -> {
            List<PushNotificationConfig> remaining = existing.stream()
                    .filter(c -> !configId.equals(c.id()))
                    .toList();
            return remaining.isEmpty() ? null : remaining;
        });
    }
}
