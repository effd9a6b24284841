package io.agentrelay.server.messages;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;

import io.agentrelay.spec.Message;
import io.agentrelay.util.Utils;

@ApplicationScoped
public class InMemoryMessageStore implements MessageStore {

    private final ConcurrentMap<String, List<Message>> messages = new ConcurrentHashMap<>();

    @Override
    public void save(Message message) {
        String contextId = message.contextId();
        if (contextId == null) {
            throw new IllegalArgumentException("Message '" + message.messageId() + "' has no contextId");
        }
        messages.compute(contextId, (id, existing) -> List.copyOf(Utils.appendToList(existing, message)));
    }

    @Override
    public List<Message> getByContext(String contextId) {
        return messages.getOrDefault(contextId, List.of());
    }

    @Override
    public void deleteByContext(String contextId) {
        messages.remove(contextId);
    }

    @Override
    public void replaceByContext(String contextId, List<Message> replacement) {
        for (Message message : replacement) {
            if (!contextId.equals(message.contextId())) {
                throw new IllegalArgumentException("Message '" + message.messageId()
                        + "' does not belong to context '" + contextId + "'");
            }
        }
        messages.put(contextId, List.copyOf(replacement));
    }
}
