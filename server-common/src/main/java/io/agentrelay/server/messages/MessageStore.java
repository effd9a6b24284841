package io.agentrelay.server.messages;

import java.util.List;

import io.agentrelay.spec.Message;

/**
 * Storage of conversation messages, grouped by context id. Agents use it to keep the messages
 * exchanged outside of tasks, for example when they answer with plain messages.
 */
public interface MessageStore {

    /**
     * Appends a message to its conversation.
     *
     * @param message the message; its context id must be set
     * @throws IllegalArgumentException if the message has no context id
     */
    void save(Message message);

    List<Message> getByContext(String contextId);

    void deleteByContext(String contextId);

    void replaceByContext(String contextId, List<Message> messages);
}
