package io.agentrelay.server.messages;

import java.util.List;

import io.agentrelay.spec.Message;
import io.agentrelay.util.Assert;

/**
 * A view of a {@link MessageStore} limited to one conversation.
 */
public class ContextMessageStore {

    private final String contextId;
    private final MessageStore messageStore;

    public ContextMessageStore(String contextId, MessageStore messageStore) {
        this.contextId = Assert.checkNotNullParam("contextId", contextId);
        this.messageStore = Assert.checkNotNullParam("messageStore", messageStore);
    }

    public void save(Message message) {
        checkContext(message);
        messageStore.save(message);
    }

    public List<Message> getAll() {
        return messageStore.getByContext(contextId);
    }

    public void deleteAll() {
        messageStore.deleteByContext(contextId);
    }

    public void replaceAll(List<Message> messages) {
        messages.forEach(this::checkContext);
        messageStore.replaceByContext(contextId, messages);
    }

    private void checkContext(Message message) {
        if (!contextId.equals(message.contextId())) {
            throw new IllegalArgumentException("Message contextId '" + message.contextId()
                    + "' does not match the current context '" + contextId + "'");
        }
    }
}
