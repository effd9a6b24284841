package io.agentrelay.spec;

import io.agentrelay.util.Assert;

public record ListTaskPushNotificationConfigParams(String id) {

    public ListTaskPushNotificationConfigParams {
        Assert.checkNotNullParam("id", id);
    }
}
