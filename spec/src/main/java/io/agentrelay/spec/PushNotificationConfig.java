package io.agentrelay.spec;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.agentrelay.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Where, and with which token, final task snapshots are pushed.
 *
 * @param id config id, unique per task; defaults to the task id when saved without one
 * @param url the callback URL
 * @param token optional token sent along with each notification
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PushNotificationConfig(@Nullable String id, String url, @Nullable String token) {

    public PushNotificationConfig {
        Assert.checkNotBlankParam("url", url);
    }

    public PushNotificationConfig(String url) {
        this(null, url, null);
    }

    public PushNotificationConfig withId(String id) {
        return new PushNotificationConfig(id, url, token);
    }
}
