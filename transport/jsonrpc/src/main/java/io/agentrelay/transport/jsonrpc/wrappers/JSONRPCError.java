package io.agentrelay.transport.jsonrpc.wrappers;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.agentrelay.spec.A2AError;
import org.jspecify.annotations.Nullable;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JSONRPCError(int code, String message, @Nullable Object data) {

    public static JSONRPCError from(A2AError error) {
        return new JSONRPCError(error.getCode(), error.getMessage(), error.getData());
    }
}
