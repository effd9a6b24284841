package io.agentrelay.transport.jsonrpc.wrappers;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.agentrelay.spec.A2AError;
import io.agentrelay.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * A response envelope carrying either a result or an error, never both.
 *
 * @param jsonrpc the protocol version, always {@value #JSONRPC_VERSION}
 * @param id the id of the request this response answers
 * @param result the result, for a successful call
 * @param error the error, for a failed call
 * @param <R> the result type
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JSONRPCResponse<R>(String jsonrpc, Object id, @Nullable R result, @Nullable JSONRPCError error) {

    public static final String JSONRPC_VERSION = "2.0";

    public JSONRPCResponse {
        Assert.checkNotNullParam("jsonrpc", jsonrpc);
        Assert.checkNotNullParam("id", id);
        if (result != null && error != null) {
            throw new IllegalArgumentException("Invalid response: cannot have both result and error");
        }
    }

    public static <R> JSONRPCResponse<R> success(Object id, @Nullable R result) {
        return new JSONRPCResponse<>(JSONRPC_VERSION, id, result, null);
    }

    public static <R> JSONRPCResponse<R> failure(Object id, A2AError error) {
        return new JSONRPCResponse<>(JSONRPC_VERSION, id, null, JSONRPCError.from(error));
    }

    public boolean failed() {
        return error != null;
    }
}
