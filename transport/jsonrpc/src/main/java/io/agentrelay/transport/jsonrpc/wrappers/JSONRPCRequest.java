package io.agentrelay.transport.jsonrpc.wrappers;

import io.agentrelay.util.Assert;

/**
 * A request envelope: the client-chosen id the response is correlated with, and the operation
 * parameters.
 *
 * @param id the request id, a string or a number
 * @param params the operation parameters
 * @param <P> the parameters type
 */
public record JSONRPCRequest<P>(Object id, P params) {

    public JSONRPCRequest {
        Assert.checkNotNullParam("id", id);
        Assert.checkNotNullParam("params", params);
    }
}
