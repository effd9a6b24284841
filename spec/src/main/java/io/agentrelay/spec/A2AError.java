package io.agentrelay.spec;

import org.jspecify.annotations.Nullable;

/**
 * Base class of the protocol errors an operation may fail with.
 * <p>
 * Each error carries the numeric code it is reported with on the wire (see {@link A2AErrorCodes}),
 * a human readable message and optional structured data. Errors raised by an agent are
 * propagated to the caller unchanged.
 */
public class A2AError extends RuntimeException {

    private final int code;
    private final @Nullable Object data;

    public A2AError(int code, String message, @Nullable Object data) {
        super(message);
        this.code = code;
        this.data = data;
    }

    public A2AError(int code, String message, @Nullable Object data, @Nullable Throwable cause) {
        super(message, cause);
        this.code = code;
        this.data = data;
    }

    public int getCode() {
        return code;
    }

    public @Nullable Object getData() {
        return data;
    }
}
