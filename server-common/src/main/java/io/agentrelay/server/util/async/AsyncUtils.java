package io.agentrelay.server.util.async;

import mutiny.zero.BackpressureStrategy;
import mutiny.zero.TubeConfiguration;

public final class AsyncUtils {

    private AsyncUtils() {
    }

    /**
     * Returns the tube configuration used by every event stream publisher. Streams buffer
     * without bound so that no event is ever dropped for a slow subscriber.
     *
     * @return the tube configuration
     */
    public static TubeConfiguration createTubeConfig() {
        return new TubeConfiguration()
                .withBackpressureStrategy(BackpressureStrategy.UNBOUNDED_BUFFER)
                .withBufferSize(256);
    }
}
