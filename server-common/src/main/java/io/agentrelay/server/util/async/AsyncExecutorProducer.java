package io.agentrelay.server.util.async;

import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.agentrelay.server.config.ConfigProvider;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces the bounded worker pool shared by session jobs, event stream forwarders and session
 * monitors.
 * <p>
 * The pool starts a thread per submission until {@code agentrelay.executor.max-pool-size} threads
 * exist, then queues work until a thread frees up. Work never runs on the submitting thread, which
 * may hold a task lock or be serving a request. Idle threads exit after
 * {@code agentrelay.executor.keep-alive-seconds}.
 */
@ApplicationScoped
public class AsyncExecutorProducer {

    private static final Logger LOGGER = LoggerFactory.getLogger(AsyncExecutorProducer.class);

    static final String MAX_POOL_SIZE = "agentrelay.executor.max-pool-size";
    static final String KEEP_ALIVE_SECONDS = "agentrelay.executor.keep-alive-seconds";

    private ConfigProvider configProvider;
    private @Nullable ThreadPoolExecutor executor;

    @SuppressWarnings("NullAway")
    protected AsyncExecutorProducer() {
        // For CDI proxy creation
        this.configProvider = null;
    }

    @Inject
    public AsyncExecutorProducer(ConfigProvider configProvider) {
        this.configProvider = configProvider;
    }

    @Produces
    @Internal
    public synchronized Executor produce() {
        if (executor == null) {
            int maxPoolSize = Integer.parseInt(configProvider.getValue(MAX_POOL_SIZE));
            long keepAliveSeconds = Long.parseLong(configProvider.getValue(KEEP_ALIVE_SECONDS));
            LOGGER.info("Creating worker pool: max={}, keepAlive={}s", maxPoolSize, keepAliveSeconds);
            // core == max so that the unbounded queue is only used once every thread is busy
            ThreadPoolExecutor pool = new ThreadPoolExecutor(maxPoolSize, maxPoolSize, keepAliveSeconds, TimeUnit.SECONDS,
                    new LinkedBlockingQueue<>(), new WorkerThreadFactory());
            pool.allowCoreThreadTimeOut(true);
            executor = pool;
        }
        return executor;
    }

    @PreDestroy
    public synchronized void close() {
        if (executor != null) {
            LOGGER.debug("Shutting down worker pool");
            executor.shutdownNow();
            executor = null;
        }
    }

    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "agentrelay-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
