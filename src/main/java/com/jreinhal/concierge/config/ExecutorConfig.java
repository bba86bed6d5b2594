package com.jreinhal.concierge.config;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Thread pools for guarded store calls, stream subscriptions, graph projection and HITL outcomes.
 *
 * <p>Rejected tasks are logged and fail with {@link RejectedExecutionException} rather than running
 * on the caller, so a saturated pool degrades its store instead of blocking request threads.</p>
 */
@Configuration
public class ExecutorConfig {
    private static final Logger log = LoggerFactory.getLogger(ExecutorConfig.class);

    @Bean(name = {"storeCallExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor storeCallExecutor(
            @Value("${concierge.executor.store-core-threads:4}") int coreThreads,
            @Value("${concierge.executor.store-max-threads:16}") int maxThreads,
            @Value("${concierge.executor.store-queue-capacity:200}") int queueCapacity) {
        return this.buildExecutor("store-call-", coreThreads, maxThreads, queueCapacity);
    }

    /**
     * Each listener subscription holds a thread for its lifetime, so the pool is fixed-size and
     * subscriptions beyond it wait in the queue.
     */
    @Bean(name = {"activityExecutor"}, destroyMethod = "shutdownNow")
    public ThreadPoolExecutor activityExecutor(
            @Value("${concierge.executor.subscription-threads:16}") int threads) {
        return this.buildExecutor("activity-sub-", threads, threads, Math.max(50, threads * 4));
    }

    @Bean(name = {"projectionExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor projectionExecutor(
            @Value("${concierge.executor.projection-threads:2}") int threads) {
        return this.buildExecutor("graph-proj-", threads, threads, 1000);
    }

    /**
     * Runs HITL outcome listeners after the decision is committed, so a slow feedback store never
     * holds up the reviewer's respond call.
     */
    @Bean(name = {"outcomeExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor outcomeExecutor(
            @Value("${concierge.executor.outcome-threads:2}") int threads,
            @Value("${concierge.executor.outcome-queue-capacity:1000}") int queueCapacity) {
        return this.buildExecutor("hitl-outcome-", threads, threads, queueCapacity);
    }

    private ThreadPoolExecutor buildExecutor(String prefix, int coreThreads, int maxThreads, int queueCapacity) {
        int core = Math.max(1, coreThreads);
        int max = Math.max(core, maxThreads);
        int queue = Math.max(10, queueCapacity);
        ThreadPoolExecutor executor = new ThreadPoolExecutor(core, max, 30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queue), new NamedThreadFactory(prefix), new MonitoredRejectionHandler(prefix));
        executor.allowCoreThreadTimeOut(true);
        log.info("Thread pool '{}' initialized: core={}, max={}, queue={}", prefix, core, max, queue);
        return executor;
    }

    public static final class MonitoredRejectionHandler implements RejectedExecutionHandler {
        private final String poolName;
        private final AtomicLong rejectionCount = new AtomicLong(0);

        public MonitoredRejectionHandler(String poolName) {
            this.poolName = poolName;
        }

        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            long count = this.rejectionCount.incrementAndGet();
            log.warn("Task rejected from pool '{}', queue full. active={}, poolSize={}, queueSize={}, totalRejections={}",
                    this.poolName, executor.getActiveCount(), executor.getPoolSize(), executor.getQueue().size(), count);
            throw new RejectedExecutionException("Thread pool '" + this.poolName + "' overloaded (rejected " + count + " tasks)");
        }

        public long getRejectionCount() {
            return this.rejectionCount.get();
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName(this.prefix + this.counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
