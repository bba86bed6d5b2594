package com.jreinhal.concierge.config;

import com.jreinhal.concierge.util.GuardedCall;
import com.jreinhal.concierge.util.OutageTracker;
import com.jreinhal.concierge.util.SimpleCircuitBreaker;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * One {@link GuardedCall} per optional store. The HITL request and tenant stores are on the core
 * path and deliberately have none.
 */
@Configuration
public class ResilienceConfig {
    private final ResilienceProperties properties;
    private final Clock clock;

    public ResilienceConfig(ResilienceProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @Bean
    public OutageTracker outageTracker() {
        return new OutageTracker(this.clock);
    }

    @Bean(name = {"activityStoreGuard"})
    public GuardedCall activityStoreGuard(@Qualifier("storeCallExecutor") ExecutorService executor, OutageTracker outageTracker) {
        return this.guard("activity", this.properties.getActivity(), executor, outageTracker);
    }

    @Bean(name = {"semanticStoreGuard"})
    public GuardedCall semanticStoreGuard(@Qualifier("storeCallExecutor") ExecutorService executor, OutageTracker outageTracker) {
        return this.guard("semantic", this.properties.getSemantic(), executor, outageTracker);
    }

    @Bean(name = {"graphStoreGuard"})
    public GuardedCall graphStoreGuard(@Qualifier("storeCallExecutor") ExecutorService executor, OutageTracker outageTracker) {
        return this.guard("graph", this.properties.getGraph(), executor, outageTracker);
    }

    @Bean(name = {"playbookStoreGuard"})
    public GuardedCall playbookStoreGuard(@Qualifier("storeCallExecutor") ExecutorService executor, OutageTracker outageTracker) {
        return this.guard("playbooks", this.properties.getPlaybooks(), executor, outageTracker);
    }

    private GuardedCall guard(String store, ResilienceProperties.Guard settings, ExecutorService executor, OutageTracker outageTracker) {
        SimpleCircuitBreaker breaker = new SimpleCircuitBreaker(store, settings.getFailureThreshold(),
                settings.getOpenDuration(), settings.getHalfOpenMaxCalls(), this.clock);
        return new GuardedCall(store, breaker, executor, Duration.ofMillis(Math.max(1L, settings.getTimeoutMs())), outageTracker);
    }
}
