package com.jreinhal.concierge.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Circuit breaker and timeout settings for each optional backing store.
 */
@Component
@ConfigurationProperties(prefix = "concierge.resilience")
public class ResilienceProperties {
    private Guard activity = new Guard();
    private Guard semantic = new Guard();
    private Guard graph = new Guard();
    private Guard playbooks = new Guard();

    public static class Guard {
        /**
         * Consecutive failures that open the breaker.
         */
        private int failureThreshold = 5;

        private Duration openDuration = Duration.ofSeconds(30);

        private int halfOpenMaxCalls = 1;

        private long timeoutMs = 2000;

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Duration getOpenDuration() {
            return openDuration;
        }

        public void setOpenDuration(Duration openDuration) {
            this.openDuration = openDuration;
        }

        public int getHalfOpenMaxCalls() {
            return halfOpenMaxCalls;
        }

        public void setHalfOpenMaxCalls(int halfOpenMaxCalls) {
            this.halfOpenMaxCalls = halfOpenMaxCalls;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    public Guard getActivity() {
        return activity;
    }

    public void setActivity(Guard activity) {
        this.activity = activity;
    }

    public Guard getSemantic() {
        return semantic;
    }

    public void setSemantic(Guard semantic) {
        this.semantic = semantic;
    }

    public Guard getGraph() {
        return graph;
    }

    public void setGraph(Guard graph) {
        this.graph = graph;
    }

    public Guard getPlaybooks() {
        return playbooks;
    }

    public void setPlaybooks(Guard playbooks) {
        this.playbooks = playbooks;
    }
}
