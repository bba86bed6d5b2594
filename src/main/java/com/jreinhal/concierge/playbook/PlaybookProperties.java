package com.jreinhal.concierge.playbook;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "concierge.playbook")
public class PlaybookProperties {
    /**
     * Resolutions a pattern needs before it becomes a playbook or is suggested.
     */
    private int minSamples = 3;

    /**
     * Success rate a playbook must hold to be suggested. Playbooks that fall below it are
     * superseded.
     */
    private double minSuccessRate = 0.7;

    /**
     * Prefix similarity at or above which two step sequences are treated as one pattern.
     */
    private double mergeSimilarity = 0.6;

    private int maxSuggestions = 3;

    public int getMinSamples() {
        return minSamples;
    }

    public void setMinSamples(int minSamples) {
        this.minSamples = minSamples;
    }

    public double getMinSuccessRate() {
        return minSuccessRate;
    }

    public void setMinSuccessRate(double minSuccessRate) {
        this.minSuccessRate = minSuccessRate;
    }

    public double getMergeSimilarity() {
        return mergeSimilarity;
    }

    public void setMergeSimilarity(double mergeSimilarity) {
        this.mergeSimilarity = mergeSimilarity;
    }

    public int getMaxSuggestions() {
        return maxSuggestions;
    }

    public void setMaxSuggestions(int maxSuggestions) {
        this.maxSuggestions = maxSuggestions;
    }
}
