package com.jreinhal.concierge.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Backing store per component, chosen once at startup. {@code memory} stores keep nothing across
 * restarts.
 */
@Component
@ConfigurationProperties(prefix = "concierge.storage")
public class StorageProperties {
    private StorageMode tenants = StorageMode.MONGO;
    private StorageMode hitl = StorageMode.MONGO;
    private StorageMode activity = StorageMode.MONGO;
    private StorageMode graph = StorageMode.MONGO;
    private StorageMode goldenPaths = StorageMode.MONGO;
    private StorageMode playbooks = StorageMode.MONGO;
    private StorageMode reviewers = StorageMode.MONGO;

    public enum StorageMode {
        MONGO,
        MEMORY;
    }

    public StorageMode getTenants() {
        return tenants;
    }

    public void setTenants(StorageMode tenants) {
        this.tenants = tenants;
    }

    public StorageMode getHitl() {
        return hitl;
    }

    public void setHitl(StorageMode hitl) {
        this.hitl = hitl;
    }

    public StorageMode getActivity() {
        return activity;
    }

    public void setActivity(StorageMode activity) {
        this.activity = activity;
    }

    public StorageMode getGraph() {
        return graph;
    }

    public void setGraph(StorageMode graph) {
        this.graph = graph;
    }

    public StorageMode getGoldenPaths() {
        return goldenPaths;
    }

    public void setGoldenPaths(StorageMode goldenPaths) {
        this.goldenPaths = goldenPaths;
    }

    public StorageMode getPlaybooks() {
        return playbooks;
    }

    public void setPlaybooks(StorageMode playbooks) {
        this.playbooks = playbooks;
    }

    public StorageMode getReviewers() {
        return reviewers;
    }

    public void setReviewers(StorageMode reviewers) {
        this.reviewers = reviewers;
    }
}
