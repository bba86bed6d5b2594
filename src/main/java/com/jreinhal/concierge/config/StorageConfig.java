package com.jreinhal.concierge.config;

import com.jreinhal.concierge.activity.ActivityStore;
import com.jreinhal.concierge.activity.MongoActivityStore;
import com.jreinhal.concierge.activity.RingBufferActivityStore;
import com.jreinhal.concierge.config.StorageProperties.StorageMode;
import com.jreinhal.concierge.feedback.GoldenPathStore;
import com.jreinhal.concierge.feedback.InMemoryGoldenPathStore;
import com.jreinhal.concierge.feedback.MongoGoldenPathStore;
import com.jreinhal.concierge.graph.GraphStore;
import com.jreinhal.concierge.graph.InMemoryGraphStore;
import com.jreinhal.concierge.graph.MongoGraphStore;
import com.jreinhal.concierge.hitl.HitlRequestStore;
import com.jreinhal.concierge.hitl.InMemoryHitlRequestStore;
import com.jreinhal.concierge.hitl.MongoHitlRequestStore;
import com.jreinhal.concierge.hitl.escalation.InMemoryReviewerDirectory;
import com.jreinhal.concierge.hitl.escalation.MongoReviewerDirectory;
import com.jreinhal.concierge.hitl.escalation.ReviewerDirectory;
import com.jreinhal.concierge.playbook.InMemoryPlaybookStore;
import com.jreinhal.concierge.playbook.MongoPlaybookStore;
import com.jreinhal.concierge.playbook.PlaybookStore;
import com.jreinhal.concierge.tenant.InMemoryTenantStore;
import com.jreinhal.concierge.tenant.MongoTenantStore;
import com.jreinhal.concierge.tenant.TenantStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * Picks the durable or in-memory implementation of every store from {@link StorageProperties}.
 * Business code only sees the interfaces.
 */
@Configuration
public class StorageConfig {
    private static final Logger log = LoggerFactory.getLogger(StorageConfig.class);
    private final StorageProperties properties;
    private final ObjectProvider<MongoTemplate> mongoTemplates;

    public StorageConfig(StorageProperties properties, ObjectProvider<MongoTemplate> mongoTemplates) {
        this.properties = properties;
        this.mongoTemplates = mongoTemplates;
    }

    @Bean
    public TenantStore tenantStore() {
        return this.mode("tenants", this.properties.getTenants()) == StorageMode.MONGO
                ? new MongoTenantStore(this.mongo())
                : new InMemoryTenantStore();
    }

    @Bean
    public HitlRequestStore hitlRequestStore() {
        return this.mode("hitl", this.properties.getHitl()) == StorageMode.MONGO
                ? new MongoHitlRequestStore(this.mongo())
                : new InMemoryHitlRequestStore();
    }

    @Bean
    public ReviewerDirectory reviewerDirectory() {
        return this.mode("reviewers", this.properties.getReviewers()) == StorageMode.MONGO
                ? new MongoReviewerDirectory(this.mongo())
                : new InMemoryReviewerDirectory();
    }

    @Bean(name = {"activityRingBuffer"})
    public RingBufferActivityStore activityRingBuffer(@Value("${concierge.activity.ring-buffer-capacity:5000}") int capacity) {
        return new RingBufferActivityStore(capacity);
    }

    /**
     * In memory mode the ring buffer is the primary store; there is nothing to fall back from.
     */
    @Bean
    @Primary
    public ActivityStore activityStore(RingBufferActivityStore activityRingBuffer) {
        return this.mode("activity", this.properties.getActivity()) == StorageMode.MONGO
                ? new MongoActivityStore(this.mongo())
                : activityRingBuffer;
    }

    @Bean
    public GraphStore graphStore() {
        return this.mode("graph", this.properties.getGraph()) == StorageMode.MONGO
                ? new MongoGraphStore(this.mongo())
                : new InMemoryGraphStore();
    }

    @Bean
    public GoldenPathStore goldenPathStore() {
        return this.mode("golden-paths", this.properties.getGoldenPaths()) == StorageMode.MONGO
                ? new MongoGoldenPathStore(this.mongo())
                : new InMemoryGoldenPathStore();
    }

    @Bean
    public PlaybookStore playbookStore() {
        return this.mode("playbooks", this.properties.getPlaybooks()) == StorageMode.MONGO
                ? new MongoPlaybookStore(this.mongo())
                : new InMemoryPlaybookStore();
    }

    private StorageMode mode(String component, StorageMode mode) {
        StorageMode resolved = mode != null ? mode : StorageMode.MONGO;
        if (resolved == StorageMode.MEMORY) {
            log.warn("Storage for '{}' is in-memory: data is lost on restart", component);
        }
        else {
            log.info("Storage for '{}' is MongoDB", component);
        }
        return resolved;
    }

    private MongoTemplate mongo() {
        MongoTemplate template = this.mongoTemplates.getIfAvailable();
        if (template == null) {
            throw new IllegalStateException("MongoDB storage selected but no MongoTemplate is configured; "
                    + "set concierge.storage.* to memory or configure spring.data.mongodb");
        }
        return template;
    }
}
