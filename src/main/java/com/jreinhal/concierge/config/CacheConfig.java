package com.jreinhal.concierge.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.jreinhal.concierge.governance.GovernanceSnapshot;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CacheConfig {
    @Bean
    public Cache<String, GovernanceSnapshot> governanceSnapshotCache(
            @Value("${concierge.governance.cache-ttl:5s}") Duration ttl) {
        return Caffeine.newBuilder()
            .maximumSize(1000L)
            .expireAfterWrite(ttl)
            .build();
    }
}
