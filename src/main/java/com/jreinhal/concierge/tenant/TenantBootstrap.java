package com.jreinhal.concierge.tenant;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Seeds tenants listed in {@code concierge.tenant.bootstrap} as {@code id[:tier]} entries.
 */
@Component
public class TenantBootstrap implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(TenantBootstrap.class);
    private final TenantService tenantService;
    private final List<String> entries;

    public TenantBootstrap(TenantService tenantService,
                           @Value("${concierge.tenant.bootstrap:}") List<String> entries) {
        this.tenantService = tenantService;
        this.entries = entries;
    }

    @Override
    public void run(ApplicationArguments args) {
        for (String entry : this.entries) {
            if (entry == null || entry.isBlank()) {
                continue;
            }
            String[] parts = entry.trim().split(":", 2);
            try {
                this.tenantService.ensureTenant(parts[0], parts.length > 1 ? parts[1] : null);
            }
            catch (Exception e) {
                log.warn("Failed to seed tenant '{}': {}", parts[0], e.getMessage());
            }
        }
    }
}
