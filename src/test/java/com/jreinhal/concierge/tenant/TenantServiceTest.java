package com.jreinhal.concierge.tenant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.jreinhal.concierge.exception.NotFoundException;
import com.jreinhal.concierge.support.MutableClock;
import com.jreinhal.concierge.tenant.TenantService.TenantProvisionRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TenantServiceTest {
    private final MutableClock clock = MutableClock.startingAt("2026-03-02T09:00:00Z");
    private final TenantService service = new TenantService(new InMemoryTenantStore(), clock, "STARTER");

    @Test
    @DisplayName("Provisioning derives a slug id and applies tier defaults")
    void provisionDerivesIdAndQuota() {
        Tenant tenant = service.provision(new TenantProvisionRequest(null, "Acme Support, Inc.", "professional", null));

        assertThat(tenant.id()).isEqualTo("acme-support-inc");
        assertThat(tenant.tier()).isEqualTo(TenantTier.PROFESSIONAL);
        assertThat(tenant.quota()).isEqualTo(TenantTier.PROFESSIONAL.defaultQuota());
        assertThat(tenant.namespacePrefix()).isEqualTo("t_acme-support-inc");
        assertThat(tenant.isActive()).isTrue();
    }

    @Test
    void provisionRejectsDuplicatesAndUnknownTiers() {
        service.provision(new TenantProvisionRequest("acme", "Acme", null, null));

        assertThatThrownBy(() -> service.provision(new TenantProvisionRequest("acme", "Acme again", null, null)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.provision(new TenantProvisionRequest("globex", "Globex", "platinum", null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("platinum");
        assertThatThrownBy(() -> service.provision(new TenantProvisionRequest("x", " ", null, null)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void ensureTenantIsIdempotent() {
        Tenant first = service.ensureTenant("acme", "FREE");
        Tenant second = service.ensureTenant("acme", "ENTERPRISE");

        assertThat(second).isEqualTo(first);
        assertThat(second.tier()).isEqualTo(TenantTier.FREE);
    }

    @Test
    @DisplayName("Quota edits produce a new context rather than mutating the old one")
    void quotaUpdateYieldsNewContext() {
        TenantContext before = service.ensureTenant("acme", "STARTER").toContext();

        service.updateQuota("acme", new TenantQuota(5, -1, 2));
        TenantContext after = service.resolveContext("acme");

        assertThat(before.quotaLimits()).isEqualTo(TenantTier.STARTER.defaultQuota());
        assertThat(after.quotaLimits()).isEqualTo(new TenantQuota(5, 0, 2));
        assertThat(after).isNotEqualTo(before);
    }

    @Test
    void suspendAndActivate() {
        service.ensureTenant("acme", "STARTER");

        assertThat(service.suspend("acme").status()).isEqualTo(TenantStatus.SUSPENDED);
        assertThat(service.requireTenant("acme").isActive()).isFalse();
        assertThat(service.activate("acme").isActive()).isTrue();
    }

    @Test
    void unknownTenantsFailOrFallBack() {
        assertThatThrownBy(() -> service.resolveContext("nobody")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> service.requireTenant(" ")).isInstanceOf(IllegalArgumentException.class);

        TenantContext fallback = service.systemContext("nobody");
        assertThat(fallback.tenantId()).isEqualTo("nobody");
        assertThat(fallback.tier()).isEqualTo(TenantTier.STARTER);
    }
}
