package com.jreinhal.concierge.tenant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class TenantContextTest {

    @Test
    void defaultsFollowTheTier() {
        TenantContext ctx = new TenantContext("acme", null, null, " ");

        assertThat(ctx.tier()).isEqualTo(TenantTier.STARTER);
        assertThat(ctx.quotaLimits()).isEqualTo(TenantTier.STARTER.defaultQuota());
        assertThat(ctx.namespaced("golden_paths")).isEqualTo("t_acme:golden_paths");
    }

    @Test
    void equalityCoversTenantAndLimits() {
        assertThat(TenantContext.of("acme", TenantTier.FREE)).isEqualTo(TenantContext.of("acme", TenantTier.FREE));
        assertThat(TenantContext.of("acme", TenantTier.FREE)).isNotEqualTo(TenantContext.of("acme", TenantTier.ENTERPRISE));
        assertThat(TenantContext.of("acme", TenantTier.FREE)).isNotEqualTo(TenantContext.of("globex", TenantTier.FREE));
    }

    @Test
    void requireSameTenantGuardsEntities() {
        TenantContext acme = TenantContext.of("acme", TenantTier.STARTER);

        assertThatCode(() -> acme.requireSameTenant("acme")).doesNotThrowAnyException();
        assertThatThrownBy(() -> acme.requireSameTenant("globex"))
                .isInstanceOfSatisfying(TenantMismatchException.class,
                        e -> assertThat(e.getActualTenantId()).isEqualTo("globex"));
        assertThatThrownBy(() -> new TenantContext(" ", TenantTier.FREE, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
