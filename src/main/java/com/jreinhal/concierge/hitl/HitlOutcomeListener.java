package com.jreinhal.concierge.hitl;

import com.jreinhal.concierge.tenant.TenantContext;

/**
 * Downstream consumer of completed requests. Called after the decision is committed; an exception
 * here is recorded and never undoes the decision.
 */
public interface HitlOutcomeListener {

    void onCompleted(TenantContext ctx, HitlRequest request);
}
