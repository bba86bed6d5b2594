package com.jreinhal.concierge.hitl.escalation;

import com.jreinhal.concierge.tenant.TenantContext;
import com.jreinhal.concierge.tenant.TenantContextHolder;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(value={"/api/hitl/escalation"})
public class EscalationController {
    private final EscalationPolicyEngine engine;
    private final ContextEscalationPolicy contextPolicy;

    public EscalationController(EscalationPolicyEngine engine, ContextEscalationPolicy contextPolicy) {
        this.engine = engine;
        this.contextPolicy = contextPolicy;
    }

    @GetMapping("/context-rules")
    public ResponseEntity<List<ContextEscalationRule>> contextRules() {
        return ResponseEntity.ok(this.contextPolicy.rules());
    }

    @GetMapping("/rules")
    public ResponseEntity<List<EscalationRule>> rules() {
        return ResponseEntity.ok(this.engine.rulesFor(TenantContextHolder.require()));
    }

    @PutMapping("/rules")
    public ResponseEntity<List<EscalationRule>> overrideRules(@RequestBody List<EscalationRule> rules) {
        TenantContext ctx = TenantContextHolder.require();
        this.engine.setTenantRules(ctx, rules);
        return ResponseEntity.ok(this.engine.rulesFor(ctx));
    }

    @DeleteMapping("/rules")
    public ResponseEntity<List<EscalationRule>> resetRules() {
        TenantContext ctx = TenantContextHolder.require();
        this.engine.clearTenantRules(ctx);
        return ResponseEntity.ok(this.engine.rulesFor(ctx));
    }
}
