package com.jreinhal.concierge.playbook;

import com.jreinhal.concierge.tenant.TenantContextHolder;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read access and on-demand extraction. Execution needs in-process step handlers, so it is not
 * exposed over HTTP.
 */
@RestController
@RequestMapping(value={"/api/playbooks"})
public class PlaybookController {
    private final PlaybookEngine playbookEngine;

    public PlaybookController(PlaybookEngine playbookEngine) {
        this.playbookEngine = playbookEngine;
    }

    @GetMapping
    public ResponseEntity<List<Playbook>> list(@RequestParam(required = false) String category,
                                               @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(this.playbookEngine.list(TenantContextHolder.require(), category, limit));
    }

    @GetMapping("/{playbookId}")
    public ResponseEntity<Playbook> get(@PathVariable String playbookId) {
        return ResponseEntity.ok(this.playbookEngine.get(TenantContextHolder.require(), playbookId));
    }

    @GetMapping("/suggestions")
    public ResponseEntity<List<PlaybookSuggestion>> suggestions(@RequestParam String category,
                                                                @RequestParam(required = false) Integer topK) {
        return ResponseEntity.ok(this.playbookEngine.suggestions(TenantContextHolder.require(), category, topK));
    }

    @PostMapping("/extract")
    public ResponseEntity<List<Playbook>> extract(@RequestParam String category) {
        return ResponseEntity.ok(this.playbookEngine.extract(TenantContextHolder.require(), category));
    }

    @GetMapping("/stats")
    public ResponseEntity<PlaybookStats> stats() {
        return ResponseEntity.ok(this.playbookEngine.stats(TenantContextHolder.require()));
    }
}
