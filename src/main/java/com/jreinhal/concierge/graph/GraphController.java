package com.jreinhal.concierge.graph;

import com.jreinhal.concierge.tenant.TenantContextHolder;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(value={"/api/graph"})
public class GraphController {
    private final ActivityGraphService graphService;
    private final ActivityGraphProjector projector;

    public GraphController(ActivityGraphService graphService, ActivityGraphProjector projector) {
        this.graphService = graphService;
        this.projector = projector;
    }

    @GetMapping("/customers/{customerId}/journey")
    public ResponseEntity<List<JourneyEntry>> customerJourney(@PathVariable String customerId) {
        return ResponseEntity.ok(this.graphService.customerJourney(TenantContextHolder.require(), customerId));
    }

    @GetMapping("/resolutions")
    public ResponseEntity<List<GraphNode>> similarResolutions(@RequestParam String category,
                                                              @RequestParam(defaultValue = "10") int limit) {
        return ResponseEntity.ok(this.graphService.similarResolutions(TenantContextHolder.require(), category, limit));
    }

    @GetMapping("/stats")
    public ResponseEntity<GraphStats> stats() {
        return ResponseEntity.ok(this.graphService.stats(TenantContextHolder.require()));
    }

    @PostMapping("/rebuild")
    public ResponseEntity<Map<String, Object>> rebuild() {
        int applied = this.projector.rebuild(TenantContextHolder.require());
        return ResponseEntity.ok(Map.of("eventsApplied", applied));
    }
}
