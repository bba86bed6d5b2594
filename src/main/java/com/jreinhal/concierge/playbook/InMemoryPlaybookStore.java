package com.jreinhal.concierge.playbook;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

public class InMemoryPlaybookStore implements PlaybookStore {
    private final Map<String, Playbook> playbooks = new ConcurrentHashMap<>();

    @Override
    public void save(Playbook playbook) {
        this.playbooks.put(playbook.playbookId(), playbook);
    }

    @Override
    public Optional<Playbook> find(String tenantId, String playbookId) {
        return Optional.ofNullable(this.playbooks.get(playbookId)).filter(p -> tenantId.equals(p.tenantId()));
    }

    @Override
    public List<Playbook> findByCategory(String tenantId, String category, PlaybookStatus status) {
        return this.playbooks.values().stream()
                .filter(p -> tenantId.equals(p.tenantId()) && category.equals(p.category()))
                .filter(p -> status == null || p.status() == status)
                .sorted(Comparator.comparing(Playbook::createdAt).thenComparing(Playbook::playbookId))
                .toList();
    }

    @Override
    public List<Playbook> list(String tenantId, String category, int limit) {
        return this.playbooks.values().stream()
                .filter(p -> tenantId.equals(p.tenantId()))
                .filter(p -> category == null || category.equals(p.category()))
                .sorted(Comparator.comparing(Playbook::updatedAt).reversed().thenComparing(Playbook::playbookId))
                .limit(limit)
                .toList();
    }

    @Override
    public Optional<Playbook> recordExecution(String tenantId, String playbookId, boolean success, Instant at) {
        Playbook updated = this.playbooks.computeIfPresent(playbookId, (id, p) -> {
            if (!tenantId.equals(p.tenantId())) {
                return p;
            }
            return new Playbook(p.playbookId(), p.tenantId(), p.category(), p.name(), p.description(), p.status(),
                    p.steps(), p.edges(), p.entryStepId(), p.successRate(), p.sampleCount(), p.successCount(),
                    p.executionCount() + 1, p.executionSuccesses() + (success ? 1 : 0), p.sourceResolutionIds(),
                    p.supersededBy(), p.version(), p.createdAt(), at);
        });
        return Optional.ofNullable(updated).filter(p -> tenantId.equals(p.tenantId()));
    }

    @Override
    public long removeSourceResolutions(String tenantId, Collection<String> resolutionIds) {
        Set<String> doomed = new HashSet<>(resolutionIds);
        AtomicLong changed = new AtomicLong();
        this.playbooks.replaceAll((id, p) -> {
            if (!tenantId.equals(p.tenantId()) || p.sourceResolutionIds().stream().noneMatch(doomed::contains)) {
                return p;
            }
            changed.incrementAndGet();
            List<String> kept = p.sourceResolutionIds().stream().filter(r -> !doomed.contains(r)).toList();
            return new Playbook(p.playbookId(), p.tenantId(), p.category(), p.name(), p.description(), p.status(),
                    p.steps(), p.edges(), p.entryStepId(), p.successRate(), p.sampleCount(), p.successCount(),
                    p.executionCount(), p.executionSuccesses(), kept, p.supersededBy(), p.version(),
                    p.createdAt(), p.updatedAt());
        });
        return changed.get();
    }
}
