package com.jreinhal.concierge.playbook;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface PlaybookStore {

    /** Inserts or replaces the playbook by id. */
    void save(Playbook playbook);

    Optional<Playbook> find(String tenantId, String playbookId);

    /**
     * @param status optional filter
     */
    List<Playbook> findByCategory(String tenantId, String category, PlaybookStatus status);

    /**
     * Most recently updated first.
     *
     * @param category optional filter
     */
    List<Playbook> list(String tenantId, String category, int limit);

    /**
     * Atomically counts one execution.
     *
     * @return the playbook after the update, empty when it does not exist
     */
    Optional<Playbook> recordExecution(String tenantId, String playbookId, boolean success, Instant at);

    /**
     * Removes the given resolution ids from every playbook's sources.
     *
     * @return playbooks changed
     */
    long removeSourceResolutions(String tenantId, Collection<String> resolutionIds);
}
