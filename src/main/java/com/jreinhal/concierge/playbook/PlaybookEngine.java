package com.jreinhal.concierge.playbook;

import com.jreinhal.concierge.activity.ActivityEventDraft;
import com.jreinhal.concierge.activity.ActivityEventTypes;
import com.jreinhal.concierge.activity.ActivityStreamService;
import com.jreinhal.concierge.exception.BackingStoreUnavailableException;
import com.jreinhal.concierge.exception.NotFoundException;
import com.jreinhal.concierge.graph.ActivityGraphService;
import com.jreinhal.concierge.graph.ResolutionTrace;
import com.jreinhal.concierge.tenant.QuotaExceededException;
import com.jreinhal.concierge.tenant.QuotaResource;
import com.jreinhal.concierge.tenant.Tenant;
import com.jreinhal.concierge.tenant.TenantContext;
import com.jreinhal.concierge.tenant.TenantQuotaService;
import com.jreinhal.concierge.tenant.TenantService;
import com.jreinhal.concierge.util.GuardedCall;
import com.jreinhal.concierge.util.PipelineFailureLog;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Mines the activity graph for repeated successful resolutions and turns them into playbooks,
 * suggests them to agents and runs them.
 *
 * <p>Extraction for one tenant and category is serialized; different categories and tenants run
 * concurrently. Running extraction twice over the same evidence changes nothing.</p>
 */
@Service
public class PlaybookEngine {
    private static final Logger log = LoggerFactory.getLogger(PlaybookEngine.class);
    private static final String SOURCE = "playbook-engine";
    static final String SEQUENTIAL = "sequential";
    private static final int MAX_LIST = 200;

    private final PlaybookStore store;
    private final GuardedCall guard;
    private final ActivityGraphService graphService;
    private final WorkflowCompiler compiler;
    private final TenantService tenantService;
    private final TenantQuotaService quotaService;
    private final ActivityStreamService activityStream;
    private final PipelineFailureLog failureLog;
    private final PlaybookProperties properties;
    private final Clock clock;
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    @Autowired
    public PlaybookEngine(PlaybookStore store,
                          @Qualifier("playbookStoreGuard") GuardedCall guard,
                          ActivityGraphService graphService,
                          ObjectProvider<WorkflowCompiler> compilers,
                          TenantService tenantService,
                          TenantQuotaService quotaService,
                          ActivityStreamService activityStream,
                          PipelineFailureLog failureLog,
                          PlaybookProperties properties,
                          Clock clock) {
        this(store, guard, graphService, compilers.getIfAvailable(), tenantService, quotaService, activityStream,
                failureLog, properties, clock);
    }

    public PlaybookEngine(PlaybookStore store,
                          GuardedCall guard,
                          ActivityGraphService graphService,
                          WorkflowCompiler compiler,
                          TenantService tenantService,
                          TenantQuotaService quotaService,
                          ActivityStreamService activityStream,
                          PipelineFailureLog failureLog,
                          PlaybookProperties properties,
                          Clock clock) {
        this.store = store;
        this.guard = guard;
        this.graphService = graphService;
        this.compiler = compiler;
        this.tenantService = tenantService;
        this.quotaService = quotaService;
        this.activityStream = activityStream;
        this.failureLog = failureLog;
        this.properties = properties;
        this.clock = clock;
        if (compiler == null) {
            log.info("No workflow compiler configured; playbooks will run sequentially");
        }
    }

    /**
     * Best playbook for the category by live success rate. Empty is a normal answer: not enough
     * evidence yet, or the playbook store is degraded.
     */
    public Optional<Playbook> suggest(TenantContext ctx, String category) {
        return suggestible(ctx, category).stream()
                .max(Comparator.comparingDouble(Playbook::liveSuccessRate)
                        .thenComparingInt(Playbook::sampleCount)
                        .thenComparing(Playbook::updatedAt));
    }

    /**
     * Ranked suggestions, weighing success rate against the amount of evidence behind it.
     */
    public List<PlaybookSuggestion> suggestions(TenantContext ctx, String category, Integer topK) {
        int k = topK == null || topK <= 0 ? this.properties.getMaxSuggestions() : Math.min(topK, MAX_LIST);
        return suggestible(ctx, category).stream()
                .map(p -> new PlaybookSuggestion(p, relevance(p), String.format(Locale.ROOT,
                        "Success rate %.0f%% across %d samples", p.liveSuccessRate() * 100, p.sampleCount())))
                .sorted(Comparator.comparingDouble(PlaybookSuggestion::relevance).reversed()
                        .thenComparing(s -> s.playbook().playbookId()))
                .limit(k)
                .toList();
    }

    /**
     * Mines the category's resolutions and reconciles them with its active playbooks: new patterns
     * become playbooks, known ones take the new evidence, a pattern whose typical sequence changed
     * gets a replacement, and overlapping playbooks collapse into one.
     *
     * @return playbooks created, updated or superseded by this call
     * @throws BackingStoreUnavailableException when the graph or playbook store cannot be read
     */
    public List<Playbook> extract(TenantContext ctx, String category) {
        String normalized = requireCategory(category);
        ReentrantLock lock = this.locks.computeIfAbsent(ctx.tenantId() + "|" + normalized, k -> new ReentrantLock());
        lock.lock();
        try {
            return extractLocked(ctx, normalized);
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Runs the playbook with the given step handlers, keyed by tool name, and records the outcome.
     * A playbook whose live success rate falls below the minimum is superseded.
     */
    public PlaybookExecutionResult execute(TenantContext ctx, String playbookId, Map<String, StepHandler> handlers,
                                           Map<String, Object> input) {
        Playbook playbook = get(ctx, playbookId);
        if (!playbook.isActive()) {
            throw new PlaybookNotActiveException(playbookId, playbook.supersededBy());
        }
        Map<String, StepHandler> stepHandlers = handlers != null ? handlers : Map.of();
        Map<String, Object> stepInput = input != null ? input : Map.of();
        WorkflowRun run;
        String engine;
        if (this.compiler != null) {
            WorkflowCompiler.CompiledWorkflow compiled = compileOrNull(playbook);
            if (compiled != null) {
                run = compiled.run(stepHandlers, stepInput);
                engine = this.compiler.name();
            }
            else {
                run = SequentialPlaybookRunner.run(playbook, stepHandlers, stepInput);
                engine = SEQUENTIAL;
            }
        }
        else {
            run = SequentialPlaybookRunner.run(playbook, stepHandlers, stepInput);
            engine = SEQUENTIAL;
        }
        boolean superseded = recordOutcome(ctx, playbook, run.success());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("playbookId", playbookId);
        payload.put("category", playbook.category());
        payload.put("success", run.success());
        payload.put("engine", engine);
        if (run.error() != null) {
            payload.put("error", run.error());
        }
        this.activityStream.appendQuietly(ctx, ActivityEventDraft.of(ActivityEventTypes.PLAYBOOK_EXECUTED, SOURCE, payload));
        return new PlaybookExecutionResult(playbookId, run.success(), run.stepResults(), run.error(), engine, superseded);
    }

    public Playbook get(TenantContext ctx, String playbookId) {
        if (playbookId == null || playbookId.isBlank()) {
            throw new IllegalArgumentException("Playbook id is required");
        }
        Playbook playbook = this.guard.call(() -> this.store.find(ctx.tenantId(), playbookId))
                .orElseThrow(() -> new NotFoundException("playbook", playbookId));
        ctx.requireSameTenant(playbook.tenantId());
        return playbook;
    }

    public List<Playbook> list(TenantContext ctx, String category, int limit) {
        String normalized = category == null || category.isBlank() ? null : category.trim();
        int bounded = Math.max(1, Math.min(limit, MAX_LIST));
        return this.guard.call(() -> this.store.list(ctx.tenantId(), normalized, bounded));
    }

    public PlaybookStats stats(TenantContext ctx) {
        List<Playbook> playbooks;
        try {
            playbooks = this.guard.call(() -> this.store.list(ctx.tenantId(), null, Integer.MAX_VALUE));
        }
        catch (BackingStoreUnavailableException e) {
            return new PlaybookStats(new EnumMap<>(PlaybookStatus.class), 0L, 0L, 0.0, List.of(), compilerName(), true);
        }
        Map<PlaybookStatus, Long> byStatus = new EnumMap<>(PlaybookStatus.class);
        long executions = 0;
        long successes = 0;
        for (Playbook playbook : playbooks) {
            byStatus.merge(playbook.status(), 1L, Long::sum);
            executions += playbook.executionCount();
            successes += playbook.executionSuccesses();
        }
        List<String> categories = playbooks.stream().filter(Playbook::isActive).map(Playbook::category).distinct().sorted().toList();
        return new PlaybookStats(byStatus, executions, successes, executions == 0 ? 0.0 : (double) successes / executions,
                categories, compilerName(), this.guard.isDegraded());
    }

    /**
     * Extraction pass over every active tenant and every category its graph has seen. Failures are
     * recorded per tenant and category, and the pass carries on.
     */
    @Scheduled(fixedDelayString = "${concierge.playbook.extract-interval-ms:300000}",
            initialDelayString = "${concierge.playbook.extract-initial-delay-ms:60000}")
    public int extractAll() {
        int changed = 0;
        for (Tenant tenant : this.tenantService.listTenants()) {
            if (!tenant.isActive()) {
                continue;
            }
            TenantContext ctx = this.tenantService.systemContext(tenant.id());
            Collection<String> categories;
            try {
                categories = this.graphService.categories(ctx);
            }
            catch (RuntimeException e) {
                log.warn("Playbook extraction skipped for tenant {}: {}", tenant.id(), e.getMessage());
                this.failureLog.record(tenant.id(), "playbook.extract", null, e);
                continue;
            }
            for (String category : categories) {
                try {
                    changed += extract(ctx, category).size();
                }
                catch (RuntimeException e) {
                    log.warn("Playbook extraction failed for tenant {} category {}: {}", tenant.id(), category, e.getMessage());
                    this.failureLog.record(tenant.id(), "playbook.extract", category, e);
                }
            }
        }
        if (changed > 0) {
            log.info("Playbook extraction changed {} playbooks", changed);
        }
        return changed;
    }

    /**
     * Drops purged resolutions from playbook evidence. The playbooks themselves stay: they carry
     * step names, not subject data.
     */
    public long purgeSources(TenantContext ctx, Collection<String> resolutionIds) {
        if (resolutionIds == null || resolutionIds.isEmpty()) {
            return 0L;
        }
        return this.guard.call(() -> this.store.removeSourceResolutions(ctx.tenantId(), resolutionIds));
    }

    public boolean isDegraded() {
        return this.guard.isDegraded();
    }

    public String compilerName() {
        return this.compiler != null ? this.compiler.name() : null;
    }

    private List<Playbook> extractLocked(TenantContext ctx, String category) {
        List<ResolutionTrace> traces = this.graphService.resolutionTraces(ctx, category);
        List<PatternCluster> clusters = PatternMiner.cluster(traces, this.properties.getMergeSimilarity());
        List<Playbook> active = new ArrayList<>(this.guard.call(
                () -> this.store.findByCategory(ctx.tenantId(), category, PlaybookStatus.ACTIVE)));
        List<Playbook> changed = new ArrayList<>();
        Instant now = this.clock.instant();
        for (PatternCluster cluster : clusters) {
            if (cluster.sampleCount() < this.properties.getMinSamples()) {
                log.debug("Pattern {} in {} has {} samples, below {}", cluster.representativeSteps(), category,
                        cluster.sampleCount(), this.properties.getMinSamples());
                continue;
            }
            List<Playbook> matches = matching(active, cluster.representativeSteps());
            if (matches.isEmpty()) {
                if (cluster.successRate() >= this.properties.getMinSuccessRate()) {
                    create(ctx, category, cluster, 1, now).ifPresent(changed::add);
                }
                continue;
            }
            active.removeAll(matches);
            Playbook primary = matches.get(0);
            String survivorId = reconcile(ctx, category, primary, cluster, now, changed);
            for (Playbook duplicate : matches.subList(1, matches.size())) {
                changed.add(supersede(ctx, duplicate, survivorId, now));
            }
        }
        return changed;
    }

    /**
     * Applies the cluster's evidence to its closest active playbook.
     *
     * @return the id of the playbook that remains active for the pattern, or null when none does
     */
    private String reconcile(TenantContext ctx, String category, Playbook primary, PatternCluster cluster,
                             Instant now, List<Playbook> changed) {
        boolean healthy = cluster.successRate() >= this.properties.getMinSuccessRate();
        if (!primary.stepNames().equals(cluster.representativeSteps())) {
            if (healthy) {
                Optional<Playbook> replacement = create(ctx, category, cluster, primary.version() + 1, now);
                if (replacement.isPresent()) {
                    changed.add(replacement.get());
                    changed.add(supersede(ctx, primary, replacement.get().playbookId(), now));
                    return replacement.get().playbookId();
                }
            }
            else {
                changed.add(supersede(ctx, primary, null, now));
                return null;
            }
        }
        if (primary.sampleCount() == cluster.sampleCount() && primary.successCount() == cluster.successCount()
                && new HashSet<>(primary.sourceResolutionIds()).equals(new HashSet<>(cluster.resolutionIds()))) {
            return primary.playbookId();
        }
        Playbook updated = primary.withEvidence(cluster.sampleCount(), cluster.successCount(), cluster.resolutionIds(), now);
        if (updated.liveSuccessRate() < this.properties.getMinSuccessRate()) {
            changed.add(supersede(ctx, updated, null, now));
            return null;
        }
        this.guard.run(() -> this.store.save(updated));
        emit(ctx, ActivityEventTypes.PLAYBOOK_UPDATED, updated);
        log.info("Playbook {} updated to version {} ({} samples, success rate {})", updated.playbookId(),
                updated.version(), updated.sampleCount(), String.format(Locale.ROOT, "%.2f", updated.successRate()));
        changed.add(updated);
        return updated.playbookId();
    }

    private List<Playbook> matching(List<Playbook> active, List<String> steps) {
        double threshold = this.properties.getMergeSimilarity();
        return active.stream()
                .filter(p -> PatternMiner.prefixSimilarity(p.stepNames(), steps) >= threshold)
                .sorted(Comparator.comparingDouble((Playbook p) -> PatternMiner.prefixSimilarity(p.stepNames(), steps)).reversed()
                        .thenComparing(Playbook::createdAt)
                        .thenComparing(Playbook::playbookId))
                .toList();
    }

    private Optional<Playbook> create(TenantContext ctx, String category, PatternCluster cluster, int version, Instant now) {
        try {
            this.quotaService.checkAndReserve(ctx, QuotaResource.PLAYBOOKS, 1);
        }
        catch (QuotaExceededException e) {
            log.warn("Playbook for {} not created: tenant {} is at its playbook quota", category, ctx.tenantId());
            this.failureLog.record(ctx.tenantId(), "playbook.quota", category, e);
            return Optional.empty();
        }
        Playbook playbook = Playbook.linear("pb-" + UUID.randomUUID().toString().replace("-", "").substring(0, 12),
                ctx.tenantId(), category, cluster.representativeSteps(), cluster.sampleCount(), cluster.successCount(),
                cluster.resolutionIds(), version, now);
        try {
            this.guard.run(() -> this.store.save(playbook));
        }
        catch (BackingStoreUnavailableException e) {
            this.quotaService.release(ctx, QuotaResource.PLAYBOOKS, 1);
            throw e;
        }
        emit(ctx, ActivityEventTypes.PLAYBOOK_CREATED, playbook);
        log.info("Playbook {} created for {} ({} steps, {} samples)", playbook.playbookId(), category,
                playbook.steps().size(), playbook.sampleCount());
        return Optional.of(playbook);
    }

    private Playbook supersede(TenantContext ctx, Playbook playbook, String replacementId, Instant now) {
        Playbook superseded = playbook.superseded(replacementId, now);
        this.guard.run(() -> this.store.save(superseded));
        try {
            this.quotaService.release(ctx, QuotaResource.PLAYBOOKS, 1);
        }
        catch (RuntimeException e) {
            this.failureLog.record(ctx.tenantId(), "quota.release", playbook.playbookId(), e);
        }
        emit(ctx, ActivityEventTypes.PLAYBOOK_SUPERSEDED, superseded);
        log.info("Playbook {} superseded{}", playbook.playbookId(), replacementId != null ? " by " + replacementId : "");
        return superseded;
    }

    private boolean recordOutcome(TenantContext ctx, Playbook playbook, boolean success) {
        Optional<Playbook> updated;
        try {
            updated = this.guard.call(() -> this.store.recordExecution(ctx.tenantId(), playbook.playbookId(), success, this.clock.instant()));
        }
        catch (BackingStoreUnavailableException e) {
            this.failureLog.record(ctx.tenantId(), "playbook.execution", playbook.playbookId(), e);
            return false;
        }
        if (updated.isEmpty() || !updated.get().isActive()
                || updated.get().liveSuccessRate() >= this.properties.getMinSuccessRate()) {
            return false;
        }
        ReentrantLock lock = this.locks.computeIfAbsent(ctx.tenantId() + "|" + playbook.category(), k -> new ReentrantLock());
        lock.lock();
        try {
            Optional<Playbook> current = this.guard.call(() -> this.store.find(ctx.tenantId(), playbook.playbookId()));
            if (current.isEmpty() || !current.get().isActive()) {
                return false;
            }
            supersede(ctx, current.get(), null, this.clock.instant());
            return true;
        }
        catch (BackingStoreUnavailableException e) {
            this.failureLog.record(ctx.tenantId(), "playbook.supersede", playbook.playbookId(), e);
            return false;
        }
        finally {
            lock.unlock();
        }
    }

    private WorkflowCompiler.CompiledWorkflow compileOrNull(Playbook playbook) {
        try {
            return this.compiler.compile(playbook);
        }
        catch (IllegalStateException e) {
            log.warn("Playbook {} could not be compiled, running sequentially: {}", playbook.playbookId(), e.getMessage());
            return null;
        }
    }

    private List<Playbook> suggestible(TenantContext ctx, String category) {
        String normalized = requireCategory(category);
        List<Playbook> candidates;
        try {
            candidates = this.guard.call(() -> this.store.findByCategory(ctx.tenantId(), normalized, PlaybookStatus.ACTIVE));
        }
        catch (BackingStoreUnavailableException e) {
            log.debug("Playbook suggestions unavailable for tenant {}: {}", ctx.tenantId(), e.getMessage());
            return List.of();
        }
        return candidates.stream()
                .filter(p -> ctx.owns(p.tenantId()) && p.isActive())
                .filter(p -> p.sampleCount() >= this.properties.getMinSamples())
                .filter(p -> p.liveSuccessRate() >= this.properties.getMinSuccessRate())
                .toList();
    }

    private void emit(TenantContext ctx, String eventType, Playbook playbook) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("playbookId", playbook.playbookId());
        payload.put("category", playbook.category());
        payload.put("name", playbook.name());
        payload.put("steps", playbook.stepNames());
        payload.put("successRate", playbook.successRate());
        payload.put("sampleCount", playbook.sampleCount());
        payload.put("status", playbook.status().name());
        payload.put("version", playbook.version());
        payload.put("sourceResolutionIds", playbook.sourceResolutionIds());
        if (playbook.supersededBy() != null) {
            payload.put("supersededBy", playbook.supersededBy());
        }
        this.activityStream.appendQuietly(ctx, ActivityEventDraft.of(eventType, SOURCE, payload));
    }

    private static double relevance(Playbook playbook) {
        double score = playbook.liveSuccessRate() * 0.6 + Math.min(playbook.sampleCount() / 20.0, 1.0) * 0.4;
        return Math.round(score * 1000.0) / 1000.0;
    }

    private static String requireCategory(String category) {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("Category is required");
        }
        return category.trim();
    }
}
