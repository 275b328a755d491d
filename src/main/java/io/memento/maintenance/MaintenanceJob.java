package io.memento.maintenance;

import io.memento.consolidation.AutoConsolidationResult;
import io.memento.consolidation.ConsolidationEngine;
import io.memento.decay.DecayJob;
import io.memento.decay.DecayResult;
import io.memento.embedding.BackfillResult;
import io.memento.embedding.EmbeddingBackfillJob;
import io.memento.memory.MemoryStore;
import io.memento.memory.ReconcileReport;
import io.memento.workspace.WorkspaceRegistry;
import org.jobrunr.jobs.annotations.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Maintenance work that runs as JobRunr jobs, once per workspace.
 *
 * <p>Every task first reconciles the workspace, so half-written merges are repaired before decay
 * or clustering look at it. A workspace that fails is logged and reported; the remaining
 * workspaces still run.</p>
 */
@Component
public class MaintenanceJob {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceJob.class);

    static final String DECAY = "decay";
    static final String DAILY = "daily";
    static final String BACKFILL = "backfill";

    private final WorkspaceRegistry workspaces;
    private final DecayJob decayJob;
    private final ConsolidationEngine consolidationEngine;
    private final EmbeddingBackfillJob backfillJob;
    private final Clock clock;

    public MaintenanceJob(WorkspaceRegistry workspaces, DecayJob decayJob, ConsolidationEngine consolidationEngine,
                          EmbeddingBackfillJob backfillJob, Clock clock) {
        this.workspaces = workspaces;
        this.decayJob = decayJob;
        this.consolidationEngine = consolidationEngine;
        this.backfillJob = backfillJob;
        this.clock = clock;
    }

    @Job(name = "Memory decay")
    public List<WorkspaceTaskResult> runDecay() {
        return forEachWorkspace(DECAY, (workspace, store, reconcile) -> {
            DecayResult decay = decayJob.applyDecay(store, clock.instant());
            return new WorkspaceTaskResult(workspace, DECAY, reconcile, decay, null, null, null);
        });
    }

    /**
     * Decay followed by tag-cluster consolidation.
     */
    @Job(name = "Daily memory maintenance")
    public List<WorkspaceTaskResult> runDaily() {
        return forEachWorkspace(DAILY, (workspace, store, reconcile) -> {
            Instant now = clock.instant();
            DecayResult decay = decayJob.applyDecay(store, now);
            AutoConsolidationResult consolidation = consolidationEngine.consolidateCluster(store, workspace, now);
            return new WorkspaceTaskResult(workspace, DAILY, reconcile, decay, consolidation, null, null);
        });
    }

    @Job(name = "Embedding backfill")
    public List<WorkspaceTaskResult> runBackfill() {
        return forEachWorkspace(BACKFILL, (workspace, store, reconcile) -> {
            BackfillResult backfill = backfillJob.backfill(store, workspace);
            return new WorkspaceTaskResult(workspace, BACKFILL, reconcile, null, null, backfill, null);
        });
    }

    private List<WorkspaceTaskResult> forEachWorkspace(String task, WorkspaceTask work) {
        List<String> names = workspaces.listWorkspaces();
        log.info("Running {} maintenance on {} workspaces", task, names.size());

        List<WorkspaceTaskResult> results = new ArrayList<>(names.size());
        for (String workspace : names) {
            try (MemoryStore store = workspaces.open(workspace)) {
                ReconcileReport reconcile = store.reconcile();
                if (!reconcile.isClean()) {
                    log.warn("Workspace {} reconciled: {} reactivated, {} completed",
                            workspace, reconcile.reactivated(), reconcile.completed());
                }
                results.add(work.run(workspace, store, reconcile));
            } catch (RuntimeException e) {
                log.error("{} maintenance failed for workspace {}", task, workspace, e);
                results.add(WorkspaceTaskResult.failure(workspace, task, e.getMessage()));
            }
        }
        return results;
    }

    @FunctionalInterface
    private interface WorkspaceTask {
        WorkspaceTaskResult run(String workspace, MemoryStore store, ReconcileReport reconcile);
    }
}
