package io.memento.maintenance;

import io.memento.consolidation.AutoConsolidationResult;
import io.memento.decay.DecayResult;
import io.memento.embedding.BackfillResult;
import io.memento.memory.ReconcileReport;

/**
 * Outcome of one maintenance task on one workspace. Fields for steps the task did not run are null.
 *
 * @param workspace     workspace name
 * @param task          task name, see {@link MaintenanceJob}
 * @param reconcile     repairs made before the task ran
 * @param decay         decay pass result
 * @param consolidation clustering pass result
 * @param backfill      embedding backfill result
 * @param error         failure message when the workspace could not be processed
 */
public record WorkspaceTaskResult(
        String workspace,
        String task,
        ReconcileReport reconcile,
        DecayResult decay,
        AutoConsolidationResult consolidation,
        BackfillResult backfill,
        String error
) {
    public boolean failed() {
        return error != null;
    }

    static WorkspaceTaskResult failure(String workspace, String task, String error) {
        return new WorkspaceTaskResult(workspace, task, null, null, null, null, error);
    }
}
