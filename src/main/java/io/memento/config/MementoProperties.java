package io.memento.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration for the memory engine.
 *
 * <p>Binds to {@code memento} in application.yml:</p>
 * <pre>
 * memento:
 *   data-path: ${MEMENTO_DATA_PATH:./data/workspaces}
 *   recall:
 *     alpha: 0.5
 *     keyword-candidates: 20
 *     limit: 10
 *   maintenance:
 *     enabled: true
 *     decay-cron: "0 *&#47;6 * * *"
 *     daily-cron: "0 3 * * *"
 *   consolidation:
 *     min-group-size: 3
 *     ai-summary-enabled: true
 *   embedding:
 *     enabled: ${MEMENTO_EMBEDDING_ENABLED:false}
 *     batch-size: 50
 *     index-path: ./data/vectors.db
 * </pre>
 *
 * @param dataPath      directory holding one SQLite file per workspace
 * @param recall        retrieval settings
 * @param maintenance   scheduled decay / consolidation settings
 * @param consolidation consolidation settings
 * @param embedding     vector embedding settings
 */
@ConfigurationProperties(prefix = "memento")
public record MementoProperties(
        String dataPath,
        Recall recall,
        Maintenance maintenance,
        Consolidation consolidation,
        Embedding embedding
) {

    public MementoProperties {
        if (dataPath == null || dataPath.isBlank()) {
            dataPath = "./data/workspaces";
        }
        if (recall == null) {
            recall = new Recall(null, null, null);
        }
        if (maintenance == null) {
            maintenance = new Maintenance(null, null, null);
        }
        if (consolidation == null) {
            consolidation = new Consolidation(null, null);
        }
        if (embedding == null) {
            embedding = new Embedding(null, null, null);
        }
    }

    /**
     * All defaults.
     */
    public static MementoProperties defaults() {
        return new MementoProperties(null, null, null, null, null);
    }

    /**
     * @param alpha             keyword weight in hybrid ranking, used when the workspace has no {@code recall_alpha}
     * @param keywordCandidates keyword results kept before fusion
     * @param limit             results returned by a recall
     */
    public record Recall(Double alpha, Integer keywordCandidates, Integer limit) {
        public Recall {
            if (alpha == null || alpha < 0 || alpha > 1) {
                alpha = 0.5;
            }
            if (keywordCandidates == null || keywordCandidates <= 0) {
                keywordCandidates = 20;
            }
            if (limit == null || limit <= 0) {
                limit = 10;
            }
        }
    }

    /**
     * @param enabled    whether recurring jobs are registered on startup
     * @param decayCron  schedule of the decay-only run
     * @param dailyCron  schedule of the daily decay + consolidation run
     */
    public record Maintenance(Boolean enabled, String decayCron, String dailyCron) {
        public Maintenance {
            if (enabled == null) {
                enabled = true;
            }
            if (decayCron == null || decayCron.isBlank()) {
                decayCron = "0 */6 * * *";
            }
            if (dailyCron == null || dailyCron.isBlank()) {
                dailyCron = "0 3 * * *";
            }
        }
    }

    /**
     * @param minGroupSize     members a tag cluster needs before it is consolidated
     * @param aiSummaryEnabled whether the summarizer model is asked before falling back to the template
     */
    public record Consolidation(Integer minGroupSize, Boolean aiSummaryEnabled) {
        public Consolidation {
            if (minGroupSize == null || minGroupSize < 2) {
                minGroupSize = 3;
            }
            if (aiSummaryEnabled == null) {
                aiSummaryEnabled = true;
            }
        }
    }

    /**
     * @param enabled   whether vectors are computed at all
     * @param batchSize rows per backfill batch
     * @param indexPath SQLite file of the vector index
     */
    public record Embedding(Boolean enabled, Integer batchSize, String indexPath) {
        public Embedding {
            if (enabled == null) {
                enabled = false;
            }
            if (batchSize == null || batchSize <= 0) {
                batchSize = 50;
            }
            if (indexPath == null || indexPath.isBlank()) {
                indexPath = "./data/vectors.db";
            }
        }
    }
}
