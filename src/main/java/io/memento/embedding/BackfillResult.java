package io.memento.embedding;

/**
 * Counts from one embedding backfill run.
 *
 * @param embedded memories embedded and marked
 * @param skipped  memories with blank content, or that the embedder declined
 * @param errors   memories whose embedding or marking failed
 */
public record BackfillResult(int embedded, int skipped, int errors) {

    public static BackfillResult empty() {
        return new BackfillResult(0, 0, 0);
    }
}
