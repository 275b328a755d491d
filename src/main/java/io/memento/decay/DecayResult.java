package io.memento.decay;

/**
 * Counts from one decay run over a workspace.
 *
 * @param decayed rows whose stored relevance was rewritten
 * @param errors  rows whose update failed
 */
public record DecayResult(int decayed, int errors) {
}
