package io.memento.scoring;

import io.memento.memory.Memory;

/**
 * A memory with its keyword-gated score.
 */
public record ScoredMemory(Memory memory, double score) {
}
