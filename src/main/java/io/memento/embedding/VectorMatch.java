package io.memento.embedding;

/**
 * One hit from the vector index.
 *
 * @param id    memory id
 * @param score similarity score; higher is closer
 */
public record VectorMatch(String id, double score) {
}
