package io.memento.embedding;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Embeds text with a Spring AI {@link EmbeddingModel} and keeps the vectors in a SQLite index.
 *
 * <p>Vectors are stored under {@code <workspace>:<memoryId>} with the workspace in its own column,
 * so every query is filtered to one workspace. Similarity is cosine. Model failures propagate
 * to the caller; index failures are logged and reported as {@code false} or no matches.</p>
 */
public class SpringAiEmbedder implements Embedder {

    private static final Logger log = LoggerFactory.getLogger(SpringAiEmbedder.class);

    private final EmbeddingModel embeddingModel;
    private final String indexPath;
    private Connection connection;

    public SpringAiEmbedder(EmbeddingModel embeddingModel, String indexPath) {
        this.embeddingModel = embeddingModel;
        this.indexPath = indexPath;
    }

    @PostConstruct
    public void init() {
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + indexPath);
            try (var stmt = connection.createStatement()) {
                stmt.execute("PRAGMA journal_mode=WAL");
                stmt.execute("""
                    CREATE TABLE IF NOT EXISTS memory_vectors (
                        id TEXT PRIMARY KEY,
                        workspace_id TEXT NOT NULL,
                        memory_id TEXT NOT NULL,
                        vector BLOB NOT NULL
                    )
                    """);
                stmt.execute("CREATE INDEX IF NOT EXISTS idx_vectors_workspace ON memory_vectors(workspace_id)");
            }
            log.info("Vector index initialized at: {}", indexPath);
        } catch (SQLException e) {
            log.error("Failed to initialize vector index at {}", indexPath, e);
            throw new IllegalStateException("Vector index initialization failed", e);
        }
    }

    @Override
    public Optional<float[]> embed(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        float[] vector = embeddingModel.embed(text);
        return vector == null || vector.length == 0 ? Optional.empty() : Optional.of(vector);
    }

    @Override
    public synchronized boolean upsert(String workspaceId, String memoryId, float[] vector) {
        String sql = """
            INSERT INTO memory_vectors (id, workspace_id, memory_id, vector) VALUES (?, ?, ?, ?)
            ON CONFLICT(id) DO UPDATE SET vector = excluded.vector
            """;
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, vectorId(workspaceId, memoryId));
            stmt.setString(2, workspaceId);
            stmt.setString(3, memoryId);
            stmt.setBytes(4, toBytes(vector));
            stmt.executeUpdate();
            return true;
        } catch (SQLException e) {
            log.warn("Failed to store vector for {}:{}", workspaceId, memoryId, e);
            return false;
        }
    }

    @Override
    public synchronized List<VectorMatch> query(float[] vector, int topK, String workspaceId) {
        if (vector == null || vector.length == 0 || topK <= 0) {
            return List.of();
        }
        List<VectorMatch> matches = new ArrayList<>();
        try (var stmt = connection.prepareStatement(
                "SELECT memory_id, vector FROM memory_vectors WHERE workspace_id = ?")) {
            stmt.setString(1, workspaceId);
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    float[] candidate = fromBytes(rs.getBytes("vector"));
                    if (candidate.length != vector.length) {
                        log.debug("Skipping vector with dimension {} (query has {})", candidate.length, vector.length);
                        continue;
                    }
                    matches.add(new VectorMatch(rs.getString("memory_id"), cosine(vector, candidate)));
                }
            }
        } catch (SQLException e) {
            log.warn("Vector query failed for workspace {}", workspaceId, e);
            return List.of();
        }
        matches.sort(Comparator.comparingDouble(VectorMatch::score).reversed());
        return List.copyOf(matches.subList(0, Math.min(topK, matches.size())));
    }

    @Override
    public synchronized boolean delete(String workspaceId, String memoryId) {
        try (var stmt = connection.prepareStatement("DELETE FROM memory_vectors WHERE id = ?")) {
            stmt.setString(1, vectorId(workspaceId, memoryId));
            stmt.executeUpdate();
            return true;
        } catch (SQLException e) {
            log.warn("Failed to delete vector for {}:{}", workspaceId, memoryId, e);
            return false;
        }
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @PreDestroy
    public synchronized void close() {
        if (connection != null) {
            try {
                connection.close();
                log.info("Vector index closed");
            } catch (SQLException e) {
                log.error("Failed to close vector index", e);
            }
        }
    }

    static String vectorId(String workspaceId, String memoryId) {
        return workspaceId + ":" + memoryId;
    }

    static double cosine(float[] a, float[] b) {
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) return 0;
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private static byte[] toBytes(float[] vector) {
        ByteBuffer buffer = ByteBuffer.allocate(vector.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (float value : vector) {
            buffer.putFloat(value);
        }
        return buffer.array();
    }

    private static float[] fromBytes(byte[] bytes) {
        if (bytes == null) return new float[0];
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        float[] vector = new float[bytes.length / Float.BYTES];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = buffer.getFloat();
        }
        return vector;
    }
}
