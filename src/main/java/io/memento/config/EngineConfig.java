package io.memento.config;

import io.memento.consolidation.ChatModelSummarizer;
import io.memento.consolidation.Summarizer;
import io.memento.embedding.Embedder;
import io.memento.embedding.NoopEmbedder;
import io.memento.embedding.SpringAiEmbedder;
import io.memento.workspace.DirectoryWorkspaceRegistry;
import io.memento.workspace.WorkspaceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the memory engine. The model-backed beans fall back to their no-op form when the
 * corresponding Spring AI model is absent or disabled.
 */
@Configuration
@EnableConfigurationProperties(MementoProperties.class)
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public WorkspaceRegistry workspaceRegistry(MementoProperties properties) {
        log.info("Workspace data path: {}", properties.dataPath());
        return new DirectoryWorkspaceRegistry(Path.of(properties.dataPath()));
    }

    @Bean
    public Embedder embedder(MementoProperties properties, ObjectProvider<EmbeddingModel> embeddingModel) {
        EmbeddingModel model = embeddingModel.getIfAvailable();
        if (!properties.embedding().enabled() || model == null) {
            log.info("Vector embeddings disabled, recall is keyword-only");
            return new NoopEmbedder();
        }
        log.info("Vector embeddings enabled with {}", model.getClass().getSimpleName());
        return new SpringAiEmbedder(model, properties.embedding().indexPath());
    }

    /**
     * Null when no chat model is configured; consolidation then always uses the template summary.
     */
    @Bean
    public Summarizer summarizer(MementoProperties properties, ObjectProvider<ChatModel> chatModel) {
        ChatModel model = chatModel.getIfAvailable();
        if (!properties.consolidation().aiSummaryEnabled() || model == null) {
            log.info("AI consolidation summaries disabled, using template summaries");
            return null;
        }
        return new ChatModelSummarizer(model);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService embeddingExecutor() {
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "memento-embedding");
            thread.setDaemon(true);
            return thread;
        });
    }
}
