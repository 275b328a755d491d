package io.memento.config;

import io.memento.embedding.NoopEmbedder;
import io.memento.embedding.SpringAiEmbedder;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.ObjectProvider;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class MementoPropertiesTest {

    @Test
    void shouldApplyDefaults() {
        var props = MementoProperties.defaults();

        assertEquals("./data/workspaces", props.dataPath());
        assertEquals(0.5, props.recall().alpha());
        assertEquals(20, props.recall().keywordCandidates());
        assertEquals(10, props.recall().limit());
        assertTrue(props.maintenance().enabled());
        assertEquals("0 */6 * * *", props.maintenance().decayCron());
        assertEquals("0 3 * * *", props.maintenance().dailyCron());
        assertEquals(3, props.consolidation().minGroupSize());
        assertTrue(props.consolidation().aiSummaryEnabled());
        assertFalse(props.embedding().enabled());
        assertEquals(50, props.embedding().batchSize());
    }

    @Test
    void shouldRejectOutOfRangeValues() {
        var recall = new MementoProperties.Recall(1.7, -1, 0);
        assertEquals(0.5, recall.alpha());
        assertEquals(20, recall.keywordCandidates());
        assertEquals(10, recall.limit());

        assertEquals(3, new MementoProperties.Consolidation(1, null).minGroupSize());
    }

    @Test
    void shouldKeepConfiguredValues() {
        var props = new MementoProperties("/var/memento", new MementoProperties.Recall(0.8, 30, 5),
                new MementoProperties.Maintenance(false, "0 * * * *", null), null, null);

        assertEquals("/var/memento", props.dataPath());
        assertEquals(0.8, props.recall().alpha());
        assertFalse(props.maintenance().enabled());
        assertEquals("0 * * * *", props.maintenance().decayCron());
        assertEquals("0 3 * * *", props.maintenance().dailyCron());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldUseNoopEmbedderWhenDisabledOrModelMissing() {
        var config = new EngineConfig();
        ObjectProvider<EmbeddingModel> present = mock(ObjectProvider.class);
        when(present.getIfAvailable()).thenReturn(mock(EmbeddingModel.class));
        ObjectProvider<EmbeddingModel> absent = mock(ObjectProvider.class);

        assertInstanceOf(NoopEmbedder.class, config.embedder(MementoProperties.defaults(), present));

        var enabled = new MementoProperties(null, null, null, null,
                new MementoProperties.Embedding(true, null, "unused.db"));
        assertInstanceOf(NoopEmbedder.class, config.embedder(enabled, absent));
        assertInstanceOf(SpringAiEmbedder.class, config.embedder(enabled, present));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldOnlyCreateSummarizerWithChatModel() {
        var config = new EngineConfig();
        ObjectProvider<ChatModel> present = mock(ObjectProvider.class);
        when(present.getIfAvailable()).thenReturn(mock(ChatModel.class));
        ObjectProvider<ChatModel> absent = mock(ObjectProvider.class);

        assertNotNull(config.summarizer(MementoProperties.defaults(), present));
        assertNull(config.summarizer(MementoProperties.defaults(), absent));

        var disabled = new MementoProperties(null, null, null, new MementoProperties.Consolidation(null, false), null);
        assertNull(config.summarizer(disabled, present));
    }
}
