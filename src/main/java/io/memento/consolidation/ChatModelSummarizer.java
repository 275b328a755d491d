package io.memento.consolidation;

import io.memento.memory.Memory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;

import java.util.List;
import java.util.StringJoiner;

/**
 * Summarizes memory groups with a Spring AI {@link ChatModel}.
 */
public class ChatModelSummarizer implements Summarizer {

    private static final Logger log = LoggerFactory.getLogger(ChatModelSummarizer.class);
    private static final int MAX_CONTENT_LENGTH = 500;

    private static final String SYSTEM_PROMPT = """
            You consolidate an AI agent's stored memories. Merge the entries below into one concise memory
            that keeps every distinct fact, decision and caveat. Drop repetition. Reply with the merged
            memory text only: no preamble, no markdown headings, no list of sources.
            """;

    private final ChatClient chatClient;

    public ChatModelSummarizer(ChatModel chatModel) {
        this.chatClient = ChatClient.builder(chatModel).build();
    }

    @Override
    public String summarize(List<Memory> memories) {
        StringJoiner listing = new StringJoiner("\n");
        for (Memory memory : memories) {
            listing.add("- [%s] %s".formatted(memory.type(), truncate(memory.content())));
        }

        log.debug("Requesting AI summary for {} memories", memories.size());
        return chatClient.prompt()
                .system(SYSTEM_PROMPT)
                .user("Memories to consolidate:\n" + listing)
                .call()
                .content();
    }

    private static String truncate(String s) {
        return s.length() <= MAX_CONTENT_LENGTH ? s : s.substring(0, MAX_CONTENT_LENGTH) + "...";
    }
}
