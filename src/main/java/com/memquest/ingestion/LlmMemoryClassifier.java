package com.memquest.ingestion;

import com.memquest.providers.ChatCompletionClient;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

public class LlmMemoryClassifier implements MemoryClassifier {

    static final String SYSTEM_PROMPT = """
            You decide whether a message from a conversation is worth keeping in long-term memory.
            Keep stable facts about the user, preferences, constraints, decisions and task outcomes.
            Skip greetings, filler and anything that will not matter in a later conversation.
            Answer with exactly one of: STORE DURABLE, STORE VOLATILE, SKIP.""";

    private final ChatCompletionClient client;

    public LlmMemoryClassifier(ChatCompletionClient client) {
        this.client = client;
    }

    @Override
    public Optional<Classification> classify(String text, List<String> tags) throws Exception {
        var prompt = tags.isEmpty() ? text : "[tags: " + String.join(", ", tags) + "]\n" + text;
        var answer = client.complete(SYSTEM_PROMPT, prompt).trim().toUpperCase(Locale.ROOT);
        if (answer.startsWith("SKIP")) {
            return Optional.of(new Classification(false, false));
        }
        if (answer.startsWith("STORE")) {
            return Optional.of(new Classification(true, answer.contains("DURABLE")));
        }
        return Optional.empty();
    }
}
