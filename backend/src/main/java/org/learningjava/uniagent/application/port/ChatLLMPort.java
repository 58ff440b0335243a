package org.learningjava.uniagent.application.port;

import org.learningjava.uniagent.domain.model.conversation.ChatTurn;

import java.util.List;

public interface ChatLLMPort {
    String provider();

    /**
     * One blocking multi-turn completion. Implementations own their retries;
     * when they give up they throw {@link EngineException}.
     */
    ChatResult chat(String systemPrompt, List<ChatTurn> turns, String model);

    record Usage(Integer promptTokens, Integer completionTokens, Integer totalTokens) {}
    record ChatResult(String text, Usage usage) {}

}
