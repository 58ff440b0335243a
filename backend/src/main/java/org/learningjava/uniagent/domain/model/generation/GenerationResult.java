package org.learningjava.uniagent.domain.model.generation;

import org.learningjava.uniagent.domain.model.conversation.ChatTurn;

import java.util.List;

public record GenerationResult(
        String document,
        Outcome outcome,
        int roundsUsed,
        TokenUsage usage,
        List<ChatTurn> transcript
) {
    public GenerationResult {
        document = document == null ? "" : document;
        transcript = transcript == null ? List.of() : List.copyOf(transcript);
    }
}
