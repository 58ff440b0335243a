package org.learningjava.uniagent.domain.model.generation;

import org.learningjava.uniagent.application.port.ChatLLMPort.Usage;

/** Token counts summed over the engine calls of one run. */
public record TokenUsage(long promptTokens, long completionTokens, long totalTokens) {

    public static final TokenUsage ZERO = new TokenUsage(0, 0, 0);

    /** Adds one call's usage; a null usage (provider reported nothing) adds zero. */
    public TokenUsage plus(Usage usage) {
        if (usage == null) return this;
        long p = usage.promptTokens() == null ? 0 : usage.promptTokens();
        long c = usage.completionTokens() == null ? 0 : usage.completionTokens();
        long t = usage.totalTokens() != null ? usage.totalTokens() : p + c;
        return new TokenUsage(promptTokens + p, completionTokens + c, totalTokens + t);
    }
}
