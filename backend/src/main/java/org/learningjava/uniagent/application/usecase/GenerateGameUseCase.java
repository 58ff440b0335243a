package org.learningjava.uniagent.application.usecase;

import org.learningjava.uniagent.application.port.ChatLLMPort;
import org.learningjava.uniagent.config.UniAgentProperties;
import org.learningjava.uniagent.domain.model.generation.GenerationResult;
import org.learningjava.uniagent.domain.service.ChatRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Set;

@Service
public class GenerateGameUseCase {

    private static final Logger log = LoggerFactory.getLogger(GenerateGameUseCase.class);

    private final ChatRegistry chatRegistry;
    private final RoundController controller;
    private final UniAgentProperties props;

    public GenerateGameUseCase(ChatRegistry chatRegistry,
                               RoundController controller,
                               UniAgentProperties props) {
        this.chatRegistry = chatRegistry;
        this.controller = controller;
        this.props = props;
    }

    /** Checks the request up front so bad input fails before any run is scheduled. */
    public GenerationPlan plan(String topic, String providerId, String model, Integer maxRounds) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic must not be blank");
        }
        String provider = isBlank(providerId) ? props.getDefaultProvider() : providerId.trim();
        chatRegistry.resolve(provider);

        int rounds = maxRounds == null ? props.getMaxRounds() : maxRounds;
        if (rounds < 1) {
            throw new IllegalArgumentException("maxRounds must be >= 1, was " + rounds);
        }
        String llmModel = isBlank(model) ? props.getDefaultModel() : model.trim();
        return new GenerationPlan(topic.trim(), provider, llmModel, rounds);
    }

    public GenerationResult generate(GenerationPlan plan, RoundListener listener) {
        ChatLLMPort chat = chatRegistry.resolve(plan.provider());

        long t0 = System.nanoTime();
        GenerationResult result = controller.run(chat, plan.model(), plan.topic(), plan.maxRounds(), listener);
        long elapsedMs = Math.max(1L, Math.round((System.nanoTime() - t0) / 1_000_000.0));

        log.info("Generation finished: provider={}, model={}, outcome={}, rounds={}/{}, tokens={}, ms={}",
                plan.provider(), plan.model(), result.outcome(), result.roundsUsed(), plan.maxRounds(),
                result.usage().totalTokens(), elapsedMs);
        return result;
    }

    public Set<String> providers() {
        return chatRegistry.listProviders();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public record GenerationPlan(String topic, String provider, String model, int maxRounds) {}
}
