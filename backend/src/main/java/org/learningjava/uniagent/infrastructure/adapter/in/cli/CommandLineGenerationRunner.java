package org.learningjava.uniagent.infrastructure.adapter.in.cli;

import org.learningjava.uniagent.application.usecase.GenerateGameUseCase;
import org.learningjava.uniagent.application.usecase.GenerateGameUseCase.GenerationPlan;
import org.learningjava.uniagent.domain.model.generation.GenerationResult;
import org.learningjava.uniagent.domain.model.generation.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * One-shot generation from the terminal: {@code --uniagent.cli.enabled=true --topic="..."},
 * or the idea on standard input.
 */
@Component
@ConditionalOnProperty(prefix = "uniagent.cli", name = "enabled", havingValue = "true")
public class CommandLineGenerationRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(CommandLineGenerationRunner.class);
    private static final String RULE = "=".repeat(60);

    private final GenerateGameUseCase useCase;
    private final InputStream in;
    private final PrintStream out;

    public CommandLineGenerationRunner(GenerateGameUseCase useCase) {
        this(useCase, System.in, System.out);
    }

    CommandLineGenerationRunner(GenerateGameUseCase useCase, InputStream in, PrintStream out) {
        this.useCase = useCase;
        this.in = in;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        String topic = readTopic(args);
        if (topic.isBlank()) {
            out.println("No input provided. Exiting.");
            return;
        }

        String provider = firstOption(args, "provider");
        String model = firstOption(args, "model");
        GenerationPlan plan = useCase.plan(topic, provider, model, null);
        log.info("CLI generation: provider={}, model={}, maxRounds={}", plan.provider(), plan.model(), plan.maxRounds());

        GenerationResult result = useCase.generate(plan, null);
        printSummary(result.usage());

        if (!result.document().isBlank()) {
            out.println();
            out.println("----- BEGIN FINAL HTML OUTPUT -----");
            out.println();
            out.println(result.document().strip());
            out.println();
            out.println("----- END FINAL HTML OUTPUT -----");
        } else {
            out.println();
            out.println("No final HTML produced.");
        }
    }

    private String readTopic(ApplicationArguments args) throws IOException {
        String fromArgs = firstOption(args, "topic");
        if (fromArgs != null) {
            return fromArgs.strip();
        }
        out.println("Describe your mini-game idea:");
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        String line = reader.readLine();
        return line == null ? "" : line.strip();
    }

    private void printSummary(TokenUsage usage) {
        out.println();
        out.println(RULE);
        out.println(" CUMULATIVE TOKEN USAGE SUMMARY");
        out.println(RULE);
        out.println(String.format(Locale.ROOT, " Total Prompt Tokens:     %,d", usage.promptTokens()));
        out.println(String.format(Locale.ROOT, " Total Completion Tokens: %,d", usage.completionTokens()));
        out.println(String.format(Locale.ROOT, " Total Tokens Used:       %,d", usage.totalTokens()));
        out.println(RULE);
    }

    private static String firstOption(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
