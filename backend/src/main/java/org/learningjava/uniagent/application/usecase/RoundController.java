package org.learningjava.uniagent.application.usecase;

import org.learningjava.uniagent.application.port.ChatLLMPort;
import org.learningjava.uniagent.application.port.ChatLLMPort.ChatResult;
import org.learningjava.uniagent.domain.model.conversation.ChatTurn;
import org.learningjava.uniagent.domain.model.conversation.Conversation;
import org.learningjava.uniagent.domain.model.generation.GenerationResult;
import org.learningjava.uniagent.domain.model.generation.Outcome;
import org.learningjava.uniagent.domain.model.generation.TokenUsage;
import org.learningjava.uniagent.domain.model.lint.Defect;
import org.learningjava.uniagent.domain.model.patch.PatchResult;
import org.learningjava.uniagent.domain.model.protocol.Command;
import org.learningjava.uniagent.domain.model.protocol.ParsedResponse;
import org.learningjava.uniagent.domain.model.protocol.RawCommand;
import org.learningjava.uniagent.domain.model.quality.Issue;
import org.learningjava.uniagent.domain.model.quality.Severity;
import org.learningjava.uniagent.domain.model.round.ControllerPhase;
import org.learningjava.uniagent.domain.model.round.Readiness;
import org.learningjava.uniagent.domain.model.round.RoundState;
import org.learningjava.uniagent.domain.policy.PatchModePolicy;
import org.learningjava.uniagent.domain.service.feedback.FeedbackFormatter;
import org.learningjava.uniagent.domain.service.lint.StructuralValidator;
import org.learningjava.uniagent.domain.service.patch.PatchEngine;
import org.learningjava.uniagent.domain.service.prompting.PromptRepository;
import org.learningjava.uniagent.domain.service.protocol.ProtocolParser;
import org.learningjava.uniagent.domain.service.quality.HeuristicChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Drives one generation run: engine call, patch or replace, command dispatch, feedback,
 * repeated until a FINAL is accepted or the round budget runs out.
 * <p>
 * A run never throws. Engine failures cost a round; exhaustion returns the best
 * document seen (or an empty one).
 */
@Service
public class RoundController {

    private static final Logger log = LoggerFactory.getLogger(RoundController.class);

    private static final int PREVIEW_CHARS = 600;

    private final ProtocolParser parser;
    private final PatchEngine patchEngine;
    private final StructuralValidator validator;
    private final HeuristicChecker checker;
    private final FeedbackFormatter feedback;
    private final PatchModePolicy patchPolicy;
    private final PromptRepository prompts;

    public RoundController(ProtocolParser parser,
                           PatchEngine patchEngine,
                           StructuralValidator validator,
                           HeuristicChecker checker,
                           FeedbackFormatter feedback,
                           PatchModePolicy patchPolicy,
                           PromptRepository prompts) {
        this.parser = parser;
        this.patchEngine = patchEngine;
        this.validator = validator;
        this.checker = checker;
        this.feedback = feedback;
        this.patchPolicy = patchPolicy;
        this.prompts = prompts;
    }

    public GenerationResult run(ChatLLMPort chat, String model, String topic, int maxRounds, RoundListener listener) {
        RoundListener progress = listener == null ? RoundListener.NONE : listener;
        String systemPrompt = prompts.systemPrompt();
        Conversation conversation = new Conversation();
        conversation.append(ChatTurn.user(prompts.kickoff(topic)));

        RoundState state = new RoundState();
        TokenUsage usage = TokenUsage.ZERO;

        for (int round = 1; round <= maxRounds; round++) {
            log.info("=== ROUND {}/{} ===", round, maxRounds);
            progress.roundStarted(round, maxRounds);
            state.phase(ControllerPhase.AWAITING_RESPONSE);

            ChatResult response;
            try {
                response = chat.chat(systemPrompt, conversation.snapshot(), model);
            } catch (RuntimeException e) {
                log.warn("Round {}: engine call failed, round consumed: {}", round, e.toString());
                continue;
            }
            usage = usage.plus(response.usage());

            if (processResponse(response.text(), state, conversation)) {
                state.phase(ControllerPhase.FINALIZED);
                log.info("Controller: Final accepted after {} round(s)", round);
                return new GenerationResult(state.document(), Outcome.FINALIZED, round, usage, conversation.snapshot());
            }
        }

        state.phase(ControllerPhase.EXHAUSTED);
        Outcome outcome = state.hasDocument() ? Outcome.EXHAUSTED : Outcome.FAILED;
        log.info("Controller: Reached max rounds ({}) without finalization -> {}", maxRounds, outcome);
        return new GenerationResult(state.document(), outcome, Math.max(maxRounds, 0), usage, conversation.snapshot());
    }

    /**
     * Handles one engine response and appends it plus the controller feedback to the
     * conversation.
     *
     * @return true when a FINAL command was accepted
     */
    boolean processResponse(String rawResponse, RoundState state, Conversation conversation) {
        state.phase(ControllerPhase.PROCESSING_RESPONSE);
        ParsedResponse parsed = parser.parse(rawResponse == null ? "" : rawResponse);
        String text = parsed.text();
        if (log.isDebugEnabled()) {
            log.debug("AGENT OUTPUT (truncated preview):\n{}{}",
                    text.substring(0, Math.min(PREVIEW_CHARS, text.length())),
                    text.length() > PREVIEW_CHARS ? "\n..." : "");
        }

        List<String> followups = new ArrayList<>();
        state.phase(ControllerPhase.NEITHER);

        if (parsed.patchBlock().isPresent() && state.hasDocument()) {
            state.phase(ControllerPhase.PATCH_APPLYING);
            log.info("Controller: Detected patch. Applying...");
            PatchResult result = patchEngine.apply(state.document(), parsed.patchBlock().get());
            if (result.success()) {
                state.replaceDocument(result.document());
                List<Defect> defects = validator.validate(state.document());
                List<Issue> issues = checker.check(state.document());
                state.lastDefects(defects);
                state.lastIssues(issues);
                followups.add(feedback.lintResult(defects));
                followups.add(feedback.qgResult(issues));
            } else {
                log.warn("Controller: Patch apply failed: {}", result.reason());
                followups.add(feedback.patchFailed(result.reason()));
            }
        }

        // a full document always wins over whatever the patch produced
        if (parsed.document().isPresent()) {
            state.phase(ControllerPhase.DOCUMENT_REPLACING);
            state.replaceDocument(parsed.document().get());
        }

        state.phase(ControllerPhase.COMMAND_DISPATCH);
        List<RawCommand> commands = parsed.commands();
        log.info("Detected commands: {}", commands.isEmpty() ? "None" : commands.stream().map(RawCommand::name).toList());

        for (RawCommand raw : commands) {
            if (dispatch(Command.from(raw), state, followups)) {
                conversation.append(ChatTurn.assistant(text));
                return true;
            }
        }

        state.phase(ControllerPhase.FEEDBACK_EMISSION);
        if (state.hasDocument()) {
            boolean enablePatch = patchPolicy.shouldUsePatch(
                    state.lastDefects(), state.lastIssues(), state.document().length());
            if (enablePatch) {
                followups.add(feedback.patchModeRequest(state.document(), prompts.patchInstructions()));
            }
            state.patchModeHinted(enablePatch);
        }

        if (commands.isEmpty() && parsed.patchBlock().isEmpty()) {
            followups.add(nudge(state));
        }

        conversation.append(ChatTurn.assistant(text));
        for (String f : followups) {
            conversation.append(ChatTurn.user(f));
        }
        return false;
    }

    private boolean dispatch(Command command, RoundState state, List<String> followups) {
        if (command instanceof Command.RunLint) {
            if (!state.hasDocument()) {
                state.lastDefects(List.of(Defect.global("No HTML to lint")));
                followups.add(feedback.lintWithoutDocument());
            } else {
                List<Defect> defects = validator.validate(state.document());
                state.lastDefects(defects);
                followups.add(feedback.lintResult(defects));
            }
        } else if (command instanceof Command.RunQgCheck) {
            List<Issue> issues = state.hasDocument()
                    ? checker.check(state.document())
                    : List.of(new Issue("no_html", "No HTML to analyze.", "Output full HTML first.", Severity.ERROR));
            state.lastIssues(issues);
            followups.add(feedback.qgResult(issues));
        } else if (command instanceof Command.SelfInstruct self) {
            followups.add(feedback.selfInstruction(self.text()));
        } else if (command instanceof Command.AskFinal) {
            followups.add(feedback.finalStatus(assess(state)));
        } else if (command instanceof Command.Finalize) {
            if (!state.hasDocument()) {
                followups.add(feedback.finalRejectedWithoutDocument());
                return false;
            }
            Readiness readiness = assess(state);
            if (readiness.ready()) {
                return true;
            }
            log.warn("Controller: FINAL rejected ({} defects, {} QG errors)",
                    readiness.defects().size(), readiness.errorCount());
            followups.add(feedback.finalRejected(readiness));
        } else if (command instanceof Command.Unknown unknown) {
            followups.add(feedback.unknownCommand(unknown.name(), unknown.argument()));
        } else {
            throw new IllegalStateException("Unhandled command variant: " + command);
        }
        return false;
    }

    /** Fresh checks, never the cached last results. */
    Readiness assess(RoundState state) {
        if (!state.hasDocument()) {
            return new Readiness(
                    List.of(Defect.global("No HTML")),
                    List.of(new Issue("no_html", "No HTML present.", "Provide HTML.", Severity.ERROR)),
                    false);
        }
        return new Readiness(validator.validate(state.document()), checker.check(state.document()), true);
    }

    private String nudge(RoundState state) {
        if (!state.hasDocument()) {
            return feedback.noDocument();
        }
        Readiness readiness = assess(state);
        return readiness.ready()
                ? feedback.allChecksPass()
                : feedback.noCommands(readiness, state.patchModeHinted());
    }
}
