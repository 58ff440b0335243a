package org.learningjava.uniagent.application.usecase;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.uniagent.application.port.ChatLLMPort;
import org.learningjava.uniagent.application.port.ChatLLMPort.ChatResult;
import org.learningjava.uniagent.application.port.ChatLLMPort.Usage;
import org.learningjava.uniagent.application.port.EngineException;
import org.learningjava.uniagent.domain.model.conversation.ChatTurn;
import org.learningjava.uniagent.domain.model.conversation.Conversation;
import org.learningjava.uniagent.domain.model.conversation.Role;
import org.learningjava.uniagent.domain.model.generation.GenerationResult;
import org.learningjava.uniagent.domain.model.generation.Outcome;
import org.learningjava.uniagent.domain.model.generation.TokenUsage;
import org.learningjava.uniagent.domain.model.lint.Defect;
import org.learningjava.uniagent.domain.model.patch.PatchResult;
import org.learningjava.uniagent.domain.model.round.ControllerPhase;
import org.learningjava.uniagent.domain.model.round.Readiness;
import org.learningjava.uniagent.domain.model.round.RoundState;
import org.learningjava.uniagent.domain.policy.PatchModePolicy;
import org.learningjava.uniagent.domain.service.feedback.FeedbackFormatter;
import org.learningjava.uniagent.domain.service.lint.StructuralValidator;
import org.learningjava.uniagent.domain.service.patch.PatchEngine;
import org.learningjava.uniagent.domain.service.prompting.PromptRepository;
import org.learningjava.uniagent.domain.service.protocol.ProtocolParser;
import org.learningjava.uniagent.domain.service.quality.MiniGameHeuristicChecker;
import org.learningjava.uniagent.support.Fixtures;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class RoundControllerTest {

    private static final String MODEL = "test-model";

    // CLEAN_GAME with the restart button closed by </div>: one mismatched-tag defect on line 11
    private static final String BROKEN_GAME = Fixtures.CLEAN_GAME.replace(
            "<button id=\"restart\">Restart</button>", "<button id=\"restart\">Restart</div>");

    private ChatLLMPort chat;
    private ProtocolParser parser;
    private PromptRepository prompts;
    private RoundController controller;

    @BeforeEach
    void setUp() {
        chat = mock(ChatLLMPort.class);
        parser = new ProtocolParser();
        prompts = new PromptRepository();
        controller = newController(new PatchEngine(parser));
    }

    private RoundController newController(PatchEngine patchEngine) {
        return new RoundController(parser, patchEngine, new StructuralValidator(),
                new MiniGameHeuristicChecker(), new FeedbackFormatter(12, 240),
                PatchModePolicy.DEFAULT, prompts);
    }

    private static ChatResult reply(String text) {
        return new ChatResult(text, new Usage(100, 10, 110));
    }

    private static List<String> userTurns(List<ChatTurn> turns) {
        return turns.stream().filter(t -> t.role() == Role.USER).map(ChatTurn::content).toList();
    }

    // --- run ------------------------------------------------------------------

    @Test
    void cleanDocumentWithFinal_isAcceptedInFirstRound() {
        when(chat.chat(anyString(), anyList(), anyString()))
                .thenReturn(reply(Fixtures.CLEAN_GAME + "\n[[FINAL]]"));

        GenerationResult r = controller.run(chat, MODEL, "dodge the blocks", 5, null);

        assertEquals(Outcome.FINALIZED, r.outcome());
        assertEquals(1, r.roundsUsed());
        assertEquals(Fixtures.CLEAN_GAME.strip(), r.document());
        assertEquals(new TokenUsage(100, 10, 110), r.usage());
        // kickoff + the accepted assistant turn, no feedback after it
        assertEquals(2, r.transcript().size());
        assertEquals(Role.ASSISTANT, r.transcript().get(1).role());
        verify(chat, times(1)).chat(eq(prompts.systemPrompt()), anyList(), eq(MODEL));
    }

    @Test
    void kickoffTurn_carriesTheTopic() {
        when(chat.chat(anyString(), anyList(), anyString()))
                .thenReturn(reply(Fixtures.CLEAN_GAME + "\n[[FINAL]]"));

        GenerationResult r = controller.run(chat, MODEL, "space frogs", 3, RoundListener.NONE);

        assertEquals(prompts.kickoff("space frogs"), r.transcript().get(0).content());
    }

    @Test
    void unbalancedScripts_areNotReady_andFinalIsRejectedUntilExhausted() {
        when(chat.chat(anyString(), anyList(), anyString()))
                .thenReturn(reply(Fixtures.TWO_SCRIPT_OPENS + "\n[[ASK:FINAL_OK?]]"))
                .thenReturn(reply("[[FINAL]]"));
        RoundListener listener = mock(RoundListener.class);

        GenerationResult r = controller.run(chat, MODEL, "topic", 2, listener);

        assertEquals(Outcome.EXHAUSTED, r.outcome());
        assertEquals(2, r.roundsUsed());
        assertEquals(Fixtures.TWO_SCRIPT_OPENS.strip(), r.document());
        assertEquals(new TokenUsage(200, 20, 220), r.usage());

        List<String> feedback = userTurns(r.transcript());
        assertThat(feedback).anySatisfy(f -> assertThat(f)
                .startsWith(FeedbackFormatter.FINAL_OK_TAG)
                .contains("Controller decision: NOT_READY"));
        assertThat(feedback).anySatisfy(f -> assertThat(f)
                .startsWith("Controller: FINAL rejected due to remaining issues.")
                .contains("unbalanced_script_tags"));

        verify(listener).roundStarted(1, 2);
        verify(listener).roundStarted(2, 2);
    }

    @Test
    void engineFailures_consumeRounds_andLeaveConversationUntouched() {
        when(chat.chat(anyString(), anyList(), anyString())).thenThrow(new EngineException("down"));

        GenerationResult r = controller.run(chat, MODEL, "topic", 3, null);

        assertEquals(Outcome.FAILED, r.outcome());
        assertEquals(3, r.roundsUsed());
        assertEquals("", r.document());
        assertEquals(TokenUsage.ZERO, r.usage());
        assertEquals(1, r.transcript().size());
        verify(chat, times(3)).chat(anyString(), anyList(), anyString());
    }

    @Test
    void engineFailure_thenSuccess_stillFinalizes() {
        when(chat.chat(anyString(), anyList(), anyString()))
                .thenThrow(new EngineException("timeout"))
                .thenReturn(reply(Fixtures.CLEAN_GAME + "\n[[FINAL]]"));

        GenerationResult r = controller.run(chat, MODEL, "topic", 3, null);

        assertEquals(Outcome.FINALIZED, r.outcome());
        assertEquals(2, r.roundsUsed());
    }

    @Test
    void smallDefect_triggersPatchMode_andPatchFixesDocument() {
        String patch = """
                *** Begin Patch
                *** Update File: index.html
                @@ restart button
                -11
                +<button id="restart">Restart</button>
                *** End Patch""";
        when(chat.chat(anyString(), anyList(), anyString()))
                .thenReturn(reply(BROKEN_GAME + "\n[[DO:LINT]]"))
                .thenReturn(reply(patch))
                .thenReturn(reply("[[FINAL]]"));

        GenerationResult r = controller.run(chat, MODEL, "topic", 5, null);

        assertEquals(Outcome.FINALIZED, r.outcome());
        assertEquals(3, r.roundsUsed());
        assertEquals(Fixtures.CLEAN_GAME.strip(), r.document().strip());

        List<String> feedback = userTurns(r.transcript());
        assertThat(feedback).anySatisfy(f -> assertThat(f)
                .contains("Mismatched closing tag </div>; expected </button>"));
        assertThat(feedback).anySatisfy(f -> assertThat(f)
                .startsWith(FeedbackFormatter.PATCH_MODE_TAG)
                .contains("ln11, <button id=\"restart\">Restart</div>"));
        assertThat(feedback).contains("[[RESULT:LINT]]\nLINTER: OK. No syntax issues.");
    }

    // --- processResponse --------------------------------------------------------

    @Test
    void noDocumentNoCommands_asksForADocument() {
        RoundState state = new RoundState();
        Conversation conv = new Conversation();

        assertFalse(controller.processResponse("I will think about it.", state, conv));

        assertEquals(2, conv.turns().size());
        assertEquals("I will think about it.", conv.turns().get(0).content());
        assertThat(conv.turns().get(1).content()).startsWith("Controller: No HTML detected.");
    }

    @Test
    void finalWithoutDocument_isRejected() {
        RoundState state = new RoundState();
        Conversation conv = new Conversation();

        assertFalse(controller.processResponse("[[FINAL]]", state, conv));

        assertEquals("Controller: FINAL rejected. No HTML detected.", conv.turns().get(1).content());
    }

    @Test
    void lintAndQgWithoutDocument_reportAbsence() {
        RoundState state = new RoundState();
        Conversation conv = new Conversation();

        controller.processResponse("[[DO:LINT]]\n[[DO:QG_CHECK]]", state, conv);

        List<String> feedback = userTurns(conv.turns());
        assertEquals("[[RESULT:LINT]]\nNo full HTML detected to lint.", feedback.get(0));
        assertThat(feedback.get(1)).startsWith("[[RESULT:QG_CHECK]]\nQG_CHECK: ISSUES").contains("no_html");
        assertEquals(1, state.lastDefects().size());
    }

    @Test
    void commandsAreAnsweredInOrder() {
        RoundState state = new RoundState();
        Conversation conv = new Conversation();

        controller.processResponse(Fixtures.CLEAN_GAME
                + "\n[[TOSELF: add sound]]\n[[DO:DEPLOY]]\n[[DO:QG_CHECK]]", state, conv);

        List<String> feedback = userTurns(conv.turns());
        assertEquals(3, feedback.size());
        assertEquals("[[SELF-INSTRUCTION]] add sound", feedback.get(0));
        assertThat(feedback.get(1)).contains("[[DO:DEPLOY]]");
        assertEquals("[[RESULT:QG_CHECK]]\nQG_CHECK: OK\nNo general issues detected.", feedback.get(2));
    }

    @Test
    void cleanDocumentWithoutCommands_isToldToFinalize() {
        RoundState state = new RoundState();
        Conversation conv = new Conversation();

        controller.processResponse(Fixtures.CLEAN_GAME, state, conv);

        assertThat(conv.turns().get(1).content()).startsWith("Controller: All checks pass.");
        assertEquals(ControllerPhase.FEEDBACK_EMISSION, state.phase());
    }

    @Test
    void patchWithoutDocument_isIgnored() {
        RoundState state = new RoundState();
        Conversation conv = new Conversation();

        controller.processResponse("*** Begin Patch\n-1\n*** End Patch", state, conv);

        assertFalse(state.hasDocument());
        assertEquals(1, conv.turns().size());
    }

    @Test
    void failedPatch_asksForFullDocument_andKeepsCurrentOne() {
        PatchEngine failing = mock(PatchEngine.class);
        when(failing.apply(anyString(), anyString())).thenReturn(PatchResult.failed("ignored", "Patch apply error: boom"));
        RoundController withFailingPatch = newController(failing);

        RoundState state = new RoundState();
        state.replaceDocument(BROKEN_GAME);
        Conversation conv = new Conversation();

        withFailingPatch.processResponse("*** Begin Patch\n-11\n*** End Patch", state, conv);

        assertEquals(BROKEN_GAME, state.document());
        assertThat(userTurns(conv.turns())).contains(
                "Controller: Patch apply failed: Patch apply error: boom. Please output the FULL corrected HTML instead.");
    }

    @Test
    void fullDocument_winsOverPatchInSameResponse() {
        RoundState state = new RoundState();
        state.replaceDocument(BROKEN_GAME);
        Conversation conv = new Conversation();

        controller.processResponse("*** Begin Patch\n-1\n*** End Patch\n" + Fixtures.CLEAN_GAME, state, conv);

        assertEquals(Fixtures.CLEAN_GAME.strip(), state.document());
    }

    @Test
    void assess_usesFreshChecks_notCachedResults() {
        RoundState state = new RoundState();
        state.replaceDocument(Fixtures.CLEAN_GAME);
        state.lastDefects(List.of(Defect.global("stale")));

        Readiness readiness = controller.assess(state);

        assertTrue(readiness.ready());
        assertTrue(readiness.hasDocument());
    }
}
