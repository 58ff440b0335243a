package org.learningjava.uniagent.domain.service.feedback;

import org.junit.jupiter.api.Test;
import org.learningjava.uniagent.domain.model.lint.Defect;
import org.learningjava.uniagent.domain.model.quality.Issue;
import org.learningjava.uniagent.domain.model.quality.Severity;
import org.learningjava.uniagent.domain.model.round.Readiness;

import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

class FeedbackFormatterTest {

    private final FeedbackFormatter fmt = new FeedbackFormatter(12, 240);

    @Test
    void formatDefects_capsAtMaxItems_andCountsTheRest() {
        List<Defect> defects = new ArrayList<>();
        for (int i = 1; i <= 15; i++) {
            defects.add(new Defect("Problem " + i, i, "<p>"));
        }

        String out = fmt.formatDefects(defects);
        String[] lines = out.split("\n");

        assertEquals(13, lines.length);
        assertEquals("1. Line 1: Problem 1 | Snippet: <p>", lines[0]);
        assertEquals("12. Line 12: Problem 12 | Snippet: <p>", lines[11]);
        assertEquals("... and 3 more", lines[12]);
    }

    @Test
    void formatDefects_truncatesLongSnippets() {
        String longLine = "x".repeat(300);

        String out = fmt.formatDefects(List.of(new Defect("Long", 4, longLine)));

        assertEquals("1. Line 4: Long | Snippet: " + "x".repeat(240) + "...", out);
    }

    @Test
    void lintResult_okAndFound() {
        assertEquals("[[RESULT:LINT]]\nLINTER: OK. No syntax issues.", fmt.lintResult(List.of()));
        assertThat(fmt.lintResult(List.of(Defect.global("Missing <body> tag"))),
                startsWith("[[RESULT:LINT]]\nLINTER: Found issues:\n1. Line 1: Missing <body> tag | Snippet: "));
    }

    @Test
    void qgResult_listsSeverityUppercase() {
        Issue warn = new Issue("no_game_loop", "No loop.", "Add one.", Severity.WARN);

        assertEquals("[[RESULT:QG_CHECK]]\nQG_CHECK: OK\nNo general issues detected.", fmt.qgResult(List.of()));
        assertEquals("[[RESULT:QG_CHECK]]\nQG_CHECK: ISSUES\n1. [WARN] no_game_loop: No loop. | Hint: Add one.",
                fmt.qgResult(List.of(warn)));
    }

    @Test
    void finalStatus_notReady_carriesRecommendation() {
        Readiness r = new Readiness(List.of(),
                List.of(new Issue("unbalanced_script_tags", "d", "h", Severity.ERROR),
                        new Issue("no_game_loop", "d", "h", Severity.WARN)),
                true);

        String out = fmt.finalStatus(r);

        assertThat(out, startsWith("[[RESULT:FINAL_OK?]]\nController decision: NOT_READY"));
        assertThat(out, containsString("Lint OK: true"));
        assertThat(out, containsString("QG errors: 1 of 2"));
        assertThat(out, containsString("Has HTML: true"));
        assertThat(out, containsString("Recommendation:"));
    }

    @Test
    void finalStatus_ready_hasNoRecommendation() {
        String out = fmt.finalStatus(new Readiness(List.of(), List.of(), true));

        assertThat(out, containsString("Controller decision: READY"));
        assertThat(out, not(containsString("Recommendation")));
    }

    @Test
    void noCommands_tipOnlyWhenPatchModeNotHinted() {
        Readiness r = new Readiness(List.of(Defect.global("Missing <head> tag")), List.of(), true);

        assertThat(fmt.noCommands(r, false), allOf(
                startsWith("Controller: No commands detected."),
                containsString("Linter issues:\n1. Line 1: Missing <head> tag"),
                containsString("Tip: If changes are small")));
        assertThat(fmt.noCommands(r, true), not(containsString("Tip:")));
    }

    @Test
    void patchModeRequest_showsNumberedFileAndInstructions() {
        String out = fmt.patchModeRequest("<html>\n</html>\n", "FORMAT");

        assertThat(out, startsWith("PATCH MODE ENABLED"));
        assertThat(out, containsString("ln1, <html>\nln2, </html>"));
        assertThat(out, endsWith("Patch Specification:\nFORMAT"));
    }

    @Test
    void shortMessages() {
        assertEquals("[[SELF-INSTRUCTION]] add sound", fmt.selfInstruction("add sound"));
        assertEquals("Controller: Unknown or unhandled command [[DO:DEPLOY]]; continue with improvements and checks.",
                fmt.unknownCommand("DO", "DEPLOY"));
        assertThat(fmt.patchFailed("No patch block found."),
                containsString("No patch block found.. Please output the FULL corrected HTML instead."));
    }
}
