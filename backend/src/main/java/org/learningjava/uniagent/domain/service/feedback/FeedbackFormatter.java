package org.learningjava.uniagent.domain.service.feedback;

import org.learningjava.uniagent.domain.model.lint.Defect;
import org.learningjava.uniagent.domain.model.quality.Issue;
import org.learningjava.uniagent.domain.model.round.Readiness;
import org.learningjava.uniagent.domain.service.text.TextLines;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders controller feedback turns. The bracketed result tags are part of the protocol
 * the engine pattern-matches on; keep them stable.
 */
public class FeedbackFormatter {

    public static final String LINT_TAG = "[[RESULT:LINT]]";
    public static final String QG_TAG = "[[RESULT:QG_CHECK]]";
    public static final String FINAL_OK_TAG = "[[RESULT:FINAL_OK?]]";
    public static final String SELF_TAG = "[[SELF-INSTRUCTION]]";
    public static final String PATCH_MODE_TAG = "PATCH MODE ENABLED";

    private final int maxItems;
    private final int snippetMaxChars;

    public FeedbackFormatter(int maxItems, int snippetMaxChars) {
        this.maxItems = maxItems;
        this.snippetMaxChars = snippetMaxChars;
    }

    public String formatDefects(List<Defect> defects) {
        List<String> out = new ArrayList<>();
        int shown = Math.min(maxItems, defects.size());
        for (int i = 0; i < shown; i++) {
            Defect d = defects.get(i);
            String snippet = d.snippet().strip();
            if (snippet.length() > snippetMaxChars) {
                snippet = snippet.substring(0, snippetMaxChars) + "...";
            }
            out.add((i + 1) + ". Line " + d.line() + ": " + d.message() + " | Snippet: " + snippet);
        }
        int more = defects.size() - shown;
        if (more > 0) {
            out.add("... and " + more + " more");
        }
        return String.join("\n", out);
    }

    public String formatIssues(List<Issue> issues) {
        if (issues.isEmpty()) {
            return "QG_CHECK: OK\nNo general issues detected.";
        }
        List<String> lines = new ArrayList<>();
        lines.add("QG_CHECK: ISSUES");
        for (int i = 0; i < issues.size(); i++) {
            Issue it = issues.get(i);
            lines.add((i + 1) + ". [" + it.severity().name().toUpperCase(Locale.ROOT) + "] "
                    + it.name() + ": " + it.detail() + " | Hint: " + it.hint());
        }
        return String.join("\n", lines);
    }

    public String lintResult(List<Defect> defects) {
        String body = defects.isEmpty()
                ? "LINTER: OK. No syntax issues."
                : "LINTER: Found issues:\n" + formatDefects(defects);
        return LINT_TAG + "\n" + body;
    }

    public String lintWithoutDocument() {
        return LINT_TAG + "\nNo full HTML detected to lint.";
    }

    public String qgResult(List<Issue> issues) {
        return QG_TAG + "\n" + formatIssues(issues);
    }

    public String selfInstruction(String text) {
        return SELF_TAG + " " + text;
    }

    public String finalStatus(Readiness r) {
        List<String> report = new ArrayList<>();
        report.add(FINAL_OK_TAG);
        report.add("Controller decision: " + (r.ready() ? "READY" : "NOT_READY"));
        report.add("Lint OK: " + r.lintOk());
        report.add("QG errors: " + r.errorCount() + " of " + r.issues().size());
        report.add("Has HTML: " + r.hasDocument());
        if (!r.ready()) {
            report.add("Recommendation: Address remaining issues, then re-run [[DO:LINT]] and [[DO:QG_CHECK]].");
        }
        return String.join("\n", report);
    }

    public String finalRejected(Readiness r) {
        List<String> msg = new ArrayList<>();
        msg.add("Controller: FINAL rejected due to remaining issues.");
        appendProblems(msg, r);
        return String.join("\n", msg);
    }

    public String finalRejectedWithoutDocument() {
        return "Controller: FINAL rejected. No HTML detected.";
    }

    public String unknownCommand(String name, String argument) {
        return "Controller: Unknown or unhandled command [[" + name + ":" + argument
                + "]]; continue with improvements and checks.";
    }

    public String patchFailed(String reason) {
        return "Controller: Patch apply failed: " + reason + ". Please output the FULL corrected HTML instead.";
    }

    public String patchModeRequest(String document, String patchInstructions) {
        return PATCH_MODE_TAG + ": Changes appear small. In your NEXT reply, return ONLY the patch for index.html "
                + "using the format below. Do not include other text or protocol commands.\n\n"
                + "Current file with line prefixes for reference:\n"
                + TextLines.withLinePrefixes(document, "ln") + "\n\n"
                + "Patch Specification:\n"
                + patchInstructions;
    }

    public String allChecksPass() {
        return "Controller: All checks pass. Reply with [[FINAL]] and include the final full HTML again.";
    }

    public String noCommands(Readiness r, boolean patchModeHinted) {
        List<String> nudge = new ArrayList<>();
        nudge.add("Controller: No commands detected. Please fix issues and request checks.");
        appendProblems(nudge, r);
        if (!patchModeHinted) {
            nudge.add("Tip: If changes are small, you may reply with a patch next time.");
        }
        return String.join("\n", nudge);
    }

    public String noDocument() {
        return "Controller: No HTML detected. Output a complete HTML5 document and then add [[DO:LINT]] and [[DO:QG_CHECK]].";
    }

    private void appendProblems(List<String> out, Readiness r) {
        if (!r.defects().isEmpty()) {
            out.add("Linter issues:\n" + formatDefects(r.defects()));
        }
        if (!r.issues().isEmpty()) {
            out.add("QG issues:\n" + formatIssues(r.issues()));
        }
    }
}
