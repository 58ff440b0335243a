package org.learningjava.uniagent.domain.service.prompting;

import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class PromptRepository {

    public static final String SYSTEM = "system";
    public static final String PATCH_FORMAT = "patch-format";

    private static final Map<String, String> prompts = Map.of(
            SYSTEM,
            """
                    You are UniAgent, a single self-steering agent that produces, critiques, and iterates on a single-file HTML5 mini-game.

                    Protocol (use this exact special syntax; each on its own line):
                    - [[DO:LINT]]            -> Ask controller to run an HTML syntax linter on your latest full HTML and return results.
                    - [[DO:QG_CHECK]]        -> Ask controller to run general QA checks (bugs, disconnects, mobile readiness) and return results.
                    - [[TOSELF: <prompt>]]   -> Send yourself a new "user" instruction for the next turn (self-feedback). Keep it concise and actionable.
                    - [[ASK:FINAL_OK?]]      -> Ask controller if all checks are clear. Controller will reply. If not clear, continue improving.
                    - [[FINAL]]              -> Use only when you have a clean, mobile-friendly, playable single-file HTML and all checks are clear.

                    Optional patch mode:
                    - When the controller provides a numbered file view and patch instructions, and changes are small, respond with ONLY a patch using that format. Otherwise output full HTML.

                    Rules:
                    - Always output one complete, valid HTML5 document (<!DOCTYPE html> ... </html>) whenever you write or revise code, unless controller explicitly requests patch-only mode.
                    - After the HTML (or the patch), list any commands using the special syntax lines above. Zero or more per turn.
                    - Generate your TOSELF prompt by questioning general things:
                      * Is any part of the code likely buggy or undefined?
                      * Anything feels disconnected (buttons without handlers, loops not running, variables not declared)?
                      * Is the UI mobile-ready (viewport meta, touch controls, 44px targets, 16px fonts)?
                      * Are game loops and state transitions robust?
                    - If linter or QA feedback reports issues, fix them in the next HTML and request checks again.
                    - If controller responds that all checks are clear, emit [[FINAL]] with the final, full HTML.

                    Deliverable:
                    - A complete single-file <html> with inline <style> and <script>, playable and mobile-friendly.
                    """,
            PATCH_FORMAT,
            """
                    *** Begin Patch
                    *** Update File: index.html
                    @@ <body>
                    -<line_number_to_delete>
                    +<new_code_line_to_add>
                    *** End Patch

                    Rules:
                    - For deletions: -<line_number> (single integer, refers to current file line number)
                    - For additions: +<new_code_line> (write full new line, no line number)
                    - Show 3 lines of context before and after each change if possible.
                    - If multiple sections need changes, repeat the *** Update File header.
                    - Only return the patch. Do not add commentary.
                    """
    );

    public String getPrompt(String key) {
        return prompts.getOrDefault(key, "");
    }

    public String systemPrompt() {
        return getPrompt(SYSTEM);
    }

    public String patchInstructions() {
        return getPrompt(PATCH_FORMAT);
    }

    /** First user turn of a run. */
    public String kickoff(String topic) {
        return "User request: Build a tiny playable mini-game from this idea:\n"
                + topic + "\n\n"
                + "Produce one complete HTML5 file now. Then request checks with [[DO:LINT]] and [[DO:QG_CHECK]], "
                + "and add one [[TOSELF: ...]] instruction to improve next turn.";
    }
}
