package org.learningjava.uniagent.domain.model.lint;

/**
 * Structural problem reported by the validator.
 *
 * @param message human-readable description
 * @param line    1-based line in the comment-stripped document
 * @param snippet trimmed source line, empty for document-wide checks
 */
public record Defect(String message, int line, String snippet) {

    public Defect {
        snippet = snippet == null ? "" : snippet;
    }

    public static Defect global(String message) {
        return new Defect(message, 1, "");
    }
}
