package org.learningjava.uniagent.domain.policy;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.learningjava.uniagent.domain.model.quality.Severity;

/**
 * One regex heuristic from {@code quality_rules/rules.yml}.
 * The rule fires when {@code pattern} is ABSENT (or PRESENT, per {@code trigger}),
 * and only if {@code requires} (when set) matches somewhere in the document.
 * A {@code builtin} entry has no pattern; it marks where the code-level check of that name runs.
 */
public class QualityRule {

    public enum Trigger { ABSENT, PRESENT }

    @JsonProperty("name")
    private String name;

    @JsonProperty("builtin")
    private boolean builtin;

    @JsonProperty("pattern")
    private String pattern;

    @JsonProperty("ignoreCase")
    private boolean ignoreCase;

    @JsonProperty("trigger")
    private Trigger trigger = Trigger.ABSENT;

    @JsonProperty("requires")
    private String requires;

    @JsonProperty("severity")
    private Severity severity = Severity.WARN;

    @JsonProperty("detail")
    private String detail;

    @JsonProperty("hint")
    private String hint;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public boolean isBuiltin() {
        return builtin;
    }

    public void setBuiltin(boolean builtin) {
        this.builtin = builtin;
    }

    public String getPattern() {
        return pattern;
    }

    public void setPattern(String pattern) {
        this.pattern = pattern;
    }

    public boolean isIgnoreCase() {
        return ignoreCase;
    }

    public void setIgnoreCase(boolean ignoreCase) {
        this.ignoreCase = ignoreCase;
    }

    public Trigger getTrigger() {
        return trigger;
    }

    public void setTrigger(Trigger trigger) {
        this.trigger = trigger;
    }

    public String getRequires() {
        return requires;
    }

    public void setRequires(String requires) {
        this.requires = requires;
    }

    public Severity getSeverity() {
        return severity;
    }

    public void setSeverity(Severity severity) {
        this.severity = severity;
    }

    public String getDetail() {
        return detail;
    }

    public void setDetail(String detail) {
        this.detail = detail;
    }

    public String getHint() {
        return hint;
    }

    public void setHint(String hint) {
        this.hint = hint;
    }
}
