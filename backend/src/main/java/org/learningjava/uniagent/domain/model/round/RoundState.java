package org.learningjava.uniagent.domain.model.round;

import org.learningjava.uniagent.domain.model.lint.Defect;
import org.learningjava.uniagent.domain.model.quality.Issue;

import java.util.List;

/**
 * Per-run controller state: the current document, the latest check results
 * and whether patch mode was hinted to the engine last round.
 */
public class RoundState {

    private String document;
    private List<Defect> lastDefects = List.of();
    private List<Issue> lastIssues = List.of();
    private boolean patchModeHinted;
    private ControllerPhase phase = ControllerPhase.AWAITING_RESPONSE;

    public boolean hasDocument() {
        return document != null && !document.isEmpty();
    }

    public String document() { return document; }
    public void replaceDocument(String document) { this.document = document; }

    public List<Defect> lastDefects() { return lastDefects; }
    public void lastDefects(List<Defect> defects) { this.lastDefects = List.copyOf(defects); }

    public List<Issue> lastIssues() { return lastIssues; }
    public void lastIssues(List<Issue> issues) { this.lastIssues = List.copyOf(issues); }

    public boolean patchModeHinted() { return patchModeHinted; }
    public void patchModeHinted(boolean hinted) { this.patchModeHinted = hinted; }

    public ControllerPhase phase() { return phase; }
    public void phase(ControllerPhase phase) { this.phase = phase; }
}
