package org.learningjava.uniagent.domain.model.round;

import org.learningjava.uniagent.domain.model.lint.Defect;
import org.learningjava.uniagent.domain.model.quality.Issue;

import java.util.List;

/**
 * Fresh validator and checker results for the finalization gate.
 * Ready means no structural defects and no error-severity issues.
 */
public record Readiness(List<Defect> defects, List<Issue> issues, boolean hasDocument) {

    public Readiness {
        defects = List.copyOf(defects);
        issues = List.copyOf(issues);
    }

    public long errorCount() {
        return issues.stream().filter(Issue::isError).count();
    }

    public boolean lintOk() {
        return defects.isEmpty();
    }

    public boolean ready() {
        return lintOk() && errorCount() == 0;
    }
}
