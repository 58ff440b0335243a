package org.learningjava.uniagent.domain.policy;

import org.learningjava.uniagent.domain.model.lint.Defect;
import org.learningjava.uniagent.domain.model.quality.Issue;

import java.util.List;

/**
 * Patch mode is worth it only for a few problems in a document big enough
 * that resending it costs more than a patch.
 */
public record PatchModePolicy(int minDocumentLength, int maxIssues) {

    public static final PatchModePolicy DEFAULT = new PatchModePolicy(200, 5);

    public boolean shouldUsePatch(List<Defect> lastDefects, List<Issue> lastIssues, int documentLength) {
        if (documentLength == 0) return false;
        int defects = lastDefects == null ? 0 : lastDefects.size();
        long errors = lastIssues == null ? 0 : lastIssues.stream().filter(Issue::isError).count();
        long total = defects + errors;
        return total > 0 && total <= maxIssues && documentLength >= minDocumentLength;
    }
}
