package org.learningjava.uniagent.domain.service.quality;

import org.learningjava.uniagent.domain.model.quality.Issue;

import java.util.List;

/**
 * Advisory checks beyond syntax. Only ERROR issues block finalization.
 */
public interface HeuristicChecker {

    List<Issue> check(String document);
}
