package org.learningjava.uniagent.domain.model.patch;

import java.util.List;

/**
 * Parsed body of a Begin/End Patch block.
 *
 * @param deletions 1-based line numbers, as written, against the pre-patch document
 * @param additions full replacement lines, in order, without line terminators
 */
public record PatchBlock(List<Integer> deletions, List<String> additions) {

    public PatchBlock {
        deletions = List.copyOf(deletions);
        additions = List.copyOf(additions);
    }
}
