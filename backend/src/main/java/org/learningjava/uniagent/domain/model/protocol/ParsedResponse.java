package org.learningjava.uniagent.domain.model.protocol;

import java.util.List;
import java.util.Optional;

/**
 * What the protocol parser found in one engine response.
 *
 * @param text       response with code fences removed
 * @param document   first embedded full HTML document, if any
 * @param patchBlock first Begin/End Patch block, if any
 * @param commands   command lines in document order
 */
public record ParsedResponse(
        String text,
        Optional<String> document,
        Optional<String> patchBlock,
        List<RawCommand> commands
) {
    public ParsedResponse {
        commands = commands == null ? List.of() : List.copyOf(commands);
    }
}
