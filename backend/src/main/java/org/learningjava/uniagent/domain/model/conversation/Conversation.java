package org.learningjava.uniagent.domain.model.conversation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only list of chat turns sent to the engine each round.
 * Turns are immutable records; nothing here removes or replaces one.
 */
public class Conversation {

    private final List<ChatTurn> turns = new ArrayList<>();

    public void append(ChatTurn turn) {
        turns.add(turn);
    }

    public List<ChatTurn> turns() {
        return Collections.unmodifiableList(turns);
    }

    /** Copy for callers that outlive the run (job status, CLI). */
    public List<ChatTurn> snapshot() {
        return List.copyOf(turns);
    }
}
