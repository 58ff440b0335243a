package org.learningjava.uniagent.domain.model.conversation;

import java.util.Locale;

public enum Role {
    SYSTEM,
    USER,
    ASSISTANT;

    /** Lower-case wire name used by the chat-completions APIs. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
