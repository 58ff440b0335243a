package org.learningjava.uniagent.domain.model.conversation;

import java.util.Objects;

public record ChatTurn(Role role, String content) {

    public ChatTurn {
        Objects.requireNonNull(role, "role");
        content = content == null ? "" : content;
    }

    public static ChatTurn user(String content) {
        return new ChatTurn(Role.USER, content);
    }

    public static ChatTurn assistant(String content) {
        return new ChatTurn(Role.ASSISTANT, content);
    }
}
