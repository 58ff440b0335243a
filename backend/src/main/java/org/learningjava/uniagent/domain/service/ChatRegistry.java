package org.learningjava.uniagent.domain.service;

import org.learningjava.uniagent.application.port.ChatLLMPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Chat engines by provider id. Ids are matched case-insensitively and listed in sorted order.
 */
@Component
public class ChatRegistry {

    private static final Logger log = LoggerFactory.getLogger(ChatRegistry.class);

    private final Map<String, ChatLLMPort> engines = new TreeMap<>();

    public ChatRegistry(List<ChatLLMPort> adapters) {
        for (ChatLLMPort adapter : adapters) {
            String id = normalize(adapter.provider());
            ChatLLMPort previous = engines.putIfAbsent(id, adapter);
            if (previous != null) {
                throw new IllegalStateException("Two chat engines claim provider '" + id + "': "
                        + previous.getClass().getSimpleName() + ", " + adapter.getClass().getSimpleName());
            }
        }
        log.info("Chat engines registered: {}", engines.keySet());
    }

    /** Engine for {@code id}, or {@code IllegalArgumentException} naming the unknown provider. */
    public ChatLLMPort resolve(String id) {
        ChatLLMPort engine = id == null ? null : engines.get(normalize(id));
        if (engine == null) {
            throw new IllegalArgumentException("Unknown provider: " + id);
        }
        return engine;
    }

    public Set<String> listProviders() {
        return Collections.unmodifiableSet(engines.keySet());
    }

    private static String normalize(String id) {
        return id.trim().toLowerCase(Locale.ROOT);
    }
}
