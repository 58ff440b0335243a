package org.learningjava.uniagent.domain.service;

import org.junit.jupiter.api.Test;
import org.learningjava.uniagent.application.port.ChatLLMPort;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ChatRegistryTest {

    private static ChatLLMPort engine(String provider) {
        ChatLLMPort port = mock(ChatLLMPort.class);
        when(port.provider()).thenReturn(provider);
        return port;
    }

    @Test
    void resolve_matchesIdIgnoringCaseAndSpaces() {
        ChatLLMPort ollama = engine("ollama");
        ChatRegistry registry = new ChatRegistry(List.of(engine("openai"), ollama));

        assertSame(ollama, registry.resolve(" Ollama "));
    }

    @Test
    void resolve_unknownOrNull_namesTheProvider() {
        ChatRegistry registry = new ChatRegistry(List.of(engine("openai")));

        IllegalArgumentException unknown = assertThrows(IllegalArgumentException.class,
                () -> registry.resolve("gemini"));
        assertEquals("Unknown provider: gemini", unknown.getMessage());
        assertThrows(IllegalArgumentException.class, () -> registry.resolve(null));
    }

    @Test
    void duplicateProviderIds_failAtStartup() {
        List<ChatLLMPort> adapters = List.of(engine("openai"), engine("OpenAI"));

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> new ChatRegistry(adapters));
        assertTrue(ex.getMessage().contains("'openai'"));
    }

    @Test
    void listProviders_isSortedAndReadOnly() {
        ChatRegistry registry = new ChatRegistry(List.of(engine("openai"), engine("ollama")));

        assertEquals(List.of("ollama", "openai"), List.copyOf(registry.listProviders()));
        assertThrows(UnsupportedOperationException.class, () -> registry.listProviders().clear());
    }
}
