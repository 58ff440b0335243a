package org.learningjava.uniagent.infrastructure.adapter.out.openai;

import org.learningjava.uniagent.application.port.ChatLLMPort;
import org.learningjava.uniagent.application.port.EngineException;
import org.learningjava.uniagent.domain.model.conversation.ChatTurn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.*;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * OpenAI-compatible chat completions (OpenAI, OpenRouter and friends).
 * Retries 429/5xx, timeouts and unreadable bodies with capped exponential backoff.
 */
@Component
public class OpenAiChatAdapter implements ChatLLMPort {

    private static final Logger log = LoggerFactory.getLogger(OpenAiChatAdapter.class);

    private static final double MAX_DELAY_SECONDS = 30.0;

    private final RestTemplate rest;
    private final String apiKey;
    private final String baseUrl;
    private final String systemRole;
    private final String reasoningEffort;
    private final String verbosity;
    private final int maxRetries;

    @Autowired
    public OpenAiChatAdapter(
            @Value("${OPENAI_API_KEY:}") String envKey,
            @Value("${OPENAI_API_KEY_FILE:/run/secrets/openai_api_key}") String apiKeyFilePath,
            @Value("${uniagent.openai.base-url:https://api.openai.com/v1}") String baseUrl,
            @Value("${uniagent.openai.system-role:developer}") String systemRole,
            @Value("${uniagent.openai.reasoning-effort:low}") String reasoningEffort,
            @Value("${uniagent.openai.verbosity:low}") String verbosity,
            @Value("${uniagent.openai.max-retries:6}") int maxRetries,
            @Value("${uniagent.openai.connect-timeout.ms:15000}") int connectTimeoutMs,
            @Value("${uniagent.openai.read-timeout.ms:180000}") int readTimeoutMs
    ) {
        this(buildRestTemplate(connectTimeoutMs, readTimeoutMs), resolveApiKey(envKey, apiKeyFilePath),
                baseUrl, systemRole, reasoningEffort, verbosity, maxRetries);
    }

    OpenAiChatAdapter(RestTemplate rest, String apiKey, String baseUrl, String systemRole,
                      String reasoningEffort, String verbosity, int maxRetries) {
        this.rest = rest;
        this.apiKey = apiKey;
        this.baseUrl = trimTrailingSlash(baseUrl);
        this.systemRole = systemRole;
        this.reasoningEffort = reasoningEffort;
        this.verbosity = verbosity;
        this.maxRetries = Math.max(1, maxRetries);
        log.debug("OpenAiChatAdapter init: baseUrl={}, systemRole={}, maxRetries={}", this.baseUrl, systemRole, this.maxRetries);
    }

    @Override
    public String provider() { return "openai"; }

    @Override
    public ChatResult chat(String systemPrompt, List<ChatTurn> turns, String model) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new EngineException("OpenAI API key not configured. Set OPENAI_API_KEY or mount OPENAI_API_KEY_FILE.");
        }
        final String url = baseUrl + "/chat/completions";

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.setBearerAuth(apiKey);

        HttpEntity<Map<String, Object>> request = new HttpEntity<>(buildBody(systemPrompt, turns, model), headers);

        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            log.info("API: Request attempt {}/{}", attempt, maxRetries);
            try {
                ResponseEntity<Map> response = rest.postForEntity(url, request, Map.class);
                if (response.getBody() == null) {
                    throw new EngineException("OpenAI call returned no body: status=" + response.getStatusCode().value());
                }
                return parse(response.getBody());
            } catch (HttpStatusCodeException ex) {
                int status = ex.getStatusCode().value();
                if (status == 429 || ex.getStatusCode().is5xxServerError()) {
                    String bodyText = safeBody(ex);
                    double delay = backoffSeconds(attempt);
                    log.warn("API: HTTP {}. Retrying in {}s. Body: {}", status, String.format("%.1f", delay),
                            bodyText.length() > 500 ? bodyText.substring(0, 500) : bodyText);
                    pause(delay);
                    continue;
                }
                log.error("API: HTTP {} {} for model='{}'\nResponse body: {}", status, ex.getStatusText(), model, safeBody(ex));
                if (status == HttpStatus.UNAUTHORIZED.value()) {
                    throw new EngineException("OpenAI 401 Unauthorized. Check API key and model access.", ex);
                }
                throw new EngineException("OpenAI error: " + status + " " + ex.getStatusText(), ex);
            } catch (ResourceAccessException io) {
                double delay = backoffSeconds(attempt);
                log.warn("API: Timeout or connection problem ({}). Retrying in {}s...", io.getMessage(), String.format("%.1f", delay));
                pause(delay);
            } catch (RestClientException unreadable) {
                double delay = backoffSeconds(attempt);
                log.warn("API: Unreadable response ({}). Retrying in {}s...", unreadable.getMessage(), String.format("%.1f", delay));
                pause(delay);
            }
        }
        throw new EngineException("API: Exhausted retries without success.");
    }

    // ---- helpers ----

    private Map<String, Object> buildBody(String systemPrompt, List<ChatTurn> turns, String model) {
        List<Map<String, Object>> messages = new ArrayList<>(turns.size() + 1);
        messages.add(Map.of("role", systemRole, "content", systemPrompt));
        for (ChatTurn t : turns) {
            messages.add(Map.of("role", t.role().wireName(), "content", t.content()));
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", messages);
        body.put("response_format", Map.of("type", "text"));
        if (verbosity != null && !verbosity.isBlank()) body.put("verbosity", verbosity);
        if (reasoningEffort != null && !reasoningEffort.isBlank()) body.put("reasoning_effort", reasoningEffort);
        return body;
    }

    private ChatResult parse(Map<?, ?> body) {
        // content: choices[0].message.content
        String content = "";
        Object choices = body.get("choices");
        if (choices instanceof List<?> list && !list.isEmpty()) {
            Object first = list.get(0);
            if (first instanceof Map<?, ?> m) {
                Object message = m.get("message");
                if (message instanceof Map<?, ?> mm) {
                    Object c = mm.get("content");
                    if (c != null) content = String.valueOf(c);
                }
            }
        } else {
            log.warn("OpenAI response missing choices[0].message.content; returning empty string. Raw body={}", body);
        }

        Usage usageObj = null;
        Object usage = body.get("usage");
        if (usage instanceof Map<?, ?> u) {
            Integer pt = u.get("prompt_tokens") instanceof Number n ? n.intValue() : null;
            Integer ct = u.get("completion_tokens") instanceof Number n ? n.intValue() : null;
            Integer tt = u.get("total_tokens") instanceof Number n ? n.intValue() : null;
            if (pt != null || ct != null || tt != null) {
                usageObj = new Usage(pt, ct, tt);
                log.info("API: Tokens used - Prompt: {}, Completion: {}, Total: {}", pt, ct, tt);
            }
        }
        return new ChatResult(content, usageObj);
    }

    static double backoffSeconds(int attempt) {
        return Math.min(Math.pow(2, attempt) + ThreadLocalRandom.current().nextDouble(), MAX_DELAY_SECONDS);
    }

    private void pause(double seconds) {
        try {
            sleep(Math.round(seconds * 1000));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineException("Interrupted while backing off", e);
        }
    }

    /** Overridden in tests. */
    void sleep(long millis) throws InterruptedException {
        Thread.sleep(millis);
    }

    private static RestTemplate buildRestTemplate(int connectTimeoutMs, int readTimeoutMs) {
        SimpleClientHttpRequestFactory f = new SimpleClientHttpRequestFactory();
        f.setConnectTimeout(connectTimeoutMs);
        f.setReadTimeout(readTimeoutMs);
        return new RestTemplate(f);
    }

    private static String trimTrailingSlash(String s) {
        if (s == null) return "";
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }

    private static String resolveApiKey(String envKey, String filePath) {
        String key = envKey == null ? "" : envKey.trim();
        if (!key.isBlank()) return key;
        try {
            Path path = Path.of(filePath);
            if (Files.exists(path)) {
                return Files.readString(path, StandardCharsets.UTF_8).trim();
            }
        } catch (IOException e) {
            log.warn("Could not read API key file {}: {}", filePath, e.toString());
        }
        return "";
    }

    private static String safeBody(HttpStatusCodeException ex) {
        String s = ex.getResponseBodyAsString();
        return s == null ? "" : s;
    }
}
