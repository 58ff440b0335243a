package org.learningjava.uniagent.infrastructure.adapter.out.ollama;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.learningjava.uniagent.application.port.ChatLLMPort;
import org.learningjava.uniagent.application.port.EngineException;
import org.learningjava.uniagent.domain.model.conversation.ChatTurn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
public class OllamaChatAdapter implements ChatLLMPort {

    private static final Logger log = LoggerFactory.getLogger(OllamaChatAdapter.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient http;
    private final ObjectMapper om = new ObjectMapper();
    private final String baseUrl;
    private final int numCtx;

    private static OkHttpClient defaultClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .writeTimeout(Duration.ofSeconds(600))   // whole conversation goes up every round
                .readTimeout(Duration.ofMinutes(3))      // a full HTML file takes a while
                .retryOnConnectionFailure(true)
                .build();
    }

    @Autowired
    public OllamaChatAdapter(@Value("${uniagent.ollama.url:http://localhost:11434}") String baseUrl,
                             @Value("${uniagent.ollama.num-ctx:16384}") int numCtx) {
        this(defaultClient(), baseUrl, numCtx);
    }

    OllamaChatAdapter(OkHttpClient http, String baseUrl, int numCtx) {
        this.http = http;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.numCtx = numCtx;
    }

    @Override
    public String provider() { return "ollama"; }

    /** Multi-turn chat via /api/chat; usage from prompt_eval_count / eval_count. */
    @Override
    public ChatResult chat(String systemPrompt, List<ChatTurn> turns, String model) {
        try {
            return doChat(model, systemPrompt, turns);
        } catch (IOException e) {
            throw new EngineException("Ollama chat failed: " + e.getMessage(), e);
        }
    }

    private ChatResult doChat(String modelName, String systemPrompt, List<ChatTurn> turns) throws IOException {
        List<Map<String, String>> messages = new ArrayList<>(turns.size() + 1);
        messages.add(Map.of("role", "system", "content", systemPrompt));
        for (ChatTurn t : turns) {
            messages.add(Map.of("role", t.role().wireName(), "content", t.content()));
        }
        var body = Map.of(
                "model", modelName,
                "messages", messages,
                "stream", false,
                "options", Map.of("num_ctx", numCtx)
        );

        var req = new Request.Builder()
                .url(baseUrl + "/api/chat")
                .header("Accept", "application/json")
                .post(RequestBody.create(om.writeValueAsBytes(body), JSON))
                .build();

        try (Response resp = http.newCall(req).execute()) {
            if (!resp.isSuccessful()) {
                String bodyStr = resp.body() != null ? resp.body().string() : "";
                throw new IOException("HTTP " + resp.code() + " - " + resp.message() + " | body=" + bodyStr);
            }
            var raw = resp.body() != null ? resp.body().string() : "{}";
            JsonNode json = om.readTree(raw);

            String text = json.path("message").path("content").asText("");

            Integer promptTok = json.has("prompt_eval_count") && json.get("prompt_eval_count").canConvertToInt()
                    ? json.get("prompt_eval_count").asInt() : null;
            Integer completionTok = json.has("eval_count") && json.get("eval_count").canConvertToInt()
                    ? json.get("eval_count").asInt() : null;
            log.debug("Ollama: model={}, promptTok={}, completionTok={}", modelName, promptTok, completionTok);

            Usage usage = (promptTok != null || completionTok != null) ? new Usage(promptTok, completionTok, null) : null;
            return new ChatResult(text, usage);
        }
    }
}
