package smartlocator.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Minimal client for an OpenAI-compatible {@code /chat/completions} endpoint
 * (Ollama, vLLM, LM Studio or a hosted API).
 *
 * <p>Server errors (5xx) and I/O failures are retried up to {@code retryCount}
 * times; client errors and malformed responses fail immediately.
 */
public class LLMClient {

    private static final Logger log = LoggerFactory.getLogger(LLMClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String baseUrl;
    private final String model;
    private final double temperature;
    private final int maxTokens;
    private final int retryCount;
    private final long retryDelayMs;
    private final String apiKey;
    private final OkHttpClient httpClient;

    public LLMClient(String baseUrl, String model, double temperature, int maxTokens,
                     int timeoutSec, int retryCount, long retryDelayMs) {
        this(baseUrl, model, temperature, maxTokens, timeoutSec, retryCount, retryDelayMs,
                System.getenv("SMART_LOCATOR_LLM_API_KEY"));
    }

    /**
     * @param apiKey bearer token sent as {@code Authorization}; {@code null} for local servers
     */
    public LLMClient(String baseUrl, String model, double temperature, int maxTokens,
                     int timeoutSec, int retryCount, long retryDelayMs, String apiKey) {
        this.baseUrl      = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.model        = model;
        this.temperature  = temperature;
        this.maxTokens    = maxTokens;
        this.retryCount   = Math.max(0, retryCount);
        this.retryDelayMs = retryDelayMs;
        this.apiKey       = apiKey == null || apiKey.isBlank() ? null : apiKey.trim();
        this.httpClient   = new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(timeoutSec, TimeUnit.SECONDS)
                .writeTimeout(30, TimeUnit.SECONDS)
                .build();
    }

    /**
     * Sends one chat completion request.
     *
     * @param messages conversation in order
     * @return {@code choices[0].message.content}, trimmed
     * @throws IOException if the request fails after all retries, or the response is unusable
     */
    public String complete(List<ChatMessage> messages) throws IOException {
        String requestJson = buildRequestJson(messages);
        String url = baseUrl + "/chat/completions";
        log.debug("LLM request to {} | model={} | {} message(s)", url, model, messages.size());

        IOException lastException = null;
        for (int attempt = 0; attempt <= retryCount; attempt++) {
            if (attempt > 0) {
                log.warn("Retrying LLM request (attempt {}/{}) after {}ms delay", attempt, retryCount, retryDelayMs);
                pause();
            }

            Request.Builder request = new Request.Builder()
                    .url(url)
                    .post(RequestBody.create(requestJson, JSON));
            if (apiKey != null) {
                request.header("Authorization", "Bearer " + apiKey);
            }

            try (Response response = httpClient.newCall(request.build()).execute()) {
                String body = response.body() != null ? response.body().string() : "";
                int status = response.code();
                if (status >= 500) {
                    log.warn("LLM endpoint returned {} on attempt {}", status, attempt + 1);
                    lastException = new IOException("LLM server error " + status + ": " + abbreviate(body));
                    continue;
                }
                if (!response.isSuccessful()) {
                    throw new NonRetriableException("LLM request failed with HTTP " + status + ": " + abbreviate(body));
                }
                return parseContent(body);
            } catch (NonRetriableException e) {
                throw e;
            } catch (IOException e) {
                log.warn("LLM request I/O error on attempt {}: {}", attempt + 1, e.getMessage());
                lastException = e;
            }
        }

        throw new IOException("LLM request failed after " + (retryCount + 1) + " attempt(s). Last error: "
                + (lastException != null ? lastException.getMessage() : "unknown"), lastException);
    }

    public String getModel() { return model; }

    // ── Internal helpers ──────────────────────────────────────────────────

    private String buildRequestJson(List<ChatMessage> messages) throws IOException {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("model", model);
        root.put("temperature", temperature);
        root.put("max_tokens", maxTokens);
        root.put("stream", false);

        ArrayNode msgs = root.putArray("messages");
        for (ChatMessage msg : messages) {
            msgs.addObject()
                    .put("role", msg.role())
                    .put("content", msg.content());
        }
        return MAPPER.writeValueAsString(root);
    }

    private static String parseContent(String responseBody) throws IOException {
        JsonNode root;
        try {
            root = MAPPER.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new NonRetriableException("Failed to parse LLM response JSON: " + e.getOriginalMessage(), e);
        }
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new NonRetriableException("LLM response missing 'choices' array: " + abbreviate(responseBody));
        }
        JsonNode content = choices.get(0).path("message").path("content");
        if (content.isMissingNode() || content.isNull()) {
            throw new NonRetriableException("LLM response missing choices[0].message.content");
        }
        return content.asText().trim();
    }

    private void pause() throws IOException {
        try {
            Thread.sleep(retryDelayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted during retry delay", ie);
        }
    }

    private static String abbreviate(String s) {
        if (s == null || s.isEmpty()) return "<empty>";
        return s.length() > 300 ? s.substring(0, 300) + "..." : s;
    }

    /** Marks failures that another attempt cannot fix. */
    private static final class NonRetriableException extends IOException {
        NonRetriableException(String msg) { super(msg); }
        NonRetriableException(String msg, Throwable cause) { super(msg, cause); }
    }

    // ── Nested types ──────────────────────────────────────────────────────

    /** One chat turn. */
    public record ChatMessage(String role, String content) {

        public static ChatMessage system(String content) {
            return new ChatMessage("system", content);
        }

        public static ChatMessage user(String content) {
            return new ChatMessage("user", content);
        }
    }
}
