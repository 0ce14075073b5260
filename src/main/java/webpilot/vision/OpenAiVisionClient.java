package webpilot.vision;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import webpilot.session.SessionConfig;

import java.io.IOException;
import java.util.Base64;
import java.util.concurrent.TimeUnit;

/**
 * VisionService backed by an OpenAI-compatible chat-completions endpoint.
 * The screenshot travels inline as a base64 {@code data:} URL next to the prompt.
 */
public class OpenAiVisionClient implements VisionService {
    private static final Logger log = LoggerFactory.getLogger(OpenAiVisionClient.class);
    private static final MediaType JSON_MT = MediaType.get("application/json; charset=utf-8");
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String endpoint;
    private final String apiKey;
    private final String model;
    private final OkHttpClient http;

    public OpenAiVisionClient(String endpoint, String apiKey, String model, int timeoutSec) {
        this.endpoint = endpoint;
        this.apiKey   = apiKey;
        this.model    = model;
        this.http = new OkHttpClient.Builder()
            .connectTimeout(30, TimeUnit.SECONDS)
            .readTimeout(timeoutSec, TimeUnit.SECONDS)
            .build();
    }

    /** Factory: endpoint and model from config, API key from the configured environment variable. */
    public static OpenAiVisionClient fromConfig(SessionConfig config) {
        String envKey = config.getVisionApiKeyEnv();
        String apiKey = System.getenv(envKey);
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("Environment variable {} is not set, vision requests will be rejected", envKey);
            apiKey = "MISSING_" + envKey;
        }
        return new OpenAiVisionClient(
            config.getVisionEndpoint(),
            apiKey,
            config.getVisionModel(),
            config.getVisionTimeoutSec());
    }

    @Override
    public String describe(byte[] png, String prompt) throws IOException {
        ObjectNode imageUrl = MAPPER.createObjectNode();
        imageUrl.put("url", "data:image/png;base64," + Base64.getEncoder().encodeToString(png));

        ObjectNode textPart = MAPPER.createObjectNode();
        textPart.put("type", "text");
        textPart.put("text", prompt);

        ObjectNode imagePart = MAPPER.createObjectNode();
        imagePart.put("type", "image_url");
        imagePart.set("image_url", imageUrl);

        ObjectNode message = MAPPER.createObjectNode();
        message.put("role", "user");
        message.set("content", MAPPER.createArrayNode().add(textPart).add(imagePart));

        ObjectNode body = MAPPER.createObjectNode();
        body.put("model", model);
        body.set("messages", MAPPER.createArrayNode().add(message));

        Request request = new Request.Builder()
            .url(endpoint)
            .header("Authorization", "Bearer " + apiKey)
            .post(RequestBody.create(MAPPER.writeValueAsString(body), JSON_MT))
            .build();

        log.debug("Vision request: model={} prompt='{}' image={} bytes", model, prompt, png.length);
        try (Response response = http.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("Vision API error: " + response.code() + " " + response.message());
            }
            ResponseBody responseBody = response.body();
            if (responseBody == null) {
                throw new IOException("Vision API returned an empty body");
            }
            JsonNode content = MAPPER.readTree(responseBody.string())
                .path("choices").path(0).path("message").path("content");
            if (content.isMissingNode() || content.isNull()) {
                throw new IOException("Vision API response has no choices[0].message.content");
            }
            return content.asText();
        }
    }
}
