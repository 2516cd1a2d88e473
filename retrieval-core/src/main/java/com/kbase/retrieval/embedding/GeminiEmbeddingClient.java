package com.kbase.retrieval.embedding;

import com.kbase.retrieval.model.EmbeddingModel;
import org.json.JSONArray;
import org.json.JSONObject;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Native Gemini variant calling {@code models/{id}:embedContent}.
 */
public class GeminiEmbeddingClient extends AbstractHttpEmbeddingClient {

    public static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com/v1beta";

    public GeminiEmbeddingClient(HttpClient httpClient, Duration requestTimeout) {
        super(httpClient, requestTimeout);
    }

    @Override
    protected URI endpoint(String baseUrl, EmbeddingModel model) {
        String modelName = URLEncoder.encode(stripModelsPrefix(model.getId()), StandardCharsets.UTF_8);
        return URI.create(trimTrailingSlash(baseUrl) + "/models/" + modelName + ":embedContent");
    }

    @Override
    protected Map<String, String> headers(EmbeddingModel model) {
        return Map.of("x-goog-api-key", model.getApiKey());
    }

    @Override
    protected JSONObject requestBody(String text, EmbeddingModel model) {
        JSONObject part = new JSONObject().put("text", text);
        JSONObject content = new JSONObject().put("parts", new JSONArray().put(part));
        return new JSONObject()
                .put("model", "models/" + stripModelsPrefix(model.getId()))
                .put("content", content);
    }

    @Override
    protected List<EmbeddingResponseFormat> acceptedFormats() {
        return List.of(EmbeddingResponseFormat.GEMINI_VALUES);
    }

    @Override
    protected String defaultBaseUrl() {
        return DEFAULT_BASE_URL;
    }

    /**
     * Gemini descriptors carry their output width; without it the caller falls back to a probe.
     */
    @Override
    public OptionalInt declaredDimensions(EmbeddingModel model) {
        Integer dimensions = model.getDimensions();
        return dimensions != null && dimensions > 0 ? OptionalInt.of(dimensions) : OptionalInt.empty();
    }

    private static String stripModelsPrefix(String modelId) {
        return modelId.startsWith("models/") ? modelId.substring("models/".length()) : modelId;
    }
}
