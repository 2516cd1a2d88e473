package com.kbase.retrieval.embedding;

import com.kbase.retrieval.model.EmbeddingModel;
import org.json.JSONObject;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Generic HTTP embeddings variant: {@code POST {baseUrl}/embeddings} with a bearer token and
 * {@code {"model": ..., "input": ...}}. Works with OpenAI and the many services copying its API.
 */
public class OpenAiCompatibleEmbeddingClient extends AbstractHttpEmbeddingClient {

    public OpenAiCompatibleEmbeddingClient(HttpClient httpClient, Duration requestTimeout) {
        super(httpClient, requestTimeout);
    }

    @Override
    protected URI endpoint(String baseUrl, EmbeddingModel model) {
        return URI.create(trimTrailingSlash(baseUrl) + "/embeddings");
    }

    @Override
    protected Map<String, String> headers(EmbeddingModel model) {
        return Map.of("Authorization", "Bearer " + model.getApiKey());
    }

    @Override
    protected JSONObject requestBody(String text, EmbeddingModel model) {
        JSONObject body = new JSONObject();
        body.put("model", model.getId());
        body.put("input", text);
        return body;
    }

    @Override
    protected List<EmbeddingResponseFormat> acceptedFormats() {
        return EmbeddingResponseFormat.GENERIC_FORMATS;
    }
}
