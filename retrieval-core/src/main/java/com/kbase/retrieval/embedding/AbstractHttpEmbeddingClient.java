package com.kbase.retrieval.embedding;

import com.kbase.retrieval.model.EmbeddingModel;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Shared plumbing for embedding clients that talk JSON over HTTP: descriptor validation,
 * request dispatch and status handling. Subclasses supply the endpoint, headers and body shape.
 */
public abstract class AbstractHttpEmbeddingClient implements EmbeddingClient {

    private static final Logger logger = LoggerFactory.getLogger(AbstractHttpEmbeddingClient.class);

    private static final int MAX_ERROR_BODY_LENGTH = 300;

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    protected AbstractHttpEmbeddingClient(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public List<Float> embed(String text, EmbeddingModel model) {
        String baseUrl = resolveBaseUrl(model);
        if (model.getApiKey() == null || model.getApiKey().isBlank()) {
            throw new EmbeddingException("Embedding model " + model.getId() + " has no API key configured");
        }
        if (!isValidUrl(baseUrl)) {
            throw new EmbeddingException("Embedding model " + model.getId()
                    + " has no valid API endpoint configured: " + baseUrl);
        }

        URI endpoint = endpoint(baseUrl, model);
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json");
        headers(model).forEach(builder::header);
        HttpRequest request = builder
                .POST(HttpRequest.BodyPublishers.ofString(requestBody(text, model).toString()))
                .build();

        HttpResponse<String> response;
        try {
            logger.debug("Requesting embedding from {} for model {} ({} chars)", endpoint, model.getId(), text.length());
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new EmbeddingException("Embedding request to " + endpoint + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Embedding request to " + endpoint + " was interrupted", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new EmbeddingException("Embedding request for model " + model.getId()
                    + " failed with status " + status + ": " + abbreviate(response.body()));
        }
        return EmbeddingResponseFormat.parse(response.body(), acceptedFormats());
    }

    /**
     * The endpoint to POST to for the given model.
     */
    protected abstract URI endpoint(String baseUrl, EmbeddingModel model);

    /**
     * Provider specific headers, typically authentication.
     */
    protected abstract Map<String, String> headers(EmbeddingModel model);

    /**
     * The JSON request body for one text.
     */
    protected abstract JSONObject requestBody(String text, EmbeddingModel model);

    /**
     * Response shapes this provider may return, in the order they are tried.
     */
    protected abstract List<EmbeddingResponseFormat> acceptedFormats();

    /**
     * Base URL to use when the descriptor does not carry one.
     */
    protected String defaultBaseUrl() {
        return null;
    }

    private String resolveBaseUrl(EmbeddingModel model) {
        String baseUrl = model.getBaseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = defaultBaseUrl();
        }
        return baseUrl;
    }

    protected static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    /**
     * Validate that a URL string is an absolute http(s) URL.
     */
    static boolean isValidUrl(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        if (!url.startsWith("http://") && !url.startsWith("https://")) {
            return false;
        }
        try {
            URI uri = new URI(url);
            return uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= MAX_ERROR_BODY_LENGTH ? body : body.substring(0, MAX_ERROR_BODY_LENGTH) + "...";
    }
}
