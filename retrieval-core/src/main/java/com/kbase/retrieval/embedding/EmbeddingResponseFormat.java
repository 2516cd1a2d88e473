package com.kbase.retrieval.embedding;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import java.util.ArrayList;
import java.util.List;

/**
 * Response body shapes understood by the embedding clients. Each client declares the
 * ordered subset it accepts; a body matching none of them is a parse failure.
 */
public enum EmbeddingResponseFormat {

    /**
     * {@code {"data": [{"embedding": [...]}]}}
     */
    OPENAI_DATA {
        @Override
        JSONArray vectorOf(Object json) {
            if (!(json instanceof JSONObject)) {
                return null;
            }
            JSONArray data = ((JSONObject) json).optJSONArray("data");
            if (data == null || data.isEmpty()) {
                return null;
            }
            JSONObject first = data.optJSONObject(0);
            return first != null ? first.optJSONArray("embedding") : null;
        }
    },

    /**
     * {@code {"embedding": [...]}}
     */
    SINGLE_OBJECT {
        @Override
        JSONArray vectorOf(Object json) {
            if (!(json instanceof JSONObject)) {
                return null;
            }
            return ((JSONObject) json).optJSONArray("embedding");
        }
    },

    /**
     * {@code [...]}
     */
    BARE_ARRAY {
        @Override
        JSONArray vectorOf(Object json) {
            return json instanceof JSONArray ? (JSONArray) json : null;
        }
    },

    /**
     * Gemini: {@code {"embedding": {"values": [...]}}}
     */
    GEMINI_VALUES {
        @Override
        JSONArray vectorOf(Object json) {
            if (!(json instanceof JSONObject)) {
                return null;
            }
            JSONObject embedding = ((JSONObject) json).optJSONObject("embedding");
            return embedding != null ? embedding.optJSONArray("values") : null;
        }
    };

    /**
     * Formats accepted from a generic HTTP embeddings endpoint, in the order they are tried.
     */
    public static final List<EmbeddingResponseFormat> GENERIC_FORMATS =
            List.of(OPENAI_DATA, SINGLE_OBJECT, BARE_ARRAY);

    /**
     * The vector array if the body has this shape, otherwise {@code null}.
     */
    abstract JSONArray vectorOf(Object json);

    /**
     * Parse a response body with the first format that recognises it.
     *
     * @param body Raw response body
     * @param formats Accepted formats, in priority order
     * @return The embedding vector
     * @throws EmbeddingException if the body is not JSON, matches no format or holds non-numeric values
     */
    public static List<Float> parse(String body, List<EmbeddingResponseFormat> formats) {
        Object json;
        try {
            json = new JSONTokener(body).nextValue();
        } catch (JSONException e) {
            throw new EmbeddingException("Embedding response is not valid JSON", e);
        }

        for (EmbeddingResponseFormat format : formats) {
            JSONArray array = format.vectorOf(json);
            if (array != null) {
                return toVector(array, format);
            }
        }
        throw new EmbeddingException("Unrecognised embedding response format, expected one of " + formats);
    }

    private static List<Float> toVector(JSONArray array, EmbeddingResponseFormat format) {
        if (array.isEmpty()) {
            throw new EmbeddingException("Embedding response (" + format + ") contains an empty vector");
        }
        List<Float> vector = new ArrayList<>(array.length());
        try {
            for (int i = 0; i < array.length(); i++) {
                vector.add((float) array.getDouble(i));
            }
        } catch (JSONException e) {
            throw new EmbeddingException("Embedding response (" + format + ") contains a non-numeric value", e);
        }
        return vector;
    }
}
