package com.kbase.retrieval.embedding;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.kbase.retrieval.embedding.EmbeddingResponseFormat.GENERIC_FORMATS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EmbeddingResponseFormatTest {

    @Test
    void parsesOpenAiDataShape() {
        String body = "{\"object\":\"list\",\"data\":[{\"object\":\"embedding\",\"index\":0,\"embedding\":[0.5,-0.25,1]}],"
                + "\"model\":\"text-embedding-3-small\"}";

        assertThat(EmbeddingResponseFormat.parse(body, GENERIC_FORMATS)).containsExactly(0.5f, -0.25f, 1f);
    }

    @Test
    void parsesSingleObjectShape() {
        assertThat(EmbeddingResponseFormat.parse("{\"embedding\":[1,2,3]}", GENERIC_FORMATS))
                .containsExactly(1f, 2f, 3f);
    }

    @Test
    void parsesBareArray() {
        assertThat(EmbeddingResponseFormat.parse("[0.1, 0.2]", GENERIC_FORMATS)).containsExactly(0.1f, 0.2f);
    }

    @Test
    void parsesGeminiValuesOnlyWhenAccepted() {
        String body = "{\"embedding\":{\"values\":[0.3,0.4]}}";

        assertThat(EmbeddingResponseFormat.parse(body, List.of(EmbeddingResponseFormat.GEMINI_VALUES)))
                .containsExactly(0.3f, 0.4f);
        assertThatThrownBy(() -> EmbeddingResponseFormat.parse(body, GENERIC_FORMATS))
                .isInstanceOf(EmbeddingException.class)
                .hasMessageContaining("Unrecognised");
    }

    @Test
    void rejectsUnknownShape() {
        assertThatThrownBy(() -> EmbeddingResponseFormat.parse("{\"vectors\":[[1,2]]}", GENERIC_FORMATS))
                .isInstanceOf(EmbeddingException.class);
    }

    @Test
    void rejectsInvalidJson() {
        assertThatThrownBy(() -> EmbeddingResponseFormat.parse("{not json", GENERIC_FORMATS))
                .isInstanceOf(EmbeddingException.class)
                .hasMessageContaining("not valid JSON");
    }

    @Test
    void rejectsEmptyAndNonNumericVectors() {
        assertThatThrownBy(() -> EmbeddingResponseFormat.parse("{\"embedding\":[]}", GENERIC_FORMATS))
                .isInstanceOf(EmbeddingException.class)
                .hasMessageContaining("empty");
        assertThatThrownBy(() -> EmbeddingResponseFormat.parse("[1, \"two\"]", GENERIC_FORMATS))
                .isInstanceOf(EmbeddingException.class)
                .hasMessageContaining("non-numeric");
    }
}
