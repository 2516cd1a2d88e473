package com.kbase.retrieval.rag;

import com.kbase.retrieval.embedding.EmbeddingException;
import com.kbase.retrieval.embedding.EmbeddingService;
import com.kbase.retrieval.model.DocumentMetadata;
import com.kbase.retrieval.model.EmbeddingModel;
import com.kbase.retrieval.model.KnowledgeDocument;
import com.kbase.retrieval.model.SearchResult;
import com.kbase.retrieval.model.SourceMetadata;
import com.kbase.retrieval.search.DimensionMismatchException;
import com.kbase.retrieval.search.SimilarityEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EnhancedRetrievalPipelineTest {

    private static final EmbeddingModel MODEL = new EmbeddingModel("m", "openai", "k", "https://x.example", 3);

    private EmbeddingService embeddingService;
    private SimilarityEngine engine;
    private EnhancedRetrievalPipeline pipeline;

    @BeforeEach
    void setUp() {
        embeddingService = mock(EmbeddingService.class);
        engine = new SimilarityEngine();
        pipeline = new EnhancedRetrievalPipeline(embeddingService, engine);
    }

    @Test
    void diversityFilterDropsNearDuplicates() {
        List<KnowledgeDocument> docs = List.of(
                doc("dup1", "first copy", 1f, 0.1f, 0f),
                doc("dup2", "second copy", 1f, 0.1f, 0.15f),
                doc("other", "something else", 0.5f, 0f, 0.866f));
        RetrievalConfig config = RetrievalConfig.plain();
        config.setDiversityFilter(true);
        config.setDiversityThreshold(0.95);

        List<SearchResult> results = pipeline.search("q", List.of(1f, 0f, 0f), docs, MODEL, 0.3, 5, config);

        assertThat(results).extracting(SearchResult::getDocumentId).containsExactly("dup1", "other");
    }

    @Test
    void withEveryStageDisabledMatchesPlainSearch() {
        List<KnowledgeDocument> docs = sampleDocs();
        List<Float> query = List.of(1f, 0.2f, 0f);

        List<SearchResult> enhanced = pipeline.search("keys", query, docs, MODEL, 0.1, 3, RetrievalConfig.plain());
        List<SearchResult> plain = engine.search(query, docs, 0.1, 3);

        assertThat(ids(enhanced)).isEqualTo(ids(plain));
        assertThat(enhanced).extracting(SearchResult::getScore)
                .isEqualTo(plain.stream().map(SearchResult::getScore).toList());
    }

    @Test
    void withEveryStageFailingMatchesPlainSearch() {
        QueryExpander expander = mock(QueryExpander.class);
        LexicalScorer lexical = mock(LexicalScorer.class);
        Reranker reranker = mock(Reranker.class);
        when(expander.expand(anyString(), anyList())).thenThrow(new IllegalStateException("expander down"));
        when(lexical.score(anyString(), anyList(), anyString())).thenThrow(new IllegalStateException("lexical down"));
        when(reranker.rerank(anyString(), anyList())).thenThrow(new IllegalStateException("reranker down"));
        EnhancedRetrievalPipeline failing = new EnhancedRetrievalPipeline(embeddingService, engine,
                expander, lexical, reranker);
        RetrievalConfig config = new RetrievalConfig();
        // cosine never exceeds 1, so nothing counts as a duplicate
        config.setDiversityThreshold(1.01);
        List<KnowledgeDocument> docs = sampleDocs();
        List<Float> query = List.of(1f, 0.2f, 0f);

        List<SearchResult> enhanced = failing.search("keys", query, docs, MODEL, 0.1, 3, config);

        assertThat(ids(enhanced)).isEqualTo(ids(engine.search(query, docs, 0.1, 3)));
    }

    @Test
    void hybridScoringPromotesKeywordMatches() {
        List<KnowledgeDocument> docs = List.of(
                doc("a", "nothing relevant here", 1f, 0f, 0f),
                doc("b", "rotate the signing keys monthly", 1f, 0f, 0f));
        RetrievalConfig config = RetrievalConfig.plain();
        config.setHybridSearch(true);

        List<SearchResult> results = pipeline.search("rotate keys", List.of(1f, 0f, 0f), docs, MODEL, 0.5, 5, config);

        assertThat(results).extracting(SearchResult::getDocumentId).containsExactly("b", "a");
        assertThat(results.get(0).getScore()).isCloseTo(1.0, within(1e-6));
        assertThat(results.get(1).getScore()).isCloseTo(0.7, within(1e-6));
    }

    @Test
    void rerankReordersWithoutAddingCandidates() {
        List<KnowledgeDocument> docs = List.of(
                doc("a", "unrelated text", 1f, 0.05f, 0f),
                doc("b", "backup schedule explained", 1f, 0.1f, 0f),
                doc("c", "far away", 0f, 1f, 0f));
        RetrievalConfig config = RetrievalConfig.plain();
        config.setRerank(true);

        List<SearchResult> results = pipeline.search("backup schedule", List.of(1f, 0f, 0f), docs, MODEL, 0.5, 5, config);

        assertThat(results).extracting(SearchResult::getDocumentId).containsExactly("b", "a");
    }

    @Test
    void queryExpansionMergesVariantHits() {
        List<KnowledgeDocument> docs = List.of(
                doc("a", "first", 1f, 0f, 0f),
                doc("b", "second", 0f, 1f, 0f),
                doc("c", "third", 0.7f, 0.7f, 0f));
        when(embeddingService.embed("alpha", MODEL)).thenReturn(List.of(1f, 0f, 0f));
        when(embeddingService.embed("beta", MODEL)).thenReturn(List.of(0f, 1f, 0f));
        RetrievalConfig config = RetrievalConfig.plain();
        config.setQueryExpansion(true);
        List<Float> query = List.of(0.7071f, 0.7071f, 0f);

        assertThat(engine.search(query, docs, 0.8, 5)).extracting(SearchResult::getDocumentId).containsExactly("c");

        List<SearchResult> results = pipeline.search("alpha, beta", query, docs, MODEL, 0.8, 5, config);

        assertThat(results).extracting(SearchResult::getDocumentId).containsExactlyInAnyOrder("a", "b", "c");
    }

    @Test
    void variantThatCannotBeEmbeddedDoesNotDiscardTheOthers() {
        List<KnowledgeDocument> docs = List.of(
                doc("a", "first", 1f, 0f, 0f),
                doc("b", "second", 0f, 1f, 0f),
                doc("c", "third", 0.7f, 0.7f, 0f));
        when(embeddingService.embed("alpha", MODEL)).thenReturn(List.of(1f, 0f, 0f));
        when(embeddingService.embed("beta", MODEL)).thenThrow(new EmbeddingException("rate limited"));
        RetrievalConfig config = RetrievalConfig.plain();
        config.setQueryExpansion(true);

        List<SearchResult> results = pipeline.search("alpha, beta", List.of(0.7071f, 0.7071f, 0f), docs, MODEL,
                0.8, 5, config);

        assertThat(results).extracting(SearchResult::getDocumentId).containsExactlyInAnyOrder("a", "c");
    }

    @Test
    void variantOfAnotherWidthIsADimensionMismatch() {
        List<KnowledgeDocument> docs = List.of(
                doc("a", "first", 1f, 0f, 0f),
                doc("b", "second", 0f, 1f, 0f));
        when(embeddingService.embed(anyString(), any())).thenReturn(List.of(1f, 0f));
        RetrievalConfig config = RetrievalConfig.plain();
        config.setQueryExpansion(true);

        assertThatThrownBy(() -> pipeline.search("alpha, beta", List.of(1f, 0f, 0f), docs, MODEL, 0.1, 5, config))
                .isInstanceOfSatisfying(DimensionMismatchException.class, e -> {
                    assertThat(e.getExpected()).isEqualTo(3);
                    assertThat(e.getActual()).isEqualTo(2);
                });
    }

    @Test
    void hybridScoringCountsSynonymsFromExpansion() {
        QueryExpander expander = new QueryExpander(Map.of("fix", List.of("repair")));
        EnhancedRetrievalPipeline expanding = new EnhancedRetrievalPipeline(embeddingService, engine,
                expander, new LexicalScorer(), new Reranker());
        List<KnowledgeDocument> docs = List.of(
                doc("other", "other words", 1f, 0f, 0f),
                doc("guide", "repair guide", 1f, 0f, 0f));
        when(embeddingService.embed("repair", MODEL)).thenReturn(List.of(1f, 0f, 0f));
        RetrievalConfig config = RetrievalConfig.plain();
        config.setQueryExpansion(true);
        config.setHybridSearch(true);

        List<SearchResult> results = expanding.search("fix", List.of(1f, 0f, 0f), docs, MODEL, 0.5, 5, config);

        assertThat(results).extracting(SearchResult::getDocumentId).containsExactly("guide", "other");
        assertThat(results.get(0).getScore()).isCloseTo(0.7 + 0.3 * 0.5, within(1e-6));
        assertThat(results.get(1).getScore()).isCloseTo(0.7, within(1e-6));
    }

    @Test
    void failingVariantEmbeddingKeepsOriginalResults() {
        List<KnowledgeDocument> docs = sampleDocs();
        when(embeddingService.embed(anyString(), any())).thenThrow(new IllegalStateException("provider down"));
        RetrievalConfig config = RetrievalConfig.plain();
        config.setQueryExpansion(true);
        List<Float> query = List.of(1f, 0.2f, 0f);

        List<SearchResult> results = pipeline.search("keys, rotation", query, docs, MODEL, 0.1, 3, config);

        assertThat(ids(results)).isEqualTo(ids(engine.search(query, docs, 0.1, 3)));
    }

    @Test
    void dimensionMismatchIsNeverSwallowed() {
        List<KnowledgeDocument> docs = List.of(doc("a", "x", 1f, 0f, 0f), doc("b", "y", 1f, 0f));

        assertThatThrownBy(() -> pipeline.search("q", List.of(1f, 0f, 0f), docs, MODEL, 0.1, 3, new RetrievalConfig()))
                .isInstanceOf(DimensionMismatchException.class);
    }

    @Test
    void dimensionMismatchInsideAStageIsPropagated() {
        QueryExpander expander = mock(QueryExpander.class);
        when(expander.expand(anyString(), anyList())).thenThrow(new DimensionMismatchException(3, 2));
        EnhancedRetrievalPipeline p = new EnhancedRetrievalPipeline(embeddingService, engine,
                expander, new LexicalScorer(), new Reranker());
        RetrievalConfig config = RetrievalConfig.plain();
        config.setQueryExpansion(true);

        assertThatThrownBy(() -> p.search("q", List.of(1f, 0f, 0f), sampleDocs(), MODEL, 0.1, 3, config))
                .isInstanceOf(DimensionMismatchException.class);
    }

    @Test
    void limitIsHonouredEvenAboveMaxCandidates() {
        RetrievalConfig config = new RetrievalConfig();
        config.setMaxCandidates(1);
        config.setQueryExpansion(false);
        config.setDiversityThreshold(1.01);

        List<SearchResult> results = pipeline.search("keys", List.of(1f, 0.2f, 0f), sampleDocs(), MODEL, 0.1, 3, config);

        assertThat(results).hasSize(3);
    }

    private static List<KnowledgeDocument> sampleDocs() {
        return List.of(
                doc("d1", "keys are rotated weekly", 1f, 0f, 0f),
                doc("d2", "backups run at night", 0.8f, 0.6f, 0f),
                doc("d3", "the keys live in the vault", 0.9f, 0.1f, 0.4f),
                doc("d4", "unrelated cooking notes", 0f, 0f, 1f),
                doc("d5", "rotation policy for keys", 1f, 0.3f, 0.1f));
    }

    private static List<String> ids(List<SearchResult> results) {
        return results.stream().map(SearchResult::getDocumentId).toList();
    }

    static KnowledgeDocument doc(String id, String content, Float... vector) {
        return new KnowledgeDocument(id, "kb", content, List.of(vector),
                DocumentMetadata.forChunk(SourceMetadata.of("test"), 0, 1L, false));
    }
}
