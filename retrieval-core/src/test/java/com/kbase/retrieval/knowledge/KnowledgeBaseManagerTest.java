package com.kbase.retrieval.knowledge;

import com.kbase.retrieval.embedding.EmbeddingException;
import com.kbase.retrieval.embedding.EmbeddingService;
import com.kbase.retrieval.embedding.FallbackVectorGenerator;
import com.kbase.retrieval.embedding.StaticEmbeddingModelResolver;
import com.kbase.retrieval.model.DocumentMetadata;
import com.kbase.retrieval.model.EmbeddingModel;
import com.kbase.retrieval.model.KnowledgeBase;
import com.kbase.retrieval.model.KnowledgeDocument;
import com.kbase.retrieval.model.SearchResult;
import com.kbase.retrieval.model.SourceMetadata;
import com.kbase.retrieval.rag.EnhancedRetrievalPipeline;
import com.kbase.retrieval.rag.InvalidConfigException;
import com.kbase.retrieval.rag.KnowledgeConfig;
import com.kbase.retrieval.rag.RetrievalConfig;
import com.kbase.retrieval.search.DimensionMismatchException;
import com.kbase.retrieval.search.SimilarityEngine;
import com.kbase.retrieval.vectordb.InMemoryVectorStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class KnowledgeBaseManagerTest {

    private static final String MODEL = "local-model";

    private final AtomicBoolean providerUp = new AtomicBoolean(true);

    private EmbeddingService embeddingService;
    private InMemoryVectorStore vectorStore;
    private KnowledgeEventListener listener;
    private KnowledgeConfig config;
    private KnowledgeBaseManager manager;

    @BeforeEach
    void setUp() {
        embeddingService = mock(EmbeddingService.class);
        when(embeddingService.embed(anyString(), any(EmbeddingModel.class))).thenAnswer(invocation -> {
            if (!providerUp.get()) {
                throw new EmbeddingException("provider unavailable");
            }
            return vectorFor(invocation.getArgument(0));
        });
        when(embeddingService.dimensionsOf(any(EmbeddingModel.class))).thenReturn(2);

        vectorStore = new InMemoryVectorStore();
        listener = mock(KnowledgeEventListener.class);
        config = new KnowledgeConfig();
        manager = newManager(new EnhancedRetrievalPipeline(embeddingService, new SimilarityEngine()));
    }

    private KnowledgeBaseManager newManager(EnhancedRetrievalPipeline pipeline) {
        return new KnowledgeBaseManager(
                new InMemoryKnowledgeBaseRepository(),
                vectorStore,
                embeddingService,
                new StaticEmbeddingModelResolver(List.of(new EmbeddingModel(MODEL, "openai", "key",
                        "http://localhost/v1", null))),
                new SimilarityEngine(),
                pipeline,
                new FallbackVectorGenerator(),
                listener,
                config);
    }

    static List<Float> vectorFor(String text) {
        if (text.contains("north")) {
            return List.of(1f, 0f);
        }
        if (text.contains("east")) {
            return List.of(0f, 1f);
        }
        return List.of(0.6f, 0.8f);
    }

    private KnowledgeBase createBase(String name) {
        return manager.createKnowledgeBase(new CreateKnowledgeBaseRequest(name, MODEL));
    }

    @Test
    void createFillsDefaultsAndAsksTheModelForDimensions() {
        KnowledgeBase kb = createBase("Runbooks");

        assertThat(kb.getId()).isNotBlank();
        assertThat(kb.getDimensions()).isEqualTo(2);
        assertThat(kb.getDocumentCount()).isEqualTo(5);
        assertThat(kb.getChunkSize()).isEqualTo(1000);
        assertThat(kb.getChunkOverlap()).isEqualTo(200);
        assertThat(kb.getThreshold()).isEqualTo(0.7);
        assertThat(kb.getCreatedAt()).isEqualTo(kb.getUpdatedAt());
        assertThat(manager.getKnowledgeBase(kb.getId()).getName()).isEqualTo("Runbooks");
        verify(listener).onKnowledgeBaseCreated(kb.getId());
    }

    @Test
    void createUsesCatalogDimensionsForUnconfiguredModels() {
        KnowledgeBase kb = manager.createKnowledgeBase(new CreateKnowledgeBaseRequest("Docs", "text-embedding-004"));

        assertThat(kb.getDimensions()).isEqualTo(768);
    }

    @Test
    void createRejectsInvalidRequests() {
        assertThatThrownBy(() -> manager.createKnowledgeBase(new CreateKnowledgeBaseRequest(" ", MODEL)))
                .isInstanceOf(InvalidConfigException.class);
        assertThatThrownBy(() -> manager.createKnowledgeBase(new CreateKnowledgeBaseRequest("kb", null)))
                .isInstanceOf(InvalidConfigException.class);
        assertThatThrownBy(() -> manager.createKnowledgeBase(new CreateKnowledgeBaseRequest("kb", MODEL)
                .setChunkSize(100).setChunkOverlap(100)))
                .isInstanceOf(InvalidConfigException.class);
        assertThatThrownBy(() -> manager.createKnowledgeBase(new CreateKnowledgeBaseRequest("kb", MODEL)
                .setThreshold(1.5)))
                .isInstanceOf(InvalidConfigException.class);
        assertThat(manager.listKnowledgeBases()).isEmpty();
    }

    @Test
    void addDocumentChunksEmbedsAndReportsProgressInOrder() {
        KnowledgeBase kb = createBase("Runbooks");
        String text = "x".repeat(2500);

        List<KnowledgeDocument> chunks = manager.addDocument(kb.getId(), text,
                new SourceMetadata("file", "guide.md", "f-1"));

        assertThat(chunks).hasSize(3);
        assertThat(chunks).extracting(d -> d.getMetadata().getChunkIndex()).containsExactly(0, 1, 2);
        assertThat(chunks).allSatisfy(d -> {
            assertThat(d.getMetadata().getFileName()).isEqualTo("guide.md");
            assertThat(d.getMetadata().isDegraded()).isFalse();
            assertThat(d.getVector()).hasSize(2);
        });
        assertThat(manager.listDocuments(kb.getId())).containsExactlyElementsOf(chunks);

        InOrder order = inOrder(listener);
        order.verify(listener).onKnowledgeBaseCreated(kb.getId());
        order.verify(listener).onDocumentChunkProcessed(anyString(), eq(kb.getId()), eq(1), eq(3));
        order.verify(listener).onDocumentChunkProcessed(anyString(), eq(kb.getId()), eq(2), eq(3));
        order.verify(listener).onDocumentChunkProcessed(anyString(), eq(kb.getId()), eq(3), eq(3));
        order.verify(listener).onDocumentsAdded(kb.getId(), 3);
    }

    @Test
    void addDocumentToUnknownBaseFails() {
        assertThatThrownBy(() -> manager.addDocument("missing", "text", SourceMetadata.of("manual")))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void searchReturnsExactMatchWithFullScore() {
        KnowledgeBase kb = createBase("Compass");
        manager.addDocument(kb.getId(), "north", SourceMetadata.of("manual"));
        manager.addDocument(kb.getId(), "east", SourceMetadata.of("manual"));

        List<SearchResult> results = manager.search(kb.getId(), "north", 0.5, 5, false);

        assertThat(results).hasSize(1);
        assertThat(results.get(0).getContent()).isEqualTo("north");
        assertThat(results.get(0).getScore()).isCloseTo(1.0, within(1e-6));
    }

    @Test
    void enhancedSearchKeepsTheBestMatchFirst() {
        KnowledgeBase kb = createBase("Compass");
        manager.addDocument(kb.getId(), "north", SourceMetadata.of("manual"));
        manager.addDocument(kb.getId(), "east", SourceMetadata.of("manual"));
        manager.addDocument(kb.getId(), "south west", SourceMetadata.of("manual"));

        List<SearchResult> results = manager.search(kb.getId(), "north", 0.0, 2, null);

        assertThat(results).hasSizeLessThanOrEqualTo(2);
        assertThat(results.get(0).getContent()).isEqualTo("north");
    }

    @Test
    void searchUsesBaseDefaultsWhenThresholdAndLimitAreOmitted() {
        KnowledgeBase kb = manager.createKnowledgeBase(new CreateKnowledgeBaseRequest("Compass", MODEL)
                .setDocumentCount(1)
                .setThreshold(0.0));
        manager.addDocument(kb.getId(), "north", SourceMetadata.of("manual"));
        manager.addDocument(kb.getId(), "somewhere", SourceMetadata.of("manual"));

        assertThat(manager.search(kb.getId(), "north")).hasSize(1);
    }

    @Test
    void providerOutageDegradesInsteadOfFailing() {
        providerUp.set(false);
        KnowledgeBase kb = manager.createKnowledgeBase(new CreateKnowledgeBaseRequest("Offline", MODEL)
                .setDimensions(2));

        List<KnowledgeDocument> chunks = manager.addDocument(kb.getId(), "y".repeat(2500), SourceMetadata.of("manual"));

        assertThat(chunks).hasSize(3);
        assertThat(chunks).allSatisfy(d -> {
            assertThat(d.getMetadata().isDegraded()).isTrue();
            assertThat(d.getVector()).hasSize(2);
        });
        verify(listener, times(3)).onEmbeddingDegraded(eq(kb.getId()), anyString(), any(EmbeddingException.class));
        assertThat(manager.listDegradedDocuments(kb.getId())).hasSize(3);

        assertThat(manager.search(kb.getId(), "anything", -1.0, 10, false)).hasSize(3);
        assertThat(manager.search(kb.getId(), "anything", -1.0, 10, true)).isNotEmpty();
    }

    @Test
    void fallbackVectorsAreDeterministic() {
        providerUp.set(false);
        KnowledgeBase kb = manager.createKnowledgeBase(new CreateKnowledgeBaseRequest("Offline", MODEL)
                .setDimensions(2));

        KnowledgeDocument first = manager.addDocument(kb.getId(), "same text", SourceMetadata.of("a")).get(0);
        KnowledgeDocument second = manager.addDocument(kb.getId(), "same text", SourceMetadata.of("b")).get(0);

        assertThat(first.getVector()).isEqualTo(second.getVector());
    }

    @Test
    void unconfiguredModelStoresFallbackVectorsOfCatalogWidth() {
        KnowledgeBase kb = manager.createKnowledgeBase(new CreateKnowledgeBaseRequest("Docs", "text-embedding-004"));

        List<KnowledgeDocument> chunks = manager.addDocument(kb.getId(), "north", SourceMetadata.of("manual"));

        assertThat(chunks.get(0).getMetadata().isDegraded()).isTrue();
        assertThat(chunks.get(0).getVector()).hasSize(768);
    }

    @Test
    void reembedRepairsDegradedChunksOnceTheProviderIsBack() {
        providerUp.set(false);
        KnowledgeBase kb = manager.createKnowledgeBase(new CreateKnowledgeBaseRequest("Offline", MODEL)
                .setDimensions(2));
        String chunkId = manager.addDocument(kb.getId(), "north", SourceMetadata.of("manual")).get(0).getId();

        assertThat(manager.reembedDegradedDocuments(kb.getId())).isZero();

        providerUp.set(true);
        assertThat(manager.reembedDegradedDocuments(kb.getId())).isEqualTo(1);

        KnowledgeDocument repaired = vectorStore.getById(chunkId).orElseThrow();
        assertThat(repaired.getMetadata().isDegraded()).isFalse();
        assertThat(repaired.getVector()).containsExactly(1f, 0f);
        assertThat(manager.listDegradedDocuments(kb.getId())).isEmpty();
    }

    @Test
    void embeddingWidthDifferentFromBaseIsRejected() {
        KnowledgeBase kb = manager.createKnowledgeBase(new CreateKnowledgeBaseRequest("Wide", MODEL)
                .setDimensions(3));

        assertThatThrownBy(() -> manager.addDocument(kb.getId(), "north", SourceMetadata.of("manual")))
                .isInstanceOf(DimensionMismatchException.class)
                .hasMessageContaining("recreate");
    }

    @Test
    void failedAddLeavesNoChunksBehind() {
        KnowledgeBase kb = createBase("Partial");
        doThrow(new EmbeddingException("timeout"))
                .doReturn(List.of(1f, 0f, 0f))
                .when(embeddingService).embed(anyString(), any(EmbeddingModel.class));

        assertThatThrownBy(() -> manager.addDocument(kb.getId(), "z".repeat(1500), SourceMetadata.of("manual")))
                .isInstanceOf(DimensionMismatchException.class);

        assertThat(manager.listDocuments(kb.getId())).isEmpty();
        verify(listener).onDocumentChunkProcessed(anyString(), eq(kb.getId()), eq(1), eq(2));
        verify(listener, never()).onDocumentsAdded(anyString(), anyInt());
    }

    @Test
    void searchFailsWhenStoredChunksHaveAnotherWidth() {
        KnowledgeBase kb = createBase("Mixed");
        vectorStore.put(new KnowledgeDocument("legacy", kb.getId(), "old chunk", List.of(1f, 0f, 0f),
                DocumentMetadata.forChunk(SourceMetadata.of("import"), 0, 1L, false)));

        assertThatThrownBy(() -> manager.search(kb.getId(), "north"))
                .isInstanceOfSatisfying(DimensionMismatchException.class, e -> {
                    assertThat(e.getExpected()).isEqualTo(3);
                    assertThat(e.getActual()).isEqualTo(2);
                });
    }

    @Test
    void failingPipelineFallsBackToPlainSearch() {
        EnhancedRetrievalPipeline pipeline = mock(EnhancedRetrievalPipeline.class);
        when(pipeline.search(anyString(), anyList(), anyList(), any(), anyDouble(), anyInt(),
                any(RetrievalConfig.class))).thenThrow(new IllegalStateException("boom"));
        KnowledgeBaseManager fragile = newManager(pipeline);
        KnowledgeBase kb = fragile.createKnowledgeBase(new CreateKnowledgeBaseRequest("Compass", MODEL));
        fragile.addDocument(kb.getId(), "north", SourceMetadata.of("manual"));

        List<SearchResult> results = fragile.search(kb.getId(), "north", 0.5, 5, true);

        assertThat(results).extracting(SearchResult::getContent).containsExactly("north");
    }

    @Test
    void enhancedSearchWithoutConfigUsesConfiguredPipelineSettings() {
        EnhancedRetrievalPipeline pipeline = mock(EnhancedRetrievalPipeline.class);
        when(pipeline.search(anyString(), anyList(), anyList(), any(), anyDouble(), anyInt(),
                any(RetrievalConfig.class))).thenReturn(List.of());
        KnowledgeBaseManager spied = newManager(pipeline);
        KnowledgeBase kb = spied.createKnowledgeBase(new CreateKnowledgeBaseRequest("Compass", MODEL));

        spied.enhancedSearch(kb.getId(), "north", null, null, null);

        verify(pipeline).search(eq("north"), eq(List.of(1f, 0f)), eq(List.of()), any(EmbeddingModel.class),
                eq(0.7), eq(5), eq(config.getRetrieval()));
    }

    @Test
    void plainSearchSkipsThePipeline() {
        EnhancedRetrievalPipeline pipeline = mock(EnhancedRetrievalPipeline.class);
        KnowledgeBaseManager plain = newManager(pipeline);
        KnowledgeBase kb = plain.createKnowledgeBase(new CreateKnowledgeBaseRequest("Compass", MODEL));
        plain.addDocument(kb.getId(), "north", SourceMetadata.of("manual"));

        assertThat(plain.search(kb.getId(), "north", 0.5, 5, false)).hasSize(1);
        verifyNoInteractions(pipeline);
    }

    @Test
    void deleteKnowledgeBaseCascadesToItsChunksOnly() {
        KnowledgeBase doomed = createBase("Doomed");
        KnowledgeBase kept = createBase("Kept");
        manager.addDocument(doomed.getId(), "north", SourceMetadata.of("manual"));
        manager.addDocument(doomed.getId(), "east", SourceMetadata.of("manual"));
        manager.addDocument(kept.getId(), "north", SourceMetadata.of("manual"));

        int removed = manager.deleteKnowledgeBase(doomed.getId());

        assertThat(removed).isEqualTo(2);
        assertThat(vectorStore.listByKnowledgeBase(doomed.getId())).isEmpty();
        assertThat(vectorStore.listByKnowledgeBase(kept.getId())).hasSize(1);
        assertThat(manager.listKnowledgeBases()).extracting(KnowledgeBase::getId).containsExactly(kept.getId());
        assertThatThrownBy(() -> manager.getKnowledgeBase(doomed.getId())).isInstanceOf(NotFoundException.class);
        verify(listener).onKnowledgeBaseDeleted(doomed.getId(), 2);
    }

    @Test
    void deleteUnknownKnowledgeBaseFails() {
        assertThatThrownBy(() -> manager.deleteKnowledgeBase("missing")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void updateAppliesPatchAndBumpsUpdatedAt() {
        KnowledgeBase kb = createBase("Before");

        KnowledgeBase updated = manager.updateKnowledgeBase(kb.getId(), new UpdateKnowledgeBaseRequest()
                .setName("After")
                .setDocumentCount(9)
                .setThreshold(0.4));

        assertThat(updated.getName()).isEqualTo("After");
        assertThat(updated.getDocumentCount()).isEqualTo(9);
        assertThat(updated.getThreshold()).isEqualTo(0.4);
        assertThat(updated.getModel()).isEqualTo(MODEL);
        assertThat(updated.getUpdatedAt()).isAfterOrEqualTo(kb.getCreatedAt());
        assertThat(manager.getKnowledgeBase(kb.getId()).getName()).isEqualTo("After");
        verify(listener).onKnowledgeBaseUpdated(kb.getId());
    }

    @Test
    void updateRejectsModelChangeWhileDocumentsExist() {
        KnowledgeBase kb = createBase("Populated");
        manager.addDocument(kb.getId(), "north", SourceMetadata.of("manual"));

        assertThatThrownBy(() -> manager.updateKnowledgeBase(kb.getId(),
                new UpdateKnowledgeBaseRequest().setModel("text-embedding-004")))
                .isInstanceOf(InvalidConfigException.class);
        assertThatThrownBy(() -> manager.updateKnowledgeBase(kb.getId(),
                new UpdateKnowledgeBaseRequest().setDimensions(4)))
                .isInstanceOf(InvalidConfigException.class);
        assertThat(manager.getKnowledgeBase(kb.getId()).getModel()).isEqualTo(MODEL);
    }

    @Test
    void updateOfEmptyBaseMayChangeModel() {
        KnowledgeBase kb = createBase("Empty");

        KnowledgeBase updated = manager.updateKnowledgeBase(kb.getId(),
                new UpdateKnowledgeBaseRequest().setModel("text-embedding-004"));

        assertThat(updated.getModel()).isEqualTo("text-embedding-004");
        assertThat(updated.getDimensions()).isEqualTo(768);
    }

    @Test
    void updateRejectsBlankName() {
        KnowledgeBase kb = createBase("Named");

        assertThatThrownBy(() -> manager.updateKnowledgeBase(kb.getId(), new UpdateKnowledgeBaseRequest().setName("")))
                .isInstanceOf(InvalidConfigException.class);
    }

    @Test
    void deleteDocumentRemovesOneChunkAndNotifies() {
        KnowledgeBase kb = createBase("Compass");
        KnowledgeDocument north = manager.addDocument(kb.getId(), "north", SourceMetadata.of("manual")).get(0);
        manager.addDocument(kb.getId(), "east", SourceMetadata.of("manual"));

        manager.deleteDocument(north.getId());

        assertThat(manager.listDocuments(kb.getId())).extracting(KnowledgeDocument::getContent)
                .containsExactly("east");
        verify(listener).onDocumentDeleted(north.getId(), kb.getId());
        assertThatThrownBy(() -> manager.deleteDocument(north.getId())).isInstanceOf(NotFoundException.class);
    }
}
