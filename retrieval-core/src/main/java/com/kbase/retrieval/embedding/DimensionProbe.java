package com.kbase.retrieval.embedding;

import com.kbase.retrieval.model.EmbeddingModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;

/**
 * Best-effort asynchronous lookup of a model's vector width, as used while a user is
 * picking a model. Only the most recent probe may deliver a result: starting a new probe
 * cancels the one in flight, and a cancelled probe never calls its consumer.
 */
public class DimensionProbe implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DimensionProbe.class);

    private final EmbeddingService embeddingService;
    private final ExecutorService executor;
    private final Object lock = new Object();
    private CompletableFuture<Integer> current;

    public DimensionProbe(EmbeddingService embeddingService) {
        this(embeddingService, newDaemonExecutor());
    }

    public DimensionProbe(EmbeddingService embeddingService, ExecutorService executor) {
        this.embeddingService = embeddingService;
        this.executor = executor;
    }

    /**
     * Start probing the given model, superseding any probe still running.
     *
     * @param model The model to probe
     * @param onResult Receives the width, unless the probe is cancelled or superseded first
     * @return A future completing with the width, or cancelled; already cancelled after {@link #close()}
     */
    public CompletableFuture<Integer> probe(EmbeddingModel model, IntConsumer onResult) {
        CompletableFuture<Integer> task = new CompletableFuture<>();
        synchronized (lock) {
            if (current != null) {
                current.cancel(false);
            }
            current = task;
        }
        try {
            executor.execute(() -> {
                if (task.isDone()) {
                    return;
                }
                int dimensions = embeddingService.dimensionsOf(model);
                synchronized (lock) {
                    if (current == task && task.complete(dimensions)) {
                        onResult.accept(dimensions);
                    } else {
                        logger.debug("Discarding superseded dimension probe for model {}", model.getId());
                    }
                }
            });
        } catch (RejectedExecutionException e) {
            synchronized (lock) {
                if (current == task) {
                    current = null;
                }
            }
            task.cancel(false);
            logger.warn("Dimension probe for model {} was rejected by its executor", model.getId());
        }
        return task;
    }

    /**
     * Cancel the probe in flight, if any.
     */
    public void cancel() {
        synchronized (lock) {
            if (current != null) {
                current.cancel(false);
                current = null;
            }
        }
    }

    @Override
    public void close() {
        cancel();
        executor.shutdownNow();
    }

    private static ExecutorService newDaemonExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "dimension-probe-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
