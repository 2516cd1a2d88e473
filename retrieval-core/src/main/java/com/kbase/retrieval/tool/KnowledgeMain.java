package com.kbase.retrieval.tool;

import com.kbase.retrieval.embedding.DimensionProbe;
import com.kbase.retrieval.embedding.EmbeddingModelCatalog;
import com.kbase.retrieval.embedding.EmbeddingService;
import com.kbase.retrieval.knowledge.CreateKnowledgeBaseRequest;
import com.kbase.retrieval.knowledge.KnowledgeBaseManager;
import com.kbase.retrieval.knowledge.KnowledgeContextService;
import com.kbase.retrieval.knowledge.LoggingKnowledgeEventListener;
import com.kbase.retrieval.model.EmbeddingModel;
import com.kbase.retrieval.model.KnowledgeBase;
import com.kbase.retrieval.model.SearchResult;
import com.kbase.retrieval.rag.DocumentProcessor;
import com.kbase.retrieval.rag.KnowledgeConfig;
import com.kbase.retrieval.rag.RagFactory;
import org.json.JSONArray;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * CLI to build a throw-away knowledge base from a directory of text files and query it.
 *
 * Usage:
 *   mvn --projects retrieval-core exec:java \
 *     -Dexec.args="search /path/to/docs 'how do I rotate the keys?'"
 *
 * Commands:
 *   search &lt;dir&gt; &lt;query&gt; [--plain]   print ranked passages as JSON
 *   prompt &lt;dir&gt; &lt;query&gt;             print the query enhanced with knowledge context
 *   dimensions &lt;modelId&gt;              print the vector width of a model
 *
 * Options: --config &lt;file&gt; loads settings from a file instead of KnowledgeConfig.properties,
 * --model &lt;id&gt; overrides the embedding model, --ext &lt;.md,.txt&gt; filters ingested files.
 */
public class KnowledgeMain {

    private static final Logger logger = LoggerFactory.getLogger(KnowledgeMain.class);

    private static final long PROBE_TIMEOUT_SECONDS = 60;

    public static void main(String[] args) {
        int status = new KnowledgeMain().run(args, System.out);
        if (status != 0) {
            System.exit(status);
        }
    }

    int run(String[] args, PrintStream out) {
        CommandLine cmd = CommandLine.parse(args);
        if (cmd == null) {
            printUsage();
            return 1;
        }

        KnowledgeConfig config;
        try {
            config = cmd.configFile != null
                    ? KnowledgeConfig.fromPropertiesFile(cmd.configFile)
                    : KnowledgeConfig.fromResource(KnowledgeConfig.DEFAULT_RESOURCE);
        } catch (IOException e) {
            logger.error("Failed to load configuration: {}", e.getMessage(), e);
            return 2;
        }
        String modelId = cmd.model != null ? cmd.model : config.getDefaultEmbeddingModel();

        switch (cmd.command) {
            case "search":
            case "prompt":
                return runQuery(cmd, config, modelId, out);
            case "dimensions":
                return probeDimensions(config, cmd.positional.get(0), out);
            default:
                printUsage();
                return 1;
        }
    }

    private int runQuery(CommandLine cmd, KnowledgeConfig config, String modelId, PrintStream out) {
        Path directory = Path.of(cmd.positional.get(0));
        String query = cmd.positional.get(1);

        EmbeddingService embeddingService = RagFactory.createEmbeddingService(config);
        KnowledgeBaseManager manager = RagFactory.createKnowledgeBaseManager(config, embeddingService,
                RagFactory.createVectorStore(), new LoggingKnowledgeEventListener());
        KnowledgeBase kb = manager.createKnowledgeBase(
                new CreateKnowledgeBaseRequest(directory.getFileName().toString(), modelId));

        try {
            int files = RagFactory.createDocumentProcessor(manager)
                    .processDirectory(kb.getId(), directory, cmd.extensions, true);
            logger.info("Ingested {} files from {}", files, directory);
        } catch (IOException e) {
            logger.error("Error processing directory {}: {}", directory, e.getMessage(), e);
            return 2;
        }

        int degraded = manager.listDegradedDocuments(kb.getId()).size();
        if (degraded > 0) {
            logger.warn("{} chunks have fallback vectors; results for them are not meaningful", degraded);
        }

        if ("prompt".equals(cmd.command)) {
            KnowledgeContextService contextService = RagFactory.createContextService(manager, config);
            out.println(contextService.enhancePromptWithContext(query, query, List.of(kb.getId())));
            return 0;
        }

        List<SearchResult> results = manager.search(kb.getId(), query, null, null, !cmd.plain);
        JSONArray array = new JSONArray();
        for (SearchResult result : results) {
            JSONObject json = new JSONObject();
            json.put("documentId", result.getDocumentId());
            json.put("score", result.getScore());
            json.put("content", result.getContent());
            json.put("metadata", new JSONObject(result.getMetadata().toMap()));
            array.put(json);
        }
        out.println(array.toString(2));
        return 0;
    }

    private int probeDimensions(KnowledgeConfig config, String modelId, PrintStream out) {
        EmbeddingModel model = RagFactory.createModelResolver(config).resolve(modelId).orElse(null);
        if (model == null) {
            logger.warn("Model {} is not configured, reporting catalog dimensions", modelId);
            out.println(EmbeddingModelCatalog.dimensionsOf(modelId));
            return 0;
        }
        try (DimensionProbe probe = new DimensionProbe(RagFactory.createEmbeddingService(config))) {
            int dimensions = probe.probe(model, d -> logger.info("Model {} has {} dimensions", modelId, d))
                    .get(PROBE_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            out.println(dimensions);
            return 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Dimension probe for {} was interrupted", modelId);
            return 2;
        } catch (ExecutionException | TimeoutException e) {
            logger.error("Dimension probe for {} failed: {}", modelId, e.getMessage(), e);
            return 2;
        }
    }

    private static void printUsage() {
        System.err.println("Usage: KnowledgeMain search <dir> <query> [--plain] [--model <id>] [--ext <.md,.txt>] [--config <file>]");
        System.err.println("       KnowledgeMain prompt <dir> <query> [--model <id>] [--ext <.md,.txt>] [--config <file>]");
        System.err.println("       KnowledgeMain dimensions <modelId> [--config <file>]");
    }

    static final class CommandLine {
        String command;
        final List<String> positional = new ArrayList<>();
        String configFile;
        String model;
        boolean plain;
        List<String> extensions = List.of();

        /**
         * @return The parsed command line, or {@code null} if it is incomplete
         */
        static CommandLine parse(String[] args) {
            if (args.length == 0) {
                return null;
            }
            CommandLine cmd = new CommandLine();
            cmd.command = args[0];
            for (int i = 1; i < args.length; i++) {
                String arg = args[i];
                if ("--plain".equals(arg)) {
                    cmd.plain = true;
                } else if ("--config".equals(arg) && i + 1 < args.length) {
                    cmd.configFile = args[++i];
                } else if ("--model".equals(arg) && i + 1 < args.length) {
                    cmd.model = args[++i];
                } else if ("--ext".equals(arg) && i + 1 < args.length) {
                    cmd.extensions = Arrays.asList(args[++i].split("\\s*,\\s*"));
                } else if (arg.startsWith("--")) {
                    return null;
                } else {
                    cmd.positional.add(arg);
                }
            }
            int required = "dimensions".equals(cmd.command) ? 1 : 2;
            return cmd.positional.size() < required ? null : cmd;
        }
    }
}
