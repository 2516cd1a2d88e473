package com.kbase.retrieval.rag;

import com.kbase.retrieval.knowledge.KnowledgeBaseManager;
import com.kbase.retrieval.model.KnowledgeDocument;
import com.kbase.retrieval.model.SourceMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.FileVisitor;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * A service for ingesting plain-text files into a knowledge base. Files are read as
 * UTF-8 text; no format extraction is attempted.
 */
public class DocumentProcessor {

    private static final Logger logger = LoggerFactory.getLogger(DocumentProcessor.class);

    static final String FILE_SOURCE = "file";

    private final KnowledgeBaseManager manager;

    public DocumentProcessor(KnowledgeBaseManager manager) {
        this.manager = manager;
    }

    /**
     * Ingest one file.
     *
     * @param knowledgeBaseId The target knowledge base
     * @param filePath The file to read
     * @return The stored chunks, or an empty list if the file could not be read as text
     */
    public List<KnowledgeDocument> processFile(String knowledgeBaseId, Path filePath) {
        if (!Files.isRegularFile(filePath)) {
            logger.warn("Not a regular file, skipping: {}", filePath);
            return Collections.emptyList();
        }

        String content;
        try {
            content = Files.readString(filePath, StandardCharsets.UTF_8);
        } catch (MalformedInputException e) {
            logger.warn("Skipping {}, it is not UTF-8 text", filePath);
            return Collections.emptyList();
        } catch (IOException e) {
            logger.error("Error reading file {}: {}", filePath, e.getMessage(), e);
            return Collections.emptyList();
        }

        String fileName = filePath.getFileName().toString();
        String fileId = UUID.nameUUIDFromBytes(filePath.toAbsolutePath().normalize().toString()
                .getBytes(StandardCharsets.UTF_8)).toString();
        List<KnowledgeDocument> documents = manager.addDocument(knowledgeBaseId, content,
                new SourceMetadata(FILE_SOURCE, fileName, fileId));
        logger.info("Processed file {} into {} chunks", fileName, documents.size());
        return documents;
    }

    /**
     * Ingest every matching file of a directory.
     *
     * @param knowledgeBaseId The target knowledge base
     * @param directoryPath The directory to scan
     * @param extensions File name suffixes to accept, e.g. ".md"; empty accepts every file
     * @param recursive Whether to descend into subdirectories
     * @return The number of files that produced at least one chunk
     * @throws IOException If the directory cannot be walked
     */
    public int processDirectory(String knowledgeBaseId, Path directoryPath, List<String> extensions,
                                boolean recursive) throws IOException {
        int processed = 0;
        for (Path file : findFiles(directoryPath, extensions, recursive)) {
            if (!processFile(knowledgeBaseId, file).isEmpty()) {
                processed++;
            }
        }
        logger.info("Processed {} documents from directory: {}", processed, directoryPath);
        return processed;
    }

    /**
     * Find all files with the specified extensions in a directory, in a stable order.
     *
     * @param directoryPath The path to the directory to search
     * @param extensions The file extensions to include
     * @param recursive Whether to recursively search subdirectories
     * @return A list of matching file paths
     * @throws IOException If an I/O error occurs
     */
    public static List<Path> findFiles(Path directoryPath, List<String> extensions, boolean recursive)
            throws IOException {
        if (!Files.isDirectory(directoryPath)) {
            return Collections.emptyList();
        }

        List<Path> matchingFiles = new ArrayList<>();

        FileVisitor<Path> fileVisitor = new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                String fileName = file.getFileName().toString();
                boolean matchesExtension = extensions.isEmpty()
                        || extensions.stream().anyMatch(fileName::endsWith);

                if (matchesExtension && attrs.isRegularFile()) {
                    matchingFiles.add(file);
                }

                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                return recursive || dir.equals(directoryPath)
                        ? FileVisitResult.CONTINUE : FileVisitResult.SKIP_SUBTREE;
            }
        };

        Files.walkFileTree(directoryPath, fileVisitor);
        Collections.sort(matchingFiles);
        return matchingFiles;
    }
}
