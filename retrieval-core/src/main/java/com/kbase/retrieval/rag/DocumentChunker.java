package com.kbase.retrieval.rag;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Utility class for splitting document text into overlapping chunks for embedding and retrieval.
 */
public final class DocumentChunker {

    private static final Logger logger = LoggerFactory.getLogger(DocumentChunker.class);

    private DocumentChunker() {
    }

    /**
     * Chunk text with a sliding character window.
     * <p>
     * Windows are {@code chunkSize} characters long and start every {@code chunkSize - overlap}
     * characters. The window that reaches the end of the text is the last one and may be shorter.
     *
     * @param text The text to chunk
     * @param chunkSize Window length in characters
     * @param overlap Number of characters shared by two consecutive chunks
     * @return The chunks in document order; empty for empty text
     * @throws InvalidConfigException if {@code chunkSize > overlap >= 0} does not hold
     */
    public static List<String> chunk(String text, int chunkSize, int overlap) {
        validate(chunkSize, overlap);
        if (text == null || text.isEmpty()) {
            return new ArrayList<>();
        }

        int stride = chunkSize - overlap;
        List<String> chunks = new ArrayList<>();
        int start = 0;
        while (true) {
            int end = Math.min(start + chunkSize, text.length());
            chunks.add(text.substring(start, end));
            if (end == text.length()) {
                break;
            }
            start += stride;
        }

        logger.debug("Chunked {} characters into {} chunks (size={}, overlap={})",
                text.length(), chunks.size(), chunkSize, overlap);
        return chunks;
    }

    /**
     * Validate a chunk size / overlap pair.
     *
     * @throws InvalidConfigException if the overlap is negative or not smaller than the chunk size
     */
    public static void validate(int chunkSize, int overlap) {
        if (overlap < 0) {
            throw new InvalidConfigException("Chunk overlap must not be negative, got " + overlap);
        }
        if (chunkSize <= overlap) {
            throw new InvalidConfigException("Chunk size must be greater than chunk overlap, got size="
                    + chunkSize + ", overlap=" + overlap);
        }
    }
}
