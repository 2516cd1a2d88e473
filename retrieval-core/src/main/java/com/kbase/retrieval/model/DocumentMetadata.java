package com.kbase.retrieval.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Metadata attached to a single chunk record.
 */
public class DocumentMetadata {

    private final String source;
    private final String fileName;
    private final String fileId;
    private final int chunkIndex;
    private final long timestamp;
    private final boolean degraded;

    public DocumentMetadata(String source, String fileName, String fileId,
                            int chunkIndex, long timestamp, boolean degraded) {
        this.source = source;
        this.fileName = fileName;
        this.fileId = fileId;
        this.chunkIndex = chunkIndex;
        this.timestamp = timestamp;
        this.degraded = degraded;
    }

    public static DocumentMetadata forChunk(SourceMetadata source, int chunkIndex, long timestamp, boolean degraded) {
        return new DocumentMetadata(source.getSource(), source.getFileName(), source.getFileId(),
                chunkIndex, timestamp, degraded);
    }

    /**
     * Same metadata with the degraded flag cleared, used after a successful re-embed.
     */
    public DocumentMetadata withDegraded(boolean degraded) {
        return new DocumentMetadata(source, fileName, fileId, chunkIndex, timestamp, degraded);
    }

    public String getSource() {
        return source;
    }

    public String getFileName() {
        return fileName;
    }

    public String getFileId() {
        return fileId;
    }

    public int getChunkIndex() {
        return chunkIndex;
    }

    public long getTimestamp() {
        return timestamp;
    }

    /**
     * True when the chunk's vector is a locally generated fallback rather than a real embedding.
     * Such chunks still take part in searches, but their scores say nothing about relevance.
     */
    public boolean isDegraded() {
        return degraded;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("source", source);
        if (fileName != null) {
            map.put("fileName", fileName);
        }
        if (fileId != null) {
            map.put("fileId", fileId);
        }
        map.put("chunkIndex", chunkIndex);
        map.put("timestamp", timestamp);
        map.put("degraded", degraded);
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DocumentMetadata)) {
            return false;
        }
        DocumentMetadata that = (DocumentMetadata) o;
        return chunkIndex == that.chunkIndex
                && timestamp == that.timestamp
                && degraded == that.degraded
                && Objects.equals(source, that.source)
                && Objects.equals(fileName, that.fileName)
                && Objects.equals(fileId, that.fileId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, fileName, fileId, chunkIndex, timestamp, degraded);
    }
}
