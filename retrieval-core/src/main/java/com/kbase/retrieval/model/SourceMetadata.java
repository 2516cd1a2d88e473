package com.kbase.retrieval.model;

/**
 * Describes where an ingested document came from.
 */
public class SourceMetadata {

    private final String source;
    private final String fileName;
    private final String fileId;

    public SourceMetadata(String source, String fileName, String fileId) {
        this.source = source;
        this.fileName = fileName;
        this.fileId = fileId;
    }

    public static SourceMetadata of(String source) {
        return new SourceMetadata(source, null, null);
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
}
