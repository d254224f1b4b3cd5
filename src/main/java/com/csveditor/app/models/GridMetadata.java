package com.csveditor.app.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * File-level information shown alongside a grid: name, path, counts,
 * delimiter, encoding, size and modification time.
 * Display-only. Row and column counts here are whatever the loader reported;
 * the authoritative counts always come from {@link Grid} itself.
 */
public class GridMetadata {

    private final String filename;
    private final String path;
    private final int rowCount;
    private final int columnCount;
    private final boolean hasHeaders;
    private final String delimiter;
    private final String encoding;
    private final long fileSize;
    private final String lastModified;

    @JsonCreator
    public GridMetadata(@JsonProperty("filename") String filename,
                        @JsonProperty("path") String path,
                        @JsonProperty("rowCount") int rowCount,
                        @JsonProperty("columnCount") int columnCount,
                        @JsonProperty("hasHeaders") boolean hasHeaders,
                        @JsonProperty("delimiter") String delimiter,
                        @JsonProperty("encoding") String encoding,
                        @JsonProperty("fileSize") long fileSize,
                        @JsonProperty("lastModified") String lastModified) {
        this.filename = filename;
        this.path = path;
        this.rowCount = rowCount;
        this.columnCount = columnCount;
        this.hasHeaders = hasHeaders;
        this.delimiter = delimiter == null ? "," : delimiter;
        this.encoding = encoding == null ? "UTF-8" : encoding;
        this.fileSize = fileSize;
        this.lastModified = lastModified;
    }

    /**
     * Metadata for a grid that has never been saved.
     */
    public static GridMetadata untitled(int rowCount, int columnCount) {
        return new GridMetadata("untitled.csv", "", rowCount, columnCount,
                true, ",", "UTF-8", 0L, "");
    }

    public String getFilename() {
        return filename;
    }

    public String getPath() {
        return path;
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColumnCount() {
        return columnCount;
    }

    public boolean isHasHeaders() {
        return hasHeaders;
    }

    public String getDelimiter() {
        return delimiter;
    }

    public String getEncoding() {
        return encoding;
    }

    public long getFileSize() {
        return fileSize;
    }

    public String getLastModified() {
        return lastModified;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GridMetadata)) {
            return false;
        }
        GridMetadata that = (GridMetadata) o;
        return rowCount == that.rowCount
                && columnCount == that.columnCount
                && hasHeaders == that.hasHeaders
                && fileSize == that.fileSize
                && Objects.equals(filename, that.filename)
                && Objects.equals(path, that.path)
                && Objects.equals(delimiter, that.delimiter)
                && Objects.equals(encoding, that.encoding)
                && Objects.equals(lastModified, that.lastModified);
    }

    @Override
    public int hashCode() {
        return Objects.hash(filename, path, rowCount, columnCount, hasHeaders,
                delimiter, encoding, fileSize, lastModified);
    }
}
