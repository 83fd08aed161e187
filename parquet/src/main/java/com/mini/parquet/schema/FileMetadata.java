package com.mini.parquet.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 文件元数据
 * 行数、行组、列数、文件大小以及每个行组的概要和内嵌的 Schema
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FileMetadata {
    private final long numRows;
    private final int numRowGroups;
    private final int numColumns;

    /** 文件字节数 */
    private final long byteSize;

    private final List<RowGroupMetadata> rowGroups;
    private final SchemaDescriptor schema;

    @JsonCreator
    public FileMetadata(
            @JsonProperty("numRows") long numRows,
            @JsonProperty("numRowGroups") int numRowGroups,
            @JsonProperty("numColumns") int numColumns,
            @JsonProperty("size") long byteSize,
            @JsonProperty("rowGroups") List<RowGroupMetadata> rowGroups,
            @JsonProperty("schema") SchemaDescriptor schema) {
        this.numRows = numRows;
        this.numRowGroups = numRowGroups;
        this.numColumns = numColumns;
        this.byteSize = byteSize;
        this.rowGroups = rowGroups != null
                ? Collections.unmodifiableList(rowGroups) : Collections.emptyList();
        this.schema = Objects.requireNonNull(schema, "schema");
    }

    @JsonProperty("numRows")
    public long getNumRows() {
        return numRows;
    }

    @JsonProperty("numRowGroups")
    public int getNumRowGroups() {
        return numRowGroups;
    }

    @JsonProperty("numColumns")
    public int getNumColumns() {
        return numColumns;
    }

    @JsonProperty("size")
    public long getByteSize() {
        return byteSize;
    }

    @JsonProperty("rowGroups")
    public List<RowGroupMetadata> getRowGroups() {
        return rowGroups;
    }

    @JsonProperty("schema")
    public SchemaDescriptor getSchema() {
        return schema;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FileMetadata that = (FileMetadata) o;
        return numRows == that.numRows &&
                numRowGroups == that.numRowGroups &&
                numColumns == that.numColumns &&
                byteSize == that.byteSize &&
                rowGroups.equals(that.rowGroups) &&
                schema.equals(that.schema);
    }

    @Override
    public int hashCode() {
        return Objects.hash(numRows, numRowGroups, numColumns, byteSize, rowGroups, schema);
    }

    @Override
    public String toString() {
        return "FileMetadata{" +
                "numRows=" + numRows +
                ", numRowGroups=" + numRowGroups +
                ", numColumns=" + numColumns +
                ", size=" + byteSize +
                ", rowGroups=" + rowGroups +
                '}';
    }

    /**
     * 行组概要
     */
    public static class RowGroupMetadata {
        private final int index;
        private final long numRows;

        /** 列块数量 */
        private final int numColumns;

        @JsonCreator
        public RowGroupMetadata(
                @JsonProperty("index") int index,
                @JsonProperty("numRows") long numRows,
                @JsonProperty("numColumns") int numColumns) {
            this.index = index;
            this.numRows = numRows;
            this.numColumns = numColumns;
        }

        @JsonProperty("index")
        public int getIndex() {
            return index;
        }

        @JsonProperty("numRows")
        public long getNumRows() {
            return numRows;
        }

        @JsonProperty("numColumns")
        public int getNumColumns() {
            return numColumns;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            RowGroupMetadata that = (RowGroupMetadata) o;
            return index == that.index && numRows == that.numRows && numColumns == that.numColumns;
        }

        @Override
        public int hashCode() {
            return Objects.hash(index, numRows, numColumns);
        }

        @Override
        public String toString() {
            return "RowGroup{index=" + index + ", numRows=" + numRows + ", numColumns=" + numColumns + "}";
        }
    }
}
