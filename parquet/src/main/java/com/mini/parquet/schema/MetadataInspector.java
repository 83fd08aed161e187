package com.mini.parquet.schema;

import com.google.common.base.Preconditions;
import com.mini.parquet.format.ColumnarFile;
import com.mini.parquet.format.ColumnarFileOpener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 元数据查看器
 * 只读取文件 footer，不读取行数据；每次调用都重新计算，不缓存
 */
public class MetadataInspector {
    private static final Logger logger = LoggerFactory.getLogger(MetadataInspector.class);

    private final ColumnarFileOpener opener;

    public MetadataInspector(ColumnarFileOpener opener) {
        this.opener = Preconditions.checkNotNull(opener, "opener");
    }

    public FileMetadata getMetadata(String path) throws IOException {
        try (ColumnarFile file = opener.open(path)) {
            int numRowGroups = file.numRowGroups();
            List<FileMetadata.RowGroupMetadata> rowGroups = new ArrayList<>(numRowGroups);
            for (int i = 0; i < numRowGroups; i++) {
                rowGroups.add(new FileMetadata.RowGroupMetadata(
                        i, file.rowGroupRowCount(i), file.rowGroupColumnCount(i)));
            }

            FileMetadata metadata = new FileMetadata(
                    file.numRows(),
                    numRowGroups,
                    file.fields().size(),
                    file.byteSize(),
                    rowGroups,
                    SchemaDescriptor.of(file.fields()));
            logger.debug("Metadata of {}: {}", path, metadata);
            return metadata;
        }
    }
}
