package com.mini.parquet.schema;

import com.google.common.base.Preconditions;
import com.mini.parquet.format.ColumnarFile;
import com.mini.parquet.format.ColumnarFileOpener;

import java.io.IOException;

/**
 * Schema 查看器
 * 每次调用都重新打开文件读取，不缓存
 */
public class SchemaInspector {

    private final ColumnarFileOpener opener;

    public SchemaInspector(ColumnarFileOpener opener) {
        this.opener = Preconditions.checkNotNull(opener, "opener");
    }

    public SchemaDescriptor getSchema(String path) throws IOException {
        try (ColumnarFile file = opener.open(path)) {
            return SchemaDescriptor.of(file.fields());
        }
    }
}
