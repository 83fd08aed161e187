package com.mini.parquet.format.parquet;

import com.google.common.base.Preconditions;
import com.mini.parquet.exception.FileAccessException;
import com.mini.parquet.exception.FileFormatException;
import com.mini.parquet.format.ColumnarFile;
import com.mini.parquet.format.ColumnarFileOpener;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.Path;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.util.HadoopInputFile;
import org.apache.parquet.io.InputFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Paths;

/**
 * 本地 Parquet 文件打开器
 *
 * 打开分两步：
 * 1. 检查本地文件是否存在、可读并获取大小，失败抛出 {@link FileAccessException}
 * 2. 由 parquet-hadoop 读取 footer，任何失败抛出 {@link FileFormatException}
 */
public class ParquetColumnarFileOpener implements ColumnarFileOpener {
    private static final Logger logger = LoggerFactory.getLogger(ParquetColumnarFileOpener.class);

    private final Configuration hadoopConf;

    public ParquetColumnarFileOpener(Configuration hadoopConf) {
        this.hadoopConf = Preconditions.checkNotNull(hadoopConf, "hadoopConf");
    }

    @Override
    public ColumnarFile open(String path) throws IOException {
        Preconditions.checkNotNull(path, "path");

        java.nio.file.Path localPath;
        try {
            localPath = Paths.get(path).toAbsolutePath();
        } catch (InvalidPathException e) {
            throw new FileAccessException(path, "Invalid file path", e);
        }
        if (!Files.exists(localPath)) {
            throw FileAccessException.notFound(path);
        }
        if (!Files.isRegularFile(localPath)) {
            throw new FileAccessException(path, "Not a regular file");
        }
        if (!Files.isReadable(localPath)) {
            throw new FileAccessException(path, "Permission denied");
        }

        long byteSize;
        InputFile inputFile;
        try {
            byteSize = Files.size(localPath);
            inputFile = HadoopInputFile.fromPath(new Path(localPath.toUri()), hadoopConf);
        } catch (IOException e) {
            throw new FileAccessException(path, "Failed to stat file", e);
        }

        ParquetFileReader reader;
        try {
            reader = ParquetFileReader.open(inputFile);
        } catch (IOException | RuntimeException e) {
            throw new FileFormatException(path, "Failed to open parquet file", e);
        }

        try {
            ParquetColumnarFile file = new ParquetColumnarFile(path, byteSize, reader);
            logger.debug("Opened parquet file {} ({} bytes, {} row groups)",
                    path, byteSize, file.numRowGroups());
            return file;
        } catch (RuntimeException e) {
            reader.close();
            throw new FileFormatException(path, "Unsupported parquet schema", e);
        }
    }
}
