package com.mini.parquet.session;

import com.google.common.base.Preconditions;
import com.mini.parquet.cache.ReaderCache;
import org.apache.hadoop.conf.Configuration;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Session 上下文配置
 *
 * 支持的配置项:
 * - cache.ttl-ms: 全量读取结果的缓存过期时间（毫秒），默认 5 分钟
 * - hadoop.*: 去掉前缀后原样写入传给 Parquet 库的 Hadoop Configuration
 */
public class SessionContext {

    public static final String CACHE_TTL_MS = "cache.ttl-ms";
    public static final String HADOOP_PREFIX = "hadoop.";

    /** 全量读取结果的缓存过期时间 */
    private final Duration cacheTtl;

    /** 其他配置选项 */
    private final Map<String, String> options;

    private SessionContext(Duration cacheTtl, Map<String, String> options) {
        this.cacheTtl = cacheTtl;
        this.options = new HashMap<>(options);
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public String getOption(String key) {
        return options.get(key);
    }

    public String getOption(String key, String defaultValue) {
        return options.getOrDefault(key, defaultValue);
    }

    /**
     * 构建传给 Parquet 库的 Hadoop 配置
     */
    public Configuration toHadoopConfiguration() {
        Configuration conf = new Configuration();
        for (Map.Entry<String, String> entry : options.entrySet()) {
            if (entry.getKey().startsWith(HADOOP_PREFIX)) {
                conf.set(entry.getKey().substring(HADOOP_PREFIX.length()), entry.getValue());
            }
        }
        return conf;
    }

    public static SessionContext defaults() {
        return builder().build();
    }

    /**
     * 从 properties 文件加载配置
     */
    public static SessionContext fromProperties(Path file) throws IOException {
        Properties properties = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            properties.load(in);
        }
        Builder builder = builder();
        for (String key : properties.stringPropertyNames()) {
            builder.option(key, properties.getProperty(key));
        }
        return builder.build();
    }

    /**
     * 创建 SessionContext Builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * SessionContext Builder
     */
    public static class Builder {
        private Duration cacheTtl;
        private final Map<String, String> options = new HashMap<>();

        public Builder cacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
            return this;
        }

        public Builder option(String key, String value) {
            this.options.put(key, value);
            return this;
        }

        public Builder options(Map<String, String> options) {
            this.options.putAll(options);
            return this;
        }

        public SessionContext build() {
            Duration ttl = cacheTtl;
            if (ttl == null) {
                String configured = options.get(CACHE_TTL_MS);
                ttl = configured == null ? ReaderCache.DEFAULT_TTL : parseTtl(configured);
            }
            Preconditions.checkArgument(!ttl.isNegative(), "Cache TTL must not be negative: %s", ttl);
            return new SessionContext(ttl, options);
        }

        private static Duration parseTtl(String value) {
            try {
                return Duration.ofMillis(Long.parseLong(value.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "Invalid value for " + CACHE_TTL_MS + ": " + value, e);
            }
        }
    }

    @Override
    public String toString() {
        return "SessionContext{" +
                "cacheTtl=" + cacheTtl +
                ", options=" + options +
                '}';
    }
}
