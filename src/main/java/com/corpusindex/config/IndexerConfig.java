package com.corpusindex.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 索引器运行时配置
 *
 * 支持从 JSON 配置文件或 CLI 参数注入，覆盖 Constants 默认值
 */
public class IndexerConfig {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private Path outputDir = Paths.get("./index");
    private int workerThreads = Constants.DEFAULT_WORKER_THREADS;
    private int channelCapacity = Constants.DEFAULT_CHANNEL_CAPACITY;
    private int bucketPrefixLength = Constants.DEFAULT_BUCKET_PREFIX_LENGTH;
    private TokenizerMode tokenizerMode = TokenizerMode.ENGLISH;
    private boolean enableStopWords = false;
    private List<String> stopWords = new ArrayList<>();
    private int minTermLength = Constants.DEFAULT_MIN_TERM_LENGTH;
    private List<String> includeExtensions = new ArrayList<>();
    private final Map<ErrorKind, ErrorPolicy> errorPolicies = defaultErrorPolicies();
    private int flushMaxAttempts = Constants.DEFAULT_FLUSH_MAX_ATTEMPTS;
    private long flushRetryBackoffMillis = Constants.DEFAULT_FLUSH_RETRY_BACKOFF_MILLIS;
    private long deadlineMillis = 0L;
    private long spillThresholdPostings = Constants.DEFAULT_SPILL_THRESHOLD_POSTINGS;

    @JsonIgnore
    public Path getOutputDir() {
        return outputDir;
    }

    @JsonIgnore
    public void setOutputDir(Path outputDir) {
        this.outputDir = outputDir;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public int getChannelCapacity() {
        return channelCapacity;
    }

    public void setChannelCapacity(int channelCapacity) {
        this.channelCapacity = channelCapacity;
    }

    public int getBucketPrefixLength() {
        return bucketPrefixLength;
    }

    public void setBucketPrefixLength(int bucketPrefixLength) {
        this.bucketPrefixLength = bucketPrefixLength;
    }

    public TokenizerMode getTokenizerMode() {
        return tokenizerMode;
    }

    public void setTokenizerMode(TokenizerMode tokenizerMode) {
        this.tokenizerMode = tokenizerMode;
    }

    public boolean isEnableStopWords() {
        return enableStopWords;
    }

    public void setEnableStopWords(boolean enableStopWords) {
        this.enableStopWords = enableStopWords;
    }

    /**
     * 自定义停用词表，为空时使用内置英文词表。
     */
    public List<String> getStopWords() {
        return List.copyOf(stopWords);
    }

    public void setStopWords(List<String> stopWords) {
        List<String> copy = new ArrayList<>();
        if (stopWords != null) {
            for (String word : stopWords) {
                if (word != null && !word.isBlank()) {
                    copy.add(word.trim());
                }
            }
        }
        this.stopWords = copy;
    }

    public int getMinTermLength() {
        return minTermLength;
    }

    public void setMinTermLength(int minTermLength) {
        this.minTermLength = minTermLength;
    }

    public List<String> getIncludeExtensions() {
        return List.copyOf(includeExtensions);
    }

    public void setIncludeExtensions(List<String> includeExtensions) {
        List<String> normalized = new ArrayList<>();
        if (includeExtensions != null) {
            for (String extension : includeExtensions) {
                if (extension != null && !extension.isBlank()) {
                    String trimmed = extension.trim().toLowerCase(Locale.ROOT);
                    normalized.add(trimmed.startsWith(".") ? trimmed.substring(1) : trimmed);
                }
            }
        }
        this.includeExtensions = normalized;
    }

    public Map<ErrorKind, ErrorPolicy> getErrorPolicies() {
        return Map.copyOf(errorPolicies);
    }

    /**
     * 覆盖给定错误类别的策略，未出现的类别保持默认值。
     */
    public void setErrorPolicies(Map<ErrorKind, ErrorPolicy> overrides) {
        if (overrides == null) {
            return;
        }
        for (Map.Entry<ErrorKind, ErrorPolicy> entry : overrides.entrySet()) {
            if (entry.getKey() != null && entry.getValue() != null) {
                errorPolicies.put(entry.getKey(), entry.getValue());
            }
        }
    }

    /**
     * 查询错误类别对应的处理策略。
     */
    public ErrorPolicy policyFor(ErrorKind errorKind) {
        return errorPolicies.getOrDefault(errorKind, ErrorPolicy.SKIP);
    }

    public int getFlushMaxAttempts() {
        return flushMaxAttempts;
    }

    public void setFlushMaxAttempts(int flushMaxAttempts) {
        this.flushMaxAttempts = flushMaxAttempts;
    }

    public long getFlushRetryBackoffMillis() {
        return flushRetryBackoffMillis;
    }

    public void setFlushRetryBackoffMillis(long flushRetryBackoffMillis) {
        this.flushRetryBackoffMillis = flushRetryBackoffMillis;
    }

    public long getDeadlineMillis() {
        return deadlineMillis;
    }

    public void setDeadlineMillis(long deadlineMillis) {
        this.deadlineMillis = deadlineMillis;
    }

    /**
     * 合并器内存中常驻倒排项达到该数量时溢写到临时文件，0 表示不溢写。
     */
    public long getSpillThresholdPostings() {
        return spillThresholdPostings;
    }

    public void setSpillThresholdPostings(long spillThresholdPostings) {
        this.spillThresholdPostings = spillThresholdPostings;
    }

    /**
     * 校验配置取值范围，非法时抛出 IllegalArgumentException。
     */
    public IndexerConfig validate() {
        requireAtLeast("workerThreads", workerThreads, 1);
        requireAtLeast("channelCapacity", channelCapacity, 1);
        requireAtLeast("bucketPrefixLength", bucketPrefixLength, 1);
        requireAtLeast("minTermLength", minTermLength, 1);
        requireAtLeast("flushMaxAttempts", flushMaxAttempts, 1);
        if (flushRetryBackoffMillis < 0) {
            throw new IllegalArgumentException("flushRetryBackoffMillis 不能为负数: " + flushRetryBackoffMillis);
        }
        if (deadlineMillis < 0) {
            throw new IllegalArgumentException("deadlineMillis 不能为负数: " + deadlineMillis);
        }
        if (spillThresholdPostings < 0) {
            throw new IllegalArgumentException("spillThresholdPostings 不能为负数: " + spillThresholdPostings);
        }
        if (tokenizerMode == null) {
            throw new IllegalArgumentException("tokenizerMode 不能为空");
        }
        if (outputDir == null) {
            throw new IllegalArgumentException("outputDir 不能为空");
        }
        return this;
    }

    /**
     * 使用默认配置创建实例
     */
    public static IndexerConfig defaults() {
        return new IndexerConfig();
    }

    /**
     * 以默认配置为基础，叠加 JSON 配置文件中的字段。
     *
     * @param configFile JSON 配置文件
     * @return 合并后的配置
     * @throws IOException 文件不存在或解析失败时抛出
     */
    public static IndexerConfig load(Path configFile) throws IOException {
        if (configFile == null) {
            throw new IllegalArgumentException("配置文件不能为空");
        }
        if (!Files.isRegularFile(configFile)) {
            throw new IOException("配置文件不存在: " + configFile.toAbsolutePath());
        }
        try {
            return OBJECT_MAPPER.readerForUpdating(defaults()).readValue(configFile.toFile());
        } catch (IOException exception) {
            throw new IOException("读取配置文件失败: " + configFile.toAbsolutePath(), exception);
        }
    }

    private static Map<ErrorKind, ErrorPolicy> defaultErrorPolicies() {
        Map<ErrorKind, ErrorPolicy> policies = new EnumMap<>(ErrorKind.class);
        for (ErrorKind errorKind : ErrorKind.values()) {
            policies.put(errorKind, ErrorPolicy.SKIP);
        }
        policies.put(ErrorKind.OUT_OF_MEMORY, ErrorPolicy.FATAL);
        return policies;
    }

    private static void requireAtLeast(String name, long value, long minimum) {
        if (value < minimum) {
            throw new IllegalArgumentException(name + " 必须 >= " + minimum + "，当前值: " + value);
        }
    }
}
