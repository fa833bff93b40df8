package com.corpusindex.storage;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * 索引清单，描述一次成功运行产出的全部桶。
 *
 * 不含时间戳，相同输入重复运行得到字节一致的清单。
 */
public record IndexManifest(
    int formatVersion,
    int bucketPrefixLength,
    int documentCount,
    int indexedCount,
    int skippedCount,
    int termCount,
    List<BucketMeta> buckets
) {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    public IndexManifest {
        buckets = buckets == null ? List.of() : List.copyOf(buckets);
    }

    /**
     * 将清单写入指定 JSON 文件。
     *
     * @param file 清单文件
     * @throws IOException 写入失败时抛出
     */
    public void writeTo(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("清单文件不能为空");
        }
        try {
            OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(file, this);
        } catch (IOException exception) {
            throw new IOException("写入索引清单失败: " + file.getAbsolutePath(), exception);
        }
    }

    /**
     * 从指定 JSON 文件读取清单。
     *
     * @param file 清单文件
     * @return 反序列化后的清单
     * @throws IOException 读取或解析失败时抛出
     */
    public static IndexManifest readFrom(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("清单文件不能为空");
        }
        try {
            return OBJECT_MAPPER.readValue(file, IndexManifest.class);
        } catch (IOException exception) {
            throw new IOException("读取索引清单失败: " + file.getAbsolutePath(), exception);
        }
    }
}
