package com.corpusindex.index;

import com.corpusindex.storage.BucketEntry;
import com.corpusindex.storage.BucketMeta;
import com.corpusindex.storage.BucketReader;
import com.corpusindex.storage.FileBucketStore;
import com.corpusindex.storage.IndexManifest;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 校验输出目录：清单中的每个桶都可读且与清单一致，词只落在所属桶内，
 * 桶之间按词序首尾相接，目录中没有清单以外的桶文件。
 */
public final class IndexVerifier {
    private final FileBucketStore store;

    public IndexVerifier(FileBucketStore store) {
        this.store = store;
    }

    /**
     * 执行校验。
     *
     * @return 校验报告，problems 为空表示通过
     * @throws IOException 清单缺失或无法读取时抛出
     */
    public VerificationReport verify() throws IOException {
        IndexManifest manifest = store.readManifest();
        BucketPartitioner partitioner = new BucketPartitioner(manifest.bucketPrefixLength());
        List<String> problems = new ArrayList<>();
        Set<String> listedFiles = new HashSet<>();
        int termCount = 0;
        long postingCount = 0;
        String previousBucketLastWord = null;

        for (BucketMeta meta : manifest.buckets()) {
            listedFiles.add(meta.fileName());
            BucketReader reader;
            try {
                reader = new BucketReader(store.getOutputDir().resolve(meta.fileName()).toFile());
            } catch (IOException exception) {
                problems.add("桶 " + meta.bucketKey() + " 无法读取: " + exception.getMessage());
                continue;
            }
            if (reader.getTermCount() != meta.termCount()) {
                problems.add("桶 " + meta.bucketKey() + " 词数不一致: manifest=" + meta.termCount()
                    + ", file=" + reader.getTermCount());
            }
            if (reader.getPostingCount() != meta.postingCount()) {
                problems.add("桶 " + meta.bucketKey() + " 倒排项数不一致: manifest=" + meta.postingCount()
                    + ", file=" + reader.getPostingCount());
            }
            List<BucketEntry> entries = reader.entries();
            for (BucketEntry entry : entries) {
                if (!partitioner.bucketKey(entry.word()).equals(meta.bucketKey())) {
                    problems.add("词 " + entry.word() + " 不属于桶 " + meta.bucketKey());
                }
            }
            if (!entries.isEmpty()) {
                String firstWord = entries.get(0).word();
                if (previousBucketLastWord != null && firstWord.compareTo(previousBucketLastWord) <= 0) {
                    problems.add("桶 " + meta.bucketKey() + " 与前一个桶词序重叠");
                }
                previousBucketLastWord = entries.get(entries.size() - 1).word();
            }
            termCount += reader.getTermCount();
            postingCount += reader.getPostingCount();
        }

        if (termCount != manifest.termCount()) {
            problems.add("总词数不一致: manifest=" + manifest.termCount() + ", buckets=" + termCount);
        }
        for (String fileName : store.listBucketFiles()) {
            if (!listedFiles.contains(fileName)) {
                problems.add("清单之外的桶文件: " + fileName);
            }
        }
        return new VerificationReport(manifest.buckets().size(), termCount, postingCount, problems);
    }

    /**
     * 校验结果。
     */
    public record VerificationReport(int bucketCount, int termCount, long postingCount, List<String> problems) {
        public VerificationReport {
            problems = List.copyOf(problems);
        }

        public boolean passed() {
            return problems.isEmpty();
        }
    }
}
