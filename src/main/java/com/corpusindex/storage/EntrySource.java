package com.corpusindex.storage;

import java.io.Closeable;
import java.io.IOException;
import java.util.Iterator;
import java.util.List;

/**
 * 按词序逐条产出词条的来源，可以是桶文件、溢写段或内存列表。
 */
public interface EntrySource extends Closeable {

    /**
     * @return 下一个词条，没有更多词条时返回 null
     */
    BucketEntry next() throws IOException;

    /**
     * 包装已按词序排列的内存词条。
     */
    static EntrySource of(List<BucketEntry> entries) {
        Iterator<BucketEntry> iterator = List.copyOf(entries).iterator();
        return new EntrySource() {
            @Override
            public BucketEntry next() {
                return iterator.hasNext() ? iterator.next() : null;
            }

            @Override
            public void close() {
            }
        };
    }
}
