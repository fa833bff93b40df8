package com.corpusindex.document;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.stream.Stream;

/**
 * 惰性深度优先文件树遍历。
 *
 * 参数可以是文件或目录；目录递归展开，同一目录下的条目按文件名排序，
 * 因此对未变化的文件树多次遍历得到相同顺序。根路径以外的符号链接目录不展开。
 * 每次调用 {@link #iterator()} 都从头开始一次新的遍历。
 */
public final class FileTreeWalker implements Iterable<FileInfo> {
    private static final Logger logger = LoggerFactory.getLogger(FileTreeWalker.class);

    private final List<Path> roots;
    private final Set<String> includeExtensions;

    /**
     * @param roots 待遍历的文件或目录
     * @param includeExtensions 只保留这些扩展名（小写、不带点）；为空时保留全部文件
     */
    public FileTreeWalker(List<Path> roots, List<String> includeExtensions) {
        if (roots == null) {
            throw new IllegalArgumentException("遍历根路径不能为空");
        }
        this.roots = List.copyOf(roots);
        this.includeExtensions = includeExtensions == null ? Set.of() : Set.copyOf(includeExtensions);
    }

    /**
     * 返回新的遍历迭代器。无法列出目录或根路径不存在时，迭代过程抛出 UncheckedIOException。
     */
    @Override
    public Iterator<FileInfo> iterator() {
        return new WalkIterator();
    }

    private boolean accepts(Path file) {
        if (includeExtensions.isEmpty()) {
            return true;
        }
        String fileName = file.getFileName() == null ? "" : file.getFileName().toString();
        int lastDotIndex = fileName.lastIndexOf('.');
        if (lastDotIndex < 0 || lastDotIndex == fileName.length() - 1) {
            return false;
        }
        return includeExtensions.contains(fileName.substring(lastDotIndex + 1).toLowerCase(Locale.ROOT));
    }

    private final class WalkIterator implements Iterator<FileInfo> {
        private final Deque<Iterator<Path>> pending = new ArrayDeque<>();
        private final Iterator<Path> rootIterator = roots.iterator();
        private FileInfo nextFile;

        @Override
        public boolean hasNext() {
            if (nextFile == null) {
                nextFile = advance();
            }
            return nextFile != null;
        }

        @Override
        public FileInfo next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            FileInfo current = nextFile;
            nextFile = null;
            return current;
        }

        private FileInfo advance() {
            while (true) {
                Path candidate;
                boolean isRoot;
                if (!pending.isEmpty()) {
                    Iterator<Path> top = pending.peek();
                    if (!top.hasNext()) {
                        pending.pop();
                        continue;
                    }
                    candidate = top.next();
                    isRoot = false;
                } else if (rootIterator.hasNext()) {
                    candidate = rootIterator.next().toAbsolutePath().normalize();
                    isRoot = true;
                } else {
                    return null;
                }

                try {
                    FileInfo fileInfo = visit(candidate, isRoot);
                    if (fileInfo != null) {
                        return fileInfo;
                    }
                } catch (NoSuchFileException missing) {
                    if (isRoot) {
                        throw new UncheckedIOException("路径不存在: " + candidate, missing);
                    }
                    logger.debug("遍历期间文件已消失，忽略: {}", candidate);
                } catch (IOException exception) {
                    throw new UncheckedIOException("无法列出路径: " + candidate, exception);
                }
            }
        }

        private FileInfo visit(Path path, boolean isRoot) throws IOException {
            if (isRoot && !Files.exists(path)) {
                throw new NoSuchFileException(path.toString());
            }
            boolean directory = isRoot ? Files.isDirectory(path) : Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS);
            if (directory) {
                try (Stream<Path> children = Files.list(path)) {
                    List<Path> sortedChildren = children
                        .sorted((left, right) -> left.getFileName().toString().compareTo(right.getFileName().toString()))
                        .toList();
                    pending.push(sortedChildren.iterator());
                }
                return null;
            }
            if (!Files.isRegularFile(path) || !accepts(path)) {
                return null;
            }
            return new FileInfo(path, Files.size(path));
        }
    }
}
