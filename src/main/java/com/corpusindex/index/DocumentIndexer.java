package com.corpusindex.index;

import com.corpusindex.config.ErrorKind;
import com.corpusindex.config.ErrorPolicy;
import com.corpusindex.config.IndexerConfig;
import com.corpusindex.document.ContentReader;
import com.corpusindex.document.Document;
import com.corpusindex.pipeline.PipelineException;
import com.corpusindex.text.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;

/**
 * 单文档索引：读取字节、严格按 UTF-8 解码、分词并构建片段。
 *
 * 读取、解码、分词或构建片段期间内存不足归为 OUT_OF_MEMORY。读取或解码失败按错误类别查询策略：SKIP 生成跳过消息，FATAL 抛出 {@link PipelineException}。
 */
public final class DocumentIndexer {
    private static final Logger logger = LoggerFactory.getLogger(DocumentIndexer.class);

    private final ContentReader contentReader;
    private final Tokenizer tokenizer;
    private final IndexerConfig config;

    public DocumentIndexer(ContentReader contentReader, Tokenizer tokenizer, IndexerConfig config) {
        this.contentReader = contentReader;
        this.tokenizer = tokenizer;
        this.config = config;
    }

    /**
     * 索引一个文档。
     *
     * @return 片段消息或跳过消息
     * @throws PipelineException 错误类别的策略为 FATAL 时抛出
     */
    public FragmentMessage index(Document document) {
        InMemoryIndex fragment;
        try {
            String text = decode(contentReader.read(document));
            fragment = InMemoryIndex.fromTokens(document.docId(), tokenizer.tokenize(text));
        } catch (IOException exception) {
            return handleFailure(document, classify(exception), exception);
        } catch (OutOfMemoryError error) {
            return handleFailure(document, ErrorKind.OUT_OF_MEMORY, error);
        }
        return new FragmentMessage.Fragment(document, fragment);
    }

    static ErrorKind classify(IOException exception) {
        if (exception instanceof NoSuchFileException) {
            return ErrorKind.NOT_FOUND;
        }
        if (exception instanceof AccessDeniedException) {
            return ErrorKind.PERMISSION_DENIED;
        }
        if (exception instanceof CharacterCodingException) {
            return ErrorKind.DECODE_ERROR;
        }
        return ErrorKind.IO_ERROR;
    }

    private static String decode(byte[] bytes) throws CharacterCodingException {
        return StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT)
            .decode(ByteBuffer.wrap(bytes))
            .toString();
    }

    private FragmentMessage handleFailure(Document document, ErrorKind errorKind, Throwable cause) {
        String reason = describe(errorKind, cause);
        if (config.policyFor(errorKind) == ErrorPolicy.FATAL) {
            throw PipelineException.document(document.docId(), errorKind, reason, cause);
        }
        logger.warn("跳过文档 {} ({}): {}", document.docId(), document.path(), reason);
        SkippedDocument skipped = new SkippedDocument(document.docId(), document.path(), errorKind, reason);
        return new FragmentMessage.Skipped(document, skipped);
    }

    private static String describe(ErrorKind errorKind, Throwable cause) {
        return switch (errorKind) {
            case NOT_FOUND -> "文件不存在";
            case PERMISSION_DENIED -> "无读取权限";
            case DECODE_ERROR -> "内容不是合法的 UTF-8";
            case OUT_OF_MEMORY -> "内存不足";
            case IO_ERROR -> "读取失败: " + cause.getMessage();
        };
    }
}
