package com.corpusindex.storage;

import java.io.EOFException;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.zip.CRC32;

/**
 * 存储文件工具方法，封装 CRC32 页脚与原子替换逻辑。
 */
final class StorageFileUtil {
    private StorageFileUtil() {
    }

    /**
     * 计算指定前缀字节区间的 CRC32。
     *
     * @param randomAccessFile 源文件
     * @param length 参与校验的字节长度
     * @return CRC32 无符号值
     * @throws IOException 读取失败时抛出
     */
    static long computeCrc32(RandomAccessFile randomAccessFile, long length) throws IOException {
        long originalPointer = randomAccessFile.getFilePointer();
        CRC32 crc32 = new CRC32();
        byte[] buffer = new byte[8 * 1024];
        long remainingBytes = length;
        randomAccessFile.seek(0L);
        while (remainingBytes > 0) {
            int chunkSize = (int) Math.min(buffer.length, remainingBytes);
            int readBytes = randomAccessFile.read(buffer, 0, chunkSize);
            if (readBytes < 0) {
                throw new EOFException("计算 CRC32 时遇到 EOF");
            }
            crc32.update(buffer, 0, readBytes);
            remainingBytes -= readBytes;
        }
        randomAccessFile.seek(originalPointer);
        return crc32.getValue();
    }

    /**
     * 在文件尾部追加 CRC32 页脚。
     *
     * @param randomAccessFile 目标文件
     * @return 写入的 CRC32 无符号值
     * @throws IOException 写入失败时抛出
     */
    static long appendCrc32Footer(RandomAccessFile randomAccessFile) throws IOException {
        long dataLength = randomAccessFile.length();
        long crc32Value = computeCrc32(randomAccessFile, dataLength);
        randomAccessFile.seek(dataLength);
        randomAccessFile.writeInt((int) crc32Value);
        return crc32Value;
    }

    /**
     * 验证尾部 CRC32 并返回数据区长度。
     *
     * @param randomAccessFile 源文件
     * @param fileName 文件名（用于错误消息）
     * @return 不含 CRC 页脚的数据区长度
     * @throws IOException CRC 不匹配或文件过短时抛出
     */
    static long verifyCrc32Footer(RandomAccessFile randomAccessFile, String fileName) throws IOException {
        long fileLength = randomAccessFile.length();
        if (fileLength < Integer.BYTES) {
            throw new IOException("文件过短，缺少 CRC32 页脚: " + fileName);
        }
        long dataLength = fileLength - Integer.BYTES;
        randomAccessFile.seek(dataLength);
        long expectedCrc32 = Integer.toUnsignedLong(randomAccessFile.readInt());
        long actualCrc32 = computeCrc32(randomAccessFile, dataLength);
        if (actualCrc32 != expectedCrc32) {
            throw new IOException("CRC32 校验失败: " + fileName + ", expected=" + expectedCrc32 + ", actual=" + actualCrc32);
        }
        return dataLength;
    }

    /**
     * 将临时文件原子替换为目标文件；失败时删除临时文件。
     */
    static void moveAtomically(Path tempFile, Path target) throws IOException {
        try {
            Files.move(tempFile, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException moveException) {
            deleteQuietly(tempFile, moveException);
            throw moveException;
        }
    }

    /**
     * 删除文件，删除失败时把异常附加到原始异常上。
     */
    static void deleteQuietly(Path file, Exception original) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException deleteException) {
            original.addSuppressed(deleteException);
        }
    }

    /**
     * 字符串 UTF-8 字节的小写十六进制，用于把任意桶键变成安全的文件名片段。
     */
    static String hexOfUtf8(String value) {
        StringBuilder builder = new StringBuilder();
        for (byte b : value.getBytes(StandardCharsets.UTF_8)) {
            builder.append(Character.forDigit((b >> 4) & 0xF, 16));
            builder.append(Character.forDigit(b & 0xF, 16));
        }
        return builder.toString();
    }
}
