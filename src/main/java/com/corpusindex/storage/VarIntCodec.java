package com.corpusindex.storage;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;

/**
 * VarInt变长整数编解码器
 *
 * 编码规则：每字节7位有效数据，最高位为续接标志
 * - 最高位为1：表示后续还有字节
 * - 最高位为0：表示这是最后一个字节
 */
public final class VarIntCodec {

    private VarIntCodec() {
        // 工具类，禁止实例化
    }

    /**
     * 将int值编码为VarInt并写入输出流
     *
     * @param value 要编码的值（必须非负）
     * @param out 输出流
     * @throws IOException IO异常
     * @throws IllegalArgumentException 如果value为负数
     */
    public static void writeVarInt(int value, OutputStream out) throws IOException {
        if (value < 0) {
            throw new IllegalArgumentException("VarInt不支持负数: " + value);
        }

        while ((value & ~0x7F) != 0) {
            out.write((value & 0x7F) | 0x80);
            value >>>= 7;
        }
        out.write(value & 0x7F);
    }

    /**
     * 从ByteBuffer读取VarInt并解码为int
     *
     * @param buf 字节缓冲区
     * @return 解码后的值
     * @throws IOException 如果VarInt格式错误或缓冲区不足
     */
    public static int readVarInt(ByteBuffer buf) throws IOException {
        int result = 0;
        int shift = 0;

        while (shift < 32) {
            if (!buf.hasRemaining()) {
                throw new IOException("ByteBuffer不足，无法读取完整VarInt");
            }

            int b = buf.get() & 0xFF;
            result |= (b & 0x7F) << shift;

            if ((b & 0x80) == 0) {
                if (result < 0) {
                    throw new IOException("VarInt解码结果为负数: " + result);
                }
                return result;
            }

            shift += 7;
        }

        throw new IOException("VarInt超过32位范围");
    }

    /**
     * 从输入流读取VarInt，供顺序扫描溢写段使用
     *
     * @param in 输入流
     * @return 解码后的值
     * @throws IOException 如果VarInt格式错误或流提前结束
     */
    public static int readVarInt(InputStream in) throws IOException {
        int result = 0;
        int shift = 0;

        while (shift < 32) {
            int b = in.read();
            if (b < 0) {
                throw new EOFException("输入流提前结束，无法读取完整VarInt");
            }
            result |= (b & 0x7F) << shift;

            if ((b & 0x80) == 0) {
                if (result < 0) {
                    throw new IOException("VarInt解码结果为负数: " + result);
                }
                return result;
            }

            shift += 7;
        }

        throw new IOException("VarInt超过32位范围");
    }

    /**
     * 计算int值编码为VarInt所需的字节数
     *
     * @param value 要编码的值（必须非负）
     * @return 所需字节数
     */
    public static int varIntSize(int value) {
        if (value < 0) {
            throw new IllegalArgumentException("VarInt不支持负数: " + value);
        }

        int size = 1;
        while ((value & ~0x7F) != 0) {
            size++;
            value >>>= 7;
        }
        return size;
    }
}
