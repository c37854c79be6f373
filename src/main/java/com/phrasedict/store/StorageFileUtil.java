package com.phrasedict.store;

import java.io.EOFException;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.util.zip.CRC32;

/**
 * 词典文件工具方法，封装 VarInt 长度字段与 CRC32 页脚的随机访问读写。
 */
final class StorageFileUtil {
    private static final int VAR_INT_MAX_SHIFT = 32;
    private static final int CRC_BUFFER_BYTES = 8 * 1024;

    private StorageFileUtil() {
    }

    /**
     * 写入非负 VarInt，每字节低 7 位为数据，最高位为续接标志。
     *
     * @param file 目标文件
     * @param value 非负整数
     * @throws IOException 写入失败时抛出
     */
    static void writeVarInt(RandomAccessFile file, int value) throws IOException {
        if (value < 0) {
            throw new IllegalArgumentException("VarInt不支持负数: " + value);
        }
        byte[] encoded = new byte[5];
        int length = 0;
        int remaining = value;
        while ((remaining & ~0x7F) != 0) {
            encoded[length++] = (byte) ((remaining & 0x7F) | 0x80);
            remaining >>>= 7;
        }
        encoded[length++] = (byte) remaining;
        file.write(encoded, 0, length);
    }

    /**
     * 读取 VarInt。
     *
     * @param file 源文件
     * @return 解码后的整数
     * @throws IOException 遇到 EOF 或超过 32 位时抛出
     */
    static int readVarInt(RandomAccessFile file) throws IOException {
        int result = 0;
        for (int shift = 0; shift < VAR_INT_MAX_SHIFT; shift += 7) {
            int current = file.read();
            if (current == -1) {
                throw new EOFException("读取 VarInt 时遇到 EOF");
            }
            result |= (current & 0x7F) << shift;
            if ((current & 0x80) == 0) {
                return result;
            }
        }
        throw new IOException("VarInt 超过 32 位范围");
    }

    /**
     * 读取带 VarInt 长度前缀的字节块。
     *
     * @param file 源文件
     * @param limit 数据区结束位置，长度越界时视为损坏
     * @param what 字段名（用于错误消息）
     * @return 字节块
     * @throws IOException 长度非法或越界时抛出
     */
    static byte[] readLengthPrefixed(RandomAccessFile file, long limit, String what) throws IOException {
        int length = readVarInt(file);
        if (length < 0 || file.getFilePointer() + length > limit) {
            throw new IOException(what + " 长度非法: " + length + ", offset=" + file.getFilePointer());
        }
        byte[] bytes = new byte[length];
        file.readFully(bytes);
        return bytes;
    }

    /**
     * 写入带 VarInt 长度前缀的字节块。
     */
    static void writeLengthPrefixed(RandomAccessFile file, byte[] bytes) throws IOException {
        writeVarInt(file, bytes.length);
        file.write(bytes);
    }

    /**
     * 以位置读取方式计算文件前 {@code length} 字节的 CRC32，不移动文件指针。
     */
    static long crc32Of(RandomAccessFile file, long length) throws IOException {
        FileChannel channel = file.getChannel();
        CRC32 crc32 = new CRC32();
        ByteBuffer buffer = ByteBuffer.allocate(CRC_BUFFER_BYTES);
        long position = 0L;
        while (position < length) {
            buffer.clear().limit((int) Math.min(buffer.capacity(), length - position));
            int read = channel.read(buffer, position);
            if (read < 0) {
                throw new EOFException("计算 CRC32 时遇到 EOF, position=" + position);
            }
            buffer.flip();
            crc32.update(buffer);
            position += read;
        }
        return crc32.getValue();
    }

    /**
     * 在文件末尾追加覆盖此前全部字节的 CRC32 页脚。
     */
    static void appendCrc32Footer(RandomAccessFile file) throws IOException {
        long dataLength = file.length();
        int footer = (int) crc32Of(file, dataLength);
        file.seek(dataLength);
        file.writeInt(footer);
    }

    /**
     * 校验 CRC32 页脚并返回数据区长度。
     *
     * @param file 源文件
     * @param fileName 文件名（用于错误消息）
     * @return 不含页脚的数据区长度
     * @throws IOException 文件过短或 CRC 不匹配时抛出
     */
    static long verifyCrc32Footer(RandomAccessFile file, String fileName) throws IOException {
        long dataLength = file.length() - Integer.BYTES;
        if (dataLength < 0) {
            throw new IOException("文件过短，缺少 CRC32 页脚: " + fileName);
        }
        file.seek(dataLength);
        long stored = Integer.toUnsignedLong(file.readInt());
        long computed = crc32Of(file, dataLength);
        if (stored != computed) {
            throw new IOException(String.format("CRC32 校验失败: %s, stored=%08x, computed=%08x",
                fileName, stored, computed));
        }
        return dataLength;
    }
}
