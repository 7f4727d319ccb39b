package org.muma.rudis.rdb;

import org.muma.rudis.common.RedisHash;
import org.muma.rudis.common.RedisList;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * RDB 序列化器
 * 负责把内存对象写成 RDB 字节流。
 */
public class RdbEncoder {

    private final OutputStream out;

    public RdbEncoder(OutputStream out) {
        this.out = out;
    }

    public void writeByte(int b) throws IOException {
        out.write(b);
    }

    /**
     * 原样写入，不带长度
     */
    public void writeBytes(byte[] bytes) throws IOException {
        out.write(bytes);
    }

    /**
     * 写入 RDB 长度编码
     * <p>
     * 规则:
     * - 00xxxxxx: len < 64 (1 byte)
     * - 01xxxxxx xxxxxxxx: len < 16384 (2 bytes)
     * - 10000000 + 4 bytes 大端: 其余 (5 bytes)
     */
    public void writeLength(long len) throws IOException {
        if (len < 0 || len > 0xFFFFFFFFL) {
            throw new IOException("Length out of range: " + len);
        }
        if (len < 64) {
            out.write((int) len);
        } else if (len < 16384) {
            out.write(0x40 | (int) ((len >> 8) & 0x3F));
            out.write((int) (len & 0xFF));
        } else {
            out.write(0x80);
            writeInt((int) len);
        }
    }

    /**
     * 4 字节整数 (大端)
     */
    public void writeInt(int v) throws IOException {
        out.write((v >>> 24) & 0xFF);
        out.write((v >>> 16) & 0xFF);
        out.write((v >>> 8) & 0xFF);
        out.write(v & 0xFF);
    }

    /**
     * 8 字节长整数 (大端)
     */
    public void writeLong(long v) throws IOException {
        writeInt((int) (v >>> 32));
        writeInt((int) v);
    }

    /**
     * 字符串: [Length][UTF-8 Bytes]
     */
    public void writeString(String str) throws IOException {
        byte[] bytes = str.getBytes(StandardCharsets.UTF_8);
        writeLength(bytes.length);
        writeBytes(bytes);
    }

    /**
     * List: [Size][Item1][Item2]...
     */
    public void writeList(RedisList list) throws IOException {
        List<String> items = list.toList();
        writeLength(items.size());
        for (String item : items) {
            writeString(item);
        }
    }

    /**
     * Hash: [Size][Field1][Value1][Field2][Value2]...
     */
    public void writeHash(RedisHash hash) throws IOException {
        Map<String, String> map = hash.toMap();
        writeLength(map.size());
        for (Map.Entry<String, String> entry : map.entrySet()) {
            writeString(entry.getKey());
            writeString(entry.getValue());
        }
    }
}
