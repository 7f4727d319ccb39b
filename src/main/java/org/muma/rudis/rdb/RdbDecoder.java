package org.muma.rudis.rdb;

import org.muma.rudis.common.RedisHash;
import org.muma.rudis.common.RedisList;

import java.io.DataInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * RDB 反序列化器
 */
public class RdbDecoder {

    private final DataInputStream in;

    public RdbDecoder(InputStream in) {
        this.in = new DataInputStream(in);
    }

    /**
     * 读取一个字节 (0-255)
     */
    public int readByte() throws IOException {
        return in.readUnsignedByte();
    }

    public byte[] readBytes(int len) throws IOException {
        byte[] bytes = new byte[len];
        in.readFully(bytes);
        return bytes;
    }

    /**
     * 读取 RDB 长度编码
     */
    public long readLength() throws IOException {
        int b = in.readUnsignedByte();
        int type = (b & 0xC0) >> 6;

        if (type == 0) {
            return b & 0x3F;
        } else if (type == 1) {
            int next = in.readUnsignedByte();
            return ((long) (b & 0x3F) << 8) | next;
        } else if (b == 0x80) {
            return in.readInt() & 0xFFFFFFFFL;
        } else {
            // 11xxxxxx 等特殊编码不支持
            throw new IOException("Unsupported RDB length encoding: 0x" + Integer.toHexString(b));
        }
    }

    public String readString() throws IOException {
        long len = readLength();
        if (len > Integer.MAX_VALUE) {
            throw new IOException("String too long: " + len);
        }
        return new String(readBytes((int) len), StandardCharsets.UTF_8);
    }

    public RedisList readList() throws IOException {
        long size = readLength();
        RedisList list = new RedisList();
        for (long i = 0; i < size; i++) {
            list.rpush(readString());
        }
        return list;
    }

    public RedisHash readHash() throws IOException {
        long size = readLength();
        RedisHash hash = new RedisHash();
        for (long i = 0; i < size; i++) {
            String field = readString();
            hash.put(field, readString());
        }
        return hash;
    }

    public long readLong() throws IOException {
        return in.readLong();
    }

    public int readInt() throws IOException {
        return in.readInt();
    }
}
