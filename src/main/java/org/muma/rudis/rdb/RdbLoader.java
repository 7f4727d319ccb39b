package org.muma.rudis.rdb;

import org.muma.rudis.common.RedisData;
import org.muma.rudis.common.RedisDataType;
import org.muma.rudis.common.RedisHash;
import org.muma.rudis.common.RedisList;
import org.muma.rudis.store.StorageEngine;
import org.muma.rudis.store.impl.MemoryStorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * RDB 加载器
 * <p>
 * 头部不合法直接失败；已过期的条目跳过；List/Hash 遇到同类型的已有 key 时合并而不是覆盖。
 */
public class RdbLoader {

    private static final Logger log = LoggerFactory.getLogger(RdbLoader.class);
    private final StorageEngine storage;

    public RdbLoader(StorageEngine storage) {
        this.storage = storage;
    }

    /**
     * 加载到一个新建的存储
     */
    public static MemoryStorageEngine load(Path file) throws IOException {
        MemoryStorageEngine storage = new MemoryStorageEngine();
        new RdbLoader(storage).loadInto(file);
        return storage;
    }

    /**
     * @return 装入的 key 数；文件不存在时为 0
     */
    public int loadInto(Path file) throws IOException {
        if (!Files.exists(file)) {
            log.info("No RDB file at {}, skipping load.", file);
            return 0;
        }

        log.info("Loading RDB file: {}", file);
        long start = System.currentTimeMillis();
        int count;
        try (InputStream is = new BufferedInputStream(Files.newInputStream(file))) {
            count = load(is);
        }
        log.info("RDB loaded. Keys: {}, Duration: {} ms", count, System.currentTimeMillis() - start);
        return count;
    }

    public int load(InputStream is) throws IOException {
        RdbDecoder decoder = new RdbDecoder(is);

        // 1. Magic "REDIS"
        byte[] magic = decoder.readBytes(RdbConstants.MAGIC.length);
        if (!Arrays.equals(magic, RdbConstants.MAGIC)) {
            throw new IOException("Invalid RDB file: bad magic");
        }

        // 2. Version
        String version = new String(decoder.readBytes(4), StandardCharsets.US_ASCII);
        if (!RdbConstants.VERSION.equals(version)) {
            throw new IOException("Unsupported RDB version: " + version);
        }

        // 3. Opcode 循环
        int count = 0;
        long expireAt = -1;
        long now = System.currentTimeMillis();
        while (true) {
            int type = decoder.readByte();

            if (type == RdbConstants.OP_EOF) {
                break;
            } else if (type == RdbConstants.OP_SELECTDB) {
                decoder.readInt(); // 单库，忽略
                continue;
            } else if (type == RdbConstants.OP_EXPIRETIME_MS) {
                expireAt = decoder.readLong();
                continue;
            }

            String key = decoder.readString();
            RedisData<?> data = readValue(decoder, type);
            data.setExpireAt(expireAt);
            expireAt = -1;

            if (data.isExpired(now)) {
                continue;
            }
            merge(key, data);
            count++;
        }
        return count;
    }

    private void merge(String key, RedisData<?> data) {
        synchronized (storage.getLock()) {
            RedisData<?> existing = storage.get(key);
            if (existing != null && existing.getType() == data.getType()) {
                if (data.getType() == RedisDataType.LIST) {
                    existing.getValue(RedisList.class).addAll(data.getValue(RedisList.class));
                    return;
                }
                if (data.getType() == RedisDataType.HASH) {
                    existing.getValue(RedisHash.class).putAll(data.getValue(RedisHash.class));
                    return;
                }
            }
            storage.restore(key, data);
        }
    }

    private RedisData<?> readValue(RdbDecoder decoder, int type) throws IOException {
        return switch (type) {
            case RdbType.STRING -> RedisData.ofString(decoder.readString());
            case RdbType.LIST -> RedisData.ofList(decoder.readList());
            case RdbType.HASH -> RedisData.ofHash(decoder.readHash());
            default -> throw new IOException("Unknown value type: " + type);
        };
    }
}
