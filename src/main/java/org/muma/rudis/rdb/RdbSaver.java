package org.muma.rudis.rdb;

import org.muma.rudis.common.RedisData;
import org.muma.rudis.common.RedisHash;
import org.muma.rudis.common.RedisList;
import org.muma.rudis.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;

public class RdbSaver {

    private static final Logger log = LoggerFactory.getLogger(RdbSaver.class);

    private final StorageEngine storage;

    public RdbSaver(StorageEngine storage) {
        this.storage = storage;
    }

    /**
     * 序列化整个存储。序列化期间持有存储锁，得到一个一致的快照。
     */
    public static byte[] dump(StorageEngine storage) {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        RdbEncoder encoder = new RdbEncoder(bos);
        try {
            // 1. Header: REDIS0002
            encoder.writeBytes(RdbConstants.MAGIC);
            encoder.writeBytes(RdbConstants.VERSION.getBytes(StandardCharsets.US_ASCII));

            // 2. Select DB 0
            encoder.writeByte(RdbConstants.OP_SELECTDB);
            encoder.writeInt(0);

            // 3. Key-Value
            synchronized (storage.getLock()) {
                long now = System.currentTimeMillis();
                for (Map.Entry<String, RedisData<?>> entry : storage.entries().entrySet()) {
                    RedisData<?> data = entry.getValue();
                    if (data.isExpired(now)) continue;

                    if (data.getExpireAt() != -1) {
                        encoder.writeByte(RdbConstants.OP_EXPIRETIME_MS);
                        encoder.writeLong(data.getExpireAt());
                    }
                    encoder.writeByte(RdbType.of(data.getType()));
                    encoder.writeString(entry.getKey());
                    writeValue(encoder, data);
                }
            }

            // 4. EOF
            encoder.writeByte(RdbConstants.OP_EOF);
        } catch (IOException e) {
            // ByteArrayOutputStream 不会抛 IO 异常；只有长度越界会走到这里
            throw new IllegalStateException("RDB dump failed", e);
        }
        return bos.toByteArray();
    }

    /**
     * 阻塞式保存：先写临时文件，再原子替换
     */
    public void save(Path file) throws IOException {
        long start = System.currentTimeMillis();
        byte[] bytes = dump(storage);

        Path target = file.toAbsolutePath();
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = target.resolveSibling("temp-" + target.getFileName());
        Files.write(temp, bytes);
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

        log.debug("DB saved on disk. Size: {}, Duration: {} ms", bytes.length, System.currentTimeMillis() - start);
    }

    private static void writeValue(RdbEncoder encoder, RedisData<?> data) throws IOException {
        switch (data.getType()) {
            case STRING -> encoder.writeString(data.getValue(String.class));
            case LIST -> encoder.writeList(data.getValue(RedisList.class));
            case HASH -> encoder.writeHash(data.getValue(RedisHash.class));
        }
    }
}
