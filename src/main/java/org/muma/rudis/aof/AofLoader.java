package org.muma.rudis.aof;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.muma.rudis.protocol.RedisArray;
import org.muma.rudis.protocol.RedisMessage;
import org.muma.rudis.protocol.RespCodec;
import org.muma.rudis.protocol.RespError;
import org.muma.rudis.protocol.RespException;
import org.muma.rudis.store.StorageEngine;
import org.muma.rudis.store.impl.MemoryStorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * AOF 加载器 (Recovery)
 * <p>
 * 启动时把 AOF 文件逐条解码并交给 {@link AofCommandApplier}。
 * 单条记录损坏只跳过并告警；文件末尾不完整的记录 (写到一半宕机) 被忽略。
 */
public class AofLoader {

    private static final Logger log = LoggerFactory.getLogger(AofLoader.class);

    private final StorageEngine storage;
    private final AofCommandApplier applier;

    public AofLoader(StorageEngine storage) {
        this.storage = storage;
        this.applier = new AofCommandApplier(storage);
    }

    /**
     * 重放到一个新建的存储
     */
    public static MemoryStorageEngine replay(Path file) throws IOException {
        MemoryStorageEngine storage = new MemoryStorageEngine();
        new AofLoader(storage).load(file);
        return storage;
    }

    /**
     * @return 成功应用的记录数；文件不存在时为 0
     * @throws IOException 文件无法读取
     */
    public int load(Path file) throws IOException {
        if (!Files.exists(file)) {
            log.info("No AOF file at {}, skipping load.", file);
            return 0;
        }

        long fileSize = Files.size(file);
        log.info("Start loading AOF file: {} (Size: {} bytes)", file, fileSize);
        long startTime = System.currentTimeMillis();

        // 一次性读入内存，文件很大时应改为分块读取
        byte[] bytes = Files.readAllBytes(file);
        ByteBuf buf = Unpooled.wrappedBuffer(bytes);

        int applied = 0;
        int skipped = 0;
        long lastLogTime = startTime;

        while (buf.isReadable()) {
            int start = buf.readerIndex();
            try {
                RespCodec.check(buf);
            } catch (RespException e) {
                if (e.getError() == RespError.NO_MORE_DATA) {
                    log.warn("AOF ends with an incomplete record at offset {}, {} bytes ignored",
                            start, buf.writerIndex() - start);
                    break;
                }
                log.warn("Skipping malformed AOF record at offset {}: {}", start, e.getMessage());
                skipped++;
                resync(buf, start + 1);
                continue;
            }

            buf.readerIndex(start);
            RedisMessage msg;
            try {
                msg = RespCodec.parse(buf);
            } catch (RespException e) {
                // 帧结构合法但内容无法解码 (如非 UTF-8 的简单字符串)
                log.warn("Skipping undecodable AOF record at offset {}: {}", start, e.getMessage());
                skipped++;
                resync(buf, start + 1);
                continue;
            }
            if (!(msg instanceof RedisArray command) || command.size() == 0) {
                log.warn("Skipping non-command AOF record at offset {}", start);
                skipped++;
                continue;
            }

            try {
                if (applier.apply(command)) {
                    applied++;
                } else {
                    skipped++;
                }
            } catch (RuntimeException e) {
                log.warn("Failed to replay AOF record at offset {}: {}", start, e.getMessage());
                skipped++;
            }

            // 大文件加载时每 2 秒打印一次进度
            if (applied % 100_000 == 0) {
                long now = System.currentTimeMillis();
                if (now - lastLogTime > 2000) {
                    log.info("AOF loading progress: {} commands processed...", applied);
                    lastLogTime = now;
                }
            }
        }

        long duration = System.currentTimeMillis() - startTime;
        log.info("AOF file {} loaded. Applied: {}, skipped: {}, keys: {}, duration: {} ms",
                file, applied, skipped, storage.size(), duration);
        return applied;
    }

    /**
     * 跳到下一个位于行首的 '*'，找不到则跳到末尾
     */
    private static void resync(ByteBuf buf, int from) {
        for (int i = from; i < buf.writerIndex(); i++) {
            if (buf.getByte(i) == '*' && buf.getByte(i - 1) == '\n') {
                buf.readerIndex(i);
                return;
            }
        }
        buf.readerIndex(buf.writerIndex());
    }
}
