package org.muma.rudis.aof;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import lombok.Getter;
import org.muma.rudis.config.RudisConfig;
import org.muma.rudis.protocol.RedisArray;
import org.muma.rudis.protocol.RespCodec;
import org.muma.rudis.utils.ThreadUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * AOF 管理器
 * <p>
 * 写路径分两段：
 * 1. 存储层在持有存储锁时调用 {@link #propagate}，把编码后的记录追加到内存缓冲 (由 bufferLock 保护)。
 * 2. 后台线程 (AOF-Flush) 每隔 appendflush 秒把缓冲写入文件并清空。只 write，不 fsync。
 * <p>
 * 写文件失败时缓冲保留，下一轮重试。
 */
public class AofManager {

    private static final Logger log = LoggerFactory.getLogger(AofManager.class);

    @Getter
    private final boolean enabled;
    @Getter
    private final Path file;
    private final long flushIntervalSeconds;

    private final Object bufferLock = new Object();
    private final ByteBuf buffer = Unpooled.buffer(4096);

    private FileChannel fileChannel;
    private ScheduledExecutorService flushExecutor;

    public AofManager(RudisConfig config) {
        this(config.isAppendOnly(), config.getAofPath(), config.getAppendFlushSeconds());
    }

    public AofManager(boolean enabled, Path file, long flushIntervalSeconds) {
        this.enabled = enabled;
        this.file = file;
        this.flushIntervalSeconds = flushIntervalSeconds;
    }

    /**
     * 打开文件并启动定时刷写。必须在 AOF 重放之后调用。
     */
    public void init() throws IOException {
        if (!enabled) return;

        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        synchronized (bufferLock) {
            this.fileChannel = FileChannel.open(file,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        }
        log.info("Opened AOF file: {}", file.toAbsolutePath());

        flushExecutor = ThreadUtils.newScheduler("AOF-Flush");
        flushExecutor.scheduleAtFixedRate(this::flushQuietly, flushIntervalSeconds, flushIntervalSeconds, TimeUnit.SECONDS);
    }

    /**
     * 追加一条命令记录: *n $len name $len arg ...
     */
    public void propagate(String command, String... args) {
        if (!enabled) return;

        String[] parts = new String[args.length + 1];
        parts[0] = command;
        System.arraycopy(args, 0, parts, 1, args.length);
        propagate(RedisArray.ofBulk(parts));
    }

    public void propagate(RedisArray command) {
        if (!enabled) return;

        synchronized (bufferLock) {
            RespCodec.serialize(command, buffer);
        }
    }

    /**
     * 把缓冲写入文件。部分写入时只丢弃已写出的字节，剩余部分留到下次。
     */
    public void flush() throws IOException {
        synchronized (bufferLock) {
            if (!buffer.isReadable() || fileChannel == null) return;

            ByteBuffer nio = buffer.nioBuffer();
            int written = 0;
            try {
                while (nio.hasRemaining()) {
                    written += fileChannel.write(nio);
                }
            } finally {
                buffer.skipBytes(written);
                buffer.discardReadBytes();
            }
        }
    }

    /**
     * 当前缓冲中尚未落盘的字节数
     */
    public int pendingBytes() {
        synchronized (bufferLock) {
            return buffer.readableBytes();
        }
    }

    private void flushQuietly() {
        try {
            flush();
        } catch (IOException e) {
            log.error("AOF flush failed, {} bytes kept for retry", pendingBytes(), e);
        }
    }

    /**
     * 停止定时任务，做最后一次刷写并关闭文件
     */
    public void shutdown() {
        if (flushExecutor != null) {
            flushExecutor.shutdownNow();
            flushExecutor = null;
        }
        synchronized (bufferLock) {
            if (fileChannel == null) return;
            try {
                flush();
            } catch (IOException e) {
                log.error("Final AOF flush failed, {} bytes lost", buffer.readableBytes(), e);
            }
            try {
                fileChannel.close();
            } catch (IOException e) {
                log.error("Error closing AOF channel", e);
            } finally {
                fileChannel = null;
            }
        }
        log.info("AOF manager stopped.");
    }
}
