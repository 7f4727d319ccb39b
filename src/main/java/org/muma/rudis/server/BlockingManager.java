package org.muma.rudis.server;

import io.netty.channel.ChannelHandlerContext;
import org.muma.rudis.protocol.BulkString;
import org.muma.rudis.protocol.RedisArray;
import org.muma.rudis.protocol.RedisMessage;
import org.muma.rudis.store.StorageEngine;
import org.muma.rudis.utils.ThreadUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 全局阻塞请求管理器
 * 负责 BLPOP / BRPOP 的挂起、唤醒与超时。
 * <p>
 * 唤醒时的弹出走 {@link StorageEngine#lpop}/{@link StorageEngine#rpop}，所以会像普通 POP 一样写入 AOF。
 * 回复写出后调用 {@link BlockingContext#complete()}，连接据此恢复处理后续命令。
 */
public class BlockingManager {

    private static final Logger log = LoggerFactory.getLogger(BlockingManager.class);

    private static final long TIMEOUT_CHECK_INTERVAL_MS = 100;

    // Key -> 等待该 Key 的客户端，按到达顺序 (FIFO)
    private final Map<String, List<BlockingContext>> waitingClients = new ConcurrentHashMap<>();

    // 超时扫描线程，第一次有客户端阻塞时才启动
    private ScheduledExecutorService scheduler;

    /**
     * 注册阻塞请求
     *
     * @param timeoutSec 0 表示永久等待
     */
    public BlockingContext addWait(ChannelHandlerContext ctx, List<String> keys, double timeoutSec, boolean leftPop) {
        long expireAt = deadline(System.currentTimeMillis(), timeoutSec);
        BlockingContext context = new BlockingContext(ctx, keys, expireAt, leftPop);

        for (String key : keys) {
            waitingClients.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(context);
        }
        ensureScheduler();

        log.debug("Client blocked on keys: {}", keys);
        return context;
    }

    /**
     * 超时截止时间，超出 long 范围时按永久等待处理
     */
    static long deadline(long now, double timeoutSec) {
        if (timeoutSec == 0) return Long.MAX_VALUE;
        double millis = timeoutSec * 1000;
        if (millis >= Long.MAX_VALUE - now) return Long.MAX_VALUE;
        return now + (long) millis;
    }

    /**
     * 有数据推入 key 时调用 (调用方持有存储锁)。
     * 按 FIFO 依次服务等待者，直到列表被取空或没有等待者。
     */
    public void onPush(String key, StorageEngine storage) {
        List<BlockingContext> clients = waitingClients.get(key);
        if (clients == null || clients.isEmpty()) return;

        Iterator<BlockingContext> it = clients.iterator();
        while (it.hasNext()) {
            BlockingContext client = it.next();

            // 断开的连接直接丢弃
            if (!client.isConnected()) {
                if (client.tryFinish()) {
                    log.debug("Dropping disconnected blocked client on key {}", key);
                }
                removeClient(client);
                continue;
            }
            // 已被超时或其他 key 处理
            if (!client.tryFinish()) {
                removeClient(client);
                continue;
            }

            List<String> popped = client.isLeftPop() ? storage.lpop(key, 1) : storage.rpop(key, 1);
            removeClient(client);
            if (popped.isEmpty()) {
                // 列表已空：不应发生 (调用方刚推入数据)，回送 nil 避免客户端永久挂起
                client.getCtx().writeAndFlush(RedisArray.NULL);
                client.complete();
                return;
            }

            client.getCtx().writeAndFlush(new RedisArray(new RedisMessage[]{
                    new BulkString(key),
                    new BulkString(popped.get(0))
            }));
            client.complete();
            log.debug("Client unblocked on key: {}", key);

            if (storage.get(key) == null) {
                return;
            }
        }
    }

    /**
     * 连接断开时清理
     */
    public void cancel(ChannelHandlerContext ctx) {
        waitingClients.values().forEach(list -> list.stream()
                .filter(c -> c.getCtx() == ctx)
                .forEach(c -> {
                    c.tryFinish();
                    removeClient(c);
                }));
    }

    public int waitingCount(String key) {
        List<BlockingContext> list = waitingClients.get(key);
        return list == null ? 0 : list.size();
    }

    void checkTimeouts() {
        long now = System.currentTimeMillis();
        waitingClients.values().forEach(list -> list.forEach(client -> {
            if (now >= client.getExpireAt() && client.tryFinish()) {
                if (client.isConnected()) {
                    client.getCtx().writeAndFlush(RedisArray.NULL);
                    client.complete();
                }
                removeClient(client);
            }
        }));
    }

    /**
     * 从所有 key 的等待队列中移除该客户端
     */
    private void removeClient(BlockingContext client) {
        for (String k : client.getKeys()) {
            waitingClients.computeIfPresent(k, (key, list) -> {
                list.remove(client);
                return list.isEmpty() ? null : list;
            });
        }
    }

    private synchronized void ensureScheduler() {
        if (scheduler == null) {
            scheduler = ThreadUtils.newScheduler("Rudis-Blocking-Timeout");
            scheduler.scheduleAtFixedRate(this::runTimeoutCheck,
                    TIMEOUT_CHECK_INTERVAL_MS, TIMEOUT_CHECK_INTERVAL_MS, TimeUnit.MILLISECONDS);
        }
    }

    private void runTimeoutCheck() {
        try {
            checkTimeouts();
        } catch (RuntimeException e) {
            log.error("Blocking timeout check failed", e);
        }
    }

    public synchronized void shutdown() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }
}
