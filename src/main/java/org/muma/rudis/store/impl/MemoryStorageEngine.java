package org.muma.rudis.store.impl;

import org.muma.rudis.aof.AofManager;
import org.muma.rudis.common.RedisData;
import org.muma.rudis.common.RedisDataType;
import org.muma.rudis.common.RedisHash;
import org.muma.rudis.common.RedisList;
import org.muma.rudis.server.BlockingManager;
import org.muma.rudis.store.StorageEngine;
import org.muma.rudis.store.pubsub.BroadcastChannel;
import org.muma.rudis.store.pubsub.PubSubRegistry;
import org.muma.rudis.utils.ThreadUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

public class MemoryStorageEngine implements StorageEngine {

    private static final Logger log = LoggerFactory.getLogger(MemoryStorageEngine.class);

    // 全局监视器锁
    private final Object lock = new Object();

    // 1. 数据存储 (Key -> Data)
    private final Map<String, RedisData<?>> memoryDb = new ConcurrentHashMap<>();

    // 2. 过期时间存储 (Key -> ExpireAt)，清理任务只扫描带 TTL 的 key
    private final Map<String, Long> ttlMap = new ConcurrentHashMap<>();

    private final PubSubRegistry pubSub = new PubSubRegistry();
    private final BlockingManager blockingManager = new BlockingManager();

    // 为 null 时不记录 AOF (加载阶段、测试)
    private volatile AofManager aofManager;

    private ScheduledExecutorService cleanupExecutor;

    public void setAofManager(AofManager aofManager) {
        this.aofManager = aofManager;
    }

    /**
     * 启动主动过期任务
     */
    public void startActiveExpire(long intervalMillis) {
        synchronized (lock) {
            if (cleanupExecutor != null) return;
            cleanupExecutor = ThreadUtils.newScheduler("Rudis-Active-Expire");
            cleanupExecutor.scheduleAtFixedRate(this::runExpireCycle, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        }
        log.info("Active expire cycle started, interval {} ms", intervalMillis);
    }

    public void shutdown() {
        synchronized (lock) {
            if (cleanupExecutor != null) {
                cleanupExecutor.shutdownNow();
                cleanupExecutor = null;
            }
        }
        blockingManager.shutdown();
    }

    private void runExpireCycle() {
        try {
            activeExpireCycle();
        } catch (RuntimeException e) {
            // 定时任务抛异常会被取消，这里记录后继续
            log.error("Active expire cycle failed", e);
        }
    }

    @Override
    public int activeExpireCycle() {
        synchronized (lock) {
            if (ttlMap.isEmpty()) return 0;

            long now = System.currentTimeMillis();
            int expired = 0;
            Iterator<Map.Entry<String, Long>> iterator = ttlMap.entrySet().iterator();
            while (iterator.hasNext()) {
                Map.Entry<String, Long> entry = iterator.next();
                if (now >= entry.getValue()) {
                    memoryDb.remove(entry.getKey());
                    iterator.remove();
                    expired++;
                }
            }
            if (expired > 0) {
                log.debug("Active expire: removed {} keys", expired);
            }
            return expired;
        }
    }

    @Override
    public Object getLock() {
        return lock;
    }

    // ------------------------------------------------------------------ KV

    @Override
    public void set(String key, RedisData<?> data, long ttlMillis) {
        synchronized (lock) {
            data.setExpireAt(ttlMillis < 0 ? -1 : System.currentTimeMillis() + ttlMillis);
            put(key, data);
        }
    }

    @Override
    public void put(String key, RedisData<?> data) {
        synchronized (lock) {
            install(key, data);
            // 只有 String 通过 put 写入；集合类型走下面的专用方法
            if (data.getType() == RedisDataType.STRING) {
                String value = data.getValue(String.class);
                if (data.getExpireAt() == -1) {
                    propagate("SET", key, value);
                } else {
                    propagate("SET", key, value, "PXAT", String.valueOf(data.getExpireAt()));
                }
            }
        }
    }

    @Override
    public RedisData<?> get(String key) {
        synchronized (lock) {
            RedisData<?> data = memoryDb.get(key);
            if (data == null) return null;

            // 惰性删除
            if (data.isExpired()) {
                remove(key);
                return null;
            }
            return data;
        }
    }

    @Override
    public RedisData<?> getForUpdate(String key) {
        synchronized (lock) {
            return memoryDb.get(key);
        }
    }

    @Override
    public boolean exists(String key) {
        return get(key) != null;
    }

    @Override
    public boolean del(String key) {
        synchronized (lock) {
            if (get(key) == null) return false;
            remove(key);
            propagate("DEL", key);
            return true;
        }
    }

    @Override
    public void restore(String key, RedisData<?> data) {
        synchronized (lock) {
            install(key, data);
        }
    }

    @Override
    public Set<String> keys() {
        synchronized (lock) {
            return new HashSet<>(memoryDb.keySet());
        }
    }

    @Override
    public Map<String, RedisData<?>> entries() {
        return Collections.unmodifiableMap(memoryDb);
    }

    @Override
    public int size() {
        return memoryDb.size();
    }

    // ---------------------------------------------------------------- Hash

    @Override
    public int hset(String key, String field, String value) {
        synchronized (lock) {
            RedisHash hash = hashOrCreate(key);
            int added = hash.put(field, value);
            propagate("HSET", key, field, value);
            return added;
        }
    }

    @Override
    public int hdel(String key, String field) {
        synchronized (lock) {
            RedisData<?> data = get(key);
            if (data == null) return 0;

            RedisHash hash = data.getValue(RedisHash.class);
            int removed = hash.remove(field);
            if (removed > 0) {
                propagate("HDEL", key, field);
                if (hash.isEmpty()) remove(key);
            }
            return removed;
        }
    }

    // ---------------------------------------------------------------- List

    @Override
    public int lpush(String key, List<String> values) {
        synchronized (lock) {
            RedisList list = listOrCreate(key);
            values.forEach(list::lpush);
            int size = list.size();
            propagate("LPUSH", key, values);
            blockingManager.onPush(key, this);
            return size;
        }
    }

    @Override
    public int rpush(String key, List<String> values) {
        synchronized (lock) {
            RedisList list = listOrCreate(key);
            values.forEach(list::rpush);
            int size = list.size();
            propagate("RPUSH", key, values);
            blockingManager.onPush(key, this);
            return size;
        }
    }

    @Override
    public List<String> lpop(String key, int count) {
        return pop(key, count, true);
    }

    @Override
    public List<String> rpop(String key, int count) {
        return pop(key, count, false);
    }

    private List<String> pop(String key, int count, boolean left) {
        synchronized (lock) {
            List<String> popped = new ArrayList<>();
            RedisData<?> data = get(key);
            if (data == null) return popped;

            RedisList list = data.getValue(RedisList.class);
            while (popped.size() < count && !list.isEmpty()) {
                popped.add(left ? list.lpop() : list.rpop());
            }
            if (!popped.isEmpty()) {
                // 记录实际弹出的个数
                propagate(left ? "LPOP" : "RPOP", key, String.valueOf(popped.size()));
            }
            if (list.isEmpty()) remove(key);
            return popped;
        }
    }

    @Override
    public void lset(String key, long index, String value) {
        synchronized (lock) {
            RedisData<?> data = get(key);
            if (data == null) {
                throw new IllegalArgumentException("no such key");
            }
            data.getValue(RedisList.class).set(index, value);
            propagate("LSET", key, String.valueOf(index), value);
        }
    }

    @Override
    public int lrem(String key, long count, String value) {
        synchronized (lock) {
            RedisData<?> data = get(key);
            if (data == null) return 0;

            RedisList list = data.getValue(RedisList.class);
            int removed = list.remove(count, value);
            if (removed > 0) {
                // 记录实际删除的个数，方向与原命令一致
                long effective = count == 0 ? 0 : (count > 0 ? removed : -removed);
                propagate("LREM", key, String.valueOf(effective), value);
                if (list.isEmpty()) remove(key);
            }
            return removed;
        }
    }

    @Override
    public void ltrim(String key, long start, long stop) {
        synchronized (lock) {
            RedisData<?> data = get(key);
            if (data == null) return;

            RedisList list = data.getValue(RedisList.class);
            int size = list.size();
            long from = start < 0 ? Math.max(0, size + start) : start;
            long to = stop < 0 ? size + stop : Math.min(stop, size - 1);

            list.trim(start, stop);
            // 记录归一化后的非负下标；空区间统一记为 1 0
            if (from > to || from >= size) {
                propagate("LTRIM", key, "1", "0");
            } else {
                propagate("LTRIM", key, String.valueOf(from), String.valueOf(to));
            }
            if (list.isEmpty()) remove(key);
        }
    }

    // ------------------------------------------------------------- Pub/Sub

    @Override
    public BroadcastChannel subscribe(String channel) {
        return pubSub.subscribe(channel);
    }

    @Override
    public BroadcastChannel psubscribe(String pattern) {
        return pubSub.psubscribe(pattern);
    }

    @Override
    public BroadcastChannel findChannel(String channel) {
        return pubSub.findChannel(channel);
    }

    @Override
    public BroadcastChannel findPattern(String pattern) {
        return pubSub.findPattern(pattern);
    }

    @Override
    public int publish(String channel, String message) {
        return pubSub.publish(channel, message);
    }

    @Override
    public BlockingManager getBlockingManager() {
        return blockingManager;
    }

    // ------------------------------------------------------------- helpers

    private void install(String key, RedisData<?> data) {
        memoryDb.put(key, data);
        // 可能由有过期变为无过期
        if (data.getExpireAt() != -1) {
            ttlMap.put(key, data.getExpireAt());
        } else {
            ttlMap.remove(key);
        }
    }

    private void remove(String key) {
        ttlMap.remove(key);
        memoryDb.remove(key);
    }

    private RedisHash hashOrCreate(String key) {
        RedisData<?> data = get(key);
        if (data == null) {
            RedisHash hash = new RedisHash();
            install(key, RedisData.ofHash(hash));
            return hash;
        }
        return data.getValue(RedisHash.class);
    }

    private RedisList listOrCreate(String key) {
        RedisData<?> data = get(key);
        if (data == null) {
            RedisList list = new RedisList();
            install(key, RedisData.ofList(list));
            return list;
        }
        return data.getValue(RedisList.class);
    }

    private void propagate(String command, String key, List<String> values) {
        String[] args = new String[values.size() + 1];
        args[0] = key;
        for (int i = 0; i < values.size(); i++) {
            args[i + 1] = values.get(i);
        }
        propagate(command, args);
    }

    private void propagate(String command, String... args) {
        AofManager aof = this.aofManager;
        if (aof != null) {
            aof.propagate(command, args);
        }
    }
}
