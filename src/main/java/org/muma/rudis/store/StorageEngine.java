package org.muma.rudis.store;

import org.muma.rudis.common.RedisData;
import org.muma.rudis.server.BlockingManager;
import org.muma.rudis.store.pubsub.BroadcastChannel;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 存储引擎
 * <p>
 * 所有数据操作都在 {@link #getLock()} 这一把监视器锁下进行；命令层在整条命令执行期间持有它。
 * 写操作在同一临界区内把"实际生效的效果"追加到 AOF，因此 AOF 顺序与内存修改顺序一致。
 */
public interface StorageEngine {

    /**
     * 全局锁对象
     */
    Object getLock();

    // --- 基础 KV ---

    /**
     * 写入并替换任意旧值。
     *
     * @param ttlMillis 小于 0 表示永不过期，否则过期时间 = now + ttl
     */
    void set(String key, RedisData<?> data, long ttlMillis);

    /**
     * 写入，保留 data 自带的绝对过期时间
     */
    void put(String key, RedisData<?> data);

    /**
     * 读取；已过期的条目会被惰性删除并返回 null
     */
    RedisData<?> get(String key);

    /**
     * 取可变引用，不做惰性删除也不记 AOF；调用方自行负责持久化语义
     */
    RedisData<?> getForUpdate(String key);

    boolean exists(String key);

    /**
     * @return true 仅当存在未过期的条目并被删除
     */
    boolean del(String key);

    /**
     * 加载器专用：原样装入，不记 AOF
     */
    void restore(String key, RedisData<?> data);

    Set<String> keys();

    /**
     * 原始视图，调用方必须持有 {@link #getLock()}
     */
    Map<String, RedisData<?>> entries();

    int size();

    // --- Hash ---

    int hset(String key, String field, String value);

    int hdel(String key, String field);

    // --- List ---

    int lpush(String key, List<String> values);

    int rpush(String key, List<String> values);

    List<String> lpop(String key, int count);

    List<String> rpop(String key, int count);

    void lset(String key, long index, String value);

    int lrem(String key, long count, String value);

    void ltrim(String key, long start, long stop);

    // --- Pub/Sub ---

    BroadcastChannel subscribe(String channel);

    BroadcastChannel psubscribe(String pattern);

    BroadcastChannel findChannel(String channel);

    BroadcastChannel findPattern(String pattern);

    int publish(String channel, String message);

    // --- 过期与阻塞 ---

    /**
     * 全量扫描并删除已过期的 key
     *
     * @return 本轮删除数量
     */
    int activeExpireCycle();

    BlockingManager getBlockingManager();
}
