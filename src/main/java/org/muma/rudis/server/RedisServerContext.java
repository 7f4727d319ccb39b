package org.muma.rudis.server;

import lombok.Getter;
import org.muma.rudis.aof.AofLoader;
import org.muma.rudis.aof.AofManager;
import org.muma.rudis.command.CommandDispatcher;
import org.muma.rudis.config.RudisConfig;
import org.muma.rudis.rdb.RdbLoader;
import org.muma.rudis.rdb.RdbManager;
import org.muma.rudis.store.impl.MemoryStorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * 服务器上下文
 * 负责组装各个模块，管理生命周期。
 */
public class RedisServerContext {

    private static final Logger log = LoggerFactory.getLogger(RedisServerContext.class);

    private final RudisConfig config;
    @Getter
    private final MemoryStorageEngine storage;
    private final AofManager aofManager;
    private final RdbManager rdbManager;
    @Getter
    private final CommandDispatcher dispatcher;

    private volatile boolean stopped;

    public RedisServerContext(RudisConfig config) {
        this.config = config;
        this.storage = new MemoryStorageEngine();
        this.aofManager = new AofManager(config);
        this.rdbManager = new RdbManager(config, storage);
        this.dispatcher = new CommandDispatcher(storage);
    }

    /**
     * 核心初始化流程
     * 顺序：快照加载 -> AOF 重放 -> 打开 AOF 追加 -> 启动后台任务
     * <p>
     * 加载阶段存储上还没有挂 AofManager，重放的记录不会被再次写回 AOF。
     */
    public void init() throws IOException {
        // Step 1: 快照 (头部不合法直接抛出，启动失败)
        if (config.isRdbEnabled()) {
            long start = System.currentTimeMillis();
            int loaded = new RdbLoader(storage).loadInto(config.getRdbPath());
            log.info("RDB loaded {} keys in {} ms", loaded, System.currentTimeMillis() - start);
        }

        // Step 2: AOF 重放
        if (config.isAppendOnly()) {
            long start = System.currentTimeMillis();
            int applied = new AofLoader(storage).load(config.getAofPath());
            log.info("AOF replayed {} commands in {} ms", applied, System.currentTimeMillis() - start);
        }

        // Step 3: 之后的写操作开始进入 AOF
        aofManager.init();
        storage.setAofManager(aofManager);

        // Step 4: 后台任务
        storage.startActiveExpire(config.getExpireIntervalMillis());
        rdbManager.init();
    }

    /**
     * 停止后台任务，AOF 最后一次刷写，RDB 最后一次快照
     */
    public synchronized void shutdown() {
        if (stopped) return;
        stopped = true;

        log.info("Shutting down persistence...");
        storage.shutdown();
        aofManager.shutdown();
        rdbManager.shutdown();
    }
}
