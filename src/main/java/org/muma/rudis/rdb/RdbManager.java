package org.muma.rudis.rdb;

import org.muma.rudis.config.RudisConfig;
import org.muma.rudis.store.StorageEngine;
import org.muma.rudis.utils.ThreadUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 定时快照：每 save_interval 秒用一份新 dump 覆盖快照文件
 */
public class RdbManager {

    private static final Logger log = LoggerFactory.getLogger(RdbManager.class);

    private final boolean enabled;
    private final Path file;
    private final long saveIntervalSeconds;
    private final RdbSaver saver;
    private ScheduledExecutorService cronExecutor;

    public RdbManager(RudisConfig config, StorageEngine storage) {
        this(config.isRdbEnabled(), config.getRdbPath(), config.getRdbSaveIntervalSeconds(), storage);
    }

    public RdbManager(boolean enabled, Path file, long saveIntervalSeconds, StorageEngine storage) {
        this.enabled = enabled;
        this.file = file;
        this.saveIntervalSeconds = saveIntervalSeconds;
        this.saver = new RdbSaver(storage);
    }

    public void init() {
        if (!enabled) return;

        cronExecutor = ThreadUtils.newScheduler("RDB-Cron");
        cronExecutor.scheduleAtFixedRate(this::triggerSave, saveIntervalSeconds, saveIntervalSeconds, TimeUnit.SECONDS);
        log.info("RDB save scheduled every {} s to {}", saveIntervalSeconds, file.toAbsolutePath());
    }

    /**
     * 同步保存，失败只记日志 (下一轮会重试)
     */
    public boolean triggerSave() {
        try {
            saver.save(file);
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("RDB save failed", e);
            return false;
        }
    }

    /**
     * 停止定时任务并做最后一次保存
     */
    public void shutdown() {
        if (cronExecutor == null) return;
        cronExecutor.shutdownNow();
        cronExecutor = null;
        if (triggerSave()) {
            log.info("Final RDB snapshot written to {}", file.toAbsolutePath());
        }
    }
}
