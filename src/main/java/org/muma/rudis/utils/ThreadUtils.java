package org.muma.rudis.utils;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 线程工厂与后台定时任务工具
 */
public final class ThreadUtils {

    private ThreadUtils() {
    }

    public static ThreadFactory namedThreadFactory(String prefix) {
        return new RudisThreadFactory(prefix);
    }

    /**
     * 单线程定时器，线程为守护线程，名字形如 prefix-1
     */
    public static ScheduledExecutorService newScheduler(String prefix) {
        return Executors.newSingleThreadScheduledExecutor(namedThreadFactory(prefix));
    }

    private static class RudisThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger(1);

        RudisThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + counter.getAndIncrement());
            t.setDaemon(true); // 后台线程，不阻止 JVM 退出
            return t;
        }
    }
}
