package org.muma.rudis.server;

import io.netty.channel.ChannelHandlerContext;
import lombok.Getter;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 阻塞上下文
 * 记录客户端连接、监听的 Keys、超时时间以及弹出方向。
 * <p>
 * done 状态位保证"超时"和"唤醒"只有一个生效，客户端只收到一次响应。
 */
@Getter
public class BlockingContext {

    private final ChannelHandlerContext ctx;
    private final List<String> keys;
    // Long.MAX_VALUE 表示永久等待
    private final long expireAt;
    private final boolean leftPop;

    @Getter(lombok.AccessLevel.NONE)
    private final AtomicBoolean done = new AtomicBoolean(false);

    // 回复写出后的回调 (连接恢复处理后续命令)
    @Getter(lombok.AccessLevel.NONE)
    private Runnable completionHook;
    @Getter(lombok.AccessLevel.NONE)
    private boolean completed;

    public BlockingContext(ChannelHandlerContext ctx, List<String> keys, long expireAt, boolean leftPop) {
        this.ctx = ctx;
        this.keys = keys;
        this.expireAt = expireAt;
        this.leftPop = leftPop;
    }

    /**
     * CAS 抢占完成状态
     *
     * @return true 表示第一次完成
     */
    public boolean tryFinish() {
        return done.compareAndSet(false, true);
    }

    public boolean isDone() {
        return done.get();
    }

    public boolean isConnected() {
        return ctx != null && ctx.channel() != null && ctx.channel().isActive();
    }

    /**
     * 注册回调；阻塞回复已写出时立即执行
     */
    public void onComplete(Runnable hook) {
        boolean runNow;
        synchronized (this) {
            runNow = completed;
            if (!runNow) {
                completionHook = hook;
            }
        }
        if (runNow) {
            hook.run();
        }
    }

    /**
     * 阻塞回复 (数据或 nil) 已写出，只生效一次
     */
    public void complete() {
        Runnable hook;
        synchronized (this) {
            if (completed) return;
            completed = true;
            hook = completionHook;
            completionHook = null;
        }
        if (hook != null) {
            hook.run();
        }
    }
}
