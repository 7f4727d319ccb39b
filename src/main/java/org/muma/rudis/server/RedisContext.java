package org.muma.rudis.server;

import io.netty.channel.ChannelHandlerContext;
import lombok.AccessLevel;
import lombok.Getter;
import org.muma.rudis.protocol.RedisMessage;

/**
 * 命令执行上下文
 * 每个连接一个实例，封装 Netty 上下文与订阅状态。
 */
@Getter
public class RedisContext {

    private final ChannelHandlerContext nettyCtx;
    private final PubSubSubscriber subscriber;

    // 本条命令挂起的阻塞请求，由连接处理器取走
    @Getter(AccessLevel.NONE)
    private volatile BlockingContext blocking;

    public RedisContext(ChannelHandlerContext nettyCtx) {
        this.nettyCtx = nettyCtx;
        this.subscriber = new PubSubSubscriber(nettyCtx);
    }

    /**
     * 是否处于订阅模式 (至少订阅了一个频道或模式)
     */
    public boolean isSubscribed() {
        return subscriber.subscriptionCount() > 0;
    }

    /**
     * 直接写出一条消息 (不 flush)，用于一条命令需要回复多帧的场景
     */
    public void write(RedisMessage message) {
        nettyCtx.write(message);
    }

    public void flush() {
        nettyCtx.flush();
    }

    public void setBlocking(BlockingContext blocking) {
        this.blocking = blocking;
    }

    /**
     * 取走并清除挂起的阻塞请求，没有时返回 null
     */
    public BlockingContext takeBlocking() {
        BlockingContext b = blocking;
        blocking = null;
        return b;
    }
}
