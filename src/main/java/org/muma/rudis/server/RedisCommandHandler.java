package org.muma.rudis.server;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import org.muma.rudis.command.CommandDispatcher;
import org.muma.rudis.protocol.*;
import org.muma.rudis.store.StorageEngine;
import org.muma.rudis.store.pubsub.BroadcastChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * 连接处理器，每个连接一个实例
 * <p>
 * 同一连接上的命令按到达顺序在 IO 线程上依次执行；跨连接的顺序由存储锁决定。
 * BLPOP/BRPOP 挂起期间连接停止读取，已解码的后续命令排队，等阻塞回复写出后再执行。
 */
public class RedisCommandHandler extends SimpleChannelInboundHandler<RedisMessage> {

    private static final Logger log = LoggerFactory.getLogger(RedisCommandHandler.class);

    private static final AtomicInteger connectedClients = new AtomicInteger();

    private final CommandDispatcher dispatcher;
    private final StorageEngine storage;

    private RedisContext context;

    // 以下状态只在 IO 线程上读写
    private final Deque<RedisMessage> pending = new ArrayDeque<>();
    private boolean blocked;

    public RedisCommandHandler(CommandDispatcher dispatcher, StorageEngine storage) {
        this.dispatcher = dispatcher;
        this.storage = storage;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        this.context = new RedisContext(ctx);
        log.info("Client connected: {}, total clients: {}", ctx.channel().remoteAddress(), connectedClients.incrementAndGet());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        cleanup(ctx);
        log.info("Client disconnected: {}, total clients: {}", ctx.channel().remoteAddress(), connectedClients.decrementAndGet());
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RedisMessage msg) {
        if (blocked) {
            // 阻塞命令未回复前，后续命令按序暂存
            pending.add(msg);
            return;
        }
        process(ctx, msg);
    }

    private void process(ChannelHandlerContext ctx, RedisMessage msg) {
        if (!(msg instanceof RedisArray array) || array.size() == 0) {
            log.warn("Received non-command message: {}", msg);
            ctx.writeAndFlush(new ErrorMessage("ERR protocol error: expected array of bulk strings"));
            return;
        }
        for (RedisMessage element : array.elements()) {
            if (!(element instanceof BulkString bulk) || bulk.isNull()) {
                ctx.writeAndFlush(new ErrorMessage("ERR protocol error: command arguments must be bulk strings"));
                return;
            }
        }

        String commandName = ((BulkString) array.elements()[0]).asString().toUpperCase(Locale.ROOT);
        if (log.isDebugEnabled()) {
            String argsLog = Arrays.stream(array.elements()).skip(1)
                    .map(e -> ((BulkString) e).asString())
                    .collect(Collectors.joining(", "));
            log.debug("Execute Command: {} args=[{}]", commandName, argsLog);
        }

        if ("QUIT".equals(commandName)) {
            pending.clear();
            ctx.writeAndFlush(SimpleString.OK).addListener(ChannelFutureListener.CLOSE);
            return;
        }

        RedisMessage response = dispatcher.dispatch(array, context);
        if (response != NoReply.INSTANCE) {
            ctx.writeAndFlush(response);
            return;
        }
        BlockingContext waiter = context.takeBlocking();
        if (waiter != null) {
            suspend(ctx, waiter);
        }
    }

    /**
     * 挂起：停止读取新数据，直到阻塞回复写出
     */
    private void suspend(ChannelHandlerContext ctx, BlockingContext waiter) {
        blocked = true;
        ctx.channel().config().setAutoRead(false);
        waiter.onComplete(() -> ctx.executor().execute(() -> resume(ctx)));
    }

    /**
     * 在 IO 线程上恢复，依次执行暂存的命令；其中再遇到阻塞命令则再次挂起
     */
    private void resume(ChannelHandlerContext ctx) {
        blocked = false;
        while (!blocked && !pending.isEmpty()) {
            process(ctx, pending.poll());
        }
        if (!blocked && ctx.channel().isActive()) {
            ctx.channel().config().setAutoRead(true);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Closing connection {} after error", ctx.channel().remoteAddress(), cause);
        ctx.close();
    }

    /**
     * 连接断开：退订全部频道，取消阻塞等待
     */
    private void cleanup(ChannelHandlerContext ctx) {
        storage.getBlockingManager().cancel(ctx);
        pending.clear();
        if (context == null) return;

        PubSubSubscriber subscriber = context.getSubscriber();
        for (String channel : subscriber.getChannels()) {
            BroadcastChannel sender = storage.findChannel(channel);
            if (sender != null) sender.removeReceiver(subscriber, channel);
            subscriber.removeChannel(channel);
        }
        for (String pattern : subscriber.getPatterns()) {
            BroadcastChannel sender = storage.findPattern(pattern);
            if (sender != null) sender.removeReceiver(subscriber, pattern);
            subscriber.removePattern(pattern);
        }
    }
}
