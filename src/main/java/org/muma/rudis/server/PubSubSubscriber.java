package org.muma.rudis.server;

import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import org.muma.rudis.protocol.BulkString;
import org.muma.rudis.protocol.RedisArray;
import org.muma.rudis.protocol.RedisMessage;
import org.muma.rudis.store.pubsub.MessageReceiver;
import org.muma.rudis.store.pubsub.PubSubMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 一个连接的订阅端
 * <p>
 * 投递是非阻塞的：连接不可写 (出站缓冲超过高水位) 时本条消息直接丢弃，发布者不会被拖慢。
 */
public class PubSubSubscriber implements MessageReceiver {

    private static final Logger log = LoggerFactory.getLogger(PubSubSubscriber.class);

    private final ChannelHandlerContext ctx;
    private final Set<String> channels = new LinkedHashSet<>();
    private final Set<String> patterns = new LinkedHashSet<>();

    public PubSubSubscriber(ChannelHandlerContext ctx) {
        this.ctx = ctx;
    }

    @Override
    public boolean deliver(PubSubMessage message) {
        Channel channel = ctx.channel();
        if (!channel.isActive()) {
            return false;
        }
        if (!channel.isWritable()) {
            log.debug("Subscriber {} lagging, skipping message on {}", channel.remoteAddress(), message.channel());
            return false;
        }

        RedisMessage frame;
        if (message.isPatternMatch()) {
            frame = new RedisArray(new RedisMessage[]{
                    new BulkString("pmessage"),
                    new BulkString(message.pattern()),
                    new BulkString(message.channel()),
                    new BulkString(message.payload())
            });
        } else {
            frame = new RedisArray(new RedisMessage[]{
                    new BulkString("message"),
                    new BulkString(message.channel()),
                    new BulkString(message.payload())
            });
        }
        ctx.writeAndFlush(frame);
        return true;
    }

    public synchronized boolean addChannel(String channel) {
        return channels.add(channel);
    }

    public synchronized boolean removeChannel(String channel) {
        return channels.remove(channel);
    }

    public synchronized boolean addPattern(String pattern) {
        return patterns.add(pattern);
    }

    public synchronized boolean removePattern(String pattern) {
        return patterns.remove(pattern);
    }

    public synchronized List<String> getChannels() {
        return new ArrayList<>(channels);
    }

    public synchronized List<String> getPatterns() {
        return new ArrayList<>(patterns);
    }

    public synchronized int subscriptionCount() {
        return channels.size() + patterns.size();
    }
}
