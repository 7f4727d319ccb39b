package org.muma.rudis.command.impl.pubsub;

import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.muma.rudis.protocol.*;
import org.muma.rudis.server.RedisContext;
import org.muma.rudis.store.impl.MemoryStorageEngine;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class PubSubCommandTest {

    private MemoryStorageEngine storage;
    private ChannelHandlerContext ctx;
    private Channel channel;
    private RedisContext context;

    @BeforeEach
    void setUp() {
        storage = new MemoryStorageEngine();
        ctx = mock(ChannelHandlerContext.class);
        channel = mock(Channel.class);
        when(ctx.channel()).thenReturn(channel);
        when(channel.isActive()).thenReturn(true);
        when(channel.isWritable()).thenReturn(true);
        context = new RedisContext(ctx);
    }

    @AfterEach
    void tearDown() {
        storage.shutdown();
    }

    private static RedisArray confirm(String kind, String name, int count) {
        return new RedisArray(new RedisMessage[]{
                new BulkString(kind),
                name == null ? BulkString.NULL : new BulkString(name),
                new RedisInteger(count)
        });
    }

    private RedisMessage publish(String channelName, String payload) {
        return new PublishCommand().execute(storage, RedisArray.ofBulk("PUBLISH", channelName, payload), null);
    }

    @Test
    void testSubscribeConfirmsEachChannel() {
        RedisMessage res = new SubscribeCommand().execute(storage, RedisArray.ofBulk("SUBSCRIBE", "news", "sport"), context);

        assertSame(NoReply.INSTANCE, res);
        InOrder inOrder = inOrder(ctx);
        inOrder.verify(ctx).write(confirm("subscribe", "news", 1));
        inOrder.verify(ctx).write(confirm("subscribe", "sport", 2));
        inOrder.verify(ctx).flush();
        assertTrue(context.isSubscribed());
    }

    @Test
    void testPublishDeliversMessageAndPmessage() {
        new SubscribeCommand().execute(storage, RedisArray.ofBulk("SUBSCRIBE", "news"), context);
        new PSubscribeCommand().execute(storage, RedisArray.ofBulk("PSUBSCRIBE", "ne*"), context);
        verify(ctx).write(confirm("psubscribe", "ne*", 2));

        assertEquals(new RedisInteger(2), publish("news", "hi"));

        verify(ctx).writeAndFlush(RedisArray.ofBulk("message", "news", "hi"));
        verify(ctx).writeAndFlush(RedisArray.ofBulk("pmessage", "ne*", "news", "hi"));
    }

    @Test
    void testPublishWithoutSubscribers() {
        assertEquals(RedisInteger.ZERO, publish("nobody", "hi"));
    }

    @Test
    void testLaggingSubscriberSkipsMessage() {
        new SubscribeCommand().execute(storage, RedisArray.ofBulk("SUBSCRIBE", "news"), context);
        when(channel.isWritable()).thenReturn(false);

        assertEquals(RedisInteger.ONE, publish("news", "dropped"));
        verify(ctx, never()).writeAndFlush(any());
    }

    @Test
    void testUnsubscribeAll() {
        new SubscribeCommand().execute(storage, RedisArray.ofBulk("SUBSCRIBE", "a", "b"), context);
        new PSubscribeCommand().execute(storage, RedisArray.ofBulk("PSUBSCRIBE", "x*"), context);

        new UnsubscribeCommand().execute(storage, RedisArray.ofBulk("UNSUBSCRIBE"), context);
        verify(ctx).write(confirm("unsubscribe", "a", 2));
        verify(ctx).write(confirm("unsubscribe", "b", 1));
        assertTrue(context.isSubscribed());

        new PUnsubscribeCommand().execute(storage, RedisArray.ofBulk("PUNSUBSCRIBE"), context);
        verify(ctx).write(confirm("punsubscribe", "x*", 0));
        assertFalse(context.isSubscribed());

        // 发送端不随退订销毁，仍计入；但不再投递
        assertEquals(RedisInteger.ONE, publish("a", "hi"));
        assertEquals(RedisInteger.ONE, publish("xyz", "hi"));
        verify(ctx, never()).writeAndFlush(any());
    }

    @Test
    void testPmessageNamesSubscribersOwnPattern() {
        ChannelHandlerContext otherCtx = mock(ChannelHandlerContext.class);
        Channel otherChannel = mock(Channel.class);
        when(otherCtx.channel()).thenReturn(otherChannel);
        when(otherChannel.isActive()).thenReturn(true);
        when(otherChannel.isWritable()).thenReturn(true);
        RedisContext other = new RedisContext(otherCtx);

        new PSubscribeCommand().execute(storage, RedisArray.ofBulk("PSUBSCRIBE", "news"), context);
        new PSubscribeCommand().execute(storage, RedisArray.ofBulk("PSUBSCRIBE", "news*"), other);

        assertEquals(RedisInteger.ONE, publish("news.tech", "hi"));
        verify(ctx).writeAndFlush(RedisArray.ofBulk("pmessage", "news", "news.tech", "hi"));
        verify(otherCtx).writeAndFlush(RedisArray.ofBulk("pmessage", "news*", "news.tech", "hi"));
    }

    @Test
    void testUnsubscribeWhenNothingSubscribed() {
        new UnsubscribeCommand().execute(storage, RedisArray.ofBulk("UNSUBSCRIBE"), context);
        verify(ctx).write(confirm("unsubscribe", null, 0));
    }

    @Test
    void testUnsubscribeUnknownChannel() {
        new SubscribeCommand().execute(storage, RedisArray.ofBulk("SUBSCRIBE", "a"), context);
        new UnsubscribeCommand().execute(storage, RedisArray.ofBulk("UNSUBSCRIBE", "zzz"), context);
        verify(ctx).write(confirm("unsubscribe", "zzz", 1));
    }

    @Test
    void testDuplicateSubscribeKeepsCount() {
        new SubscribeCommand().execute(storage, RedisArray.ofBulk("SUBSCRIBE", "a"), context);
        new SubscribeCommand().execute(storage, RedisArray.ofBulk("SUBSCRIBE", "a"), context);
        verify(ctx, times(2)).write(confirm("subscribe", "a", 1));

        assertEquals(RedisInteger.ONE, publish("a", "once"));
        verify(ctx, times(1)).writeAndFlush(RedisArray.ofBulk("message", "a", "once"));
    }

    @Test
    void testSubscribeRequiresChannel() {
        assertEquals(new ErrorMessage("ERR wrong number of arguments for 'subscribe' command"),
                new SubscribeCommand().execute(storage, RedisArray.ofBulk("SUBSCRIBE"), context));
    }
}
