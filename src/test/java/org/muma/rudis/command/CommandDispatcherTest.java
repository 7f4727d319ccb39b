package org.muma.rudis.command;

import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.rudis.protocol.*;
import org.muma.rudis.server.RedisContext;
import org.muma.rudis.store.StorageEngine;
import org.muma.rudis.store.impl.MemoryStorageEngine;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CommandDispatcherTest {

    private MemoryStorageEngine storage;
    private CommandDispatcher dispatcher;
    private RedisContext context;

    @BeforeEach
    void setUp() {
        storage = new MemoryStorageEngine();
        dispatcher = new CommandDispatcher(storage);

        ChannelHandlerContext ctx = mock(ChannelHandlerContext.class);
        Channel channel = mock(Channel.class);
        when(ctx.channel()).thenReturn(channel);
        when(channel.isActive()).thenReturn(true);
        when(channel.isWritable()).thenReturn(true);
        context = new RedisContext(ctx);
    }

    @AfterEach
    void tearDown() {
        storage.shutdown();
    }

    private RedisMessage exec(String... args) {
        return dispatcher.dispatch(RedisArray.ofBulk(args), context);
    }

    private static BulkString bulk(String s) {
        return new BulkString(s);
    }

    @Test
    void testSetGetDelScenario() {
        assertEquals(SimpleString.OK, exec("SET", "k", "v"));
        assertEquals(bulk("v"), exec("GET", "k"));
        assertEquals(RedisInteger.ONE, exec("DEL", "k"));
        assertEquals(BulkString.NULL, exec("GET", "k"));
        assertEquals(RedisInteger.ZERO, exec("DEL", "k"));
    }

    @Test
    void testHashScenario() {
        assertEquals(new RedisInteger(2), exec("HSET", "h", "f1", "v1", "f2", "v2"));
        assertEquals(RedisInteger.ZERO, exec("HSET", "h", "f1", "v1b"));
        assertEquals(bulk("v1b"), exec("HGET", "h", "f1"));
        assertEquals(BulkString.NULL, exec("HGET", "h", "nope"));
        assertEquals(new RedisInteger(2), exec("HLEN", "h"));
        assertEquals(RedisArray.ofBulk("f1", "v1b", "f2", "v2"), exec("HGETALL", "h"));
        assertEquals(new RedisArray(new RedisMessage[]{bulk("v2"), BulkString.NULL}), exec("HMGET", "h", "f2", "x"));
        assertEquals(new RedisInteger(2), exec("HDEL", "h", "f1", "f2", "x"));
        assertEquals(RedisInteger.ZERO, exec("EXISTS", "h"));
    }

    @Test
    void testListScenario() {
        assertEquals(new RedisInteger(2), exec("LPUSH", "l", "a", "b"));
        assertEquals(new RedisInteger(3), exec("RPUSH", "l", "c"));
        assertEquals(RedisArray.ofBulk("b", "a", "c"), exec("LRANGE", "l", "0", "-1"));
        assertEquals(bulk("c"), exec("LINDEX", "l", "-1"));

        assertEquals(SimpleString.OK, exec("LSET", "l", "0", "B"));
        assertEquals(new ErrorMessage("ERR index out of range"), exec("LSET", "l", "9", "x"));
        assertEquals(new ErrorMessage("ERR no such key"), exec("LSET", "missing", "0", "x"));

        assertEquals(bulk("B"), exec("LPOP", "l"));
        assertEquals(RedisArray.ofBulk("c", "a"), exec("RPOP", "l", "5"));
        assertEquals(RedisInteger.ZERO, exec("LLEN", "l"));
        assertEquals(BulkString.NULL, exec("LPOP", "l"));
        assertEquals(RedisArray.NULL, exec("LPOP", "l", "2"));
        assertEquals(RedisArray.EMPTY, exec("LRANGE", "l", "0", "-1"));
    }

    @Test
    void testLremAndLtrim() {
        exec("RPUSH", "l", "a", "x", "b", "x", "c");
        assertEquals(new RedisInteger(2), exec("LREM", "l", "0", "x"));
        assertEquals(SimpleString.OK, exec("LTRIM", "l", "1", "-1"));
        assertEquals(RedisArray.ofBulk("b", "c"), exec("LRANGE", "l", "0", "-1"));
    }

    @Test
    void testStringCommands() {
        assertEquals(RedisInteger.ONE, exec("INCR", "n"));
        assertEquals(new RedisInteger(11), exec("INCRBY", "n", "10"));
        assertEquals(new RedisInteger(8), exec("DECRBY", "n", "3"));
        assertEquals(new RedisInteger(7), exec("DECR", "n"));

        assertEquals(new RedisInteger(5), exec("APPEND", "s", "hello"));
        assertEquals(new RedisInteger(11), exec("APPEND", "s", " world"));
        assertEquals(new RedisInteger(11), exec("STRLEN", "s"));
        assertEquals(new ErrorMessage("ERR value is not an integer or out of range"), exec("INCR", "s"));

        assertEquals(SimpleString.OK, exec("MSET", "a", "1", "b", "2"));
        assertEquals(new RedisArray(new RedisMessage[]{bulk("1"), bulk("2"), BulkString.NULL}), exec("MGET", "a", "b", "c"));
        assertEquals(RedisInteger.ZERO, exec("MSETNX", "a", "9", "c", "3"));
        assertEquals(BulkString.NULL, exec("GET", "c"));
    }

    @Test
    void testSetOptions() {
        assertEquals(SimpleString.OK, exec("SET", "k", "v", "EX", "100"));
        assertTrue(storage.get("k").getExpireAt() > System.currentTimeMillis());

        assertEquals(BulkString.NULL, exec("SET", "k", "v2", "NX"));
        assertEquals(SimpleString.OK, exec("SET", "k", "v2", "XX"));
        // 不带过期参数会清除 TTL
        assertEquals(-1, storage.get("k").getExpireAt());

        assertEquals(BulkString.NULL, exec("SET", "other", "v", "XX"));
        assertEquals(ErrorMessage.SYNTAX, exec("SET", "k", "v", "NX", "XX"));
        assertEquals(new ErrorMessage("ERR invalid expire time in 'set' command"), exec("SET", "k", "v", "PX", "0"));
    }

    @Test
    void testWrongTypeLeavesStoreUnchanged() {
        exec("SET", "s", "v");
        assertEquals(ErrorMessage.WRONG_TYPE, exec("LPUSH", "s", "x"));
        assertEquals(ErrorMessage.WRONG_TYPE, exec("HSET", "s", "f", "v"));
        assertEquals(bulk("v"), exec("GET", "s"));

        exec("RPUSH", "l", "a");
        assertEquals(ErrorMessage.WRONG_TYPE, exec("GET", "l"));
        assertEquals(ErrorMessage.WRONG_TYPE, exec("HGET", "l", "f"));
    }

    @Test
    void testArgumentErrors() {
        assertEquals(new ErrorMessage("ERR wrong number of arguments for 'get' command"), exec("GET"));
        assertEquals(new ErrorMessage("ERR wrong number of arguments for 'hset' command"), exec("HSET", "h", "f"));
        assertEquals(new ErrorMessage("ERR value is not an integer or out of range"), exec("LRANGE", "l", "a", "1"));
        assertNull(storage.get("h"));
    }

    @Test
    void testUnknownCommand() {
        RedisMessage reply = exec("FLUSHALL");
        assertTrue(((ErrorMessage) reply).content().startsWith("ERR unknown command"));
        assertFalse(dispatcher.isRegistered("flushall"));
        assertTrue(dispatcher.isRegistered("blpop"));
    }

    @Test
    void testCommandNamesAreCaseInsensitive() {
        assertEquals(SimpleString.OK, exec("set", "k", "v"));
        assertEquals(bulk("v"), exec("gEt", "k"));
    }

    @Test
    void testConnectionCommands() {
        assertEquals(SimpleString.PONG, exec("PING"));
        assertEquals(bulk("hi"), exec("PING", "hi"));
        assertEquals(bulk("hello"), exec("ECHO", "hello"));
        assertEquals(SimpleString.OK, exec("SELECT", "0"));
    }

    @Test
    void testSubscribedModeRestrictsCommands() {
        assertEquals(NoReply.INSTANCE, exec("SUBSCRIBE", "news"));
        assertTrue(context.isSubscribed());

        RedisMessage reply = exec("GET", "k");
        assertTrue(((ErrorMessage) reply).content().startsWith("ERR Can't execute 'get'"));
        assertEquals(SimpleString.PONG, exec("PING"));

        exec("UNSUBSCRIBE");
        assertFalse(context.isSubscribed());
        assertEquals(BulkString.NULL, exec("GET", "k"));
    }

    @Test
    void testUnexpectedFailureBecomesInternalError() {
        StorageEngine broken = mock(StorageEngine.class);
        when(broken.getLock()).thenReturn(new Object());
        when(broken.get("k")).thenThrow(new RuntimeException("boom"));

        CommandDispatcher brokenDispatcher = new CommandDispatcher(broken);
        assertEquals(new ErrorMessage("ERR internal server error"),
                brokenDispatcher.dispatch(RedisArray.ofBulk("GET", "k"), context));
    }

    @Test
    void testClientErrorWithoutMessageNamesException() {
        StorageEngine broken = mock(StorageEngine.class);
        when(broken.getLock()).thenReturn(new Object());
        when(broken.get("k")).thenThrow(new IllegalStateException());

        CommandDispatcher brokenDispatcher = new CommandDispatcher(broken);
        assertEquals(new ErrorMessage("ERR IllegalStateException"),
                brokenDispatcher.dispatch(RedisArray.ofBulk("GET", "k"), context));
    }
}
