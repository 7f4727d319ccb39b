package org.muma.rudis.aof;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.muma.rudis.common.RedisData;
import org.muma.rudis.common.RedisHash;
import org.muma.rudis.common.RedisList;
import org.muma.rudis.protocol.RedisArray;
import org.muma.rudis.protocol.RespCodec;
import org.muma.rudis.store.impl.MemoryStorageEngine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AofLoaderTest {

    @TempDir
    Path dir;

    private static byte[] records(String[]... commands) {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        for (String[] command : commands) {
            bos.writeBytes(RespCodec.serialize(RedisArray.ofBulk(command)));
        }
        return bos.toByteArray();
    }

    private static String[] cmd(String... parts) {
        return parts;
    }

    private Path write(byte[] content) throws IOException {
        Path file = dir.resolve("appendonly.aof");
        Files.write(file, content);
        return file;
    }

    private static List<String> list(MemoryStorageEngine storage, String key) {
        return storage.get(key).getValue(RedisList.class).toList();
    }

    @Test
    void testReplayBuildsState() throws IOException {
        Path file = write(records(
                cmd("SET", "k", "v"),
                cmd("HSET", "h", "f1", "v1", "f2", "v2"),
                cmd("RPUSH", "l", "a", "b", "c"),
                cmd("LPOP", "l", "1"),
                cmd("LSET", "l", "0", "B"),
                cmd("DEL", "k")));

        MemoryStorageEngine storage = new MemoryStorageEngine();
        assertEquals(6, new AofLoader(storage).load(file));

        assertNull(storage.get("k"));
        assertEquals(Map.of("f1", "v1", "f2", "v2"), storage.get("h").getValue(RedisHash.class).toMap());
        assertEquals(List.of("B", "c"), list(storage, "l"));
    }

    @Test
    void testSetAndHsetReplayIsIdempotent() throws IOException {
        byte[] once = records(cmd("SET", "k", "v"), cmd("HSET", "h", "f", "v"));
        ByteArrayOutputStream twice = new ByteArrayOutputStream();
        twice.writeBytes(once);
        twice.writeBytes(once);

        MemoryStorageEngine storage = AofLoader.replay(write(twice.toByteArray()));

        assertEquals(2, storage.size());
        assertEquals("v", storage.get("k").getValue(String.class));
        assertEquals(Map.of("f", "v"), storage.get("h").getValue(RedisHash.class).toMap());
    }

    @Test
    void testPxatIsAbsolute() throws IOException {
        long future = System.currentTimeMillis() + 3_600_000;
        long past = System.currentTimeMillis() - 1000;
        Path file = write(records(
                cmd("SET", "live", "v", "PXAT", String.valueOf(future)),
                cmd("SET", "dead", "v", "PXAT", String.valueOf(past)),
                cmd("SET", "legacy", "v", String.valueOf(future))));

        MemoryStorageEngine storage = AofLoader.replay(file);

        RedisData<?> live = storage.get("live");
        assertNotNull(live);
        assertEquals(future, live.getExpireAt());
        assertNull(storage.get("dead"));
        assertEquals(future, storage.get("legacy").getExpireAt());
    }

    @Test
    void testMalformedRecordIsSkipped() throws IOException {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        bos.writeBytes(records(cmd("SET", "a", "1")));
        bos.writeBytes("*x\r\n".getBytes(StandardCharsets.US_ASCII));
        bos.writeBytes(records(cmd("SET", "b", "2")));

        MemoryStorageEngine storage = new MemoryStorageEngine();
        assertEquals(2, new AofLoader(storage).load(write(bos.toByteArray())));
        assertEquals("1", storage.get("a").getValue(String.class));
        assertEquals("2", storage.get("b").getValue(String.class));
    }

    @Test
    void testUndecodableRecordIsSkipped() throws IOException {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        bos.writeBytes(records(cmd("SET", "a", "1")));
        // 结构合法，但简单字符串不是 UTF-8
        bos.writeBytes(new byte[]{'+', (byte) 0xFF, '\r', '\n'});
        bos.writeBytes(records(cmd("SET", "b", "2")));

        MemoryStorageEngine storage = new MemoryStorageEngine();
        assertEquals(2, new AofLoader(storage).load(write(bos.toByteArray())));
        assertEquals("1", storage.get("a").getValue(String.class));
        assertEquals("2", storage.get("b").getValue(String.class));
    }

    @Test
    void testInvalidRecordIsSkipped() throws IOException {
        Path file = write(records(
                cmd("SET", "s", "v"),
                cmd("LPUSH", "s", "x"),
                cmd("FLUSHALL"),
                cmd("HSET", "h", "f"),
                cmd("RPUSH", "l", "a")));

        MemoryStorageEngine storage = new MemoryStorageEngine();
        assertEquals(2, new AofLoader(storage).load(file));
        assertEquals("v", storage.get("s").getValue(String.class));
        assertEquals(List.of("a"), list(storage, "l"));
        assertNull(storage.get("h"));
    }

    @Test
    void testTruncatedTailIsIgnored() throws IOException {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        bos.writeBytes(records(cmd("SET", "a", "1")));
        bos.writeBytes("*3\r\n$3\r\nSET\r\n$1\r\nb".getBytes(StandardCharsets.US_ASCII));

        MemoryStorageEngine storage = new MemoryStorageEngine();
        assertEquals(1, new AofLoader(storage).load(write(bos.toByteArray())));
        assertNull(storage.get("b"));
    }

    @Test
    void testMissingFileLoadsNothing() throws IOException {
        MemoryStorageEngine storage = new MemoryStorageEngine();
        assertEquals(0, new AofLoader(storage).load(dir.resolve("absent.aof")));
        assertEquals(0, storage.size());
    }

    @Test
    void testWrittenLogReproducesState() throws IOException {
        Path file = dir.resolve("appendonly.aof");
        AofManager aof = new AofManager(true, file, 60);
        aof.init();

        MemoryStorageEngine origin = new MemoryStorageEngine();
        origin.setAofManager(aof);
        origin.set("s", RedisData.ofString("v"), 3_600_000);
        origin.rpush("l", List.of("a", "x", "b", "x", "c", "x"));
        origin.lrem("l", -2, "x");
        origin.lpush("l", List.of("z"));
        origin.ltrim("l", 1, -2);
        origin.rpop("l", 1);
        origin.hset("h", "f1", "v1");
        origin.hset("h", "f2", "v2");
        origin.hdel("h", "f1");
        origin.set("gone", RedisData.ofString("v"), -1);
        origin.del("gone");
        aof.shutdown();

        MemoryStorageEngine replayed = AofLoader.replay(file);

        assertEquals(origin.keys(), replayed.keys());
        assertEquals(list(origin, "l"), list(replayed, "l"));
        assertEquals(origin.get("h").getValue(RedisHash.class).toMap(), replayed.get("h").getValue(RedisHash.class).toMap());
        assertEquals(origin.get("s").getExpireAt(), replayed.get("s").getExpireAt());
    }
}
