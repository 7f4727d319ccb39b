package org.muma.rudis.rdb;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.muma.rudis.common.RedisData;
import org.muma.rudis.common.RedisHash;
import org.muma.rudis.common.RedisList;
import org.muma.rudis.store.impl.MemoryStorageEngine;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RdbPersistenceTest {

    @TempDir
    Path dir;

    private MemoryStorageEngine storage;
    private RdbManager manager;

    @BeforeEach
    void setUp() {
        storage = new MemoryStorageEngine();
        storage.set("s", RedisData.ofString("value"), 3_600_000);
        storage.rpush("l", List.of("a", "b", "c"));
        storage.hset("h", "f1", "v1");
        storage.hset("h", "f2", "v2");

        RedisData<String> expired = RedisData.ofString("old");
        expired.setExpireAt(System.currentTimeMillis() - 1000);
        storage.restore("expired", expired);
    }

    @AfterEach
    void tearDown() {
        if (manager != null) manager.shutdown();
    }

    @Test
    void testDumpHeader() {
        byte[] bytes = RdbSaver.dump(storage);
        assertEquals("REDIS0002", new String(bytes, 0, 9, StandardCharsets.US_ASCII));
        assertEquals(RdbConstants.OP_SELECTDB, bytes[9] & 0xFF);
        assertEquals(RdbConstants.OP_EOF, bytes[bytes.length - 1] & 0xFF);
    }

    @Test
    void testSaveAndLoadRoundTrip() throws IOException {
        Path file = dir.resolve("dump.rdb");
        new RdbSaver(storage).save(file);
        assertTrue(Files.exists(file));

        MemoryStorageEngine loaded = RdbLoader.load(file);

        assertEquals(3, loaded.size());
        assertNull(loaded.get("expired"));

        RedisData<?> s = loaded.get("s");
        assertEquals("value", s.getValue(String.class));
        assertEquals(storage.get("s").getExpireAt(), s.getExpireAt());

        assertEquals(List.of("a", "b", "c"), loaded.get("l").getValue(RedisList.class).toList());
        assertEquals(-1, loaded.get("l").getExpireAt());
        assertEquals(Map.of("f1", "v1", "f2", "v2"), loaded.get("h").getValue(RedisHash.class).toMap());
    }

    @Test
    void testLongValuesRoundTrip() throws IOException {
        MemoryStorageEngine big = new MemoryStorageEngine();
        String longValue = "v".repeat(70_000);
        big.set("k".repeat(300), RedisData.ofString(longValue), -1);

        MemoryStorageEngine loaded = new MemoryStorageEngine();
        new RdbLoader(loaded).load(new ByteArrayInputStream(RdbSaver.dump(big)));
        assertEquals(longValue, loaded.get("k".repeat(300)).getValue(String.class));
    }

    @Test
    void testLoadMergesCollections() throws IOException {
        MemoryStorageEngine target = new MemoryStorageEngine();
        target.rpush("l", List.of("x"));
        target.hset("h", "f0", "v0");
        target.set("s", RedisData.ofString("mine"), -1);

        int count = new RdbLoader(target).load(new ByteArrayInputStream(RdbSaver.dump(storage)));

        assertEquals(3, count);
        assertEquals(List.of("x", "a", "b", "c"), target.get("l").getValue(RedisList.class).toList());
        assertEquals(3, target.get("h").getValue(RedisHash.class).size());
        // String 直接覆盖
        assertEquals("value", target.get("s").getValue(String.class));
    }

    @Test
    void testBadHeaderIsRejected() {
        byte[] bytes = RdbSaver.dump(storage);

        byte[] badMagic = Arrays.copyOf(bytes, bytes.length);
        badMagic[0] = 'X';
        assertThrows(IOException.class,
                () -> new RdbLoader(new MemoryStorageEngine()).load(new ByteArrayInputStream(badMagic)));

        byte[] oldVersion = Arrays.copyOf(bytes, bytes.length);
        System.arraycopy("0001".getBytes(StandardCharsets.US_ASCII), 0, oldVersion, 5, 4);
        assertThrows(IOException.class,
                () -> new RdbLoader(new MemoryStorageEngine()).load(new ByteArrayInputStream(oldVersion)));
    }

    @Test
    void testMissingFileLoadsNothing() throws IOException {
        assertEquals(0, new RdbLoader(new MemoryStorageEngine()).loadInto(dir.resolve("absent.rdb")));
    }

    @Test
    void testManagerSavesOnShutdown() {
        Path file = dir.resolve("dump.rdb");
        manager = new RdbManager(true, file, 3600, storage);
        manager.init();
        assertFalse(Files.exists(file));

        manager.shutdown();
        manager = null;
        assertTrue(Files.exists(file));
    }

    @Test
    void testDisabledManagerDoesNotSave() {
        Path file = dir.resolve("dump.rdb");
        manager = new RdbManager(false, file, 1, storage);
        manager.init();
        manager.shutdown();
        assertFalse(Files.exists(file));
    }
}
