package org.muma.rudis.rdb;

import java.nio.charset.StandardCharsets;

public final class RdbConstants {

    // Header: REDIS0002
    public static final byte[] MAGIC = "REDIS".getBytes(StandardCharsets.US_ASCII);
    public static final String VERSION = "0002";

    // --- OpCodes ---

    // 过期时间 (毫秒, 8 bytes 大端)
    public static final int OP_EXPIRETIME_MS = 0xFC; // 252

    // 选择数据库 (4 bytes 大端)，加载时读出后丢弃
    public static final int OP_SELECTDB = 0xFE; // 254

    // 文件结束
    public static final int OP_EOF = 0xFF; // 255

    private RdbConstants() {
    }
}
