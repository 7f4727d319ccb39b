package org.muma.rudis.rdb;

import org.muma.rudis.common.RedisDataType;

/**
 * RDB 值类型编码。2 (set)、3 (zset) 保留未用。
 */
public final class RdbType {

    public static final int STRING = 0;
    public static final int LIST = 1;
    public static final int SET = 2;
    public static final int ZSET = 3;
    public static final int HASH = 4;

    private RdbType() {
    }

    public static int of(RedisDataType type) {
        return switch (type) {
            case STRING -> STRING;
            case LIST -> LIST;
            case HASH -> HASH;
        };
    }
}
