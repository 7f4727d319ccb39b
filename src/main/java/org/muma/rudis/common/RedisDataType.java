package org.muma.rudis.common;

/**
 * 值类型，key 创建后类型固定
 */
public enum RedisDataType {
    STRING,
    HASH,
    LIST
}
