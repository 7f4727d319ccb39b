package org.muma.rudis.protocol;

// 3. 整数 (:)
public record RedisInteger(long value) implements RedisMessage {

    public static final RedisInteger ZERO = new RedisInteger(0);
    public static final RedisInteger ONE = new RedisInteger(1);
}
