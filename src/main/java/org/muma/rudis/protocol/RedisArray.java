package org.muma.rudis.protocol;

import java.util.Arrays;
import java.util.List;

// 5. 数组 (*) - elements 为 null 表示 *-1
public record RedisArray(RedisMessage[] elements) implements RedisMessage {

    public static final RedisArray NULL = new RedisArray(null);
    public static final RedisArray EMPTY = new RedisArray(new RedisMessage[0]);

    /**
     * 由字符串构建 Bulk 数组，命令帧和 AOF 记录都是这种形态
     */
    public static RedisArray ofBulk(String... parts) {
        RedisMessage[] elements = new RedisMessage[parts.length];
        for (int i = 0; i < parts.length; i++) {
            elements[i] = new BulkString(parts[i]);
        }
        return new RedisArray(elements);
    }

    public static RedisArray ofBulk(List<String> parts) {
        return ofBulk(parts.toArray(new String[0]));
    }

    public int size() {
        return elements == null ? 0 : elements.length;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RedisArray other && Arrays.equals(elements, other.elements);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(elements);
    }

    @Override
    public String toString() {
        return elements == null ? "RedisArray(nil)" : "RedisArray" + Arrays.toString(elements);
    }
}
