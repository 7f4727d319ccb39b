package org.muma.rudis.common;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class RedisData<T> {

    // 数据类型
    private RedisDataType type;

    // 绝对过期时间戳 ms (-1 表示不过期)
    private long expireAt = -1;

    // String 是 String, Hash 是 RedisHash, List 是 RedisList
    private T data;

    public RedisData(RedisDataType type, T data) {
        this.type = type;
        this.data = data;
    }

    public static RedisData<String> ofString(String value) {
        return new RedisData<>(RedisDataType.STRING, value);
    }

    public static RedisData<RedisHash> ofHash(RedisHash hash) {
        return new RedisData<>(RedisDataType.HASH, hash);
    }

    public static RedisData<RedisList> ofList(RedisList list) {
        return new RedisData<>(RedisDataType.LIST, list);
    }

    public boolean isExpired() {
        return isExpired(System.currentTimeMillis());
    }

    // now >= expireAt 即视为不存在
    public boolean isExpired(long now) {
        return expireAt != -1 && now >= expireAt;
    }

    // 避免外部强制转换时报 Unchecked warning，同时做类型检查
    public <V> V getValue(Class<V> clazz) {
        if (clazz.isInstance(data)) {
            return clazz.cast(data);
        }
        throw new IllegalStateException("Data type mismatch. Expected " + clazz.getSimpleName() + " but found " + data.getClass().getSimpleName());
    }
}
