package org.muma.rudis.common;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Redis Hash 封装 (field -> value)，保留插入顺序，HGETALL/RDB 输出稳定
 */
public class RedisHash {

    private final Map<String, String> fields = new LinkedHashMap<>();

    /**
     * @return 1 新字段, 0 覆盖旧值
     */
    public int put(String field, String value) {
        return fields.put(field, value) == null ? 1 : 0;
    }

    public String get(String field) {
        return fields.get(field);
    }

    public boolean contains(String field) {
        return fields.containsKey(field);
    }

    public int remove(String field) {
        return fields.remove(field) != null ? 1 : 0;
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    /**
     * 合并另一个 Hash (RDB 加载时同名 key 的合并语义)
     */
    public void putAll(RedisHash other) {
        fields.putAll(other.fields);
    }

    // 只读视图，供 HGETALL/HKEYS/HVALS 以及 RDB 序列化使用
    public Map<String, String> toMap() {
        return Collections.unmodifiableMap(fields);
    }
}
