package org.muma.rudis.store.pubsub;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 发布订阅注册表
 * <p>
 * 精确频道与模式频道各一张表。模式去掉末尾的 '*' 后作为 key，匹配规则是前缀匹配。
 */
public class PubSubRegistry {

    private final Map<String, BroadcastChannel> channels = new ConcurrentHashMap<>();
    private final Map<String, BroadcastChannel> patterns = new ConcurrentHashMap<>();

    public BroadcastChannel subscribe(String channel) {
        return channels.computeIfAbsent(channel, c -> new BroadcastChannel(c, false));
    }

    public BroadcastChannel psubscribe(String pattern) {
        return patterns.computeIfAbsent(stripWildcard(pattern), p -> new BroadcastChannel(pattern, true));
    }

    /**
     * 查找已存在的发送端，不会创建
     */
    public BroadcastChannel findChannel(String channel) {
        return channels.get(channel);
    }

    public BroadcastChannel findPattern(String pattern) {
        return patterns.get(stripWildcard(pattern));
    }

    /**
     * @return 被触发的发送端数量 (前缀命中的模式 + 精确频道)，不论发送端上是否还有订阅者
     */
    public int publish(String channel, String payload) {
        int fired = 0;
        for (Map.Entry<String, BroadcastChannel> entry : patterns.entrySet()) {
            if (channel.startsWith(entry.getKey())) {
                entry.getValue().send(channel, payload);
                fired++;
            }
        }
        BroadcastChannel exact = channels.get(channel);
        if (exact != null) {
            exact.send(channel, payload);
            fired++;
        }
        return fired;
    }

    static String stripWildcard(String pattern) {
        return pattern.endsWith("*") ? pattern.substring(0, pattern.length() - 1) : pattern;
    }
}
