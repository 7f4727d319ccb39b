package org.muma.rudis.store.pubsub;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * 一个频道 (或模式) 的广播发送端，挂着若干订阅者。
 * 首次订阅时创建，之后不再销毁。
 * <p>
 * 模式发送端按去掉末尾 '*' 的前缀共享，"news" 与 "news*" 落在同一个发送端上，
 * 因此每个订阅者记录自己订阅时写下的模式，pmessage 中回送的是这个原始写法。
 */
public class BroadcastChannel {

    private static final Logger log = LoggerFactory.getLogger(BroadcastChannel.class);

    // 首次订阅时的写法
    @Getter
    private final String name;
    @Getter
    private final boolean pattern;

    // 订阅者 -> 订阅时写下的名字
    private final Map<MessageReceiver, Set<String>> receivers = new ConcurrentHashMap<>();

    public BroadcastChannel(String name, boolean pattern) {
        this.name = name;
        this.pattern = pattern;
    }

    public void addReceiver(MessageReceiver receiver) {
        addReceiver(receiver, name);
    }

    public void addReceiver(MessageReceiver receiver, String subscribedAs) {
        receivers.compute(receiver, (r, names) -> {
            Set<String> result = names != null ? names : new CopyOnWriteArraySet<>();
            result.add(subscribedAs);
            return result;
        });
    }

    /**
     * 移除该订阅者的全部订阅
     */
    public void removeReceiver(MessageReceiver receiver) {
        receivers.remove(receiver);
    }

    public void removeReceiver(MessageReceiver receiver, String subscribedAs) {
        receivers.computeIfPresent(receiver, (r, names) -> {
            names.remove(subscribedAs);
            return names.isEmpty() ? null : names;
        });
    }

    public int receiverCount() {
        return receivers.size();
    }

    /**
     * 向所有订阅者广播。没有订阅者或投递被丢弃时，发送端依然算作已触发。
     */
    public void send(String channel, String payload) {
        for (Map.Entry<MessageReceiver, Set<String>> entry : receivers.entrySet()) {
            for (String subscribedAs : entry.getValue()) {
                PubSubMessage message = new PubSubMessage(pattern ? subscribedAs : null, channel, payload);
                if (!entry.getKey().deliver(message)) {
                    log.debug("Message on channel {} dropped for a lagging subscriber", channel);
                }
            }
        }
    }
}
