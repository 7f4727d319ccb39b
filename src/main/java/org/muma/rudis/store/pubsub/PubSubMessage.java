package org.muma.rudis.store.pubsub;

/**
 * 一条待投递的发布消息
 *
 * @param pattern 订阅者自己写下的模式，精确频道投递时为 null
 */
public record PubSubMessage(String pattern, String channel, String payload) {

    public boolean isPatternMatch() {
        return pattern != null;
    }
}
