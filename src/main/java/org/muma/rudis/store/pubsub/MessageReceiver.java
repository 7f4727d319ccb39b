package org.muma.rudis.store.pubsub;

/**
 * 订阅端。投递不得阻塞发布者。
 */
public interface MessageReceiver {

    /**
     * @return false 表示本条消息被丢弃 (连接已断开或写缓冲区积压)
     */
    boolean deliver(PubSubMessage message);
}
