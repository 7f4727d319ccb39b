package org.muma.rudis.command.impl.pubsub;

import org.muma.rudis.command.RedisCommand;
import org.muma.rudis.protocol.*;
import org.muma.rudis.server.PubSubSubscriber;
import org.muma.rudis.server.RedisContext;
import org.muma.rudis.store.StorageEngine;
import org.muma.rudis.store.pubsub.BroadcastChannel;

import java.util.ArrayList;
import java.util.List;

/**
 * (P)SUBSCRIBE / (P)UNSUBSCRIBE 公共逻辑
 * <p>
 * 每个频道单独回一帧确认 [kind, name, 当前订阅总数]，由命令自己写出，
 * 因此 execute 返回 NoReply。
 */
public abstract class AbstractSubscribeCommand implements RedisCommand {

    private final String kind;
    private final boolean pattern;
    private final boolean subscribe;

    protected AbstractSubscribeCommand(String kind, boolean pattern, boolean subscribe) {
        this.kind = kind;
        this.pattern = pattern;
        this.subscribe = subscribe;
    }

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (context == null) {
            return new ErrorMessage("ERR " + kind + " requires a client connection");
        }
        if (subscribe && args.size() < 2) return errorArgs(kind);

        PubSubSubscriber subscriber = context.getSubscriber();

        List<String> names = new ArrayList<>();
        for (int i = 1; i < args.size(); i++) {
            names.add(arg(args, i));
        }
        // 不带参数的退订：退订全部
        if (!subscribe && names.isEmpty()) {
            names = pattern ? subscriber.getPatterns() : subscriber.getChannels();
            if (names.isEmpty()) {
                context.write(confirm(null, subscriber.subscriptionCount()));
                context.flush();
                return NoReply.INSTANCE;
            }
        }

        for (String name : names) {
            if (subscribe) {
                doSubscribe(storage, subscriber, name);
            } else {
                doUnsubscribe(storage, subscriber, name);
            }
            context.write(confirm(name, subscriber.subscriptionCount()));
        }
        context.flush();
        return NoReply.INSTANCE;
    }

    private void doSubscribe(StorageEngine storage, PubSubSubscriber subscriber, String name) {
        boolean added = pattern ? subscriber.addPattern(name) : subscriber.addChannel(name);
        if (added) {
            BroadcastChannel sender = pattern ? storage.psubscribe(name) : storage.subscribe(name);
            sender.addReceiver(subscriber, name);
        }
    }

    private void doUnsubscribe(StorageEngine storage, PubSubSubscriber subscriber, String name) {
        boolean removed = pattern ? subscriber.removePattern(name) : subscriber.removeChannel(name);
        if (removed) {
            BroadcastChannel sender = pattern ? storage.findPattern(name) : storage.findChannel(name);
            if (sender != null) {
                sender.removeReceiver(subscriber, name);
            }
        }
    }

    private RedisArray confirm(String name, int count) {
        return new RedisArray(new RedisMessage[]{
                new BulkString(kind),
                name == null ? BulkString.NULL : new BulkString(name),
                new RedisInteger(count)
        });
    }
}
