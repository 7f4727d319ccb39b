package org.muma.rudis.command.impl.pubsub;

import org.muma.rudis.command.RedisCommand;
import org.muma.rudis.protocol.RedisArray;
import org.muma.rudis.protocol.RedisInteger;
import org.muma.rudis.protocol.RedisMessage;
import org.muma.rudis.server.RedisContext;
import org.muma.rudis.store.StorageEngine;

/**
 * PUBLISH channel message
 * 返回被触发的发送端数量 (精确频道 + 前缀匹配的模式)，而不是订阅者数量
 */
public class PublishCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() != 3) return errorArgs("publish");
        return new RedisInteger(storage.publish(arg(args, 1), arg(args, 2)));
    }
}
