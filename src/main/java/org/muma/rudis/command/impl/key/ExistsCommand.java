package org.muma.rudis.command.impl.key;

import org.muma.rudis.command.RedisCommand;
import org.muma.rudis.protocol.RedisArray;
import org.muma.rudis.protocol.RedisInteger;
import org.muma.rudis.protocol.RedisMessage;
import org.muma.rudis.server.RedisContext;
import org.muma.rudis.store.StorageEngine;

/**
 * EXISTS key [key ...]
 * 重复的 key 会被重复计数 (与 Redis 一致)
 */
public class ExistsCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() < 2) return errorArgs("exists");

        int count = 0;
        for (int i = 1; i < args.size(); i++) {
            if (storage.exists(arg(args, i))) count++;
        }
        return new RedisInteger(count);
    }
}
