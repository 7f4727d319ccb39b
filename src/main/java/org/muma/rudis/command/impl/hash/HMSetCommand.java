package org.muma.rudis.command.impl.hash;

import org.muma.rudis.command.RedisCommand;
import org.muma.rudis.common.RedisDataType;
import org.muma.rudis.protocol.*;
import org.muma.rudis.server.RedisContext;
import org.muma.rudis.store.StorageEngine;

/**
 * HMSET key field value [field value ...]
 * 与 HSET 相同，但返回 OK
 */
public class HMSetCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() < 4 || args.size() % 2 != 0) return errorArgs("hmset");

        String key = arg(args, 1);
        if (isWrongType(storage.get(key), RedisDataType.HASH)) return wrongType();

        for (int i = 2; i < args.size(); i += 2) {
            storage.hset(key, arg(args, i), arg(args, i + 1));
        }
        return SimpleString.OK;
    }
}
