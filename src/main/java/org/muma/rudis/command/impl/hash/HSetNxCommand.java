package org.muma.rudis.command.impl.hash;

import org.muma.rudis.command.RedisCommand;
import org.muma.rudis.common.RedisData;
import org.muma.rudis.common.RedisDataType;
import org.muma.rudis.common.RedisHash;
import org.muma.rudis.protocol.*;
import org.muma.rudis.server.RedisContext;
import org.muma.rudis.store.StorageEngine;

/**
 * HSETNX key field value
 */
public class HSetNxCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() != 4) return errorArgs("hsetnx");

        String key = arg(args, 1);
        String field = arg(args, 2);
        RedisData<?> data = storage.get(key);
        if (isWrongType(data, RedisDataType.HASH)) return wrongType();
        if (data != null && data.getValue(RedisHash.class).contains(field)) {
            return RedisInteger.ZERO;
        }
        storage.hset(key, field, arg(args, 3));
        return RedisInteger.ONE;
    }
}
