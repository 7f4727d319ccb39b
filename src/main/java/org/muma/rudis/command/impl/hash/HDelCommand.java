package org.muma.rudis.command.impl.hash;

import org.muma.rudis.command.RedisCommand;
import org.muma.rudis.common.RedisData;
import org.muma.rudis.common.RedisDataType;
import org.muma.rudis.protocol.*;
import org.muma.rudis.server.RedisContext;
import org.muma.rudis.store.StorageEngine;

/**
 * HDEL key field [field ...]
 * 字段删光后 key 随之删除
 */
public class HDelCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() < 3) return errorArgs("hdel");

        String key = arg(args, 1);
        RedisData<?> data = storage.get(key);
        if (data == null) return RedisInteger.ZERO;
        if (isWrongType(data, RedisDataType.HASH)) return wrongType();

        int removed = 0;
        for (int i = 2; i < args.size(); i++) {
            removed += storage.hdel(key, arg(args, i));
        }
        return new RedisInteger(removed);
    }
}
