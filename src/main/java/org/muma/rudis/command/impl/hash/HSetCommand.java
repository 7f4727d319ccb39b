package org.muma.rudis.command.impl.hash;

import org.muma.rudis.command.RedisCommand;
import org.muma.rudis.common.RedisDataType;
import org.muma.rudis.protocol.*;
import org.muma.rudis.server.RedisContext;
import org.muma.rudis.store.StorageEngine;

/**
 * HSET key field value [field value ...]
 * 返回新增字段的个数
 */
public class HSetCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() < 4 || args.size() % 2 != 0) return errorArgs("hset");

        String key = arg(args, 1);
        if (isWrongType(storage.get(key), RedisDataType.HASH)) return wrongType();

        int added = 0;
        for (int i = 2; i < args.size(); i += 2) {
            added += storage.hset(key, arg(args, i), arg(args, i + 1));
        }
        return new RedisInteger(added);
    }
}
