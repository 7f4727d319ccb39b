package org.muma.rudis.command.impl.list;

import org.muma.rudis.command.RedisCommand;
import org.muma.rudis.common.RedisData;
import org.muma.rudis.common.RedisDataType;
import org.muma.rudis.protocol.*;
import org.muma.rudis.server.RedisContext;
import org.muma.rudis.store.StorageEngine;

/**
 * LREM key count element
 * count > 0 从头删，count < 0 从尾删，count = 0 全部删除
 */
public class LRemCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() != 4) return errorArgs("lrem");

        long count;
        try {
            count = Long.parseLong(arg(args, 2));
        } catch (NumberFormatException e) {
            return errorInt();
        }

        String key = arg(args, 1);
        RedisData<?> data = storage.get(key);
        if (data == null) return RedisInteger.ZERO;
        if (isWrongType(data, RedisDataType.LIST)) return wrongType();

        return new RedisInteger(storage.lrem(key, count, arg(args, 3)));
    }
}
