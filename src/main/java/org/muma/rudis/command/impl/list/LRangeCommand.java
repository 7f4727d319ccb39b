package org.muma.rudis.command.impl.list;

import org.muma.rudis.command.RedisCommand;
import org.muma.rudis.common.RedisData;
import org.muma.rudis.common.RedisDataType;
import org.muma.rudis.common.RedisList;
import org.muma.rudis.protocol.*;
import org.muma.rudis.server.RedisContext;
import org.muma.rudis.store.StorageEngine;

/**
 * LRANGE key start stop
 */
public class LRangeCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() != 4) return errorArgs("lrange");

        long start;
        long stop;
        try {
            start = Long.parseLong(arg(args, 2));
            stop = Long.parseLong(arg(args, 3));
        } catch (NumberFormatException e) {
            return errorInt();
        }

        RedisData<?> data = storage.get(arg(args, 1));
        if (data == null) return RedisArray.EMPTY;
        if (isWrongType(data, RedisDataType.LIST)) return wrongType();

        return bulkArray(data.getValue(RedisList.class).range(start, stop));
    }
}
