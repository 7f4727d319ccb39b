package org.muma.rudis.command.impl.list;

import org.muma.rudis.command.RedisCommand;
import org.muma.rudis.common.RedisData;
import org.muma.rudis.common.RedisDataType;
import org.muma.rudis.protocol.*;
import org.muma.rudis.server.RedisContext;
import org.muma.rudis.store.StorageEngine;

/**
 * LTRIM key start stop
 */
public class LTrimCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() != 4) return errorArgs("ltrim");

        long start;
        long stop;
        try {
            start = Long.parseLong(arg(args, 2));
            stop = Long.parseLong(arg(args, 3));
        } catch (NumberFormatException e) {
            return errorInt();
        }

        String key = arg(args, 1);
        RedisData<?> data = storage.get(key);
        if (data == null) return SimpleString.OK;
        if (isWrongType(data, RedisDataType.LIST)) return wrongType();

        storage.ltrim(key, start, stop);
        return SimpleString.OK;
    }
}
