package org.muma.rudis.command.impl.list;

import org.muma.rudis.command.RedisCommand;
import org.muma.rudis.common.RedisData;
import org.muma.rudis.common.RedisDataType;
import org.muma.rudis.common.RedisList;
import org.muma.rudis.protocol.*;
import org.muma.rudis.server.RedisContext;
import org.muma.rudis.store.StorageEngine;

/**
 * LINDEX key index
 */
public class LIndexCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() != 3) return errorArgs("lindex");

        long index;
        try {
            index = Long.parseLong(arg(args, 2));
        } catch (NumberFormatException e) {
            return errorInt();
        }

        RedisData<?> data = storage.get(arg(args, 1));
        if (data == null) return BulkString.NULL;
        if (isWrongType(data, RedisDataType.LIST)) return wrongType();

        return new BulkString(data.getValue(RedisList.class).index(index));
    }
}
