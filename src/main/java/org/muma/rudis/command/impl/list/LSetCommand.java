package org.muma.rudis.command.impl.list;

import org.muma.rudis.command.RedisCommand;
import org.muma.rudis.common.RedisData;
import org.muma.rudis.common.RedisDataType;
import org.muma.rudis.common.RedisList;
import org.muma.rudis.protocol.*;
import org.muma.rudis.server.RedisContext;
import org.muma.rudis.store.StorageEngine;

/**
 * LSET key index element
 */
public class LSetCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() != 4) return errorArgs("lset");

        long index;
        try {
            index = Long.parseLong(arg(args, 2));
        } catch (NumberFormatException e) {
            return errorInt();
        }

        String key = arg(args, 1);
        RedisData<?> data = storage.get(key);
        if (data == null) return new ErrorMessage("ERR no such key");
        if (isWrongType(data, RedisDataType.LIST)) return wrongType();

        RedisList list = data.getValue(RedisList.class);
        if (list.index(index) == null) return new ErrorMessage("ERR index out of range");

        storage.lset(key, index, arg(args, 3));
        return SimpleString.OK;
    }
}
