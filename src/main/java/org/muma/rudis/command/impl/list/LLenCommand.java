package org.muma.rudis.command.impl.list;

import org.muma.rudis.command.RedisCommand;
import org.muma.rudis.common.RedisData;
import org.muma.rudis.common.RedisDataType;
import org.muma.rudis.common.RedisList;
import org.muma.rudis.protocol.*;
import org.muma.rudis.server.RedisContext;
import org.muma.rudis.store.StorageEngine;

public class LLenCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() != 2) return errorArgs("llen");

        RedisData<?> data = storage.get(arg(args, 1));
        if (data == null) return RedisInteger.ZERO;
        if (isWrongType(data, RedisDataType.LIST)) return wrongType();

        return new RedisInteger(data.getValue(RedisList.class).size());
    }
}
