package org.muma.rudis.command.impl.hash;

import org.muma.rudis.command.RedisCommand;
import org.muma.rudis.common.RedisData;
import org.muma.rudis.common.RedisDataType;
import org.muma.rudis.common.RedisHash;
import org.muma.rudis.protocol.*;
import org.muma.rudis.server.RedisContext;
import org.muma.rudis.store.StorageEngine;

public class HGetCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() != 3) return errorArgs("hget");

        RedisData<?> data = storage.get(arg(args, 1));
        if (data == null) return BulkString.NULL;
        if (isWrongType(data, RedisDataType.HASH)) return wrongType();

        return new BulkString(data.getValue(RedisHash.class).get(arg(args, 2)));
    }
}
