package org.muma.rudis.command.impl.string;

import org.muma.rudis.command.RedisCommand;
import org.muma.rudis.common.RedisData;
import org.muma.rudis.common.RedisDataType;
import org.muma.rudis.protocol.BulkString;
import org.muma.rudis.protocol.RedisArray;
import org.muma.rudis.protocol.RedisMessage;
import org.muma.rudis.server.RedisContext;
import org.muma.rudis.store.StorageEngine;

public class GetCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() != 2) return errorArgs("get");

        RedisData<?> data = storage.get(arg(args, 1));
        if (data == null) return BulkString.NULL;
        if (isWrongType(data, RedisDataType.STRING)) return wrongType();

        return new BulkString(data.getValue(String.class));
    }
}
