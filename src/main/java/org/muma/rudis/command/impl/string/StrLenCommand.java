package org.muma.rudis.command.impl.string;

import org.muma.rudis.command.RedisCommand;
import org.muma.rudis.common.RedisData;
import org.muma.rudis.common.RedisDataType;
import org.muma.rudis.protocol.RedisArray;
import org.muma.rudis.protocol.RedisInteger;
import org.muma.rudis.protocol.RedisMessage;
import org.muma.rudis.server.RedisContext;
import org.muma.rudis.store.StorageEngine;

import java.nio.charset.StandardCharsets;

public class StrLenCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() != 2) return errorArgs("strlen");

        RedisData<?> data = storage.get(arg(args, 1));
        if (data == null) return RedisInteger.ZERO;
        if (isWrongType(data, RedisDataType.STRING)) return wrongType();

        return new RedisInteger(data.getValue(String.class).getBytes(StandardCharsets.UTF_8).length);
    }
}
