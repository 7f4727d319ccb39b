package org.muma.rudis.command.impl.hash;

import org.muma.rudis.command.RedisCommand;
import org.muma.rudis.common.RedisData;
import org.muma.rudis.common.RedisDataType;
import org.muma.rudis.common.RedisHash;
import org.muma.rudis.protocol.*;
import org.muma.rudis.server.RedisContext;
import org.muma.rudis.store.StorageEngine;

import java.util.ArrayList;

public class HKeysCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() != 2) return errorArgs("hkeys");

        RedisData<?> data = storage.get(arg(args, 1));
        if (data == null) return RedisArray.EMPTY;
        if (isWrongType(data, RedisDataType.HASH)) return wrongType();

        return bulkArray(new ArrayList<>(data.getValue(RedisHash.class).toMap().keySet()));
    }
}
