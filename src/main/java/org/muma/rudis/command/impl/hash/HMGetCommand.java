package org.muma.rudis.command.impl.hash;

import org.muma.rudis.command.RedisCommand;
import org.muma.rudis.common.RedisData;
import org.muma.rudis.common.RedisDataType;
import org.muma.rudis.common.RedisHash;
import org.muma.rudis.protocol.*;
import org.muma.rudis.server.RedisContext;
import org.muma.rudis.store.StorageEngine;

/**
 * HMGET key field [field ...]
 */
public class HMGetCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() < 3) return errorArgs("hmget");

        RedisData<?> data = storage.get(arg(args, 1));
        if (isWrongType(data, RedisDataType.HASH)) return wrongType();
        RedisHash hash = data == null ? null : data.getValue(RedisHash.class);

        RedisMessage[] result = new RedisMessage[args.size() - 2];
        for (int i = 2; i < args.size(); i++) {
            result[i - 2] = hash == null ? BulkString.NULL : new BulkString(hash.get(arg(args, i)));
        }
        return new RedisArray(result);
    }
}
