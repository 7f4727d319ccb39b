package org.muma.rudis.command.impl.string;

import org.muma.rudis.command.RedisCommand;
import org.muma.rudis.common.RedisData;
import org.muma.rudis.common.RedisDataType;
import org.muma.rudis.protocol.BulkString;
import org.muma.rudis.protocol.RedisArray;
import org.muma.rudis.protocol.RedisMessage;
import org.muma.rudis.server.RedisContext;
import org.muma.rudis.store.StorageEngine;

/**
 * MGET key [key ...]
 * 不存在或非字符串类型的 key 返回 nil
 */
public class MGetCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() < 2) return errorArgs("mget");

        RedisMessage[] result = new RedisMessage[args.size() - 1];
        for (int i = 1; i < args.size(); i++) {
            RedisData<?> data = storage.get(arg(args, i));
            if (data == null || data.getType() != RedisDataType.STRING) {
                result[i - 1] = BulkString.NULL;
            } else {
                result[i - 1] = new BulkString(data.getValue(String.class));
            }
        }
        return new RedisArray(result);
    }
}
