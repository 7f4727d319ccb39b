package org.muma.rudis.command.impl.hash;

import org.muma.rudis.command.RedisCommand;
import org.muma.rudis.common.RedisData;
import org.muma.rudis.common.RedisDataType;
import org.muma.rudis.common.RedisHash;
import org.muma.rudis.protocol.*;
import org.muma.rudis.server.RedisContext;
import org.muma.rudis.store.StorageEngine;

import java.util.Map;

/**
 * HGETALL key
 * 返回 field1, value1, field2, value2 ... 的扁平数组
 */
public class HGetAllCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() != 2) return errorArgs("hgetall");

        RedisData<?> data = storage.get(arg(args, 1));
        if (data == null) return RedisArray.EMPTY;
        if (isWrongType(data, RedisDataType.HASH)) return wrongType();

        Map<String, String> map = data.getValue(RedisHash.class).toMap();
        RedisMessage[] result = new RedisMessage[map.size() * 2];
        int i = 0;
        for (Map.Entry<String, String> entry : map.entrySet()) {
            result[i++] = new BulkString(entry.getKey());
            result[i++] = new BulkString(entry.getValue());
        }
        return new RedisArray(result);
    }
}
