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

/**
 * APPEND key value
 * 返回追加后的字节长度，保留原有 TTL
 */
public class AppendCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() != 3) return errorArgs("append");

        String key = arg(args, 1);
        RedisData<?> data = storage.get(key);
        if (isWrongType(data, RedisDataType.STRING)) return wrongType();

        String current = data == null ? "" : data.getValue(String.class);
        RedisData<String> updated = RedisData.ofString(current + arg(args, 2));
        if (data != null) {
            updated.setExpireAt(data.getExpireAt());
        }
        storage.put(key, updated);
        return new RedisInteger(updated.getData().getBytes(StandardCharsets.UTF_8).length);
    }
}
