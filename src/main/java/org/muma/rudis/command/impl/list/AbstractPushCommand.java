package org.muma.rudis.command.impl.list;

import org.muma.rudis.command.RedisCommand;
import org.muma.rudis.common.RedisDataType;
import org.muma.rudis.protocol.*;
import org.muma.rudis.server.RedisContext;
import org.muma.rudis.store.StorageEngine;

import java.util.ArrayList;
import java.util.List;

/**
 * LPUSH / RPUSH 公共逻辑：key [element ...]
 * 推入后会唤醒阻塞在该 key 上的客户端 (由存储层触发)
 */
public abstract class AbstractPushCommand implements RedisCommand {

    private final String name;

    protected AbstractPushCommand(String name) {
        this.name = name;
    }

    protected abstract int push(StorageEngine storage, String key, List<String> values);

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() < 3) return errorArgs(name);

        String key = arg(args, 1);
        if (isWrongType(storage.get(key), RedisDataType.LIST)) return wrongType();

        List<String> values = new ArrayList<>(args.size() - 2);
        for (int i = 2; i < args.size(); i++) {
            values.add(arg(args, i));
        }
        return new RedisInteger(push(storage, key, values));
    }
}
