package org.muma.rudis.command.impl.list;

import org.muma.rudis.command.RedisCommand;
import org.muma.rudis.common.RedisData;
import org.muma.rudis.common.RedisDataType;
import org.muma.rudis.protocol.*;
import org.muma.rudis.server.RedisContext;
import org.muma.rudis.store.StorageEngine;

import java.util.List;

/**
 * LPOP / RPOP 公共逻辑：key [count]
 * <p>
 * 不带 count 返回单个元素 (或 nil)；带 count 返回数组，key 不存在时返回 nil 数组。
 */
public abstract class AbstractPopCommand implements RedisCommand {

    private final String name;

    protected AbstractPopCommand(String name) {
        this.name = name;
    }

    protected abstract List<String> pop(StorageEngine storage, String key, int count);

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() != 2 && args.size() != 3) return errorArgs(name);

        boolean withCount = args.size() == 3;
        int count = 1;
        if (withCount) {
            try {
                count = Integer.parseInt(arg(args, 2));
            } catch (NumberFormatException e) {
                return errorInt();
            }
            if (count < 0) return new ErrorMessage("ERR value is out of range, must be positive");
        }

        String key = arg(args, 1);
        RedisData<?> data = storage.get(key);
        if (data == null) return withCount ? RedisArray.NULL : BulkString.NULL;
        if (isWrongType(data, RedisDataType.LIST)) return wrongType();

        List<String> popped = pop(storage, key, count);
        if (!withCount) {
            return popped.isEmpty() ? BulkString.NULL : new BulkString(popped.get(0));
        }
        return bulkArray(popped);
    }
}
