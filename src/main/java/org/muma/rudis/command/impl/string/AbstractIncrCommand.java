package org.muma.rudis.command.impl.string;

import org.muma.rudis.command.RedisCommand;
import org.muma.rudis.common.RedisData;
import org.muma.rudis.common.RedisDataType;
import org.muma.rudis.protocol.ErrorMessage;
import org.muma.rudis.protocol.RedisArray;
import org.muma.rudis.protocol.RedisInteger;
import org.muma.rudis.protocol.RedisMessage;
import org.muma.rudis.server.RedisContext;
import org.muma.rudis.store.StorageEngine;

/**
 * INCR / DECR / INCRBY / DECRBY 的公共逻辑
 * <p>
 * 不存在的 key 按 0 处理；结果以 SET 的形式写入 AOF，保留原有 TTL。
 */
public abstract class AbstractIncrCommand implements RedisCommand {

    private final String name;
    private final int arity;

    protected AbstractIncrCommand(String name, int arity) {
        this.name = name;
        this.arity = arity;
    }

    /**
     * 本次增量
     *
     * @throws NumberFormatException 参数不是整数
     */
    protected abstract long delta(RedisArray args);

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() != arity) return errorArgs(name);

        long delta;
        try {
            delta = delta(args);
        } catch (NumberFormatException | ArithmeticException e) {
            return errorInt();
        }

        String key = arg(args, 1);
        RedisData<?> data = storage.get(key);
        if (isWrongType(data, RedisDataType.STRING)) return wrongType();

        long current = 0;
        if (data != null) {
            try {
                current = Long.parseLong(data.getValue(String.class));
            } catch (NumberFormatException e) {
                return errorInt();
            }
        }

        long result;
        try {
            result = Math.addExact(current, delta);
        } catch (ArithmeticException e) {
            return new ErrorMessage("ERR increment or decrement would overflow");
        }

        RedisData<String> updated = RedisData.ofString(String.valueOf(result));
        if (data != null) {
            updated.setExpireAt(data.getExpireAt());
        }
        storage.put(key, updated);
        return new RedisInteger(result);
    }
}
