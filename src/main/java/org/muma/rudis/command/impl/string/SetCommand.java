package org.muma.rudis.command.impl.string;

import org.muma.rudis.command.RedisCommand;
import org.muma.rudis.common.RedisData;
import org.muma.rudis.protocol.*;
import org.muma.rudis.server.RedisContext;
import org.muma.rudis.store.StorageEngine;

import java.util.Locale;

/**
 * SET key value [EX seconds | PX milliseconds] [NX | XX]
 * <p>
 * 不带过期参数时会清除旧的 TTL。AOF 里记录为 SET key value [PXAT 绝对时间]。
 */
public class SetCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        RedisMessage[] elements = args.elements();
        if (elements.length < 3) return errorArgs("set");

        String key = arg(args, 1);
        String value = arg(args, 2);

        // --- 1. 参数解析阶段 ---
        boolean nx = false;
        boolean xx = false;
        long ttlMillis = -1;

        for (int i = 3; i < elements.length; i++) {
            String opt = arg(args, i).toUpperCase(Locale.ROOT);
            switch (opt) {
                case "NX" -> {
                    if (xx) return ErrorMessage.SYNTAX;
                    nx = true;
                }
                case "XX" -> {
                    if (nx) return ErrorMessage.SYNTAX;
                    xx = true;
                }
                case "EX", "PX" -> {
                    if (ttlMillis != -1 || i + 1 >= elements.length) return ErrorMessage.SYNTAX;
                    long amount;
                    try {
                        amount = Long.parseLong(arg(args, ++i));
                    } catch (NumberFormatException e) {
                        return errorInt();
                    }
                    if (amount <= 0) return new ErrorMessage("ERR invalid expire time in 'set' command");
                    try {
                        ttlMillis = opt.equals("EX") ? Math.multiplyExact(amount, 1000L) : amount;
                    } catch (ArithmeticException e) {
                        return new ErrorMessage("ERR invalid expire time in 'set' command");
                    }
                }
                default -> {
                    return ErrorMessage.SYNTAX;
                }
            }
        }

        // --- 2. NX/XX 检查 (调用方已持有存储锁) ---
        boolean exists = storage.exists(key);
        if ((nx && exists) || (xx && !exists)) {
            return BulkString.NULL;
        }

        // --- 3. 写入 ---
        storage.set(key, RedisData.ofString(value), ttlMillis);
        return SimpleString.OK;
    }
}
