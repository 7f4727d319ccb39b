package org.muma.rudis.command.impl.string;

import org.muma.rudis.command.RedisCommand;
import org.muma.rudis.common.RedisData;
import org.muma.rudis.protocol.RedisArray;
import org.muma.rudis.protocol.RedisInteger;
import org.muma.rudis.protocol.RedisMessage;
import org.muma.rudis.server.RedisContext;
import org.muma.rudis.store.StorageEngine;

/**
 * MSETNX key value [key value ...]
 * 只要有一个 key 已存在就整体不写，返回 0
 */
public class MSetNxCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() < 3 || args.size() % 2 == 0) return errorArgs("msetnx");

        for (int i = 1; i < args.size(); i += 2) {
            if (storage.exists(arg(args, i))) {
                return RedisInteger.ZERO;
            }
        }
        for (int i = 1; i < args.size(); i += 2) {
            storage.set(arg(args, i), RedisData.ofString(arg(args, i + 1)), -1);
        }
        return RedisInteger.ONE;
    }
}
