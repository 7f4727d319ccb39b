package org.muma.rudis.command.impl.string;

import org.muma.rudis.command.RedisCommand;
import org.muma.rudis.common.RedisData;
import org.muma.rudis.protocol.RedisArray;
import org.muma.rudis.protocol.RedisMessage;
import org.muma.rudis.protocol.SimpleString;
import org.muma.rudis.server.RedisContext;
import org.muma.rudis.store.StorageEngine;

/**
 * MSET key value [key value ...]
 */
public class MSetCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() < 3 || args.size() % 2 == 0) return errorArgs("mset");

        for (int i = 1; i < args.size(); i += 2) {
            storage.set(arg(args, i), RedisData.ofString(arg(args, i + 1)), -1);
        }
        return SimpleString.OK;
    }
}
