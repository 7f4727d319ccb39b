package org.muma.rudis.command.impl.key;

import org.muma.rudis.command.RedisCommand;
import org.muma.rudis.protocol.RedisArray;
import org.muma.rudis.protocol.RedisInteger;
import org.muma.rudis.protocol.RedisMessage;
import org.muma.rudis.server.RedisContext;
import org.muma.rudis.store.StorageEngine;

/**
 * DEL key [key ...]
 */
public class DelCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() < 2) return errorArgs("del");

        int deleted = 0;
        for (int i = 1; i < args.size(); i++) {
            if (storage.del(arg(args, i))) {
                deleted++;
            }
        }
        return new RedisInteger(deleted);
    }
}
