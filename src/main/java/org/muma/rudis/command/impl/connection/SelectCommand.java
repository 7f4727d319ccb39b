package org.muma.rudis.command.impl.connection;

import org.muma.rudis.command.RedisCommand;
import org.muma.rudis.protocol.RedisArray;
import org.muma.rudis.protocol.RedisMessage;
import org.muma.rudis.protocol.SimpleString;
import org.muma.rudis.server.RedisContext;
import org.muma.rudis.store.StorageEngine;

/**
 * SELECT index
 * <p>
 * 只有一个库：校验下标后直接返回 OK。
 */
public class SelectCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() != 2) return errorArgs("select");
        try {
            Integer.parseInt(arg(args, 1));
        } catch (NumberFormatException e) {
            return errorInt();
        }
        return SimpleString.OK;
    }
}
