package org.muma.rudis.command.impl.connection;

import org.muma.rudis.command.RedisCommand;
import org.muma.rudis.protocol.BulkString;
import org.muma.rudis.protocol.RedisArray;
import org.muma.rudis.protocol.RedisMessage;
import org.muma.rudis.protocol.SimpleString;
import org.muma.rudis.server.RedisContext;
import org.muma.rudis.store.StorageEngine;

/**
 * PING [message]
 */
public class PingCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        return switch (args.size()) {
            case 1 -> SimpleString.PONG;
            case 2 -> new BulkString(arg(args, 1));
            default -> errorArgs("ping");
        };
    }
}
