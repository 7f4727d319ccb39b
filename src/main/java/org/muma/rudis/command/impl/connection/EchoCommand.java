package org.muma.rudis.command.impl.connection;

import org.muma.rudis.command.RedisCommand;
import org.muma.rudis.protocol.RedisArray;
import org.muma.rudis.protocol.RedisMessage;
import org.muma.rudis.server.RedisContext;
import org.muma.rudis.store.StorageEngine;

public class EchoCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() != 2) return errorArgs("echo");
        return args.elements()[1];
    }
}
