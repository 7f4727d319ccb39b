package org.muma.rudis.command.impl.string;

import org.muma.rudis.protocol.RedisArray;

/**
 * INCRBY key increment
 */
public class IncrByCommand extends AbstractIncrCommand {

    public IncrByCommand() {
        super("incrby", 3);
    }

    @Override
    protected long delta(RedisArray args) {
        return Long.parseLong(arg(args, 2));
    }
}
