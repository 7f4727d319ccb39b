package org.muma.rudis.command.impl.string;

import org.muma.rudis.protocol.RedisArray;

/**
 * DECRBY key decrement
 */
public class DecrByCommand extends AbstractIncrCommand {

    public DecrByCommand() {
        super("decrby", 3);
    }

    @Override
    protected long delta(RedisArray args) {
        return Math.negateExact(Long.parseLong(arg(args, 2)));
    }
}
