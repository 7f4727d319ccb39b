package org.muma.rudis.command.impl.string;

import org.muma.rudis.protocol.RedisArray;

public class DecrCommand extends AbstractIncrCommand {

    public DecrCommand() {
        super("decr", 2);
    }

    @Override
    protected long delta(RedisArray args) {
        return -1;
    }
}
