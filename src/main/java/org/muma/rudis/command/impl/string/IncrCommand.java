package org.muma.rudis.command.impl.string;

import org.muma.rudis.protocol.RedisArray;

public class IncrCommand extends AbstractIncrCommand {

    public IncrCommand() {
        super("incr", 2);
    }

    @Override
    protected long delta(RedisArray args) {
        return 1;
    }
}
