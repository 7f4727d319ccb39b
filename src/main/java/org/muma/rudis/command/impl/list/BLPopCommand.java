package org.muma.rudis.command.impl.list;

/**
 * BLPOP key [key ...] timeout
 */
public class BLPopCommand extends AbstractBlockingPopCommand {

    public BLPopCommand() {
        super("blpop", true);
    }
}
