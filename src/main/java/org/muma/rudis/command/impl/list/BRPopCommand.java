package org.muma.rudis.command.impl.list;

/**
 * BRPOP key [key ...] timeout
 */
public class BRPopCommand extends AbstractBlockingPopCommand {

    public BRPopCommand() {
        super("brpop", false);
    }
}
