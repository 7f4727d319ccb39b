package org.muma.rudis.command.impl.pubsub;

/**
 * PSUBSCRIBE pattern [pattern ...]
 */
public class PSubscribeCommand extends AbstractSubscribeCommand {

    public PSubscribeCommand() {
        super("psubscribe", true, true);
    }
}
