package org.muma.rudis.command.impl.pubsub;

/**
 * PUNSUBSCRIBE [pattern ...]
 */
public class PUnsubscribeCommand extends AbstractSubscribeCommand {

    public PUnsubscribeCommand() {
        super("punsubscribe", true, false);
    }
}
