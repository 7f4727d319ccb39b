package org.muma.rudis.command.impl.pubsub;

/**
 * SUBSCRIBE channel [channel ...]
 */
public class SubscribeCommand extends AbstractSubscribeCommand {

    public SubscribeCommand() {
        super("subscribe", false, true);
    }
}
