package org.muma.rudis.command.impl.pubsub;

/**
 * UNSUBSCRIBE [channel ...]
 */
public class UnsubscribeCommand extends AbstractSubscribeCommand {

    public UnsubscribeCommand() {
        super("unsubscribe", false, false);
    }
}
