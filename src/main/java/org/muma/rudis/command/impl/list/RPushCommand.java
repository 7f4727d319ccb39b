package org.muma.rudis.command.impl.list;

import org.muma.rudis.store.StorageEngine;

import java.util.List;

/**
 * RPUSH key element [element ...]
 */
public class RPushCommand extends AbstractPushCommand {

    public RPushCommand() {
        super("rpush");
    }

    @Override
    protected int push(StorageEngine storage, String key, List<String> values) {
        return storage.rpush(key, values);
    }
}
