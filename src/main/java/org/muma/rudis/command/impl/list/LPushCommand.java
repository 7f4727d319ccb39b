package org.muma.rudis.command.impl.list;

import org.muma.rudis.store.StorageEngine;

import java.util.List;

/**
 * LPUSH key element [element ...]
 * LPUSH mylist a b c -> c, b, a
 */
public class LPushCommand extends AbstractPushCommand {

    public LPushCommand() {
        super("lpush");
    }

    @Override
    protected int push(StorageEngine storage, String key, List<String> values) {
        return storage.lpush(key, values);
    }
}
