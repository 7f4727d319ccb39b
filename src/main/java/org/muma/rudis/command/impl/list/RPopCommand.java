package org.muma.rudis.command.impl.list;

import org.muma.rudis.store.StorageEngine;

import java.util.List;

public class RPopCommand extends AbstractPopCommand {

    public RPopCommand() {
        super("rpop");
    }

    @Override
    protected List<String> pop(StorageEngine storage, String key, int count) {
        return storage.rpop(key, count);
    }
}
