package org.muma.rudis.command.impl.list;

import org.muma.rudis.command.RedisCommand;
import org.muma.rudis.common.RedisDataType;
import org.muma.rudis.protocol.*;
import org.muma.rudis.server.BlockingContext;
import org.muma.rudis.server.RedisContext;
import org.muma.rudis.store.StorageEngine;

import java.util.ArrayList;
import java.util.List;

/**
 * BLPOP / BRPOP 公共逻辑：key [key ...] timeout
 * <p>
 * 有数据则立即弹出；否则注册到 BlockingManager 并返回 NoReply，连接保持挂起，
 * 直到有数据推入 (返回 [key, value]) 或超时 (返回 nil 数组)。
 * 弹出通过存储层完成，AOF 中记录为 LPOP/RPOP。
 */
public abstract class AbstractBlockingPopCommand implements RedisCommand {

    private final String name;
    private final boolean leftPop;

    protected AbstractBlockingPopCommand(String name, boolean leftPop) {
        this.name = name;
        this.leftPop = leftPop;
    }

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context) {
        if (args.size() < 3) return errorArgs(name);

        List<String> keys = new ArrayList<>();
        for (int i = 1; i < args.size() - 1; i++) {
            keys.add(arg(args, i));
        }

        double timeout;
        try {
            timeout = Double.parseDouble(arg(args, args.size() - 1));
        } catch (NumberFormatException e) {
            return new ErrorMessage("ERR timeout is not a float or out of range");
        }
        if (timeout < 0 || Double.isNaN(timeout) || Double.isInfinite(timeout)) {
            return new ErrorMessage("ERR timeout is negative");
        }

        // 1. 先检查类型，再尝试非阻塞弹出
        for (String key : keys) {
            if (isWrongType(storage.get(key), RedisDataType.LIST)) return wrongType();
        }
        for (String key : keys) {
            if (storage.get(key) == null) continue;
            List<String> popped = leftPop ? storage.lpop(key, 1) : storage.rpop(key, 1);
            if (!popped.isEmpty()) {
                return new RedisArray(new RedisMessage[]{
                        new BulkString(key),
                        new BulkString(popped.get(0))
                });
            }
        }

        // 2. 没数据，进入阻塞模式，等待推入唤醒
        BlockingContext waiter = storage.getBlockingManager().addWait(context.getNettyCtx(), keys, timeout, leftPop);
        context.setBlocking(waiter);
        return NoReply.INSTANCE;
    }
}
