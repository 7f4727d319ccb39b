package org.muma.rudis.command;

import org.muma.rudis.command.impl.connection.EchoCommand;
import org.muma.rudis.command.impl.connection.PingCommand;
import org.muma.rudis.command.impl.connection.SelectCommand;
import org.muma.rudis.command.impl.hash.*;
import org.muma.rudis.command.impl.key.DelCommand;
import org.muma.rudis.command.impl.key.ExistsCommand;
import org.muma.rudis.command.impl.list.*;
import org.muma.rudis.command.impl.pubsub.*;
import org.muma.rudis.command.impl.string.*;
import org.muma.rudis.protocol.BulkString;
import org.muma.rudis.protocol.ErrorMessage;
import org.muma.rudis.protocol.RedisArray;
import org.muma.rudis.protocol.RedisMessage;
import org.muma.rudis.server.RedisContext;
import org.muma.rudis.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 命令注册与分发
 * <p>
 * 每条命令在存储锁内整体执行，跨连接的执行顺序即加锁顺序。
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    // 订阅模式下允许的命令
    private static final Set<String> SUBSCRIBED_MODE_COMMANDS =
            Set.of("SUBSCRIBE", "PSUBSCRIBE", "UNSUBSCRIBE", "PUNSUBSCRIBE", "PING", "QUIT");

    private static final long SLOW_COMMAND_MS = 10;

    private final Map<String, RedisCommand> commandMap = new HashMap<>();
    private final StorageEngine storage;

    public CommandDispatcher(StorageEngine storage) {
        this.storage = storage;
        this.initCommandRegistry();
    }

    /**
     * 初始化命令注册表，按数据结构分类注册
     */
    private void initCommandRegistry() {
        registerGenericCommands();
        registerStringCommands();
        registerHashCommands();
        registerListCommands();
        registerPubSubCommands();

        log.info("CommandDispatcher initialized. Total commands registered: {}", commandMap.size());
    }

    private void registerGenericCommands() {
        commandMap.put("PING", new PingCommand());
        commandMap.put("ECHO", new EchoCommand());
        commandMap.put("SELECT", new SelectCommand());
        commandMap.put("DEL", new DelCommand());
        commandMap.put("EXISTS", new ExistsCommand());
    }

    private void registerStringCommands() {
        commandMap.put("SET", new SetCommand());
        commandMap.put("GET", new GetCommand());
        commandMap.put("APPEND", new AppendCommand());
        commandMap.put("STRLEN", new StrLenCommand());
        commandMap.put("INCR", new IncrCommand());
        commandMap.put("DECR", new DecrCommand());
        commandMap.put("INCRBY", new IncrByCommand());
        commandMap.put("DECRBY", new DecrByCommand());
        commandMap.put("MGET", new MGetCommand());
        commandMap.put("MSET", new MSetCommand());
        commandMap.put("MSETNX", new MSetNxCommand());
    }

    private void registerHashCommands() {
        commandMap.put("HSET", new HSetCommand());
        commandMap.put("HMSET", new HMSetCommand());
        commandMap.put("HSETNX", new HSetNxCommand());
        commandMap.put("HGET", new HGetCommand());
        commandMap.put("HMGET", new HMGetCommand());
        commandMap.put("HDEL", new HDelCommand());
        commandMap.put("HEXISTS", new HExistsCommand());
        commandMap.put("HLEN", new HLenCommand());
        commandMap.put("HKEYS", new HKeysCommand());
        commandMap.put("HVALS", new HValsCommand());
        commandMap.put("HGETALL", new HGetAllCommand());
    }

    private void registerListCommands() {
        commandMap.put("LPUSH", new LPushCommand());
        commandMap.put("RPUSH", new RPushCommand());
        commandMap.put("LPOP", new LPopCommand());
        commandMap.put("RPOP", new RPopCommand());
        commandMap.put("LLEN", new LLenCommand());
        commandMap.put("LINDEX", new LIndexCommand());
        commandMap.put("LRANGE", new LRangeCommand());
        commandMap.put("LSET", new LSetCommand());
        commandMap.put("LREM", new LRemCommand());
        commandMap.put("LTRIM", new LTrimCommand());

        // blocking
        commandMap.put("BLPOP", new BLPopCommand());
        commandMap.put("BRPOP", new BRPopCommand());
    }

    private void registerPubSubCommands() {
        commandMap.put("PUBLISH", new PublishCommand());
        commandMap.put("SUBSCRIBE", new SubscribeCommand());
        commandMap.put("PSUBSCRIBE", new PSubscribeCommand());
        commandMap.put("UNSUBSCRIBE", new UnsubscribeCommand());
        commandMap.put("PUNSUBSCRIBE", new PUnsubscribeCommand());
    }

    public boolean isRegistered(String commandName) {
        return commandMap.containsKey(commandName.toUpperCase(Locale.ROOT));
    }

    /**
     * 核心分发逻辑。args 的所有元素必须是非 null 的 BulkString (由 Handler 保证)。
     */
    public RedisMessage dispatch(RedisArray args, RedisContext context) {
        String commandName = ((BulkString) args.elements()[0]).asString();
        String cmdUpper = commandName.toUpperCase(Locale.ROOT);

        // 1. 查找命令
        RedisCommand command = commandMap.get(cmdUpper);
        if (command == null) {
            log.warn("Command not found: {}", commandName);
            return new ErrorMessage("ERR unknown command '" + commandName + "'");
        }

        // 2. 订阅模式限制
        if (context != null && context.isSubscribed() && !SUBSCRIBED_MODE_COMMANDS.contains(cmdUpper)) {
            return new ErrorMessage("ERR Can't execute '" + commandName.toLowerCase(Locale.ROOT)
                    + "': only (P)SUBSCRIBE / (P)UNSUBSCRIBE / PING / QUIT are allowed in this context");
        }

        // 3. 加锁执行并监控耗时
        long startTime = System.nanoTime();
        try {
            RedisMessage response;
            synchronized (storage.getLock()) {
                response = command.execute(storage, args, context);
            }

            long duration = (System.nanoTime() - startTime) / 1_000_000;
            if (duration > SLOW_COMMAND_MS) {
                log.warn("Slow command detected: {} cost {}ms", cmdUpper, duration);
            } else if (log.isDebugEnabled()) {
                log.debug("Command executed: {} cost {}ms", cmdUpper, duration);
            }
            return response;

        } catch (IllegalArgumentException | IllegalStateException e) {
            // 预期内的业务错误 (如下标越界)
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.warn("Command execution failed (Client Error): {} - {}", cmdUpper, reason);
            return new ErrorMessage("ERR " + reason);

        } catch (Exception e) {
            log.error("Internal Server Error processing command: {}", cmdUpper, e);
            return new ErrorMessage("ERR internal server error");
        }
    }
}
