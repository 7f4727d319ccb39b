package org.muma.rudis.aof;

import org.muma.rudis.common.RedisData;
import org.muma.rudis.common.RedisDataType;
import org.muma.rudis.protocol.BulkString;
import org.muma.rudis.protocol.RedisArray;
import org.muma.rudis.protocol.RedisMessage;
import org.muma.rudis.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * 把一条 AOF 记录应用到存储。
 * <p>
 * 重放时存储未挂 AofManager，所以这里的写入不会再次追加到 AOF。
 * 每条记录都是"实际生效的效果"，不做参数合法性以外的业务判断。
 */
public class AofCommandApplier {

    private static final Logger log = LoggerFactory.getLogger(AofCommandApplier.class);

    private final StorageEngine storage;

    public AofCommandApplier(StorageEngine storage) {
        this.storage = storage;
    }

    /**
     * @return false 表示不支持的命令，已跳过
     * @throws IllegalArgumentException 参数个数或数值不合法
     * @throws IllegalStateException    与现有 key 类型冲突
     */
    public boolean apply(RedisArray command) {
        String[] argv = toStrings(command);
        if (argv.length == 0) {
            throw new IllegalArgumentException("empty command");
        }

        String name = argv[0].toLowerCase(Locale.ROOT);
        switch (name) {
            case "set" -> applySet(argv);
            case "del" -> {
                requireArgs(argv, 2);
                for (int i = 1; i < argv.length; i++) storage.del(argv[i]);
            }
            case "hset" -> {
                requireArgs(argv, 4);
                if ((argv.length - 2) % 2 != 0) throw new IllegalArgumentException("odd field/value count");
                requireType(argv[1], RedisDataType.HASH);
                for (int i = 2; i < argv.length; i += 2) storage.hset(argv[1], argv[i], argv[i + 1]);
            }
            case "hdel" -> {
                requireArgs(argv, 3);
                requireType(argv[1], RedisDataType.HASH);
                for (int i = 2; i < argv.length; i++) storage.hdel(argv[1], argv[i]);
            }
            case "lpush", "rpush" -> {
                requireArgs(argv, 3);
                requireType(argv[1], RedisDataType.LIST);
                List<String> values = Arrays.asList(argv).subList(2, argv.length);
                if (name.equals("lpush")) storage.lpush(argv[1], values);
                else storage.rpush(argv[1], values);
            }
            case "lpop", "rpop" -> {
                requireArgs(argv, 2);
                requireType(argv[1], RedisDataType.LIST);
                int count = argv.length > 2 ? (int) parseLong(argv[2]) : 1;
                if (name.equals("lpop")) storage.lpop(argv[1], count);
                else storage.rpop(argv[1], count);
            }
            case "lset" -> {
                requireArgs(argv, 4);
                requireType(argv[1], RedisDataType.LIST);
                storage.lset(argv[1], parseLong(argv[2]), argv[3]);
            }
            case "lrem" -> {
                requireArgs(argv, 4);
                requireType(argv[1], RedisDataType.LIST);
                storage.lrem(argv[1], parseLong(argv[2]), argv[3]);
            }
            case "ltrim" -> {
                requireArgs(argv, 4);
                requireType(argv[1], RedisDataType.LIST);
                storage.ltrim(argv[1], parseLong(argv[2]), parseLong(argv[3]));
            }
            default -> {
                log.warn("Unsupported command in AOF: {}", argv[0]);
                return false;
            }
        }
        return true;
    }

    /**
     * SET key value [PXAT ms]
     * 兼容旧格式 SET key value ms，第三个参数同样按绝对时间戳解释。
     */
    private void applySet(String[] argv) {
        requireArgs(argv, 3);
        String key = argv[1];
        long expireAt = -1;
        if (argv.length == 5 && argv[3].equalsIgnoreCase("PXAT")) {
            expireAt = parseLong(argv[4]);
        } else if (argv.length == 4) {
            expireAt = parseLong(argv[3]);
        } else if (argv.length != 3) {
            throw new IllegalArgumentException("malformed SET record");
        }

        if (expireAt != -1 && expireAt <= System.currentTimeMillis()) {
            // 记录写入时有效，但现在已经过期
            storage.del(key);
            return;
        }
        RedisData<String> data = RedisData.ofString(argv[2]);
        data.setExpireAt(expireAt);
        storage.put(key, data);
    }

    private void requireType(String key, RedisDataType type) {
        RedisData<?> existing = storage.get(key);
        if (existing != null && existing.getType() != type) {
            throw new IllegalStateException("key '" + key + "' holds " + existing.getType() + ", expected " + type);
        }
    }

    private static void requireArgs(String[] argv, int min) {
        if (argv.length < min) {
            throw new IllegalArgumentException("wrong number of arguments for '" + argv[0] + "'");
        }
    }

    private static long parseLong(String s) {
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not an integer: " + s);
        }
    }

    private static String[] toStrings(RedisArray command) {
        if (command.elements() == null) return new String[0];
        List<String> out = new ArrayList<>(command.size());
        for (RedisMessage element : command.elements()) {
            if (!(element instanceof BulkString bulk) || bulk.isNull()) {
                throw new IllegalArgumentException("AOF record elements must be bulk strings");
            }
            out.add(bulk.asString());
        }
        return out.toArray(new String[0]);
    }
}
