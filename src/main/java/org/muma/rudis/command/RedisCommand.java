package org.muma.rudis.command;

import org.muma.rudis.common.RedisData;
import org.muma.rudis.common.RedisDataType;
import org.muma.rudis.protocol.BulkString;
import org.muma.rudis.protocol.ErrorMessage;
import org.muma.rudis.protocol.RedisArray;
import org.muma.rudis.protocol.RedisMessage;
import org.muma.rudis.server.RedisContext;
import org.muma.rudis.store.StorageEngine;

import java.util.List;

public interface RedisCommand {

    /**
     * 执行命令。调用方 (CommandDispatcher) 在整个执行期间持有存储锁。
     * 参数校验必须在访问存储之前完成。
     */
    RedisMessage execute(StorageEngine storage, RedisArray args, RedisContext context);

    /**
     * 取第 i 个参数 (0 是命令名)
     */
    default String arg(RedisArray args, int i) {
        return ((BulkString) args.elements()[i]).asString();
    }

    /**
     * 快速构建参数个数错误
     */
    default ErrorMessage errorArgs(String cmd) {
        return new ErrorMessage("ERR wrong number of arguments for '" + cmd + "' command");
    }

    /**
     * 快速构建数值错误
     */
    default ErrorMessage errorInt() {
        return new ErrorMessage("ERR value is not an integer or out of range");
    }

    default ErrorMessage wrongType() {
        return ErrorMessage.WRONG_TYPE;
    }

    /**
     * 存在且类型不符
     */
    default boolean isWrongType(RedisData<?> data, RedisDataType expected) {
        return data != null && data.getType() != expected;
    }

    /**
     * 字符串列表转 Bulk 数组
     */
    default RedisArray bulkArray(List<String> items) {
        RedisMessage[] result = new RedisMessage[items.size()];
        for (int i = 0; i < items.size(); i++) {
            result[i] = new BulkString(items.get(i));
        }
        return new RedisArray(result);
    }
}
