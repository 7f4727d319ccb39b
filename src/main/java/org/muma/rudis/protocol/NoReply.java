package org.muma.rudis.protocol;

/**
 * 占位响应：命令已处理，但此刻不向客户端回写任何内容。
 * 阻塞命令挂起、订阅确认已直接写出时返回它。
 */
public enum NoReply implements RedisMessage {
    INSTANCE
}
