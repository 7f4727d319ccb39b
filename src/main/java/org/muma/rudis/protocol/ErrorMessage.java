package org.muma.rudis.protocol;

// 2. 错误 (-)
public record ErrorMessage(String content) implements RedisMessage {

    public static final ErrorMessage WRONG_TYPE =
            new ErrorMessage("WRONGTYPE Operation against a key holding the wrong kind of value");
    public static final ErrorMessage SYNTAX = new ErrorMessage("ERR syntax error");
}
