package org.muma.rudis.protocol;

/**
 * RESP 帧结构错误分类
 */
public enum RespError {
    /** 缓冲区数据不足一帧，需要等待更多字节 */
    NO_MORE_DATA,
    /** 长度或整数行不是合法的十进制数 */
    NOT_NUMBER,
    /** 数值超出范围 */
    OVERFLOW,
    /** 负长度、非 UTF-8 文本等无法转换的内容 */
    TYPE_CONVERSION,
    /** 未知类型标识或缺少行结束符 */
    UN_RESP
}
