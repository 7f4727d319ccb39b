package org.muma.rudis.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * RESP 编解码核心 (无状态工具类)
 * <p>
 * 三个阶段:
 * 1. check: 只校验帧结构 (类型标识、声明长度、CRLF)，不构造对象，成功时 readerIndex 越过整帧。
 * 2. parse: 在 check 通过的区间上构造 {@link RedisMessage}。
 * 3. serialize: parse 的逆过程。
 * <p>
 * Netty 的 RespDecoder 与 AOF 重放共用这一套逻辑。
 */
public final class RespCodec {

    // RESP 协议常量
    private static final byte PLUS_BYTE = '+';
    private static final byte MINUS_BYTE = '-';
    private static final byte COLON_BYTE = ':';
    private static final byte DOLLAR_BYTE = '$';
    private static final byte ASTERISK_BYTE = '*';

    private static final byte CR = '\r';
    private static final byte LF = '\n';
    private static final byte[] CRLF = {CR, LF};
    private static final byte[] NULL_BULK = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] NULL_ARRAY = "*-1\r\n".getBytes(StandardCharsets.US_ASCII);

    // 与 Redis 一致的上限
    public static final int MAX_BULK_LENGTH = 512 * 1024 * 1024;
    public static final int MAX_ARRAY_LENGTH = 1024 * 1024;
    public static final int MAX_NESTING_DEPTH = 32;

    private RespCodec() {
    }

    // ---------------------------------------------------------------- check

    /**
     * 校验 readerIndex 处是否为一个完整合法的帧，成功时 readerIndex 移动到帧尾。
     *
     * @throws RespException 数据不足时为 NO_MORE_DATA，其余为结构错误
     */
    public static void check(ByteBuf in) {
        check(in, 0);
    }

    private static void check(ByteBuf in, int depth) {
        if (!in.isReadable()) {
            throw RespException.noMoreData();
        }
        byte type = in.readByte();
        switch (type) {
            case PLUS_BYTE, MINUS_BYTE -> skipLine(in);
            case COLON_BYTE -> readDecimal(in);
            case DOLLAR_BYTE -> {
                int len = readBulkLength(in);
                if (len >= 0) {
                    skipPayload(in, len);
                }
            }
            case ASTERISK_BYTE -> {
                if (depth >= MAX_NESTING_DEPTH) {
                    throw new RespException(RespError.OVERFLOW, "array nesting deeper than " + MAX_NESTING_DEPTH);
                }
                long count = readArrayLength(in);
                for (long i = 0; i < count; i++) {
                    check(in, depth + 1);
                }
            }
            default -> throw new RespException(RespError.UN_RESP, "unknown type byte 0x" + Integer.toHexString(type & 0xFF));
        }
    }

    // ---------------------------------------------------------------- parse

    /**
     * 解析 readerIndex 处的一个帧。调用方应先通过 {@link #check(ByteBuf)}。
     */
    public static RedisMessage parse(ByteBuf in) {
        if (!in.isReadable()) {
            throw RespException.noMoreData();
        }
        byte type = in.readByte();
        return switch (type) {
            case PLUS_BYTE -> new SimpleString(readUtf8Line(in));
            case MINUS_BYTE -> new ErrorMessage(readUtf8Line(in));
            case COLON_BYTE -> new RedisInteger(readDecimal(in));
            case DOLLAR_BYTE -> parseBulk(in);
            case ASTERISK_BYTE -> parseArray(in);
            default -> throw new RespException(RespError.UN_RESP, "unknown type byte 0x" + Integer.toHexString(type & 0xFF));
        };
    }

    private static BulkString parseBulk(ByteBuf in) {
        int len = readBulkLength(in);
        if (len < 0) {
            return BulkString.NULL;
        }
        if (in.readableBytes() < len + 2) {
            throw RespException.noMoreData();
        }
        byte[] content = new byte[len];
        in.readBytes(content);
        expectCrlf(in);
        return new BulkString(content);
    }

    private static RedisArray parseArray(ByteBuf in) {
        long count = readArrayLength(in);
        if (count < 0) {
            return RedisArray.NULL;
        }
        RedisMessage[] elements = new RedisMessage[(int) count];
        for (int i = 0; i < count; i++) {
            elements[i] = parse(in);
        }
        return new RedisArray(elements);
    }

    // ------------------------------------------------------------ serialize

    public static void serialize(RedisMessage msg, ByteBuf out) {
        if (msg == null) {
            throw new IllegalArgumentException("message must not be null");
        }
        write(msg, out);
    }

    private static void write(RedisMessage msg, ByteBuf out) {
        if (msg instanceof SimpleString s) {
            writeTextLine(out, PLUS_BYTE, s.content());
        } else if (msg instanceof ErrorMessage e) {
            writeTextLine(out, MINUS_BYTE, e.content());
        } else if (msg instanceof RedisInteger i) {
            writeLine(out, COLON_BYTE, String.valueOf(i.value()));
        } else if (msg instanceof BulkString b) {
            if (b.content() == null) {
                out.writeBytes(NULL_BULK);
            } else {
                writeLine(out, DOLLAR_BYTE, String.valueOf(b.content().length));
                out.writeBytes(b.content());
                out.writeBytes(CRLF);
            }
        } else if (msg instanceof RedisArray a) {
            if (a.elements() == null) {
                out.writeBytes(NULL_ARRAY);
            } else {
                writeLine(out, ASTERISK_BYTE, String.valueOf(a.elements().length));
                for (RedisMessage element : a.elements()) {
                    write(element, out);
                }
            }
        }
        // NoReply: 不输出任何字节
    }

    /**
     * 序列化为独立的字节数组 (AOF 记录、测试断言使用)
     */
    public static byte[] serialize(RedisMessage msg) {
        ByteBuf buf = Unpooled.buffer();
        try {
            serialize(msg, buf);
            return ByteBufUtil.getBytes(buf);
        } finally {
            buf.release();
        }
    }

    private static void writeLine(ByteBuf out, byte type, String line) {
        out.writeByte(type);
        out.writeBytes(line.getBytes(StandardCharsets.UTF_8));
        out.writeBytes(CRLF);
    }

    /**
     * 简单字符串与错误行不能含 CR/LF，按 Redis 的做法替换为空格
     */
    private static void writeTextLine(ByteBuf out, byte type, String line) {
        if (line.indexOf('\r') >= 0 || line.indexOf('\n') >= 0) {
            line = line.replace('\r', ' ').replace('\n', ' ');
        }
        writeLine(out, type, line);
    }

    // -------------------------------------------------------------- helpers

    /**
     * 定位当前行的 CR 下标 (CRLF 之前)，行不完整时抛 NO_MORE_DATA
     */
    private static int findLineEnd(ByteBuf in) {
        int start = in.readerIndex();
        int end = in.writerIndex();
        for (int i = start; i < end - 1; i++) {
            if (in.getByte(i) == CR && in.getByte(i + 1) == LF) {
                return i;
            }
        }
        throw RespException.noMoreData();
    }

    private static byte[] readLineBytes(ByteBuf in) {
        int cr = findLineEnd(in);
        byte[] line = new byte[cr - in.readerIndex()];
        in.readBytes(line);
        in.skipBytes(2);
        return line;
    }

    private static void skipLine(ByteBuf in) {
        int cr = findLineEnd(in);
        in.readerIndex(cr + 2);
    }

    private static String readUtf8Line(ByteBuf in) {
        byte[] line = readLineBytes(in);
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(line)).toString();
        } catch (CharacterCodingException e) {
            throw new RespException(RespError.TYPE_CONVERSION, "line is not valid UTF-8");
        }
    }

    private static long readDecimal(ByteBuf in) {
        String s = new String(readLineBytes(in), StandardCharsets.US_ASCII);
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            if (s.matches("-?\\d+")) {
                throw new RespException(RespError.OVERFLOW, "integer out of range: " + s);
            }
            throw new RespException(RespError.NOT_NUMBER, "not a number: '" + s + "'");
        }
    }

    /**
     * @return bulk 长度，-1 表示 null bulk
     */
    private static int readBulkLength(ByteBuf in) {
        long len = readDecimal(in);
        if (len == -1) {
            return -1;
        }
        if (len < 0) {
            throw new RespException(RespError.TYPE_CONVERSION, "negative bulk length " + len);
        }
        if (len > MAX_BULK_LENGTH) {
            throw new RespException(RespError.OVERFLOW, "bulk length too large " + len);
        }
        return (int) len;
    }

    private static long readArrayLength(ByteBuf in) {
        long count = readDecimal(in);
        if (count == -1) {
            return -1;
        }
        if (count < 0) {
            throw new RespException(RespError.TYPE_CONVERSION, "negative array length " + count);
        }
        if (count > MAX_ARRAY_LENGTH) {
            throw new RespException(RespError.OVERFLOW, "array length too large " + count);
        }
        return count;
    }

    private static void skipPayload(ByteBuf in, int len) {
        if (in.readableBytes() < len + 2) {
            throw RespException.noMoreData();
        }
        in.skipBytes(len);
        expectCrlf(in);
    }

    private static void expectCrlf(ByteBuf in) {
        if (in.readByte() != CR || in.readByte() != LF) {
            throw new RespException(RespError.UN_RESP, "bulk payload not terminated by CRLF");
        }
    }
}
