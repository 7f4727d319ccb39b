package org.muma.rudis.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class RespCodecTest {

    private static ByteBuf buf(String s) {
        return Unpooled.copiedBuffer(s, StandardCharsets.UTF_8);
    }

    private static RespError checkError(String s) {
        RespException e = assertThrows(RespException.class, () -> RespCodec.check(buf(s)));
        return e.getError();
    }

    @Test
    void testParseScalars() {
        assertEquals(new SimpleString("OK"), RespCodec.parse(buf("+OK\r\n")));
        assertEquals(new ErrorMessage("ERR boom"), RespCodec.parse(buf("-ERR boom\r\n")));
        assertEquals(new RedisInteger(-42), RespCodec.parse(buf(":-42\r\n")));
        assertEquals(new BulkString("hello"), RespCodec.parse(buf("$5\r\nhello\r\n")));
        assertEquals(new BulkString(""), RespCodec.parse(buf("$0\r\n\r\n")));
    }

    @Test
    void testParseNulls() {
        assertSame(BulkString.NULL, RespCodec.parse(buf("$-1\r\n")));
        assertSame(RedisArray.NULL, RespCodec.parse(buf("*-1\r\n")));
    }

    @Test
    void testBulkMayContainCrlf() {
        RedisMessage msg = RespCodec.parse(buf("$4\r\na\r\nb\r\n"));
        assertEquals("a\r\nb", ((BulkString) msg).asString());
    }

    @Test
    void testCheckConsumesExactlyOneFrame() {
        ByteBuf in = buf("*2\r\n$3\r\nGET\r\n$1\r\nk\r\n+PONG\r\n");
        RespCodec.check(in);
        assertEquals(20, in.readerIndex());

        in.readerIndex(0);
        assertEquals(RedisArray.ofBulk("GET", "k"), RespCodec.parse(in));
        assertEquals(SimpleString.PONG, RespCodec.parse(in));
        assertFalse(in.isReadable());
    }

    @Test
    void testPartialFrameNeedsMoreData() {
        assertEquals(RespError.NO_MORE_DATA, checkError(""));
        assertEquals(RespError.NO_MORE_DATA, checkError("+OK"));
        assertEquals(RespError.NO_MORE_DATA, checkError("$5\r\nhel"));
        assertEquals(RespError.NO_MORE_DATA, checkError("*2\r\n$3\r\nGET\r\n$1\r\n"));
        assertEquals(RespError.NO_MORE_DATA, checkError("*3\r\n:1\r\n:2\r\n"));
    }

    @Test
    void testStructuralErrors() {
        assertEquals(RespError.UN_RESP, checkError("?what\r\n"));
        assertEquals(RespError.NOT_NUMBER, checkError(":abc\r\n"));
        assertEquals(RespError.NOT_NUMBER, checkError("*x\r\n"));
        assertEquals(RespError.OVERFLOW, checkError(":99999999999999999999\r\n"));
        assertEquals(RespError.TYPE_CONVERSION, checkError("$-5\r\n"));
        assertEquals(RespError.TYPE_CONVERSION, checkError("*-2\r\n"));
        // 声明长度与实际内容不符
        assertEquals(RespError.UN_RESP, checkError("$3\r\nabcXY"));
    }

    @Test
    void testSimpleStringMustBeUtf8() {
        ByteBuf in = Unpooled.wrappedBuffer(new byte[]{'+', (byte) 0xFF, (byte) 0xFE, '\r', '\n'});
        RespException e = assertThrows(RespException.class, () -> RespCodec.parse(in));
        assertEquals(RespError.TYPE_CONVERSION, e.getError());
    }

    @Test
    void testSerialize() {
        assertEquals("*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$1\r\nv\r\n",
                new String(RespCodec.serialize(RedisArray.ofBulk("SET", "k", "v")), StandardCharsets.UTF_8));
        assertEquals("$-1\r\n", new String(RespCodec.serialize(BulkString.NULL), StandardCharsets.UTF_8));
        assertEquals("*-1\r\n", new String(RespCodec.serialize(RedisArray.NULL), StandardCharsets.UTF_8));
        assertEquals("*0\r\n", new String(RespCodec.serialize(RedisArray.EMPTY), StandardCharsets.UTF_8));
        assertEquals(":7\r\n", new String(RespCodec.serialize(new RedisInteger(7)), StandardCharsets.UTF_8));
        assertEquals(0, RespCodec.serialize(NoReply.INSTANCE).length);
    }

    @Test
    void testLineBreaksInTextLinesAreReplaced() {
        byte[] bytes = RespCodec.serialize(new ErrorMessage("ERR a\r\nb"));
        assertEquals("-ERR a  b\r\n", new String(bytes, StandardCharsets.UTF_8));

        ByteBuf in = Unpooled.wrappedBuffer(bytes);
        assertEquals(new ErrorMessage("ERR a  b"), RespCodec.parse(in));
        assertFalse(in.isReadable());

        assertEquals("+x y\r\n", new String(RespCodec.serialize(new SimpleString("x\ny")), StandardCharsets.UTF_8));
    }

    @Test
    void testNestingDepthIsLimited() {
        String deepest = "*1\r\n".repeat(RespCodec.MAX_NESTING_DEPTH) + ":1\r\n";
        ByteBuf in = buf(deepest);
        RespCodec.check(in);
        assertFalse(in.isReadable());

        String tooDeep = "*1\r\n".repeat(RespCodec.MAX_NESTING_DEPTH + 1) + ":1\r\n";
        assertEquals(RespError.OVERFLOW, checkError(tooDeep));
    }

    @Test
    void testDeclaredLengthsAreLimited() {
        assertEquals(RespError.OVERFLOW, checkError("$" + (RespCodec.MAX_BULK_LENGTH + 1L) + "\r\n"));
        assertEquals(RespError.OVERFLOW, checkError("*" + (RespCodec.MAX_ARRAY_LENGTH + 1L) + "\r\n"));
        // 上限以内只是数据不足
        assertEquals(RespError.NO_MORE_DATA, checkError("$" + RespCodec.MAX_BULK_LENGTH + "\r\n"));
    }

    @Test
    void testSerializeNullIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> RespCodec.serialize(null, Unpooled.buffer()));
    }

    @Test
    void testNestedArray() {
        RedisArray nested = new RedisArray(new RedisMessage[]{
                new RedisInteger(1),
                new RedisArray(new RedisMessage[]{new SimpleString("a"), BulkString.NULL}),
                RedisArray.NULL
        });
        ByteBuf out = Unpooled.buffer();
        RespCodec.serialize(nested, out);
        RespCodec.check(out.duplicate());
        assertEquals(nested, RespCodec.parse(out));
    }
}
