package org.muma.rudis.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;

import java.util.List;

/**
 * RESP 协议解码器
 * <p>
 * 先用 {@link RespCodec#check} 确认缓冲区里有完整一帧，再回到帧首做真正的 parse。
 * 数据不足时恢复 readerIndex 等待下一批字节；结构错误丢弃缓冲并向上抛出，由 Handler 关闭连接。
 */
public class RespDecoder extends ByteToMessageDecoder {

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        int start = in.readerIndex();
        try {
            RespCodec.check(in);
        } catch (RespException e) {
            in.readerIndex(start);
            if (e.getError() == RespError.NO_MORE_DATA) {
                return;
            }
            // 结构错误后的字节无法再对齐，全部丢弃
            in.skipBytes(in.readableBytes());
            throw e;
        }

        in.readerIndex(start);
        out.add(RespCodec.parse(in));
    }
}
