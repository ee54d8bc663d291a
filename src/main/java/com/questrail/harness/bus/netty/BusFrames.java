package com.questrail.harness.bus.netty;

import com.questrail.harness.bus.BusMessage;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPipeline;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;
import io.netty.handler.codec.MessageToMessageCodec;

import java.util.List;

/**
 * Framing shared by the daemon and its clients: a 4-byte big-endian length
 * prefix followed by a JSON {@link BusMessage}.
 */
final class BusFrames
{
    static final int MAX_FRAME_LENGTH = 16 * 1024 * 1024;

    private BusFrames() {}

    static void configure(ChannelPipeline p)
    {
        p.addLast("frameDecoder", new LengthFieldBasedFrameDecoder(MAX_FRAME_LENGTH, 0, 4, 0, 4));
        p.addLast("framePrepender", new LengthFieldPrepender(4));
        p.addLast("messageCodec", new MessageCodec());
    }

    private static final class MessageCodec extends MessageToMessageCodec<ByteBuf, BusMessage>
    {
        @Override
        protected void encode(ChannelHandlerContext ctx, BusMessage msg, List<Object> out)
        {
            out.add(Unpooled.wrappedBuffer(BusJson.write(msg)));
        }

        @Override
        protected void decode(ChannelHandlerContext ctx, ByteBuf frame, List<Object> out)
        {
            out.add(BusJson.read(ByteBufUtil.getBytes(frame)));
        }
    }
}
