package redlet.protocol.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import redlet.protocol.RespCodec;
import redlet.protocol.RespValue;

/**
 * Writes reply values in RESP wire format.
 */
public class RespEncoder extends MessageToByteEncoder<RespValue> {

    @Override
    protected void encode(ChannelHandlerContext ctx, RespValue msg, ByteBuf out) throws Exception {
        RespCodec.encode(msg, out);
    }
}
