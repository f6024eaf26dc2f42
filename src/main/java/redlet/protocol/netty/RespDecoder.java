package redlet.protocol.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import redlet.protocol.MalformedFrameException;
import redlet.protocol.RespCodec;
import redlet.utils.Log;

import java.util.List;

/**
 * Emits one {@link redlet.protocol.RespValue} per complete frame. Bytes of an
 * unfinished frame stay in the cumulation buffer until the next read, so
 * requests split across TCP segments are handled. Each read re-walks the
 * unfinished frame's header lines from its first byte; payloads are neither
 * copied nor turned into values until {@link RespCodec#frameLength} reports
 * the frame complete. Malformed input closes the channel without a reply.
 */
public class RespDecoder extends ByteToMessageDecoder {

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        RespCodec.Parsed parsed;
        try {
            parsed = RespCodec.parse(in);
        } catch (MalformedFrameException e) {
            Log.debug("Closing " + ctx.channel().remoteAddress() + ": malformed frame (" + e.getMessage() + ")");
            in.skipBytes(in.readableBytes());
            ctx.close();
            return;
        }
        if (parsed == null) return; // Wait for more data

        in.skipBytes(parsed.consumed);
        out.add(parsed.value);
    }
}
