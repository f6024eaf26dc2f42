package redlet.network;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import redlet.commands.Command;
import redlet.commands.CommandException;
import redlet.commands.CommandTranslator;
import redlet.db.Database;
import redlet.db.StoreException;
import redlet.protocol.RespValue;
import redlet.utils.Log;

/**
 * One per connection. Requests arrive already framed by the decoder and are
 * answered in arrival order. Request-level failures become error replies;
 * the connection is only closed by the peer, a malformed frame, or an
 * unexpected exception.
 */
public class ClientHandler extends ChannelInboundHandlerAdapter {
    private final Database db;

    public ClientHandler(Database db) {
        this.db = db;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        Log.debug("Client connected: " + ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        Log.debug("Client disconnected: " + ctx.channel().remoteAddress());
        super.channelInactive(ctx);
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        if (msg instanceof RespValue) {
            ctx.writeAndFlush(handleCommand((RespValue) msg));
        } else {
            ctx.fireChannelRead(msg);
        }
    }

    public RespValue handleCommand(RespValue request) {
        try {
            Command command = CommandTranslator.translate(request);
            return command.execute(db);
        } catch (CommandException e) {
            if (Log.isDebugEnabled()) {
                Log.debug("Rejected " + request + ": " + e.getMessage());
            }
            return e.toReply();
        } catch (StoreException e) {
            Log.warn("Keyspace unavailable: " + e.getMessage());
            return RespValue.error("ERR internal error: " + e.getMessage());
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        Log.warn("Closing " + ctx.channel().remoteAddress() + " after unexpected error", cause);
        ctx.close();
    }
}
