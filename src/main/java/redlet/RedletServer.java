package redlet;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.GlobalEventExecutor;
import redlet.db.Database;
import redlet.network.ClientHandler;
import redlet.protocol.netty.RespDecoder;
import redlet.protocol.netty.RespEncoder;
import redlet.utils.Log;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * Accepts connections and gives each one its own decoder, encoder and
 * {@link ClientHandler}, all sharing one {@link Database}.
 */
public class RedletServer {
    private final Config config;
    private final Database db;
    private final ChannelGroup clients = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public RedletServer(Config config, Database db) {
        this.config = config;
        this.db = db;
    }

    public synchronized void start() throws InterruptedException {
        if (serverChannel != null) {
            throw new IllegalStateException("Server already started");
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(config.workerThreads);
        try {
            ServerBootstrap b = new ServerBootstrap();
            b.group(bossGroup, workerGroup)
             .channel(NioServerSocketChannel.class)
             .childOption(ChannelOption.TCP_NODELAY, true)
             .childHandler(new ChannelInitializer<SocketChannel>() {
                 @Override
                 public void initChannel(SocketChannel ch) throws Exception {
                     clients.add(ch);
                     ch.pipeline().addLast(new RespDecoder());
                     ch.pipeline().addLast(new RespEncoder());
                     ch.pipeline().addLast(new ClientHandler(db));
                 }
             });

            serverChannel = b.bind(config.bindAddress, config.port).sync().channel();
        } catch (Throwable t) {
            shutdownGroups();
            throw t;
        }
        Log.info("Ready on " + config.bindAddress + ":" + getPort());
    }

    /** The bound port, which differs from the configured one when that was 0. */
    public int getPort() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public int getActiveConnections() {
        return clients.size();
    }

    public void awaitTermination() throws InterruptedException {
        serverChannel.closeFuture().sync();
    }

    public synchronized void stop() {
        if (serverChannel == null) return;
        serverChannel.close().syncUninterruptibly();
        clients.close().awaitUninterruptibly();
        shutdownGroups();
        serverChannel = null;
        Log.info("Server stopped");
    }

    private void shutdownGroups() {
        if (bossGroup != null) bossGroup.shutdownGracefully(0, 5, TimeUnit.SECONDS).syncUninterruptibly();
        if (workerGroup != null) workerGroup.shutdownGracefully(0, 5, TimeUnit.SECONDS).syncUninterruptibly();
        bossGroup = null;
        workerGroup = null;
    }
}
