package agora.market.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.timeout.IdleStateHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * Netty HTTP server in front of the shared {@link RouterHandler}.
 */
public final class MarketNettyServer {

    private static final Logger log = LoggerFactory.getLogger(MarketNettyServer.class);

    private static final int MAX_CONTENT_LENGTH = 1024 * 1024;

    private final RouterHandler router;

    private volatile boolean running = false;
    private Channel serverChannel;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;

    public MarketNettyServer(RouterHandler router) {
        this.router = router;
    }

    /** HTTP pipeline: codec, aggregator, router */
    ChannelInitializer<SocketChannel> pipelineInitializer() {
        return new ChannelInitializer<>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                ChannelPipeline p = ch.pipeline();
                p.addLast(new IdleStateHandler(60, 0, 0, TimeUnit.SECONDS));
                p.addLast(new HttpServerCodec());
                p.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                p.addLast(router);
            }
        };
    }

    /**
     * Bind the server. Returns false if the port could not be bound.
     */
    public synchronized boolean start(String host, int port) {
        if (running) {
            return true;
        }
        try {
            bossGroup = new NioEventLoopGroup(1);
            workerGroup = new NioEventLoopGroup();

            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(pipelineInitializer());

            serverChannel = b.bind(host, port).syncUninterruptibly().channel();
            running = true;
            log.info("Market server started on {}:{}", host, boundPort());
            return true;
        } catch (Exception e) {
            log.error("Failed to start server on port {}: {}", port, e.getMessage(), e);
            stop();
            return false;
        }
    }

    public synchronized void stop() {
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
        } finally {
            if (workerGroup != null) {
                workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
                workerGroup = null;
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
                bossGroup = null;
            }
            if (running) {
                log.info("Market server stopped");
            }
            running = false;
        }
    }

    public boolean isRunning() {
        return running;
    }

    /** Actual bound port, useful when started on port 0 */
    public int boundPort() {
        Channel ch = serverChannel;
        if (ch == null) {
            return -1;
        }
        return ((InetSocketAddress) ch.localAddress()).getPort();
    }
}
