package marouter.placement.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.timeout.IdleStateHandler;
import marouter.placement.config.Dependencies;
import marouter.placement.config.PlacementConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Netty HTTP server hosting the placement API. One instance per process.
 */
public final class PlacementNettyServer {

    private static final Logger log = LoggerFactory.getLogger(PlacementNettyServer.class);

    private static final int MAX_CONTENT_LENGTH = 1024 * 1024;

    private static volatile boolean running = false;
    private static Channel serverChannel;
    private static EventLoopGroup bossGroup;
    private static EventLoopGroup workerGroup;
    private static Dependencies dependencies;

    private PlacementNettyServer() {
    }

    /** HTTP pipeline: codec, aggregation, router */
    static ChannelHandler pipelineInitializer(RouterHandler router) {
        return new ChannelInitializer<SocketChannel>() {
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
     * Wire dependencies from the config and start listening.
     *
     * @return true if the server is running after the call
     */
    public static synchronized boolean start(int port, PlacementConfig config) {
        if (running) {
            return true;
        }
        try {
            dependencies = Dependencies.create(config);
            dependencies.seedIfConfigured();

            bossGroup = new NioEventLoopGroup(1);
            workerGroup = new NioEventLoopGroup();

            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(pipelineInitializer(dependencies.routerHandler()));

            serverChannel = b.bind(config.serverHost(), port).syncUninterruptibly().channel();
            running = true;
            log.info("Placement server started on port {}", port);
            return true;
        } catch (Exception e) {
            log.error("Failed to start placement server on port {}", port, e);
            stop();
            return false;
        }
    }

    public static synchronized void stop() {
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
        } finally {
            if (workerGroup != null) {
                workerGroup.shutdownGracefully();
                workerGroup = null;
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully();
                bossGroup = null;
            }
            if (dependencies != null) {
                dependencies.close();
                dependencies = null;
            }
            if (running) {
                log.info("Placement server stopped");
            }
            running = false;
        }
    }

    public static boolean isRunning() {
        return running;
    }

    /** Wiring of the running server, null when stopped */
    public static Dependencies dependencies() {
        return dependencies;
    }
}
