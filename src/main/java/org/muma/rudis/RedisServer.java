package org.muma.rudis;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import org.muma.rudis.config.RudisConfig;
import org.muma.rudis.protocol.RespDecoder;
import org.muma.rudis.protocol.RespEncoder;
import org.muma.rudis.server.RedisCommandHandler;
import org.muma.rudis.server.RedisServerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

public class RedisServer {

    private static final Logger log = LoggerFactory.getLogger(RedisServer.class);

    private final RudisConfig config;
    private final RedisServerContext serverContext;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public RedisServer(RudisConfig config) {
        this.config = config;
        this.serverContext = new RedisServerContext(config);
    }

    /**
     * 先完成数据恢复，再开始接受连接
     */
    public void start() throws IOException, InterruptedException {
        serverContext.init();

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(config.getWorkerThreads());

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                // Boss 线程打印连接握手
                .handler(new LoggingHandler(LogLevel.DEBUG))
                // 禁用 Nagle 算法，降低延迟
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline()
                                .addLast(new RespDecoder())
                                .addLast(new RespEncoder())
                                .addLast(new RedisCommandHandler(serverContext.getDispatcher(), serverContext.getStorage()));
                    }
                });

        serverChannel = bootstrap.bind(config.getBind(), config.getPort()).sync().channel();
        log.info("Rudis started on {}:{}", config.getBind(), config.getPort());
    }

    public void awaitTermination() throws InterruptedException {
        if (serverChannel != null) {
            serverChannel.closeFuture().sync();
        }
    }

    /**
     * 关闭监听，停止 IO 线程，最后落盘
     */
    public void stop() {
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully().syncUninterruptibly();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully().syncUninterruptibly();
        }
        serverContext.shutdown();
        log.info("Rudis stopped.");
    }
}
