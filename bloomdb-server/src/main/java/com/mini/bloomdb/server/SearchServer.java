package com.mini.bloomdb.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

/**
 * 搜索服务端
 * 每个连接处理一个请求，响应后关闭连接
 * 
 * I/O 在 netty 事件循环上完成，请求处理放在独立的业务线程组，避免存储读取阻塞 I/O 线程。
 */
public class SearchServer implements AutoCloseable {
    
    private static final Logger logger = LoggerFactory.getLogger(SearchServer.class);
    
    private final ServerOptions options;
    private final SearchService searchService;
    
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup handlerGroup;
    private Channel channel;
    
    public SearchServer(ServerOptions options) {
        this(options, SearchService.create(options));
    }
    
    public SearchServer(ServerOptions options, SearchService searchService) {
        this.options = options;
        this.searchService = searchService;
    }
    
    /**
     * 绑定端口并开始接收连接，不阻塞
     */
    public synchronized void start() throws InterruptedException {
        if (channel != null) {
            throw new IllegalStateException("Server already started");
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        handlerGroup = new DefaultEventExecutorGroup(options.getWorkerThreads());
        
        try {
            ServerBootstrap b = new ServerBootstrap();
            b.option(ChannelOption.SO_BACKLOG, 1024)
                    .childOption(ChannelOption.TCP_NODELAY, true);
            b.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childHandler(new SearchServerInitializer(options, searchService, handlerGroup));
            
            channel = b.bind(options.getHost(), options.getPort()).sync().channel();
        } catch (InterruptedException | RuntimeException e) {
            shutdownGroups();
            throw e;
        }
        
        logger.info("Search server listening on {}:{}, index root {}", 
                   options.getHost(), getPort(), options.getIndexRoot());
    }
    
    /**
     * 实际监听的端口；配置为 0 时由系统分配
     */
    public int getPort() {
        if (channel == null) {
            throw new IllegalStateException("Server not started");
        }
        return ((InetSocketAddress) channel.localAddress()).getPort();
    }
    
    /**
     * 阻塞直到服务端关闭
     */
    public void awaitTermination() throws InterruptedException {
        Channel current;
        synchronized (this) {
            current = channel;
        }
        if (current != null) {
            current.closeFuture().sync();
        }
    }
    
    @Override
    public synchronized void close() {
        if (channel != null) {
            channel.close().syncUninterruptibly();
            logger.info("Search server on port {} closed", 
                       ((InetSocketAddress) channel.localAddress()).getPort());
        }
        shutdownGroups();
    }
    
    private void shutdownGroups() {
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }
        if (handlerGroup != null) {
            handlerGroup.shutdownGracefully();
        }
    }
}
