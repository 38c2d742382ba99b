package com.mini.bloomdb.server;

import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.util.concurrent.EventExecutorGroup;

import java.util.concurrent.TimeUnit;

/**
 * 服务端连接的 pipeline：4 字节长度前缀分帧，请求到达前有读超时
 */
public class SearchServerInitializer extends ChannelInitializer<SocketChannel> {
    
    static final String READ_TIMEOUT_HANDLER = "readTimeout";
    static final int LENGTH_FIELD_BYTES = 4;
    
    private final ServerOptions options;
    private final SearchService searchService;
    private final EventExecutorGroup handlerGroup;
    
    public SearchServerInitializer(ServerOptions options, SearchService searchService, 
                                   EventExecutorGroup handlerGroup) {
        this.options = options;
        this.searchService = searchService;
        this.handlerGroup = handlerGroup;
    }
    
    @Override
    protected void initChannel(SocketChannel channel) {
        ChannelPipeline pipeline = channel.pipeline();
        pipeline.addLast(READ_TIMEOUT_HANDLER, 
            new ReadTimeoutHandler(options.getReadTimeoutMillis(), TimeUnit.MILLISECONDS));
        pipeline.addLast("frameDecoder", new LengthFieldBasedFrameDecoder(
            options.getMaxFrameBytes() + LENGTH_FIELD_BYTES, 0, LENGTH_FIELD_BYTES, 0, LENGTH_FIELD_BYTES));
        pipeline.addLast("frameEncoder", new LengthFieldPrepender(LENGTH_FIELD_BYTES));
        pipeline.addLast(handlerGroup, "searchHandler", new SearchServerHandler(searchService));
    }
}
