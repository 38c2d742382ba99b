package com.mini.bloomdb.client;

import com.mini.bloomdb.server.exception.ConnectionException;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.ReferenceCountUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * 客户端连接处理器：连接建立后发送请求，收到第一个响应帧后关闭连接
 * 
 * 每个连接一个实例，不可复用。
 */
public class SearchClientHandler extends ChannelInboundHandlerAdapter {
    
    private static final Logger logger = LoggerFactory.getLogger(SearchClientHandler.class);
    
    private final byte[] request;
    private final CompletableFuture<byte[]> response;
    
    public SearchClientHandler(byte[] request, CompletableFuture<byte[]> response) {
        this.request = request;
        this.response = response;
    }
    
    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        ctx.writeAndFlush(Unpooled.wrappedBuffer(request));
    }
    
    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        try {
            response.complete(ByteBufUtil.getBytes((ByteBuf) msg));
        } finally {
            ReferenceCountUtil.release(msg);
        }
        ctx.close();
    }
    
    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        // 已收到响应时无效果
        response.completeExceptionally(new ConnectionException("Connection closed before a response was received"));
    }
    
    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        logger.error("error caught in search client.", cause);
        response.completeExceptionally(new ConnectionException(
            "Connection error: " + cause.getMessage(), cause));
        ctx.close();
    }
}
